/********************************************************************************
 * Copyright (c) 2026 Contributors to the Eclipse Foundation
 * 
 * See the NOTICE file(s) distributed with this work for additional
 * information regarding copyright ownership.
 * 
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License v. 2.0 which is available at
 * https://www.eclipse.org/legal/epl-2.0, or the Eclipse Distribution License
 * v1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 * 
 * SPDX-License-Identifier: EPL-2.0 OR BSD-3-Clause
 ********************************************************************************/
package org.siptls.tls.config;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Reference to a {@link ConfigGeneration}.
 * 
 * Returned by {@link ConfigGenerationRegistry#checkout()}. Keeps the
 * generation alive until it's checked in again.
 * 
 * <pre>
 * <code>
 * try (ConfigReference&lt;TlsDomains&gt; reference = registry.checkout()) {
 *    TlsDomains domains = reference.get();
 *    ...
 * }
 * </code>
 * </pre>
 *
 * @param <T> type of configuration payload
 */
public final class ConfigReference<T> implements AutoCloseable {

	private final ConfigGenerationRegistry<T> registry;
	private final ConfigGeneration<T> generation;
	private final AtomicBoolean released = new AtomicBoolean();

	ConfigReference(ConfigGenerationRegistry<T> registry, ConfigGeneration<T> generation) {
		this.registry = registry;
		this.generation = generation;
	}

	/**
	 * Get configuration payload.
	 * 
	 * @return payload
	 * @throws IllegalStateException if the reference is already checked in
	 */
	public T get() {
		if (released.get()) {
			throw new IllegalStateException(generation + " already checked in!");
		}
		return generation.getPayload();
	}

	/**
	 * Get number of the referenced generation.
	 * 
	 * @return number of generation
	 */
	public long getGenerationNumber() {
		return generation.getNumber();
	}

	public boolean isCheckedIn() {
		return released.get();
	}

	ConfigGenerationRegistry<T> getRegistry() {
		return registry;
	}

	/**
	 * Release reference.
	 * 
	 * @throws IllegalStateException if the reference is already released
	 */
	void release() {
		if (!released.compareAndSet(false, true)) {
			throw new IllegalStateException(generation + " already checked in!");
		}
		generation.release();
	}

	/**
	 * Check in the reference.
	 * 
	 * @throws IllegalStateException if the reference is already checked in
	 * @see ConfigGenerationRegistry#checkin(ConfigReference)
	 */
	@Override
	public void close() {
		registry.checkin(this);
	}

	@Override
	public String toString() {
		return "ref. " + generation;
	}
}
