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

import java.util.concurrent.atomic.AtomicInteger;

import javax.security.auth.DestroyFailedException;
import javax.security.auth.Destroyable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generation of the TLS configuration.
 * 
 * Element of the list kept by {@link ConfigGenerationRegistry}. The number of
 * connections using a generation is kept in its reference counter. The link
 * to the next (older) generation is guarded by the registry's lock.
 *
 * @param <T> type of configuration payload
 */
public final class ConfigGeneration<T> {

	private static final Logger LOGGER = LoggerFactory.getLogger(ConfigGeneration.class);

	private final long number;
	private final AtomicInteger referenceCount = new AtomicInteger();
	private volatile T payload;
	private volatile boolean destroyed;
	/**
	 * Next older generation. Guarded by the registry's lock.
	 */
	ConfigGeneration<T> next;

	ConfigGeneration(long number, T payload) {
		this.number = number;
		this.payload = payload;
	}

	/**
	 * Get number of generation.
	 * 
	 * @return number, ascending with each installed generation.
	 */
	public long getNumber() {
		return number;
	}

	/**
	 * Get current number of references.
	 * 
	 * @return number of references
	 */
	public int getReferenceCount() {
		return referenceCount.get();
	}

	public boolean isDestroyed() {
		return destroyed;
	}

	T getPayload() {
		return payload;
	}

	void retain() {
		referenceCount.incrementAndGet();
	}

	void release() {
		referenceCount.decrementAndGet();
	}

	/**
	 * Destroy generation.
	 * 
	 * Unlinks the next generation and destroys the payload, if that is
	 * {@link Destroyable}.
	 */
	void destroy() {
		T payload = this.payload;
		this.payload = null;
		this.next = null;
		this.destroyed = true;
		if (payload instanceof Destroyable) {
			try {
				((Destroyable) payload).destroy();
			} catch (DestroyFailedException e) {
				LOGGER.warn("Destroy on {} failed!", payload.getClass(), e);
			}
		}
	}

	@Override
	public String toString() {
		return "generation " + number + " (" + referenceCount.get() + " refs)";
	}
}
