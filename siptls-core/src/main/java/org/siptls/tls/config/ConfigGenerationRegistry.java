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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of TLS configuration generations.
 *
 * Keeps the generations in a singly linked list, the newest first. The first
 * generation is the active one, all new connections use that. Older
 * generations are kept as long as connections still refer to them.
 *
 * The list links are only changed while holding the registry's lock. The
 * reference counters are changed without that lock. That is safe, because
 * only the active generation is checked out. A generation, which is replaced
 * by a newer one, never gets a new reference, so a zero counter read by
 * {@link #collect()} stays zero.
 *
 * <pre>
 * <code>
 * // reload
 * registry.install(domains);
 * registry.collect();
 *
 * // connection
 * ConfigReference&lt;TlsDomains&gt; reference = registry.checkout();
 * ...
 * registry.checkin(reference);
 * </code>
 * </pre>
 *
 * @param <T> type of configuration payload. If the payload implements
 *            {@link javax.security.auth.Destroyable}, it gets destroyed, when
 *            the generation is collected.
 */
public class ConfigGenerationRegistry<T> {

	private static final Logger LOGGER = LoggerFactory.getLogger(ConfigGenerationRegistry.class);

	/**
	 * Lock for the list links.
	 */
	private final ReentrantLock lock = new ReentrantLock();
	/**
	 * Active generation, head of list.
	 */
	private volatile ConfigGeneration<T> head;
	/**
	 * Number of the last installed generation. Guarded by {@link #lock}.
	 */
	private long lastNumber;

	/**
	 * Install new configuration.
	 *
	 * The new generation becomes the active one. The previous active
	 * generation is kept until it's not longer referenced and gets collected.
	 *
	 * @param payload configuration payload
	 * @return number of the new generation
	 * @throws NullPointerException if payload is {@code null}
	 */
	public long install(T payload) {
		if (payload == null) {
			throw new NullPointerException("payload must not be null!");
		}
		lock.lock();
		try {
			ConfigGeneration<T> generation = new ConfigGeneration<T>(++lastNumber, payload);
			generation.next = head;
			head = generation;
			LOGGER.info("installed TLS configuration {}", generation.getNumber());
			return generation.getNumber();
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Checkout the active generation.
	 *
	 * Lock free. If a new generation is installed concurrently, the reference
	 * is only returned, if the counted generation is still the active one
	 * after counting. Otherwise the count is undone and the checkout is
	 * retried with the new active generation.
	 *
	 * @return reference to the active generation
	 * @throws IllegalStateException if no configuration is installed
	 */
	public ConfigReference<T> checkout() {
		while (true) {
			ConfigGeneration<T> active = head;
			if (active == null) {
				throw new IllegalStateException("no TLS configuration installed!");
			}
			active.retain();
			if (active == head) {
				return new ConfigReference<T>(this, active);
			}
			active.release();
			LOGGER.debug("TLS configuration {} replaced during checkout, retry", active.getNumber());
		}
	}

	/**
	 * Checkin a reference.
	 *
	 * Decrements the reference counter of the generation. Never removes the
	 * generation, that is left to {@link #collect()}.
	 *
	 * @param reference reference returned by {@link #checkout()}
	 * @throws NullPointerException if reference is {@code null}
	 * @throws IllegalArgumentException if reference is from an other registry
	 * @throws IllegalStateException if the reference is already checked in
	 */
	public void checkin(ConfigReference<T> reference) {
		if (reference == null) {
			throw new NullPointerException("reference must not be null!");
		}
		if (reference.getRegistry() != this) {
			throw new IllegalArgumentException(reference + " belongs to an other registry!");
		}
		reference.release();
	}

	/**
	 * Delete old generations, which are not longer referenced.
	 *
	 * Skips the active generation, even if that is not referenced. Walks the
	 * older generations and removes and destroys each one with a zero
	 * reference counter. Keeps the order of the remaining ones.
	 *
	 * @return number of removed generations
	 */
	public int collect() {
		int removed = 0;
		// only one collector at a time
		lock.lock();
		try {
			ConfigGeneration<T> prev = head;
			if (prev == null) {
				return 0;
			}
			// garbage starts with the 2nd generation
			ConfigGeneration<T> current = prev.next;
			while (current != null) {
				ConfigGeneration<T> next = current.next;
				if (current.getReferenceCount() == 0) {
					prev.next = next;
					current.destroy();
					++removed;
					LOGGER.debug("removed TLS configuration {}", current.getNumber());
				} else {
					prev = current;
				}
				current = next;
			}
		} finally {
			lock.unlock();
		}
		if (removed > 0) {
			LOGGER.info("collected {} TLS configurations", removed);
		}
		return removed;
	}

	/**
	 * Get active generation.
	 *
	 * @return active generation, or {@code null}, if no configuration is
	 *         installed.
	 */
	public ConfigGeneration<T> getActive() {
		return head;
	}

	/**
	 * Get number of generations in the list.
	 *
	 * @return number of generations
	 */
	public int size() {
		return getGenerations().size();
	}

	/**
	 * Get snapshot of the generations.
	 *
	 * @return list of generations, the active one first.
	 */
	public List<ConfigGeneration<T>> getGenerations() {
		List<ConfigGeneration<T>> generations = new ArrayList<>();
		lock.lock();
		try {
			ConfigGeneration<T> current = head;
			while (current != null) {
				generations.add(current);
				current = current.next;
			}
		} finally {
			lock.unlock();
		}
		return Collections.unmodifiableList(generations);
	}
}
