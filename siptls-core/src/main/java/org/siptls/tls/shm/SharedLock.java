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
package org.siptls.tls.shm;

/**
 * Lock allocated in the {@link SharedMemory}.
 */
public interface SharedLock {

	/**
	 * Initialize lock.
	 * 
	 * @return {@code true}, if initialized, {@code false}, if initialization
	 *         failed.
	 */
	boolean init();

	/**
	 * Acquire lock.
	 * 
	 * @throws IllegalStateException if lock is not initialized or already
	 *             destroyed
	 */
	void lock();

	/**
	 * Release lock.
	 */
	void unlock();

	/**
	 * Destroy lock and return its memory.
	 */
	void destroy();
}
