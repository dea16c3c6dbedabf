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

import java.nio.ByteBuffer;

/**
 * Long-lived memory domain shared by all workers of the proxy.
 * 
 * Allocations are bounded by the capacity of the domain. Exhaustion is
 * reported by {@code null} results, not by exceptions, so callers on the
 * connection path are able to degrade.
 */
public interface SharedMemory {

	/**
	 * Allocate buffer.
	 * 
	 * @param size size in bytes
	 * @return buffer with the provided capacity, or {@code null}, if the memory
	 *         is exhausted.
	 * @throws IllegalArgumentException if size is negative
	 */
	ByteBuffer allocate(int size);

	/**
	 * Free buffer.
	 * 
	 * @param buffer buffer returned by {@link #allocate(int)}
	 */
	void free(ByteBuffer buffer);

	/**
	 * Allocate lock.
	 * 
	 * The lock must be initialized by {@link SharedLock#init()} before use.
	 * 
	 * @return allocated lock, or {@code null}, if the memory is exhausted.
	 */
	SharedLock allocateLock();

	/**
	 * Get available bytes.
	 * 
	 * @return number of available bytes
	 */
	long available();
}
