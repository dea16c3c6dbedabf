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
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared memory on the java heap.
 * 
 * Threads of one JVM share the heap, therefore only the capacity of the
 * domain is accounted.
 */
public class HeapSharedMemory implements SharedMemory {

	private static final Logger LOGGER = LoggerFactory.getLogger(HeapSharedMemory.class);

	/**
	 * Accounted size of a lock.
	 */
	public static final int LOCK_SIZE = 64;

	private final long capacity;
	private final AtomicLong used = new AtomicLong();

	/**
	 * Create shared memory.
	 * 
	 * @param capacity capacity in bytes
	 * @throws IllegalArgumentException if capacity is negative
	 */
	public HeapSharedMemory(long capacity) {
		if (capacity < 0) {
			throw new IllegalArgumentException("capacity " + capacity + " must not be negative!");
		}
		this.capacity = capacity;
	}

	@Override
	public ByteBuffer allocate(int size) {
		if (size < 0) {
			throw new IllegalArgumentException("size " + size + " must not be negative!");
		}
		if (!reserve(size)) {
			return null;
		}
		return ByteBuffer.allocate(size);
	}

	@Override
	public void free(ByteBuffer buffer) {
		if (buffer != null) {
			release(buffer.capacity());
		}
	}

	@Override
	public SharedLock allocateLock() {
		if (!reserve(LOCK_SIZE)) {
			return null;
		}
		return new HeapSharedLock();
	}

	@Override
	public long available() {
		return capacity - used.get();
	}

	private boolean reserve(int size) {
		long current;
		do {
			current = used.get();
			if (current + size > capacity) {
				LOGGER.debug("no memory left, {} of {} bytes used, {} requested", current, capacity, size);
				return false;
			}
		} while (!used.compareAndSet(current, current + size));
		return true;
	}

	private void release(int size) {
		used.addAndGet(-size);
	}

	private class HeapSharedLock implements SharedLock {

		private final ReentrantLock lock = new ReentrantLock();
		private volatile boolean initialized;
		private volatile boolean destroyed;

		@Override
		public boolean init() {
			if (destroyed) {
				return false;
			}
			initialized = true;
			return true;
		}

		@Override
		public void lock() {
			if (!initialized || destroyed) {
				throw new IllegalStateException("lock not usable!");
			}
			lock.lock();
		}

		@Override
		public void unlock() {
			lock.unlock();
		}

		@Override
		public void destroy() {
			synchronized (this) {
				if (destroyed) {
					return;
				}
				destroyed = true;
			}
			release(LOCK_SIZE);
		}
	}
}
