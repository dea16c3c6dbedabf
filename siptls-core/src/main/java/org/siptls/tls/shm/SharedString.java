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
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Zero terminated string in {@link SharedMemory}.
 * 
 * @see SharedStrings#duplicate(SharedMemory, String)
 */
public final class SharedString {

	private final SharedMemory memory;
	private final ByteBuffer buffer;
	private final AtomicBoolean released = new AtomicBoolean();

	SharedString(SharedMemory memory, ByteBuffer buffer) {
		this.memory = memory;
		this.buffer = buffer;
	}

	/**
	 * Get length of the string in bytes, without terminator.
	 * 
	 * @return length in bytes
	 */
	public int length() {
		return buffer.capacity() - 1;
	}

	/**
	 * Get copy of the bytes, including the terminating zero.
	 * 
	 * @return bytes including terminator
	 * @throws IllegalStateException if already released
	 */
	public byte[] getBytes() {
		checkReleased();
		ByteBuffer copy = buffer.duplicate();
		copy.clear();
		byte[] bytes = new byte[copy.remaining()];
		copy.get(bytes);
		return bytes;
	}

	/**
	 * Release the string and return the memory.
	 * 
	 * @return {@code true}, if released, {@code false}, if already released
	 *         before.
	 */
	public boolean release() {
		if (released.compareAndSet(false, true)) {
			memory.free(buffer);
			return true;
		}
		return false;
	}

	public boolean isReleased() {
		return released.get();
	}

	private void checkReleased() {
		if (released.get()) {
			throw new IllegalStateException("shared string already released!");
		}
	}

	@Override
	public String toString() {
		return new String(getBytes(), 0, length(), StandardCharsets.UTF_8);
	}
}
