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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies strings into the {@link SharedMemory}.
 */
public final class SharedStrings {

	private static final Logger LOGGER = LoggerFactory.getLogger(SharedStrings.class);

	private SharedStrings() {
	}

	/**
	 * Make a shared memory copy of a string.
	 * 
	 * The copy contains the UTF-8 bytes of the value followed by a terminating
	 * zero.
	 * 
	 * @param memory shared memory to allocate the copy
	 * @param value value to copy. May be {@code null}.
	 * @return copy, or {@code null}, if the provided value is {@code null}.
	 * @throws NullPointerException if memory is {@code null}
	 * @throws SharedMemoryExhaustedException if the memory has not enough space
	 *             left. Nothing is allocated in that case.
	 */
	public static SharedString duplicate(SharedMemory memory, String value) throws SharedMemoryExhaustedException {
		if (memory == null) {
			throw new NullPointerException("shared memory must not be null!");
		}
		if (value == null) {
			return null;
		}
		byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
		int size = bytes.length + 1;
		ByteBuffer buffer = memory.allocate(size);
		if (buffer == null) {
			LOGGER.error("No memory left");
			throw new SharedMemoryExhaustedException(size, memory.available());
		}
		buffer.put(bytes);
		buffer.put((byte) 0);
		buffer.flip();
		return new SharedString(memory, buffer);
	}
}
