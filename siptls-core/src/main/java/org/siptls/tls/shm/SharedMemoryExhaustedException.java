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
 * Indicates, that the {@link SharedMemory} has not enough space left.
 */
public class SharedMemoryExhaustedException extends Exception {

	private static final long serialVersionUID = 6620382719425816043L;

	private final int requested;

	/**
	 * Create exception.
	 * 
	 * @param requested requested number of bytes
	 * @param available available number of bytes
	 */
	public SharedMemoryExhaustedException(int requested, long available) {
		super("No memory left, requested " + requested + " bytes, available " + available + " bytes!");
		this.requested = requested;
	}

	/**
	 * Get requested number of bytes.
	 * 
	 * @return requested number of bytes
	 */
	public int getRequested() {
		return requested;
	}
}
