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
package org.siptls.tls.keylog;

/**
 * Results of keylog channel operations.
 * 
 * Each failure has a small negative code. Codes are only unique per
 * operation, use the enum to distinguish the cause. Any failure is safely
 * treated as "channel unavailable".
 */
public enum KeylogResult {

	SUCCESS(0),
	/**
	 * Channel selected, but the file or peer is missing.
	 */
	MISSING_PARAMETER(-1),
	/**
	 * No shared memory left for the file lock.
	 */
	LOCK_ALLOCATION_FAILURE(-2),
	/**
	 * Initialization of the file lock failed.
	 */
	LOCK_INIT_FAILURE(-3),
	/**
	 * Peer address could not be parsed.
	 */
	INVALID_ADDRESS(-2),
	/**
	 * Peer address uses another protocol than UDP.
	 */
	UNSUPPORTED_PROTOCOL(-3),
	/**
	 * Peer host could not be resolved.
	 */
	RESOLUTION_FAILURE(-4),
	/**
	 * Keylog file could not be opened or written.
	 */
	IO_FAILURE(-1),
	/**
	 * Datagram could not be sent.
	 */
	SEND_FAILURE(-1),
	/**
	 * No socket available to send datagrams.
	 */
	NO_SEND_SOCKET(-2);

	private final int code;

	private KeylogResult(int code) {
		this.code = code;
	}

	public int getCode() {
		return code;
	}

	public boolean isSuccess() {
		return this == SUCCESS;
	}
}
