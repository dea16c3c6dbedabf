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
package org.siptls.tls.util;

import javax.net.ssl.SSLException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility for leftover errors of the secure-transport library.
 */
public final class TlsErrors {

	private static final Logger LOGGER = LoggerFactory.getLogger(TlsErrors.class);

	private TlsErrors() {
	}

	/**
	 * Get leftover errors and log them.
	 * 
	 * Call this before any TLS read, write or handshake operation, to ensure,
	 * that failures of previous operations are not reported for the new one.
	 * 
	 * @param queue error queue
	 * @return number of drained errors
	 * @throws NullPointerException if queue is {@code null}
	 */
	public static int drain(TlsErrorQueue queue) {
		if (queue == null) {
			throw new NullPointerException("error queue must not be null!");
		}
		int count = 0;
		SSLException error;
		while ((error = queue.poll()) != null) {
			++count;
			LOGGER.info("clearing leftover error before TLS calls: {}", error.getMessage());
		}
		return count;
	}
}
