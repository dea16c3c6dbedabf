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

/**
 * Queue of errors reported by the secure-transport library.
 * 
 * Errors stay in the queue until they are polled. Leftovers of earlier
 * operations must be drained before new operations are started, otherwise
 * their failures are attributed to the wrong operation.
 * 
 * @see TlsErrors#drain(TlsErrorQueue)
 */
public interface TlsErrorQueue {

	/**
	 * Add error.
	 * 
	 * @param error error to add
	 * @throws NullPointerException if error is {@code null}
	 */
	void add(SSLException error);

	/**
	 * Get and remove oldest error.
	 * 
	 * @return oldest error, or {@code null}, if the queue is empty
	 */
	SSLException poll();

	/**
	 * Check, if queue is empty.
	 * 
	 * @return {@code true}, if empty, {@code false}, otherwise.
	 */
	boolean isEmpty();
}
