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
package org.siptls.elements;

import java.io.IOException;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;

/**
 * Provider of sockets to send datagrams.
 */
public interface SendSocketProvider {

	/**
	 * Get a socket to send datagrams to the provided destination.
	 * 
	 * @param destination destination of the datagrams
	 * @return socket to send datagrams, or {@code null}, if no socket is
	 *         available for that destination.
	 * @throws IOException if the socket could not be created
	 */
	DatagramSocket getSendSocket(InetSocketAddress destination) throws IOException;
}
