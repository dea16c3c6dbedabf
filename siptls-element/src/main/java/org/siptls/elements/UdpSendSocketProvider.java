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
import java.net.InetAddress;
import java.net.InetSocketAddress;

import org.siptls.elements.util.StringUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates a new UDP socket bound to an ephemeral port.
 * 
 * The local address is either the configured one, or the wildcard address.
 */
public class UdpSendSocketProvider implements SendSocketProvider {

	private static final Logger LOGGER = LoggerFactory.getLogger(UdpSendSocketProvider.class);

	private final InetAddress localAddress;

	/**
	 * Create provider binding to the wildcard address.
	 */
	public UdpSendSocketProvider() {
		this(null);
	}

	/**
	 * Create provider binding to the local address.
	 * 
	 * @param localAddress local address. {@code null} for the wildcard
	 *            address.
	 */
	public UdpSendSocketProvider(InetAddress localAddress) {
		this.localAddress = localAddress;
	}

	@Override
	public DatagramSocket getSendSocket(InetSocketAddress destination) throws IOException {
		if (destination.isUnresolved()) {
			LOGGER.warn("destination {} is not resolved!", destination);
			return null;
		}
		DatagramSocket socket = new DatagramSocket(new InetSocketAddress(localAddress, 0));
		LOGGER.debug("send socket {} for {}", StringUtil.toLog(socket.getLocalSocketAddress()),
				StringUtil.toLog(destination));
		return socket;
	}
}
