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
package org.siptls.elements.util;

import java.util.Locale;

/**
 * Transport protocols of a SIP proxy's listening and peer addresses.
 */
public enum Protocol {

	UDP(true), TCP(false), TLS(false), SCTP(false), WS(false), WSS(false);

	private final boolean datagram;

	private Protocol(boolean datagram) {
		this.datagram = datagram;
	}

	/**
	 * Check, if protocol transports datagrams.
	 * 
	 * @return {@code true}, for datagram protocols, {@code false}, otherwise.
	 */
	public boolean isDatagram() {
		return datagram;
	}

	/**
	 * Get protocol name as used in addresses.
	 * 
	 * @return lower case name, e.g. "udp"
	 */
	public String getText() {
		return name().toLowerCase(Locale.ROOT);
	}

	/**
	 * Get protocol by name.
	 * 
	 * @param name name of protocol. Case insensitive.
	 * @return protocol, or {@code null}, if not available.
	 */
	public static Protocol fromText(String name) {
		if (name != null) {
			for (Protocol protocol : values()) {
				if (protocol.name().equalsIgnoreCase(name)) {
					return protocol;
				}
			}
		}
		return null;
	}
}
