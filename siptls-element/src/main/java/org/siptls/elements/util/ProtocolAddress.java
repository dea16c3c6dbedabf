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

/**
 * Unresolved address with optional protocol and port.
 * 
 * Textual presentation {@code [proto:]host[:port]}. IPv6 hosts must be
 * enclosed in brackets, e.g. {@code udp:[::1]:9012}.
 */
public final class ProtocolAddress {

	/**
	 * Port value, if no port is provided.
	 */
	public static final int NO_PORT = 0;

	private final Protocol protocol;
	private final String host;
	private final int port;

	/**
	 * Create address.
	 * 
	 * @param protocol protocol. {@code null}, if not provided.
	 * @param host host name or literal address
	 * @param port port. {@link #NO_PORT}, if not provided.
	 * @throws NullPointerException if host is {@code null}
	 * @throws IllegalArgumentException if port is out of range
	 */
	public ProtocolAddress(Protocol protocol, String host, int port) {
		if (host == null) {
			throw new NullPointerException("host must not be null!");
		}
		if (port < 0 || port > 0xffff) {
			throw new IllegalArgumentException("port " + port + " out of range!");
		}
		this.protocol = protocol;
		this.host = host;
		this.port = port;
	}

	/**
	 * Get protocol.
	 * 
	 * @return protocol, or {@code null}, if not provided.
	 */
	public Protocol getProtocol() {
		return protocol;
	}

	public String getHost() {
		return host;
	}

	/**
	 * Get port.
	 * 
	 * @return port, or {@link #NO_PORT}, if not provided.
	 */
	public int getPort() {
		return port;
	}

	public boolean hasPort() {
		return port != NO_PORT;
	}

	/**
	 * Parse address.
	 * 
	 * @param address textual address {@code [proto:]host[:port]}
	 * @return parsed address
	 * @throws NullPointerException if address is {@code null}
	 * @throws IllegalArgumentException if the address could not be parsed
	 */
	public static ProtocolAddress parse(String address) {
		if (address == null) {
			throw new NullPointerException("address must not be null!");
		}
		String text = address.trim();
		Protocol protocol = null;
		String host;
		String port = null;
		int bracket = text.indexOf('[');
		if (bracket >= 0) {
			if (bracket > 0) {
				protocol = parseProtocol(address, text.substring(0, bracket));
			}
			int end = text.indexOf(']', bracket);
			if (end < 0) {
				throw new IllegalArgumentException("missing ']' in " + address);
			}
			host = text.substring(bracket + 1, end);
			if (host.isEmpty() || host.indexOf(':') < 0) {
				throw new IllegalArgumentException("invalid IPv6 host in " + address);
			}
			String tail = text.substring(end + 1);
			if (!tail.isEmpty()) {
				if (tail.charAt(0) != ':') {
					throw new IllegalArgumentException("invalid port in " + address);
				}
				port = tail.substring(1);
			}
		} else {
			String[] parts = text.split(":", -1);
			switch (parts.length) {
			case 1:
				host = parts[0];
				break;
			case 2:
				if (isNumber(parts[1])) {
					host = parts[0];
					port = parts[1];
				} else {
					protocol = parseProtocol(address, parts[0] + ":");
					host = parts[1];
				}
				break;
			case 3:
				protocol = parseProtocol(address, parts[0] + ":");
				host = parts[1];
				port = parts[2];
				break;
			default:
				throw new IllegalArgumentException("too many ':' in " + address);
			}
			if (!StringUtil.isValidHostName(host)) {
				throw new IllegalArgumentException("invalid host in " + address);
			}
		}
		int portNumber = NO_PORT;
		if (port != null) {
			if (!isNumber(port)) {
				throw new IllegalArgumentException("invalid port in " + address);
			}
			portNumber = Integer.parseInt(port);
			if (portNumber == NO_PORT || portNumber > 0xffff) {
				throw new IllegalArgumentException("port out of range in " + address);
			}
		}
		return new ProtocolAddress(protocol, host, portNumber);
	}

	private static Protocol parseProtocol(String address, String prefix) {
		if (!prefix.endsWith(":")) {
			throw new IllegalArgumentException("missing ':' after protocol in " + address);
		}
		Protocol protocol = Protocol.fromText(prefix.substring(0, prefix.length() - 1));
		if (protocol == null) {
			throw new IllegalArgumentException("unknown protocol in " + address);
		}
		return protocol;
	}

	private static boolean isNumber(String text) {
		if (text.isEmpty() || text.length() > 5) {
			return false;
		}
		for (int index = 0; index < text.length(); ++index) {
			if (!Character.isDigit(text.charAt(index))) {
				return false;
			}
		}
		return true;
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		if (protocol != null) {
			builder.append(protocol.getText()).append(':');
		}
		if (host.indexOf(':') >= 0) {
			builder.append('[').append(host).append(']');
		} else {
			builder.append(host);
		}
		if (hasPort()) {
			builder.append(':').append(port);
		}
		return builder.toString();
	}

	@Override
	public int hashCode() {
		int result = host.hashCode();
		result = 31 * result + port;
		result = 31 * result + (protocol == null ? 0 : protocol.hashCode());
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		} else if (!(obj instanceof ProtocolAddress)) {
			return false;
		}
		ProtocolAddress other = (ProtocolAddress) obj;
		return protocol == other.protocol && port == other.port && host.equals(other.host);
	}
}
