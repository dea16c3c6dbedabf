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

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.regex.Pattern;

/**
 * String helpers for keylog lines and log messages.
 */
public class StringUtil {

	/**
	 * Host name labels as in RFC 1123, separated by dots.
	 */
	private static final Pattern HOST_NAME = Pattern
			.compile("([a-zA-Z0-9]([a-zA-Z0-9-]*[a-zA-Z0-9])?\\.)*[a-zA-Z0-9]([a-zA-Z0-9-]*[a-zA-Z0-9])?");

	private static final char[] HEX_DIGITS = "0123456789ABCDEF".toCharArray();

	private StringUtil() {
	}

	/**
	 * Render bytes as upper case hexadecimal digits, two per byte.
	 *
	 * @param data bytes
	 * @return hexadecimal text, or {@code null}, if data is {@code null}.
	 */
	public static String byteArray2Hex(byte[] data) {
		if (data == null) {
			return null;
		}
		StringBuilder hex = new StringBuilder(data.length * 2);
		for (byte b : data) {
			hex.append(HEX_DIGITS[(b >> 4) & 0x0f]).append(HEX_DIGITS[b & 0x0f]);
		}
		return hex.toString();
	}

	/**
	 * Cut text to a maximum length.
	 *
	 * @param text text, may be {@code null}
	 * @param maxLength maximum length. {@code 0} to keep the text.
	 * @return the text or its head
	 */
	public static String trunc(String text, int maxLength) {
		if (text == null || maxLength <= 0 || text.length() <= maxLength) {
			return text;
		}
		return text.substring(0, maxLength);
	}

	/**
	 * Render socket address as {@code [name/]address:port}.
	 *
	 * IPv6 addresses are put in brackets. Unresolved addresses show
	 * {@code <unresolved>} as address.
	 *
	 * @param address socket address
	 * @return text, or {@code null}, if address is {@code null}.
	 */
	public static String toDisplayString(InetSocketAddress address) {
		if (address == null) {
			return null;
		}
		InetAddress ip = address.getAddress();
		String host = ip == null ? "<unresolved>" : ip.getHostAddress();
		if (ip instanceof Inet6Address) {
			host = "[" + host + "]";
		}
		String name = address.getHostString();
		if (ip == null || !name.equals(ip.getHostAddress())) {
			host = name + "/" + host;
		}
		return host + ":" + address.getPort();
	}

	/**
	 * Wrap socket address for parameterized log messages.
	 *
	 * The display string is only built, if the message is logged.
	 *
	 * @param address address
	 * @return wrapper, or {@code null}, if address is {@code null}.
	 */
	public static Object toLog(final SocketAddress address) {
		if (address == null) {
			return null;
		}
		return new Object() {

			@Override
			public String toString() {
				if (address instanceof InetSocketAddress) {
					return toDisplayString((InetSocketAddress) address);
				}
				return address.toString();
			}
		};
	}

	/**
	 * Check host name syntax.
	 *
	 * @param name name
	 * @return {@code true}, if name is a valid host name or IPv4 literal.
	 */
	public static boolean isValidHostName(String name) {
		return name != null && HOST_NAME.matcher(name).matches();
	}
}
