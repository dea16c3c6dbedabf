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

import org.siptls.elements.util.StringUtil;

/**
 * Keylog line.
 * 
 * {@code <label> <client random> <secret>}. Only the label is parsed.
 */
public final class SecretLine {

	private final String label;
	private final String line;

	private SecretLine(String label, String line) {
		this.label = label;
		this.line = line;
	}

	/**
	 * Get label.
	 * 
	 * @return label, the text before the first space.
	 */
	public String getLabel() {
		return label;
	}

	/**
	 * Get line.
	 * 
	 * @return the complete line
	 */
	public String getLine() {
		return line;
	}

	@Override
	public String toString() {
		return line;
	}

	/**
	 * Parse line.
	 * 
	 * @param line keylog line
	 * @return secret line
	 * @throws NullPointerException if line is {@code null}
	 */
	public static SecretLine parse(String line) {
		if (line == null) {
			throw new NullPointerException("line must not be null!");
		}
		int pos = line.indexOf(' ');
		String label = pos < 0 ? line : line.substring(0, pos);
		return new SecretLine(label, line);
	}

	/**
	 * Format line.
	 * 
	 * @param label label of the secret
	 * @param clientRandom client random of the session
	 * @param secret secret of the session
	 * @return secret line
	 * @throws NullPointerException if any parameter is {@code null}
	 */
	public static SecretLine format(String label, byte[] clientRandom, byte[] secret) {
		if (label == null) {
			throw new NullPointerException("label must not be null!");
		}
		if (clientRandom == null) {
			throw new NullPointerException("client random must not be null!");
		}
		if (secret == null) {
			throw new NullPointerException("secret must not be null!");
		}
		StringBuilder buffer = new StringBuilder(label);
		buffer.append(' ');
		buffer.append(StringUtil.byteArray2Hex(clientRandom));
		buffer.append(' ');
		buffer.append(StringUtil.byteArray2Hex(secret));
		return new SecretLine(label, buffer.toString());
	}
}
