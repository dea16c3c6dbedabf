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
 * Filter for labels of keylog lines.
 * 
 * @see <a href="https://tlswg.org/sslkeylogfile/draft-ietf-tls-keylogfile.html"
 *      target="_blank"> draft-ietf-tls-keylogfile</a>
 */
public final class KeylogLabelFilter {

	private static final String[] LABELS = { "CLIENT_RANDOM", "CLIENT_HANDSHAKE_TRAFFIC_SECRET",
			"SERVER_HANDSHAKE_TRAFFIC_SECRET", "EXPORTER_SECRET", "CLIENT_TRAFFIC_SECRET_0",
			"SERVER_TRAFFIC_SECRET_0" };

	private KeylogLabelFilter() {
	}

	/**
	 * Check, if label is exported.
	 * 
	 * @param label label. Case insensitive.
	 * @return {@code true}, if label is exported, {@code false}, otherwise.
	 */
	public static boolean matches(String label) {
		if (label != null) {
			for (String exported : LABELS) {
				if (exported.equalsIgnoreCase(label)) {
					return true;
				}
			}
		}
		return false;
	}

	/**
	 * Check, if label of line is exported.
	 * 
	 * @param line keylog line
	 * @return {@code true}, if label is exported, {@code false}, otherwise.
	 * @see SecretLine#getLabel()
	 */
	public static boolean matchesLine(String line) {
		return line != null && matches(SecretLine.parse(line).getLabel());
	}
}
