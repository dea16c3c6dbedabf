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
 * Bits of the keylog mode.
 * 
 * Each export channel is only selected, if {@link #INIT} and the bit of the
 * channel are set.
 * 
 * @see org.siptls.tls.config.TlsConfig#KEYLOG_MODE
 */
public enum KeylogMode {

	/**
	 * Enables the export of session secrets.
	 */
	INIT(1),
	/**
	 * Write session secrets to the logging.
	 */
	LOG(2),
	/**
	 * Append session secrets to the keylog file.
	 */
	FILE(4),
	/**
	 * Send session secrets to the keylog peer.
	 */
	PEER(8);

	private final int bit;

	private KeylogMode(int bit) {
		this.bit = bit;
	}

	public int getBit() {
		return bit;
	}

	/**
	 * Check, if bit is set in mode.
	 * 
	 * @param mode bitmask
	 * @return {@code true}, if set, {@code false}, otherwise.
	 */
	public boolean isSet(int mode) {
		return (mode & bit) != 0;
	}

	/**
	 * Check, if channel is selected.
	 * 
	 * @param mode bitmask
	 * @param channel channel to check
	 * @return {@code true}, if {@link #INIT} and the channel's bit are set.
	 */
	public static boolean isSelected(int mode, KeylogMode channel) {
		return INIT.isSet(mode) && channel.isSet(mode);
	}

	/**
	 * Combine modes to bitmask.
	 * 
	 * @param modes modes to combine
	 * @return bitmask
	 */
	public static int toMask(KeylogMode... modes) {
		int mask = 0;
		for (KeylogMode mode : modes) {
			mask |= mode.bit;
		}
		return mask;
	}
}
