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

import org.siptls.elements.config.Configuration;
import org.siptls.tls.config.TlsConfig;

/**
 * Keylog settings.
 */
public final class KeylogSettings {

	private final int mode;
	private final String file;
	private final String peer;

	/**
	 * Create settings.
	 * 
	 * @param mode bitmask of {@link KeylogMode}s
	 * @param file keylog file. {@code null} or empty, if not available.
	 * @param peer keylog peer. {@code null} or empty, if not available.
	 */
	public KeylogSettings(int mode, String file, String peer) {
		this.mode = mode;
		this.file = file == null ? "" : file;
		this.peer = peer == null ? "" : peer;
	}

	/**
	 * Create settings from configuration.
	 * 
	 * @param config configuration
	 * @return settings
	 * @see TlsConfig#KEYLOG_MODE
	 * @see TlsConfig#KEYLOG_FILE
	 * @see TlsConfig#KEYLOG_PEER
	 */
	public static KeylogSettings from(Configuration config) {
		return new KeylogSettings(config.get(TlsConfig.KEYLOG_MODE), config.get(TlsConfig.KEYLOG_FILE),
				config.get(TlsConfig.KEYLOG_PEER));
	}

	public int getMode() {
		return mode;
	}

	public String getFile() {
		return file;
	}

	public String getPeer() {
		return peer;
	}

	/**
	 * Check, if export is enabled.
	 * 
	 * @return {@code true}, if {@link KeylogMode#INIT} is set
	 */
	public boolean isEnabled() {
		return KeylogMode.INIT.isSet(mode);
	}

	/**
	 * Check, if channel is selected.
	 * 
	 * @param channel channel
	 * @return {@code true}, if {@link KeylogMode#INIT} and the channel are set
	 */
	public boolean isSelected(KeylogMode channel) {
		return KeylogMode.isSelected(mode, channel);
	}

	@Override
	public String toString() {
		return "keylog mode " + mode + ", file '" + file + "', peer '" + peer + "'";
	}
}
