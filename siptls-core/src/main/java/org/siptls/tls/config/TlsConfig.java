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
package org.siptls.tls.config;

import java.util.concurrent.TimeUnit;

import org.siptls.elements.config.Configuration;
import org.siptls.elements.config.Configuration.ModuleDefinitionsProvider;
import org.siptls.elements.config.IntegerDefinition;
import org.siptls.elements.config.StringDefinition;
import org.siptls.elements.config.TimeDefinition;
import org.siptls.tls.keylog.KeylogMode;

/**
 * Configuration definitions for TLS.
 */
public final class TlsConfig {

	public static final String MODULE = "TLS.";

	/**
	 * Keylog mode. Bitmask of {@link KeylogMode}s.
	 * 
	 * {@code 0} disables the export of TLS session secrets.
	 */
	public static final IntegerDefinition KEYLOG_MODE = new IntegerDefinition(MODULE + "KEYLOG_MODE",
			"TLS keylog mode. Bitmask, 1 := enable, 2 := log, 4 := file, 8 := peer. 0 to disable.", 0, 0);

	/**
	 * Keylog file.
	 * 
	 * The file contains sensitive keys for encryption! Use it with reasonable
	 * care!
	 */
	public static final StringDefinition KEYLOG_FILE = new StringDefinition(MODULE + "KEYLOG_FILE",
			"TLS keylog file. Contains sensitive keys for encryption!", "");

	/**
	 * Keylog peer. {@code [udp:]host:port}.
	 */
	public static final StringDefinition KEYLOG_PEER = new StringDefinition(MODULE + "KEYLOG_PEER",
			"TLS keylog peer address, [udp:]host:port. Receives sensitive keys for encryption!", "");

	/**
	 * Interval to collect unused TLS configuration generations. {@code 0} to
	 * collect only after reloads.
	 */
	public static final TimeDefinition CONFIG_COLLECT_INTERVAL = new TimeDefinition(
			MODULE + "CONFIG_COLLECT_INTERVAL",
			"Interval to collect unused TLS configurations. 0 to collect only after reloads.", 0, TimeUnit.SECONDS);

	public static final ModuleDefinitionsProvider DEFINITIONS = new ModuleDefinitionsProvider() {

		@Override
		public String getModule() {
			return MODULE;
		}

		@Override
		public void applyDefinitions(Configuration config) {
			config.set(KEYLOG_MODE, 0);
			config.set(KEYLOG_FILE, "");
			config.set(KEYLOG_PEER, "");
			config.set(CONFIG_COLLECT_INTERVAL, 0, TimeUnit.SECONDS);
		}
	};

	static {
		Configuration.addDefaultModule(DEFINITIONS);
	}

	private TlsConfig() {
	}

	/**
	 * Register definitions of this module to the default definitions.
	 */
	public static void register() {
		// the static initializer registers the module
	}
}
