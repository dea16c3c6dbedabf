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

import org.siptls.elements.AddressResolver;
import org.siptls.elements.DnsAddressResolver;
import org.siptls.elements.SendSocketProvider;
import org.siptls.elements.UdpSendSocketProvider;
import org.siptls.elements.config.Configuration;
import org.siptls.elements.util.StringUtil;
import org.siptls.tls.shm.SharedMemory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * TLS keylog callback.
 * <p>
 * Called by the handshake for each exported secret. Filters the secrets by
 * their label and forwards the accepted lines to the channels selected by
 * {@link KeylogSettings#getMode()}.
 * <p>
 * Enable this only for analysis! The secrets allow to decrypt the TLS
 * traffic.
 */
public class TlsKeylogHandler {

	private static final Logger LOGGER = LoggerFactory.getLogger(TlsKeylogHandler.class);

	private static final int MAX_LABEL_LOG_LENGTH = 40;

	private final KeylogSettings settings;
	private final KeylogFileChannel fileChannel;
	private final KeylogPeerChannel peerChannel;

	/**
	 * Create keylog handler.
	 * 
	 * @param settings keylog settings
	 * @param memory shared memory for the file lock
	 * @param resolver resolver for the peer
	 * @param socketProvider provider for the peer's send socket
	 * @throws NullPointerException if any parameter is {@code null}
	 */
	public TlsKeylogHandler(KeylogSettings settings, SharedMemory memory, AddressResolver resolver,
			SendSocketProvider socketProvider) {
		this(settings, new KeylogFileChannel(settings, memory),
				new KeylogPeerChannel(settings, resolver, socketProvider));
	}

	/**
	 * Create keylog handler with channels.
	 * 
	 * @param settings keylog settings
	 * @param fileChannel file channel
	 * @param peerChannel peer channel
	 * @throws NullPointerException if any parameter is {@code null}
	 */
	public TlsKeylogHandler(KeylogSettings settings, KeylogFileChannel fileChannel, KeylogPeerChannel peerChannel) {
		if (settings == null) {
			throw new NullPointerException("settings must not be null!");
		}
		if (fileChannel == null) {
			throw new NullPointerException("file channel must not be null!");
		}
		if (peerChannel == null) {
			throw new NullPointerException("peer channel must not be null!");
		}
		this.settings = settings;
		this.fileChannel = fileChannel;
		this.peerChannel = peerChannel;
	}

	/**
	 * Create keylog handler from configuration.
	 * 
	 * Uses DNS to resolve the peer and a new UDP socket to send to it.
	 * 
	 * @param config configuration with the keylog definitions of
	 *            {@link org.siptls.tls.config.TlsConfig}
	 * @param memory shared memory for the file lock
	 * @return keylog handler. Not initialized.
	 */
	public static TlsKeylogHandler create(Configuration config, SharedMemory memory) {
		return new TlsKeylogHandler(KeylogSettings.from(config), memory, new DnsAddressResolver(),
				new UdpSendSocketProvider());
	}

	/**
	 * Initialize the selected channels.
	 * 
	 * Failures are logged. A failed channel stays disabled.
	 * 
	 * @return {@code true}, if all selected channels are initialized,
	 *         {@code false}, otherwise.
	 */
	public boolean init() {
		if (!settings.isEnabled()) {
			LOGGER.debug("TLSKEYLOG: disabled");
			return true;
		}
		LOGGER.warn("TLSKEYLOG: enabled, {}", settings);
		KeylogResult file = fileChannel.init();
		if (!file.isSuccess()) {
			LOGGER.error("TLSKEYLOG: file channel failed ({})", file);
		}
		KeylogResult peer = peerChannel.init();
		if (!peer.isSuccess()) {
			LOGGER.error("TLSKEYLOG: peer channel failed ({})", peer);
		}
		return file.isSuccess() && peer.isSuccess();
	}

	/**
	 * Check, if keylog is enabled.
	 * 
	 * @return {@code true}, if enabled, {@code false}, otherwise.
	 */
	public boolean isEnabled() {
		return settings.isEnabled();
	}

	/**
	 * Keylog callback for secret.
	 * 
	 * @param label label of secret
	 * @param clientRandom client random of handshake
	 * @param secret secret
	 */
	public void onKeylog(String label, byte[] clientRandom, byte[] secret) {
		if (settings.isEnabled() && KeylogLabelFilter.matches(label)) {
			if (clientRandom == null || secret == null) {
				LOGGER.warn("TLSKEYLOG: {} without client random or secret", label);
				return;
			}
			dispatch(SecretLine.format(label, clientRandom, secret).getLine());
		} else {
			LOGGER.trace("TLSKEYLOG: ignored {}", StringUtil.trunc(label, MAX_LABEL_LOG_LENGTH));
		}
	}

	/**
	 * Keylog callback for line.
	 * 
	 * @param line keylog line, {@code LABEL client-random secret}
	 */
	public void onKeylog(String line) {
		if (settings.isEnabled() && KeylogLabelFilter.matchesLine(line)) {
			dispatch(line);
		} else if (line != null) {
			LOGGER.trace("TLSKEYLOG: ignored {}", StringUtil.trunc(line, MAX_LABEL_LOG_LENGTH));
		}
	}

	private void dispatch(String line) {
		if (settings.isSelected(KeylogMode.LOG)) {
			LOGGER.info("TLSKEYLOG: {}", line);
		}
		if (settings.isSelected(KeylogMode.FILE)) {
			KeylogResult result = fileChannel.write(line);
			if (!result.isSuccess()) {
				LOGGER.debug("TLSKEYLOG: write failed ({})", result);
			}
		}
		if (settings.isSelected(KeylogMode.PEER)) {
			KeylogResult result = peerChannel.send(line);
			if (!result.isSuccess()) {
				LOGGER.debug("TLSKEYLOG: send failed ({})", result);
			}
		}
	}

	/**
	 * Close channels.
	 */
	public void close() {
		fileChannel.close();
		peerChannel.close();
	}
}
