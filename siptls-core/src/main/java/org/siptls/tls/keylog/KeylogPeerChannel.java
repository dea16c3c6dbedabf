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

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

import org.siptls.elements.AddressResolver;
import org.siptls.elements.SendSocketProvider;
import org.siptls.elements.util.Protocol;
import org.siptls.elements.util.ProtocolAddress;
import org.siptls.elements.util.StringUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * TLSKEYLOG peer.
 * <p>
 * Sends each keylog line as single UDP datagram to the configured peer. Best
 * effort, lost datagrams are not detected.
 * <p>
 * The datagrams contain sensitive keys for encryption! Use it with reasonable
 * care!
 */
public class KeylogPeerChannel {

	private static final Logger LOGGER = LoggerFactory.getLogger(KeylogPeerChannel.class);

	private final KeylogSettings settings;
	private final AddressResolver resolver;
	private final SendSocketProvider socketProvider;
	/**
	 * Resolved destination. {@code null}, if not initialized.
	 */
	private volatile InetSocketAddress destination;
	/**
	 * Cached send socket.
	 */
	private final AtomicReference<DatagramSocket> sendSocket = new AtomicReference<DatagramSocket>();

	/**
	 * Create peer channel.
	 * 
	 * @param settings keylog settings
	 * @param resolver resolver for the peer's host
	 * @param socketProvider provider for the send socket
	 * @throws NullPointerException if any parameter is {@code null}
	 */
	public KeylogPeerChannel(KeylogSettings settings, AddressResolver resolver, SendSocketProvider socketProvider) {
		if (settings == null) {
			throw new NullPointerException("settings must not be null!");
		}
		if (resolver == null) {
			throw new NullPointerException("resolver must not be null!");
		}
		if (socketProvider == null) {
			throw new NullPointerException("socket provider must not be null!");
		}
		this.settings = settings;
		this.resolver = resolver;
		this.socketProvider = socketProvider;
	}

	/**
	 * Initialize channel.
	 * 
	 * Parses and resolves the peer address. The peer must be given as
	 * {@code udp:host:port}.
	 * 
	 * @return {@link KeylogResult#SUCCESS}, if the channel is not selected or
	 *         initialized successfully, {@link KeylogResult#MISSING_PARAMETER},
	 *         if no peer is configured, {@link KeylogResult#INVALID_ADDRESS},
	 *         if the peer could not be parsed or has no port,
	 *         {@link KeylogResult#UNSUPPORTED_PROTOCOL}, if the peer has no
	 *         protocol or an other protocol than UDP, or
	 *         {@link KeylogResult#RESOLUTION_FAILURE}, if the peer's host could
	 *         not be resolved.
	 */
	public synchronized KeylogResult init() {
		if (!settings.isSelected(KeylogMode.PEER)) {
			return KeylogResult.SUCCESS;
		}
		String peer = settings.getPeer();
		if (peer.isEmpty()) {
			LOGGER.warn("TLSKEYLOG: peer mode without peer!");
			return KeylogResult.MISSING_PARAMETER;
		}
		if (destination != null) {
			return KeylogResult.SUCCESS;
		}
		ProtocolAddress address;
		try {
			address = ProtocolAddress.parse(peer);
		} catch (IllegalArgumentException ex) {
			LOGGER.error("TLSKEYLOG: invalid peer address <{}>: {}", peer, ex.getMessage());
			return KeylogResult.INVALID_ADDRESS;
		}
		Protocol protocol = address.getProtocol();
		if (protocol == null || !protocol.isDatagram()) {
			LOGGER.error("TLSKEYLOG: only udp supported in peer address <{}>", peer);
			return KeylogResult.UNSUPPORTED_PROTOCOL;
		}
		if (!address.hasPort()) {
			LOGGER.error("TLSKEYLOG: missing port in peer address <{}>", peer);
			return KeylogResult.INVALID_ADDRESS;
		}
		try {
			destination = resolver.resolve(address.getHost(), address.getPort());
		} catch (UnknownHostException ex) {
			LOGGER.error("TLSKEYLOG: failed to resolve <{}>", peer);
			return KeylogResult.RESOLUTION_FAILURE;
		}
		LOGGER.info("TLSKEYLOG: peer {}", StringUtil.toLog(destination));
		return KeylogResult.SUCCESS;
	}

	/**
	 * Check, if channel is initialized.
	 * 
	 * @return {@code true}, if initialized, {@code false}, otherwise.
	 */
	public boolean isEnabled() {
		return destination != null;
	}

	/**
	 * Get resolved destination.
	 * 
	 * @return destination, or {@code null}, if not initialized.
	 */
	public InetSocketAddress getDestination() {
		return destination;
	}

	/**
	 * Send line to keylog peer.
	 * 
	 * Gets the send socket on first use. If that fails, the channel stays
	 * initialized and the next call tries again.
	 * 
	 * @param line line to send
	 * @return {@link KeylogResult#SUCCESS}, if the channel is not initialized
	 *         or the line is sent, {@link KeylogResult#NO_SEND_SOCKET}, if no
	 *         send socket is available, or {@link KeylogResult#SEND_FAILURE},
	 *         if sending failed.
	 * @throws NullPointerException if line is {@code null}
	 */
	public KeylogResult send(String line) {
		if (line == null) {
			throw new NullPointerException("line must not be null!");
		}
		InetSocketAddress destination = this.destination;
		if (destination == null) {
			return KeylogResult.SUCCESS;
		}
		DatagramSocket socket = getSendSocket(destination);
		if (socket == null) {
			return KeylogResult.NO_SEND_SOCKET;
		}
		byte[] data = line.getBytes(StandardCharsets.UTF_8);
		try {
			socket.send(new DatagramPacket(data, data.length, destination));
		} catch (IOException ex) {
			LOGGER.error("TLSKEYLOG: failed to send to <{}>: {}", settings.getPeer(), ex.getMessage());
			return KeylogResult.SEND_FAILURE;
		}
		return KeylogResult.SUCCESS;
	}

	private DatagramSocket getSendSocket(InetSocketAddress destination) {
		DatagramSocket socket = sendSocket.get();
		if (socket == null) {
			try {
				socket = socketProvider.getSendSocket(destination);
			} catch (IOException ex) {
				LOGGER.error("TLSKEYLOG: no send socket for <{}>: {}", settings.getPeer(), ex.getMessage());
				return null;
			}
			if (socket == null) {
				LOGGER.error("TLSKEYLOG: no send socket for <{}>", settings.getPeer());
				return null;
			}
			if (!sendSocket.compareAndSet(null, socket)) {
				// concurrent first use, keep the other socket
				socket.close();
				socket = sendSocket.get();
			}
		}
		return socket;
	}

	/**
	 * Close channel.
	 * 
	 * Closes the send socket. Following sends are ignored.
	 */
	public synchronized void close() {
		destination = null;
		DatagramSocket socket = sendSocket.getAndSet(null);
		if (socket != null) {
			socket.close();
		}
	}
}
