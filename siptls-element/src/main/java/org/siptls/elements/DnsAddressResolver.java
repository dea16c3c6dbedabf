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
package org.siptls.elements;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves host names using the platform's name service.
 */
public class DnsAddressResolver implements AddressResolver {

	private static final Logger LOGGER = LoggerFactory.getLogger(DnsAddressResolver.class);

	@Override
	public InetSocketAddress resolve(String host, int port) throws UnknownHostException {
		InetAddress address = InetAddress.getByName(host);
		LOGGER.debug("resolved {} to {}", host, address.getHostAddress());
		return new InetSocketAddress(address, port);
	}
}
