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

import java.net.InetSocketAddress;
import java.net.UnknownHostException;

/**
 * Resolver for host names.
 */
public interface AddressResolver {

	/**
	 * Resolve host and port into a socket address.
	 * 
	 * @param host host name or literal address
	 * @param port port
	 * @return resolved socket address
	 * @throws UnknownHostException if the host could not be resolved
	 */
	InetSocketAddress resolve(String host, int port) throws UnknownHostException;
}
