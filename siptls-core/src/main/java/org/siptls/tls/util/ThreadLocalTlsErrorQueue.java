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
package org.siptls.tls.util;

import java.util.ArrayDeque;
import java.util.Deque;

import javax.net.ssl.SSLException;

/**
 * Error queue per thread.
 * 
 * Each thread sees only the errors it added itself.
 */
public class ThreadLocalTlsErrorQueue implements TlsErrorQueue {

	private final ThreadLocal<Deque<SSLException>> errors = new ThreadLocal<Deque<SSLException>>() {

		@Override
		protected Deque<SSLException> initialValue() {
			return new ArrayDeque<>();
		}
	};

	@Override
	public void add(SSLException error) {
		if (error == null) {
			throw new NullPointerException("error must not be null!");
		}
		errors.get().addLast(error);
	}

	@Override
	public SSLException poll() {
		return errors.get().pollFirst();
	}

	@Override
	public boolean isEmpty() {
		return errors.get().isEmpty();
	}
}
