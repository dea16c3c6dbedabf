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
package org.siptls.elements.util;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread factory for named background threads.
 *
 * Thread names are the prefix followed by a counter, e.g.
 * {@code TlsConfigCollector#0}.
 */
public class NamedThreadFactory implements ThreadFactory {

	/**
	 * Group of all background threads of the TLS components.
	 */
	public static final ThreadGroup TLS_THREAD_GROUP = new ThreadGroup("SipTls"); //$NON-NLS-1$

	private final AtomicInteger counter = new AtomicInteger();
	private final String prefix;
	private final boolean daemon;

	/**
	 * Create factory for daemon threads.
	 *
	 * @param prefix prefix of the thread names
	 */
	public NamedThreadFactory(String prefix) {
		this(prefix, true);
	}

	/**
	 * Create factory.
	 *
	 * @param prefix prefix of the thread names
	 * @param daemon {@code true} for daemon threads
	 */
	public NamedThreadFactory(String prefix, boolean daemon) {
		this.prefix = prefix;
		this.daemon = daemon;
	}

	@Override
	public Thread newThread(Runnable runnable) {
		Thread thread = new Thread(TLS_THREAD_GROUP, runnable, prefix + counter.getAndIncrement());
		thread.setDaemon(daemon);
		thread.setPriority(Thread.NORM_PRIORITY);
		return thread;
	}
}
