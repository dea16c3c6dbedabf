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

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.siptls.elements.config.Configuration;
import org.siptls.elements.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects unused TLS configuration generations periodically.
 *
 * @see TlsConfig#CONFIG_COLLECT_INTERVAL
 * @see ConfigGenerationRegistry#collect()
 */
public class GenerationCollector {

	private static final Logger LOGGER = LoggerFactory.getLogger(GenerationCollector.class);

	private final ConfigGenerationRegistry<?> registry;
	private final long intervalMillis;

	private ScheduledExecutorService executor;
	private ScheduledFuture<?> job;

	/**
	 * Create collector.
	 *
	 * @param registry registry to collect
	 * @param config configuration providing
	 *            {@link TlsConfig#CONFIG_COLLECT_INTERVAL}
	 * @throws NullPointerException if any parameter is {@code null}
	 */
	public GenerationCollector(ConfigGenerationRegistry<?> registry, Configuration config) {
		if (registry == null) {
			throw new NullPointerException("registry must not be null!");
		}
		if (config == null) {
			throw new NullPointerException("configuration must not be null!");
		}
		this.registry = registry;
		this.intervalMillis = config.get(TlsConfig.CONFIG_COLLECT_INTERVAL, TimeUnit.MILLISECONDS);
	}

	/**
	 * Start periodic collection.
	 *
	 * @return {@code true}, if started, {@code false}, if already running or
	 *         disabled by a zero interval.
	 */
	public synchronized boolean start() {
		if (job != null) {
			return false;
		}
		if (intervalMillis == 0) {
			LOGGER.info("periodic TLS configuration collection disabled");
			return false;
		}
		executor = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("TlsConfigCollector#"));
		job = executor.scheduleWithFixedDelay(new Runnable() {

			@Override
			public void run() {
				try {
					registry.collect();
				} catch (RuntimeException ex) {
					LOGGER.error("collecting TLS configurations failed!", ex);
				}
			}
		}, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
		LOGGER.info("collecting TLS configurations every {} ms", intervalMillis);
		return true;
	}

	/**
	 * Stop periodic collection.
	 */
	public synchronized void stop() {
		if (job != null) {
			job.cancel(false);
			job = null;
			executor.shutdown();
			executor = null;
			LOGGER.info("stopped collecting TLS configurations");
		}
	}

	public synchronized boolean isRunning() {
		return job != null;
	}
}
