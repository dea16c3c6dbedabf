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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

import org.junit.Test;
import org.junit.experimental.categories.Category;
import org.siptls.elements.config.Configuration;
import org.siptls.tls.category.Small;

@Category(Small.class)
public class TlsConfigTest {

	@Test
	public void testDefaults() {
		TlsConfig.register();
		Configuration config = new Configuration();
		assertThat(config.get(TlsConfig.KEYLOG_MODE), is(0));
		assertThat(config.get(TlsConfig.KEYLOG_FILE), is(""));
		assertThat(config.get(TlsConfig.KEYLOG_PEER), is(""));
		assertThat(config.get(TlsConfig.CONFIG_COLLECT_INTERVAL, TimeUnit.SECONDS), is(0L));
	}

	@Test
	public void testLoadFromStream() {
		TlsConfig.register();
		String properties = "TLS.KEYLOG_MODE=0x0d\n" + "TLS.KEYLOG_FILE=/var/log/sip/keylog.txt\n"
				+ "TLS.KEYLOG_PEER=udp:127.0.0.1:9090\n" + "TLS.CONFIG_COLLECT_INTERVAL=30[s]\n";
		Configuration config = Configuration
				.createFromStream(new ByteArrayInputStream(properties.getBytes(StandardCharsets.ISO_8859_1)));
		assertThat(config.get(TlsConfig.KEYLOG_MODE), is(13));
		assertThat(config.get(TlsConfig.KEYLOG_FILE), is("/var/log/sip/keylog.txt"));
		assertThat(config.get(TlsConfig.KEYLOG_PEER), is("udp:127.0.0.1:9090"));
		assertThat(config.get(TlsConfig.CONFIG_COLLECT_INTERVAL, TimeUnit.MILLISECONDS), is(30000L));
	}

	@Test
	public void testNegativeModeUsesDefault() {
		Configuration config = new Configuration(TlsConfig.DEFINITIONS);
		config.setFromText(TlsConfig.KEYLOG_MODE, "1");
		Properties properties = new Properties();
		properties.setProperty(TlsConfig.KEYLOG_MODE.getKey(), "-1");
		config.add(properties);
		assertThat(config.get(TlsConfig.KEYLOG_MODE), is(0));
	}
}
