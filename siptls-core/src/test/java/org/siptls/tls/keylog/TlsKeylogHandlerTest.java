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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.experimental.categories.Category;
import org.junit.rules.TemporaryFolder;
import org.siptls.elements.config.Configuration;
import org.siptls.tls.category.Small;
import org.siptls.tls.config.TlsConfig;
import org.siptls.tls.rule.TestNameLoggerRule;
import org.siptls.tls.shm.HeapSharedMemory;

@Category(Small.class)
public class TlsKeylogHandlerTest {

	private static final String LINE = "CLIENT_RANDOM 0102 0304";

	@Rule
	public TestNameLoggerRule name = new TestNameLoggerRule();

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private KeylogFileChannel fileChannel;
	private KeylogPeerChannel peerChannel;

	@Before
	public void setUp() {
		fileChannel = mock(KeylogFileChannel.class);
		peerChannel = mock(KeylogPeerChannel.class);
		when(fileChannel.init()).thenReturn(KeylogResult.SUCCESS);
		when(peerChannel.init()).thenReturn(KeylogResult.SUCCESS);
		when(fileChannel.write(anyString())).thenReturn(KeylogResult.SUCCESS);
		when(peerChannel.send(anyString())).thenReturn(KeylogResult.SUCCESS);
	}

	@Test
	public void testDisabled() {
		TlsKeylogHandler handler = newHandler(0);
		assertThat(handler.isEnabled(), is(false));
		assertThat(handler.init(), is(true));
		handler.onKeylog(LINE);
		verify(fileChannel, never()).init();
		verify(fileChannel, never()).write(anyString());
		verify(peerChannel, never()).send(anyString());
	}

	@Test
	public void testChannelsWithoutInit() {
		TlsKeylogHandler handler = newHandler(KeylogMode.toMask(KeylogMode.FILE, KeylogMode.PEER));
		handler.onKeylog(LINE);
		verify(fileChannel, never()).write(anyString());
		verify(peerChannel, never()).send(anyString());
	}

	@Test
	public void testDispatchToFileAndPeer() {
		TlsKeylogHandler handler = newHandler(
				KeylogMode.toMask(KeylogMode.INIT, KeylogMode.FILE, KeylogMode.PEER));
		assertThat(handler.init(), is(true));
		handler.onKeylog(LINE);
		verify(fileChannel).write(LINE);
		verify(peerChannel).send(LINE);
	}

	@Test
	public void testDispatchToLogOnly() {
		TlsKeylogHandler handler = newHandler(KeylogMode.toMask(KeylogMode.INIT, KeylogMode.LOG));
		handler.init();
		handler.onKeylog(LINE);
		verify(fileChannel, never()).write(anyString());
		verify(peerChannel, never()).send(anyString());
	}

	@Test
	public void testFilterIgnoresOtherLabels() {
		TlsKeylogHandler handler = newHandler(
				KeylogMode.toMask(KeylogMode.INIT, KeylogMode.FILE, KeylogMode.PEER));
		handler.init();
		handler.onKeylog("RANDOM_BYTES 0102 0304");
		handler.onKeylog("CLIENT_EARLY_TRAFFIC_SECRET 0102 0304");
		handler.onKeylog((String) null);
		verify(fileChannel, never()).write(anyString());
		verify(peerChannel, never()).send(anyString());
	}

	@Test
	public void testFormatSecret() {
		TlsKeylogHandler handler = newHandler(KeylogMode.toMask(KeylogMode.INIT, KeylogMode.FILE));
		handler.init();
		handler.onKeylog("SERVER_HANDSHAKE_TRAFFIC_SECRET", new byte[] { 0x01, 0x02 }, new byte[] { (byte) 0xfe });
		handler.onKeylog("RANDOM_BYTES", new byte[] { 0x01, 0x02 }, new byte[] { (byte) 0xfe });
		verify(fileChannel).write("SERVER_HANDSHAKE_TRAFFIC_SECRET 0102 FE");
		verify(fileChannel, never()).write("RANDOM_BYTES 0102 FE");
	}

	@Test
	public void testSecretWithoutClientRandom() {
		TlsKeylogHandler handler = newHandler(
				KeylogMode.toMask(KeylogMode.INIT, KeylogMode.FILE, KeylogMode.PEER));
		handler.init();
		handler.onKeylog("CLIENT_RANDOM", null, new byte[] { (byte) 0xfe });
		handler.onKeylog("CLIENT_RANDOM", new byte[] { 0x01, 0x02 }, null);
		verify(fileChannel, never()).write(anyString());
		verify(peerChannel, never()).send(anyString());
	}

	@Test
	public void testFailuresDoNotPropagate() {
		when(fileChannel.write(anyString())).thenReturn(KeylogResult.IO_FAILURE);
		when(peerChannel.send(anyString())).thenReturn(KeylogResult.SEND_FAILURE);
		TlsKeylogHandler handler = newHandler(
				KeylogMode.toMask(KeylogMode.INIT, KeylogMode.FILE, KeylogMode.PEER));
		handler.init();
		handler.onKeylog(LINE);
		verify(fileChannel).write(LINE);
		verify(peerChannel).send(LINE);
	}

	@Test
	public void testInitFailure() {
		when(peerChannel.init()).thenReturn(KeylogResult.UNSUPPORTED_PROTOCOL);
		TlsKeylogHandler handler = newHandler(
				KeylogMode.toMask(KeylogMode.INIT, KeylogMode.FILE, KeylogMode.PEER));
		assertThat(handler.init(), is(false));
		verify(fileChannel).init();
	}

	@Test
	public void testClose() {
		TlsKeylogHandler handler = newHandler(KeylogMode.toMask(KeylogMode.INIT, KeylogMode.FILE));
		handler.close();
		verify(fileChannel).close();
		verify(peerChannel).close();
	}

	@Test
	public void testCreateFromConfiguration() throws IOException {
		File file = new File(folder.getRoot(), "keylog.txt");
		Configuration config = new Configuration(TlsConfig.DEFINITIONS);
		config.set(TlsConfig.KEYLOG_MODE, KeylogMode.toMask(KeylogMode.INIT, KeylogMode.LOG, KeylogMode.FILE));
		config.set(TlsConfig.KEYLOG_FILE, file.getPath());
		TlsKeylogHandler handler = TlsKeylogHandler.create(config, new HeapSharedMemory(1024));
		try {
			assertThat(handler.init(), is(true));
			handler.onKeylog(LINE);
			handler.onKeylog("random_bytes 0102 0304");
			handler.onKeylog("exporter_secret 0102 0506");
		} finally {
			handler.close();
		}
		List<String> lines = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
		assertThat(lines.size(), is(2));
		assertThat(lines.get(0), is(LINE));
		assertThat(lines.get(1), is("exporter_secret 0102 0506"));
	}

	private TlsKeylogHandler newHandler(int mode) {
		return new TlsKeylogHandler(new KeylogSettings(mode, "keylog.txt", "udp:127.0.0.1:9090"), fileChannel,
				peerChannel);
	}
}
