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

import org.junit.Test;
import org.junit.experimental.categories.Category;
import org.siptls.tls.category.Small;

@Category(Small.class)
public class SecretLineTest {

	@Test
	public void testFormat() {
		byte[] random = { 0x01, 0x02, (byte) 0xab };
		byte[] secret = { (byte) 0xff, 0x00 };
		SecretLine line = SecretLine.format("CLIENT_RANDOM", random, secret);
		assertThat(line.getLabel(), is("CLIENT_RANDOM"));
		assertThat(line.getLine(), is("CLIENT_RANDOM 0102AB FF00"));
		assertThat(line.toString(), is("CLIENT_RANDOM 0102AB FF00"));
	}

	@Test
	public void testParse() {
		SecretLine line = SecretLine.parse("SERVER_TRAFFIC_SECRET_0 0102 0304");
		assertThat(line.getLabel(), is("SERVER_TRAFFIC_SECRET_0"));
		assertThat(line.getLine(), is("SERVER_TRAFFIC_SECRET_0 0102 0304"));
	}

	@Test
	public void testParseLabelOnly() {
		SecretLine line = SecretLine.parse("EXPORTER_SECRET");
		assertThat(line.getLabel(), is("EXPORTER_SECRET"));
	}

	@Test(expected = NullPointerException.class)
	public void testFormatWithoutSecret() {
		SecretLine.format("CLIENT_RANDOM", new byte[1], null);
	}
}
