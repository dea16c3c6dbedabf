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
package org.siptls.elements.config;

/**
 * Text value. Leading and trailing whitespace is removed on parsing.
 */
public class StringDefinition extends ValueDefinition<String> {

	public StringDefinition(String key, String documentation, String defaultValue) {
		super(key, documentation, String.class, defaultValue);
	}

	@Override
	public String getTypeName() {
		return "String";
	}

	@Override
	public String format(String value) {
		return value;
	}

	@Override
	protected String convert(String text) {
		return text;
	}
}
