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
 * Integer value, decimal or hexadecimal with {@code 0x} prefix.
 */
public class IntegerDefinition extends ValueDefinition<Integer> {

	private final Integer minimum;

	public IntegerDefinition(String key, String documentation, Integer defaultValue) {
		this(key, documentation, defaultValue, null);
	}

	/**
	 * Create integer definition with minimum.
	 *
	 * @param key property name
	 * @param documentation description of the value
	 * @param defaultValue value used, if none is set. May be {@code null}.
	 * @param minimum smallest valid value. {@code null} for no limit.
	 */
	public IntegerDefinition(String key, String documentation, Integer defaultValue, Integer minimum) {
		super(key, documentation, Integer.class, defaultValue);
		this.minimum = minimum;
	}

	@Override
	public String getTypeName() {
		return "Integer";
	}

	@Override
	public String format(Integer value) {
		return value.toString();
	}

	@Override
	protected Integer convert(String text) {
		if (text.regionMatches(true, 0, "0x", 0, 2)) {
			return Integer.valueOf(text.substring(2), 16);
		}
		return Integer.valueOf(text);
	}

	@Override
	protected void validate(Integer value) throws ValueException {
		if (minimum != null && value != null && value < minimum) {
			throw new ValueException(value + " is less than " + minimum + "!");
		}
	}
}
