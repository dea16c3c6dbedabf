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

import java.util.concurrent.TimeUnit;

/**
 * Duration, written as {@code value[unit]}, e.g. {@code 30[s]}.
 * <p>
 * Supported units are {@code ms}, {@code s}, {@code min}, {@code h} and
 * {@code d}. Without unit the value is in milliseconds, which is also the
 * stored unit. Use {@link Configuration#get(TimeDefinition, TimeUnit)} to read
 * it in other units.
 */
public class TimeDefinition extends ValueDefinition<Long> {

	private static final TimeUnit[] UNITS = { TimeUnit.DAYS, TimeUnit.HOURS, TimeUnit.MINUTES, TimeUnit.SECONDS,
			TimeUnit.MILLISECONDS };
	private static final String[] UNIT_NAMES = { "d", "h", "min", "s", "ms" };

	public TimeDefinition(String key, String documentation, long defaultValue, TimeUnit unit) {
		super(key, documentation, Long.class, unit.toMillis(defaultValue));
	}

	@Override
	public String getTypeName() {
		return "Time";
	}

	@Override
	public String format(Long millis) {
		if (millis != 0) {
			for (int index = 0; index < UNITS.length; ++index) {
				long factor = UNITS[index].toMillis(1);
				if (millis % factor == 0) {
					return (millis / factor) + "[" + UNIT_NAMES[index] + "]";
				}
			}
		}
		return millis + "[ms]";
	}

	@Override
	protected Long convert(String text) throws ValueException {
		int open = text.indexOf('[');
		if (open < 0) {
			return Long.valueOf(text);
		}
		if (!text.endsWith("]")) {
			throw new ValueException("'" + text + "' is not value[unit]!");
		}
		String name = text.substring(open + 1, text.length() - 1).trim();
		for (int index = 0; index < UNITS.length; ++index) {
			if (UNIT_NAMES[index].equals(name)) {
				return UNITS[index].toMillis(Long.parseLong(text.substring(0, open).trim()));
			}
		}
		throw new ValueException("unknown unit '" + name + "'!");
	}

	@Override
	protected void validate(Long value) throws ValueException {
		if (value != null && value < 0) {
			throw new ValueException(value + "ms is negative!");
		}
	}
}
