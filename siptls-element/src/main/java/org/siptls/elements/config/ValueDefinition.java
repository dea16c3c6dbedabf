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
 * Typed, documented configuration value with a default.
 * <p>
 * The key is used as property name and must be unique. Subclasses provide the
 * conversion from and to the textual form used in properties files.
 *
 * @param <T> type of the value
 */
public abstract class ValueDefinition<T> {

	private final String key;
	private final String documentation;
	private final Class<T> valueType;
	private final T defaultValue;

	/**
	 * Create definition.
	 *
	 * @param key property name
	 * @param documentation description of the value
	 * @param valueType type of the value
	 * @param defaultValue value used, if none is set. May be {@code null}.
	 * @throws NullPointerException if key or value type is {@code null}
	 * @throws IllegalArgumentException if key is empty
	 */
	protected ValueDefinition(String key, String documentation, Class<T> valueType, T defaultValue) {
		if (key == null) {
			throw new NullPointerException("key must not be null!");
		}
		if (key.isEmpty()) {
			throw new IllegalArgumentException("key must not be empty!");
		}
		if (valueType == null) {
			throw new NullPointerException("value type must not be null!");
		}
		this.key = key;
		this.documentation = documentation;
		this.valueType = valueType;
		this.defaultValue = defaultValue;
	}

	public final String getKey() {
		return key;
	}

	public String getDocumentation() {
		return documentation;
	}

	public T getDefaultValue() {
		return defaultValue;
	}

	/**
	 * Get name of the value type for messages.
	 *
	 * @return type name
	 */
	public abstract String getTypeName();

	/**
	 * Format value for properties.
	 *
	 * @param value value. Not {@code null}.
	 * @return textual value
	 */
	public abstract String format(T value);

	/**
	 * Convert textual value.
	 *
	 * @param text trimmed, non empty text
	 * @return value
	 * @throws ValueException if the text is no valid value
	 */
	protected abstract T convert(String text) throws ValueException;

	/**
	 * Validate value.
	 *
	 * @param value value, may be {@code null}
	 * @throws ValueException if the value is out of range
	 */
	protected void validate(T value) throws ValueException {
	}

	/**
	 * Parse and validate textual value.
	 *
	 * @param text textual value
	 * @return value
	 * @throws NullPointerException if text is {@code null}
	 * @throws IllegalArgumentException if text is empty or not a valid value.
	 *             The message contains the key.
	 */
	public T parse(String text) {
		if (text == null) {
			throw new NullPointerException(key + ": text must not be null!");
		}
		String value = text.trim();
		if (value.isEmpty()) {
			throw new IllegalArgumentException(key + ": empty value!");
		}
		try {
			T result = convert(value);
			validate(result);
			return result;
		} catch (NumberFormatException ex) {
			throw new IllegalArgumentException(key + ": '" + value + "' is no " + getTypeName() + "!");
		} catch (ValueException ex) {
			throw new IllegalArgumentException(key + ": " + ex.getMessage());
		}
	}

	/**
	 * Cast and validate value.
	 *
	 * @param value value, may be {@code null}
	 * @return typed value
	 * @throws IllegalArgumentException if the value has the wrong type or is
	 *             out of range
	 */
	T accept(Object value) {
		if (value != null && !valueType.isInstance(value)) {
			throw new IllegalArgumentException(
					key + ": " + value.getClass().getSimpleName() + " is no " + getTypeName() + "!");
		}
		T typed = valueType.cast(value);
		try {
			validate(typed);
		} catch (ValueException ex) {
			throw new IllegalArgumentException(key + ": " + ex.getMessage());
		}
		return typed;
	}

	@Override
	public String toString() {
		return key;
	}
}
