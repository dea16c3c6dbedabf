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

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration of the TLS components.
 * <p>
 * Each module contributes its {@link ValueDefinition}s and their defaults with
 * a {@link ModuleDefinitionsProvider}. A module registers its provider once by
 * {@link #addDefaultModule(ModuleDefinitionsProvider)}, then every new
 * configuration contains the module's values. An administrator overrides them
 * in a properties file:
 *
 * <pre>
 * <code>
 * TLS.KEYLOG_MODE=5
 * TLS.KEYLOG_FILE=/var/log/sip/keylog.txt
 * TLS.KEYLOG_PEER=udp:127.0.0.1:9012
 * TLS.CONFIG_COLLECT_INTERVAL=30[s]
 * </code>
 * </pre>
 *
 * Invalid values in properties are logged and the default is used instead.
 */
public final class Configuration {

	/**
	 * Definitions and defaults of a module.
	 */
	public interface ModuleDefinitionsProvider {

		/**
		 * Get module name.
		 *
		 * @return module name, the prefix of the module's keys, e.g.
		 *         {@code "TLS."}.
		 */
		String getModule();

		/**
		 * Add the module's definitions with their initial values.
		 *
		 * @param config configuration to add the definitions to
		 */
		void applyDefinitions(Configuration config);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Configuration.class);

	private static final ConcurrentMap<String, ModuleDefinitionsProvider> MODULES = new ConcurrentHashMap<>();

	private final ConcurrentMap<String, ValueDefinition<?>> definitions = new ConcurrentHashMap<>();
	/**
	 * Values by key. Guarded by itself, values may be {@code null}.
	 */
	private final Map<String, Object> values = new HashMap<>();

	/**
	 * Register module for all new configurations.
	 *
	 * Registering the same provider again is ignored.
	 *
	 * @param provider module's provider
	 * @throws NullPointerException if provider is {@code null}
	 * @throws IllegalArgumentException if the module name is empty, or an
	 *             other provider is registered for that name.
	 */
	public static void addDefaultModule(ModuleDefinitionsProvider provider) {
		if (provider == null) {
			throw new NullPointerException("provider must not be null!");
		}
		String module = provider.getModule();
		if (module == null || module.isEmpty()) {
			throw new IllegalArgumentException("module name must not be empty!");
		}
		ModuleDefinitionsProvider registered = MODULES.putIfAbsent(module, provider);
		if (registered == null) {
			LOGGER.info("module {} registered", module);
		} else if (registered != provider) {
			throw new IllegalArgumentException("module " + module + " is already registered!");
		}
	}

	/**
	 * Create configuration with the registered modules and read the
	 * properties from the stream.
	 *
	 * @param in stream with properties
	 * @return configuration
	 * @throws NullPointerException if stream is {@code null}
	 */
	public static Configuration createFromStream(InputStream in) {
		Configuration configuration = new Configuration();
		try {
			configuration.load(in);
		} catch (IOException ex) {
			LOGGER.warn("reading configuration failed: {}", ex.getMessage());
		}
		return configuration;
	}

	/**
	 * Create configuration with the registered modules and read the
	 * properties from the file, if it exists.
	 *
	 * @param file properties file
	 * @return configuration
	 * @throws NullPointerException if file is {@code null}
	 */
	public static Configuration createFromFile(File file) {
		if (file == null) {
			throw new NullPointerException("file must not be null!");
		}
		Configuration configuration = new Configuration();
		if (file.exists()) {
			configuration.load(file);
		} else {
			LOGGER.info("{} is missing, defaults are used", file.getAbsolutePath());
		}
		return configuration;
	}

	/**
	 * Create configuration with all registered modules.
	 */
	public Configuration() {
		this(MODULES.values().toArray(new ModuleDefinitionsProvider[0]));
	}

	/**
	 * Create configuration with the provided modules only.
	 *
	 * @param providers modules
	 */
	public Configuration(ModuleDefinitionsProvider... providers) {
		for (ModuleDefinitionsProvider provider : providers) {
			provider.applyDefinitions(this);
		}
	}

	/**
	 * Read properties from file.
	 *
	 * Failures to read the file are logged.
	 *
	 * @param file properties file
	 * @throws NullPointerException if file is {@code null}
	 */
	public void load(File file) {
		if (file == null) {
			throw new NullPointerException("file must not be null!");
		}
		LOGGER.info("reading configuration {}", file.getAbsolutePath());
		try (InputStream in = new FileInputStream(file)) {
			load(in);
		} catch (IOException ex) {
			LOGGER.warn("reading {} failed: {}", file.getAbsolutePath(), ex.getMessage());
		}
	}

	/**
	 * Read properties from stream.
	 *
	 * @param in stream with properties
	 * @throws NullPointerException if stream is {@code null}
	 * @throws IOException if reading fails
	 */
	public void load(InputStream in) throws IOException {
		if (in == null) {
			throw new NullPointerException("stream must not be null!");
		}
		Properties properties = new Properties();
		properties.load(in);
		add(properties);
	}

	/**
	 * Add values from properties.
	 *
	 * Unknown keys are ignored. Empty or invalid values reset the value to the
	 * definition's default.
	 *
	 * @param properties properties
	 * @throws NullPointerException if properties is {@code null}
	 */
	public void add(Properties properties) {
		if (properties == null) {
			throw new NullPointerException("properties must not be null!");
		}
		for (String key : properties.stringPropertyNames()) {
			ValueDefinition<?> definition = definitions.get(key);
			if (definition == null) {
				LOGGER.warn("{} is unknown and ignored!", key);
				continue;
			}
			String text = properties.getProperty(key).trim();
			Object value = null;
			if (!text.isEmpty()) {
				try {
					value = definition.parse(text);
				} catch (IllegalArgumentException ex) {
					LOGGER.warn("{}, using default", ex.getMessage());
				}
			}
			synchronized (values) {
				values.put(key, value);
			}
		}
	}

	/**
	 * Check, if the definition is part of this configuration.
	 *
	 * @param definition definition
	 * @return {@code true}, if contained, {@code false}, otherwise.
	 */
	public boolean hasDefinition(ValueDefinition<?> definition) {
		return definitions.get(definition.getKey()) == definition;
	}

	/**
	 * Set value from text.
	 *
	 * @param <T> value type
	 * @param definition definition
	 * @param text textual value
	 * @return this configuration for chaining
	 * @throws IllegalArgumentException if the text is no valid value, or an
	 *             other definition uses the same key
	 */
	public <T> Configuration setFromText(ValueDefinition<T> definition, String text) {
		store(definition, definition.parse(text));
		return this;
	}

	/**
	 * Set value.
	 *
	 * @param <T> value type
	 * @param definition definition
	 * @param value value. {@code null} to use the default.
	 * @return this configuration for chaining
	 * @throws IllegalArgumentException if the value is out of range, or an
	 *             other definition uses the same key
	 */
	public <T> Configuration set(ValueDefinition<T> definition, T value) {
		store(definition, definition.accept(value));
		return this;
	}

	/**
	 * Set duration.
	 *
	 * @param definition definition
	 * @param value duration in provided unit
	 * @param unit unit of the duration
	 * @return this configuration for chaining
	 */
	public Configuration set(TimeDefinition definition, long value, TimeUnit unit) {
		return set(definition, unit.toMillis(value));
	}

	/**
	 * Get value.
	 *
	 * @param <T> value type
	 * @param definition definition
	 * @return value, or the default, if no value is set.
	 * @throws IllegalArgumentException if an other definition uses the same key
	 */
	public <T> T get(ValueDefinition<T> definition) {
		check(definition);
		Object value;
		synchronized (values) {
			value = values.get(definition.getKey());
		}
		return value == null ? definition.getDefaultValue() : definition.accept(value);
	}

	/**
	 * Get duration.
	 *
	 * @param definition definition
	 * @param unit unit of the result
	 * @return duration in the provided unit, or {@code null}, if neither value
	 *         nor default is available.
	 */
	public Long get(TimeDefinition definition, TimeUnit unit) {
		Long millis = get(definition);
		return millis == null ? null : unit.convert(millis, TimeUnit.MILLISECONDS);
	}

	private void check(ValueDefinition<?> definition) {
		ValueDefinition<?> known = definitions.get(definition.getKey());
		if (known != null && known != definition) {
			throw new IllegalArgumentException(definition.getKey() + " is used by an other definition!");
		}
	}

	private void store(ValueDefinition<?> definition, Object value) {
		ValueDefinition<?> known = definitions.putIfAbsent(definition.getKey(), definition);
		if (known != null && known != definition) {
			throw new IllegalArgumentException(definition.getKey() + " is used by an other definition!");
		}
		synchronized (values) {
			values.put(definition.getKey(), value);
		}
	}
}
