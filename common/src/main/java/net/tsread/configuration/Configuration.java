// This file is part of TSRead.
// Copyright (C) 2024  The TSRead Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.tsread.configuration;

import java.io.Closeable;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.tsread.configuration.provider.CommandLineProvider;
import net.tsread.configuration.provider.EnvironmentProvider;
import net.tsread.configuration.provider.PropertiesFileProvider;
import net.tsread.configuration.provider.Provider;
import net.tsread.configuration.provider.SystemPropertiesProvider;

/**
 * A flattened key to value configuration pulled from several sources. 
 * <p>
 * Components first {@link #register(String, int, boolean, String)} a key 
 * with its type, default and description, then read it with one of the 
 * typed getters. Reading a key that was never registered throws. On 
 * registration the providers are consulted from the most significant to 
 * the least and the first value found wins. The order, least significant 
 * first, is: the properties file named by {@link #CONFIG_FILE_KEY}, the 
 * environment, JVM system properties and finally command line arguments in 
 * the form {@code --key=value}.
 * <p>
 * Keys registered as dynamic may be overridden at runtime with 
 * {@link #addOverride(String, Object)}.
 * 
 * @since 1.0
 */
public class Configuration implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(Configuration.class);
  
  /**
   * Jackson mapper shared for type conversion of string values.
   */
  protected static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
  static {
    OBJECT_MAPPER.configure(JsonParser.Feature.ALLOW_NON_NUMERIC_NUMBERS, true);
    OBJECT_MAPPER.configure(JsonParser.Feature.ALLOW_COMMENTS, true);
  }
  
  /** Key for an optional properties file. */
  public static final String CONFIG_FILE_KEY = "config.file";
  
  /** Source name for runtime overrides. */
  public static final String RUNTIME_OVERRIDE_SOURCE = "RuntimeOverride";
  
  /** The main configuration. Everything works off this.*/
  protected final Map<String, ConfigurationEntry> merged_config;
  
  /** Providers in order from least significant to most significant. */
  protected final List<Provider> providers;
  
  /**
   * Ctor that loads the environment and system properties only.
   * 
   * @throws ConfigurationException if the configuration could not be 
   * loaded.
   */
  public Configuration() {
    this(new String[0]);
  }
  
  /**
   * Ctor used when running as an application that parses command line 
   * parameters.
   * 
   * @param cli_args A non-null list of zero or more command line parameters.
   * @throws IllegalArgumentException if the cli args were null.
   * @throws ConfigurationException if the configuration file could not be
   * loaded.
   */
  public Configuration(final String[] cli_args) {
    if (cli_args == null) {
      throw new IllegalArgumentException("CLI arguments cannot be null.");
    }
    merged_config = Maps.newConcurrentMap();
    providers = Lists.newArrayList();
    
    final CommandLineProvider cli = new CommandLineProvider(cli_args);
    final EnvironmentProvider env = new EnvironmentProvider();
    final SystemPropertiesProvider system = new SystemPropertiesProvider();
    
    String file = cli.getSetting(CONFIG_FILE_KEY);
    if (file == null) {
      file = system.getSetting(CONFIG_FILE_KEY);
    }
    if (file == null) {
      file = env.getSetting(CONFIG_FILE_KEY);
    }
    if (!Strings.isNullOrEmpty(file)) {
      providers.add(new PropertiesFileProvider(file));
    }
    providers.add(env);
    providers.add(system);
    providers.add(cli);
    register(CONFIG_FILE_KEY, file, false, "The path to an optional "
        + "properties file holding configuration settings.");
  }
  
  /**
   * Ctor for subclasses that supply their own providers.
   * @param providers A non-null list of providers, least significant first.
   */
  protected Configuration(final List<Provider> providers) {
    if (providers == null) {
      throw new IllegalArgumentException("Providers cannot be null.");
    }
    merged_config = Maps.newConcurrentMap();
    this.providers = Lists.newArrayList(providers);
  }
  
  /**
   * Registers a key with the type {@link String}. The schema is nullable.
   * 
   * @param key A non-null and non-empty key.
   * @param default_value A default value, may be null.
   * @param is_dynamic Whether or not the value can be overridden at runtime.
   * @param description A non-null and non-empty description.
   * @throws IllegalArgumentException if the key or description was 
   * null or empty.
   * @throws ConfigurationException if the key was already registered. 
   */
  public void register(final String key, 
                       final String default_value, 
                       final boolean is_dynamic,
                       final String description) {
    register(key, String.class, default_value, true, is_dynamic, description);
  }
  
  /**
   * Registers a key with the type {@code int}.
   * 
   * @param key A non-null and non-empty key.
   * @param default_value A default value.
   * @param is_dynamic Whether or not the value can be overridden at runtime.
   * @param description A non-null and non-empty description.
   * @throws IllegalArgumentException if the key or description was 
   * null or empty.
   * @throws ConfigurationException if the key was already registered. 
   */
  public void register(final String key, 
                       final int default_value, 
                       final boolean is_dynamic,
                       final String description) {
    register(key, int.class, default_value, false, is_dynamic, description);
  }
  
  /**
   * Registers a key with the type {@code long}.
   * 
   * @param key A non-null and non-empty key.
   * @param default_value A default value.
   * @param is_dynamic Whether or not the value can be overridden at runtime.
   * @param description A non-null and non-empty description.
   * @throws IllegalArgumentException if the key or description was 
   * null or empty.
   * @throws ConfigurationException if the key was already registered. 
   */
  public void register(final String key, 
                       final long default_value, 
                       final boolean is_dynamic,
                       final String description) {
    register(key, long.class, default_value, false, is_dynamic, description);
  }
  
  /**
   * Registers a key with the type {@code boolean}.
   * 
   * @param key A non-null and non-empty key.
   * @param default_value A default value.
   * @param is_dynamic Whether or not the value can be overridden at runtime.
   * @param description A non-null and non-empty description.
   * @throws IllegalArgumentException if the key or description was 
   * null or empty.
   * @throws ConfigurationException if the key was already registered. 
   */
  public void register(final String key, 
                       final boolean default_value, 
                       final boolean is_dynamic,
                       final String description) {
    register(key, boolean.class, default_value, false, is_dynamic, 
        description);
  }
  
  private void register(final String key,
                        final Class<?> type,
                        final Object default_value,
                        final boolean nullable,
                        final boolean is_dynamic,
                        final String description) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    if (Strings.isNullOrEmpty(description)) {
      throw new IllegalArgumentException("Description cannot be null or "
          + "empty. Help the users!");
    }
    final ConfigurationEntry entry = new ConfigurationEntry(key, type, 
        default_value, nullable, is_dynamic, description, 
        callerClassName());
    final ConfigurationEntry extant = merged_config.putIfAbsent(key, entry);
    if (extant != null) {
      throw new ConfigurationException("Schema already exists for "
          + "key: " + key);
    }
    
    for (int i = providers.size() - 1; i >= 0; i--) {
      final String setting = providers.get(i).getSetting(key);
      if (setting != null) {
        entry.setValue(convert(key, setting, type), providers.get(i).source());
        break;
      }
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Registered config: " + entry);
    }
  }
  
  /**
   * Overrides the value of a dynamic key at runtime.
   * @param key A non-null and non-empty registered key.
   * @param value The new value, converted to the registered type.
   * @throws IllegalArgumentException if the key was null or empty.
   * @throws ConfigurationException if the key was not registered, was not
   * dynamic or the value could not be converted.
   */
  public void addOverride(final String key, final Object value) {
    final ConfigurationEntry entry = entry(key);
    if (!entry.isDynamic()) {
      throw new ConfigurationException("Key is not dynamic: " + key);
    }
    entry.setValue(value == null ? null : convert(key, value, entry.type), 
        RUNTIME_OVERRIDE_SOURCE);
  }
  
  /**
   * Returns the value cast to the given type using Jackson for conversion.
   * 
   * @param key The non-null and non-empty config key entry.
   * @param type A non-null class to cast to.
   * @return The value found, may be null if set to null for non-primitive
   * types.
   * @throws IllegalArgumentException if the key was null or empty.
   * @throws ConfigurationException if the key was not registered or the
   * value could not be converted.
   */
  @SuppressWarnings("unchecked")
  public <T> T getTyped(final String key, final Class<?> type) {
    if (type == null) {
      throw new IllegalArgumentException("Type cannot be null.");
    }
    final Object value = entry(key).getValue();
    if (value == null) {
      if (type.isPrimitive()) {
        throw new ConfigurationException("Cannot cast null to a "
            + "primitive type: " + type);
      }
      return null;
    }
    return (T) convert(key, value, type);
  }
  
  /**
   * @param key The non-null and non-empty config key entry.
   * @return A String if the entry had a value, null if it was set to null.
   * @throws IllegalArgumentException if the key was null or empty.
   * @throws ConfigurationException if the key did not exist in the
   * config.
   */
  public String getString(final String key) {
    final Object value = entry(key).getValue();
    return value == null ? null : value.toString();
  }
  
  /**
   * @param key A non-null and non-empty key.
   * @return An integer value.
   * @throws IllegalArgumentException if the key was null or empty.
   * @throws ConfigurationException if the key did not exist in the
   * config.
   */
  public int getInt(final String key) {
    return (int) getTyped(key, int.class);
  }
  
  /**
   * @param key A non-null and non-empty key.
   * @return A long integer value.
   * @throws IllegalArgumentException if the key was null or empty.
   * @throws ConfigurationException if the key did not exist in the
   * config.
   */
  public long getLong(final String key) {
    return (long) getTyped(key, long.class);
  }
  
  /**
   * Checks to see if the value of the key is true or false. Nulls count
   * as false and only the values in the set [true, 1, yes] count as 
   * true (cast to lower case in string form).
   * 
   * @param key A non-null and non-empty key.
   * @return A boolean value.
   * @throws IllegalArgumentException if the key was null or empty.
   * @throws ConfigurationException if the key did not exist in the
   * config.
   */
  public boolean getBoolean(final String key) {
    String bool = getString(key);
    if (Strings.isNullOrEmpty(bool)) {
      return false;
    }
    bool = bool.toLowerCase().trim();
    return bool.equals("true") || bool.equals("1") || bool.equals("yes");
  }
  
  /**
   * Determines if the given key has been registered.
   * 
   * @param key A non-null and no-empty key.
   * @return True if the key was registered, false if not.
   * @throws IllegalArgumentException if the key was null or empty.
   */
  public boolean hasProperty(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    return merged_config.containsKey(key);
  }
  
  /** @return A snapshot of non-null settings cast to strings. */
  public Map<String, String> asUnsecuredMap() {
    final Map<String, String> map = 
        Maps.newHashMapWithExpectedSize(merged_config.size());
    for (final Entry<String, ConfigurationEntry> entry : 
        merged_config.entrySet()) {
      final Object value = entry.getValue().getValue();
      if (value != null) {
        map.put(entry.getKey(), value.toString());        
      }
    }
    return Collections.unmodifiableMap(map);
  }
  
  @Override
  public void close() throws IOException {
    for (final Provider provider : providers) {
      try {
        provider.close();
      } catch (IOException e) {
        LOG.warn("Failed to close provider: " + provider.source(), e);
      }
    }
  }
  
  /**
   * @param key A non-null and non-empty key.
   * @return The registered entry.
   * @throws ConfigurationException if the key was not registered.
   */
  protected ConfigurationEntry entry(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    final ConfigurationEntry entry = merged_config.get(key);
    if (entry == null) {
      throw new ConfigurationException("No registration found for key: " + key);
    }
    return entry;
  }
  
  private static Object convert(final String key, 
                                final Object value, 
                                final Class<?> type) {
    if (value.getClass().equals(type) || type.isInstance(value)) {
      return value;
    }
    try {
      final Object converted = OBJECT_MAPPER.convertValue(
          value instanceof String ? ((String) value).trim() : value, type);
      if (converted == null) {
        throw new ConfigurationException("Unable to convert value for key '" 
            + key + "' to " + type);
      }
      return converted;
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Unable to convert value for key '" 
          + key + "' to " + type, e);
    }
  }
  
  /** @return The name of the class that called a register method. */
  private static String callerClassName() {
    final StackTraceElement[] stack = Thread.currentThread().getStackTrace();
    for (int i = 1; i < stack.length; i++) {
      if (!stack[i].getClassName().equals(Configuration.class.getName()) &&
          !stack[i].getClassName().equals(Thread.class.getName())) {
        return stack[i].getClassName();
      }
    }
    return "unknown";
  }
}
