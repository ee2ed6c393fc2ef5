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

import java.util.Collections;
import java.util.Map;

import com.google.common.collect.Lists;

import net.tsread.configuration.provider.MapProvider;
import net.tsread.configuration.provider.Provider;

/**
 * A configuration that only reads from a map of settings, ignoring the
 * environment, system properties and command line. Any key may be 
 * overridden regardless of its dynamic flag.
 * 
 * @since 1.0
 */
public class UnitTestConfiguration extends Configuration {

  /**
   * Package private ctor.
   * @param settings A non-null map of settings.
   */
  UnitTestConfiguration(final Map<String, String> settings) {
    super(Lists.<Provider>newArrayList(new MapProvider(settings)));
  }
  
  /**
   * Sets the value of a registered key, bypassing the dynamic check.
   * @param key A non-null and non-empty registered key.
   * @param value The value to set, may be null for nullable keys.
   * @throws ConfigurationException if the key was not registered.
   */
  public void override(final String key, final Object value) {
    final ConfigurationEntry entry = entry(key);
    entry.setValue(value, RUNTIME_OVERRIDE_SOURCE);
  }
  
  /** @return An empty configuration. */
  public static UnitTestConfiguration getConfiguration() {
    return getConfiguration(Collections.<String, String>emptyMap());
  }
  
  /**
   * @param settings A non-null map of settings to load.
   * @return A configuration reading only from the map.
   */
  public static UnitTestConfiguration getConfiguration(
      final Map<String, String> settings) {
    return new UnitTestConfiguration(settings);
  }
}
