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
package net.tsread.configuration.provider;

import java.util.Map;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

/**
 * A provider backed by a fixed map of strings, mostly used by tests and
 * embedded setups.
 * 
 * @since 1.0
 */
public class MapProvider extends Provider {
  public static final String SOURCE = MapProvider.class.getSimpleName();
  
  /** The settings. */
  private final Map<String, String> settings;
  
  /**
   * Default ctor.
   * @param settings A non-null map of settings, may be empty.
   * @throws IllegalArgumentException if the map was null.
   */
  public MapProvider(final Map<String, String> settings) {
    if (settings == null) {
      throw new IllegalArgumentException("Settings cannot be null.");
    }
    this.settings = ImmutableMap.copyOf(settings);
  }
  
  @Override
  public String getSetting(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    return settings.get(key);
  }

  @Override
  public String source() {
    return SOURCE;
  }
}
