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

import com.google.common.base.Strings;

/**
 * Reads settings from the JVM system properties, i.e. {@code -Dkey=value}.
 * 
 * @since 1.0
 */
public class SystemPropertiesProvider extends Provider {
  public static final String SOURCE = 
      SystemPropertiesProvider.class.getSimpleName();
  
  @Override
  public String getSetting(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    return System.getProperty(key);
  }

  @Override
  public String source() {
    return SOURCE;
  }
}
