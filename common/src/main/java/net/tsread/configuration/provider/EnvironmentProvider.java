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
 * Reads settings from the process environment. Keys are looked up as is,
 * then upper cased with periods replaced by underscores, e.g. 
 * {@code tsd.network.port} also matches {@code TSD_NETWORK_PORT}.
 * 
 * @since 1.0
 */
public class EnvironmentProvider extends Provider {
  public static final String SOURCE = EnvironmentProvider.class.getSimpleName();
  
  @Override
  public String getSetting(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    final String value = System.getenv(key);
    if (value != null) {
      return value;
    }
    return System.getenv(key.replace('.', '_').toUpperCase());
  }

  @Override
  public String source() {
    return SOURCE;
  }
}
