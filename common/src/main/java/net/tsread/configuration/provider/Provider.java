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

import java.io.Closeable;
import java.io.IOException;

/**
 * A source of raw configuration settings. Values are returned as strings
 * and converted to the registered type by the configuration.
 * 
 * @since 1.0
 */
public abstract class Provider implements Closeable {
  
  /**
   * Returns the raw value for the key if this provider has one.
   * @param key A non-null and non-empty key.
   * @return The value or null if the provider doesn't have the key.
   * @throws IllegalArgumentException if the key was null or empty.
   */
  public abstract String getSetting(final String key);
  
  /** @return The name of the provider, reported as the value source. */
  public abstract String source();
  
  @Override
  public void close() throws IOException {
    // no-op
  }
}
