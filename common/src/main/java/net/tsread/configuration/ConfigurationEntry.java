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

/**
 * A registered configuration key: its schema (type, default, description)
 * and the value resolved from the providers, if any.
 * 
 * @since 1.0
 */
public class ConfigurationEntry {
  final String key;
  final Class<?> type;
  final Object default_value;
  final boolean nullable;
  final boolean dynamic;
  final String description;
  final String source;
  
  /** The resolved value, null if no provider had one. */
  private volatile Object value;
  
  /** The provider the value came from. */
  private volatile String value_source;
  
  ConfigurationEntry(final String key, 
                     final Class<?> type, 
                     final Object default_value,
                     final boolean nullable,
                     final boolean dynamic,
                     final String description,
                     final String source) {
    this.key = key;
    this.type = type;
    this.default_value = default_value;
    this.nullable = nullable;
    this.dynamic = dynamic;
    this.description = description;
    this.source = source;
  }
  
  /** @return The key. */
  public String getKey() {
    return key;
  }
  
  /** @return The registered type. */
  public Class<?> getType() {
    return type;
  }
  
  /** @return Whether runtime overrides are allowed. */
  public boolean isDynamic() {
    return dynamic;
  }
  
  /** @return The help text. */
  public String getDescription() {
    return description;
  }
  
  /** @return The class that registered the key. */
  public String getSource() {
    return source;
  }
  
  /** @return The provider that set the current value or "Default". */
  public String getValueSource() {
    return value_source == null ? "Default" : value_source;
  }
  
  /** @return The current value, falling back to the default. */
  public Object getValue() {
    return value_source == null ? default_value : value;
  }
  
  void setValue(final Object value, final String value_source) {
    if (value == null && !nullable) {
      throw new ConfigurationException("Null values are not allowed for "
          + "key: " + key);
    }
    this.value = value;
    this.value_source = value_source;
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("key=")
        .append(key)
        .append(", type=")
        .append(type)
        .append(", value=")
        .append(getValue())
        .append(", source=")
        .append(getValueSource())
        .toString();
  }
}
