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
 * Thrown when a configuration key is missing, duplicated or holds a value
 * that can't be converted.
 * 
 * @since 1.0
 */
public class ConfigurationException extends RuntimeException {
  private static final long serialVersionUID = -2406424592734542906L;

  /**
   * Default ctor.
   * @param msg A descriptive message.
   */
  public ConfigurationException(final String msg) {
    super(msg);
  }
  
  /**
   * Ctor with a cause.
   * @param msg A descriptive message.
   * @param cause The underlying exception.
   */
  public ConfigurationException(final String msg, final Throwable cause) {
    super(msg, cause);
  }
}
