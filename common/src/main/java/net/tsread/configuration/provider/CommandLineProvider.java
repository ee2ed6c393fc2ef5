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
 * Handles parsing the command line arguments sent to the JVM in the format
 * {@code --key=value}. A bare {@code --key} is treated as {@code true}. 
 * When a key is given more than once the last one wins.
 * 
 * @since 1.0
 */
public class CommandLineProvider extends Provider {
  public static final String SOURCE = CommandLineProvider.class.getSimpleName();
  
  /** The arguments. */
  private final String[] args;
  
  /**
   * Default ctor.
   * @param args A non-null array of CLI arguments, may be empty.
   * @throws IllegalArgumentException if the args were null.
   */
  public CommandLineProvider(final String[] args) {
    if (args == null) {
      throw new IllegalArgumentException("Args cannot be null.");
    }
    this.args = args;
  }
  
  @Override
  public String getSetting(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    final String dashed_key = "--" + key;
    String value = null;
    for (final String arg : args) {
      if (arg == null || !arg.startsWith(dashed_key)) {
        continue;
      }
      if (arg.length() == dashed_key.length()) {
        value = "true";
      } else if (arg.charAt(dashed_key.length()) == '=') {
        value = arg.substring(dashed_key.length() + 1);
      }
    }
    return value;
  }

  @Override
  public String source() {
    return SOURCE;
  }
}
