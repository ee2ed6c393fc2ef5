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
package net.tsread.data;

import com.google.common.base.Objects;
import com.google.common.collect.ComparisonChain;

/**
 * A single name and value pair attached to a time series.
 * 
 * @since 1.0
 */
public final class Label implements Comparable<Label> {
  /** The label name, e.g. "__name__" or "host". */
  private final String name;
  
  /** The label value. */
  private final String value;
  
  /**
   * Default ctor.
   * @param name A non-null and non-empty name.
   * @param value A non-null value, may be empty.
   * @throws IllegalArgumentException if the name was null or empty or the
   * value was null.
   */
  public Label(final String name, final String value) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Label name cannot be null or empty.");
    }
    if (value == null) {
      throw new IllegalArgumentException("Label value cannot be null.");
    }
    this.name = name;
    this.value = value;
  }
  
  /** @return The label name. */
  public String name() {
    return name;
  }
  
  /** @return The label value. */
  public String value() {
    return value;
  }
  
  @Override
  public int compareTo(final Label other) {
    return ComparisonChain.start()
        .compare(name, other.name)
        .compare(value, other.value)
        .result();
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final Label other = (Label) o;
    return Objects.equal(name, other.name) 
        && Objects.equal(value, other.value);
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(name, value);
  }
  
  @Override
  public String toString() {
    return name + "=\"" + value + "\"";
  }
}
