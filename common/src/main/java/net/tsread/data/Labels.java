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

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.Map.Entry;

import com.google.common.collect.ImmutableList;

/**
 * An immutable set of labels identifying a series. Labels are kept sorted
 * by name so two sets with the same pairs always iterate, compare and 
 * serialize identically regardless of the order they were added in. 
 * Names are unique within a set; adding a name twice keeps the last value.
 * 
 * @since 1.0
 */
public final class Labels implements Iterable<Label> {
  /** An empty label set. */
  public static final Labels EMPTY = new Labels(ImmutableList.<Label>of());
  
  /** The sorted labels. */
  private final List<Label> labels;
  
  private Labels(final List<Label> labels) {
    this.labels = labels;
  }
  
  /**
   * Builds a label set from alternating names and values, e.g. 
   * {@code Labels.of("__name__", "up", "job", "node")}.
   * @param names_and_values An even number of non-null strings.
   * @return A non-null label set.
   * @throws IllegalArgumentException if the array had an odd length or
   * contained invalid entries.
   */
  public static Labels of(final String... names_and_values) {
    if (names_and_values.length % 2 != 0) {
      throw new IllegalArgumentException("Names and values must be given "
          + "in pairs.");
    }
    final Builder builder = newBuilder();
    for (int i = 0; i < names_and_values.length; i += 2) {
      builder.add(names_and_values[i], names_and_values[i + 1]);
    }
    return builder.build();
  }
  
  /**
   * @param map A non-null map of names to values.
   * @return A non-null label set.
   */
  public static Labels fromMap(final Map<String, String> map) {
    final Builder builder = newBuilder();
    for (final Entry<String, String> entry : map.entrySet()) {
      builder.add(entry.getKey(), entry.getValue());
    }
    return builder.build();
  }
  
  /**
   * @param name A label name.
   * @return The value of the label or null if the set does not have it.
   */
  public String get(final String name) {
    for (final Label label : labels) {
      if (label.name().equals(name)) {
        return label.value();
      }
    }
    return null;
  }
  
  /** @return The number of labels in the set. */
  public int size() {
    return labels.size();
  }
  
  /** @return Whether or not the set is empty. */
  public boolean isEmpty() {
    return labels.isEmpty();
  }
  
  /** @return An unmodifiable list of labels sorted by name. */
  public List<Label> asList() {
    return labels;
  }
  
  @Override
  public Iterator<Label> iterator() {
    return labels.iterator();
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return labels.equals(((Labels) o).labels);
  }
  
  @Override
  public int hashCode() {
    return labels.hashCode();
  }
  
  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder().append("{");
    for (int i = 0; i < labels.size(); i++) {
      if (i > 0) {
        buf.append(", ");
      }
      buf.append(labels.get(i));
    }
    return buf.append("}").toString();
  }
  
  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder {
    private final TreeMap<String, String> labels = new TreeMap<String, String>();
    
    /**
     * @param name A non-null and non-empty name.
     * @param value A non-null value.
     * @return The builder.
     */
    public Builder add(final String name, final String value) {
      final Label label = new Label(name, value);
      labels.put(label.name(), label.value());
      return this;
    }
    
    /**
     * @param label A non-null label.
     * @return The builder.
     */
    public Builder add(final Label label) {
      labels.put(label.name(), label.value());
      return this;
    }
    
    /** @return The immutable label set. */
    public Labels build() {
      if (labels.isEmpty()) {
        return EMPTY;
      }
      final ImmutableList.Builder<Label> list = ImmutableList.builder();
      for (final Entry<String, String> entry : labels.entrySet()) {
        list.add(new Label(entry.getKey(), entry.getValue()));
      }
      return new Labels(list.build());
    }
  }
}
