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
package net.tsread.query;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.google.common.base.Objects;

/**
 * A predicate over a single label value used to select series. Regular
 * expression matchers are fully anchored the same way Prometheus anchors 
 * them, so {@code job=~"node"} does not match "node_exporter".
 * <p>
 * The query layer never evaluates matchers itself, it hands them to the
 * storage engine. {@link #matches(String)} is provided for engines that 
 * want the standard semantics.
 * 
 * @since 1.0
 */
public final class LabelMatcher {
  
  /** The kind of comparison. */
  public static enum MatchType {
    /** Value equals the pattern. */
    EQ("="),
    /** Value does not equal the pattern. */
    NEQ("!="),
    /** Value matches the anchored regular expression. */
    RE("=~"),
    /** Value does not match the anchored regular expression. */
    NRE("!~");
    
    private final String operator;
    
    MatchType(final String operator) {
      this.operator = operator;
    }
    
    /** @return The PromQL operator for the type. */
    public String operator() {
      return operator;
    }
  }
  
  private final MatchType type;
  private final String name;
  private final String value;
  
  /** Compiled pattern for the regex types, null otherwise. */
  private final Pattern pattern;
  
  /**
   * Default ctor.
   * @param type A non-null match type.
   * @param name A non-null label name.
   * @param value A non-null value or pattern.
   * @throws IllegalArgumentException if an argument was null or the 
   * regular expression failed to compile.
   */
  public LabelMatcher(final MatchType type, 
                      final String name, 
                      final String value) {
    if (type == null) {
      throw new IllegalArgumentException("Match type cannot be null.");
    }
    if (name == null) {
      throw new IllegalArgumentException("Label name cannot be null.");
    }
    if (value == null) {
      throw new IllegalArgumentException("Matcher value cannot be null.");
    }
    this.type = type;
    this.name = name;
    this.value = value;
    if (type == MatchType.RE || type == MatchType.NRE) {
      try {
        pattern = Pattern.compile("^(?:" + value + ")$", Pattern.DOTALL);
      } catch (PatternSyntaxException e) {
        throw new IllegalArgumentException("Invalid regular expression for "
            + "label '" + name + "': " + value, e);
      }
    } else {
      pattern = null;
    }
  }
  
  /** @return The match type. */
  public MatchType type() {
    return type;
  }
  
  /** @return The label name. */
  public String name() {
    return name;
  }
  
  /** @return The raw value or pattern. */
  public String value() {
    return value;
  }
  
  /**
   * Evaluates the matcher against a label value.
   * @param label_value The value of the label in a series or null if the
   * series does not have the label, in which case it's treated as empty.
   * @return True if the value satisfies the matcher.
   */
  public boolean matches(final String label_value) {
    final String v = label_value == null ? "" : label_value;
    switch (type) {
    case EQ:
      return v.equals(value);
    case NEQ:
      return !v.equals(value);
    case RE:
      return pattern.matcher(v).matches();
    case NRE:
      return !pattern.matcher(v).matches();
    default:
      throw new IllegalStateException("Unhandled match type: " + type);
    }
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final LabelMatcher other = (LabelMatcher) o;
    return type == other.type
        && Objects.equal(name, other.name)
        && Objects.equal(value, other.value);
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(type, name, value);
  }
  
  @Override
  public String toString() {
    return name + type.operator() + "\"" + value + "\"";
  }
}
