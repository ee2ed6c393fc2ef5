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

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * One query of a batched remote-read request: an inclusive time range in
 * milliseconds and a set of label matchers. The range is not validated here
 * so a bad range surfaces as a failure of this one query when it executes.
 * 
 * @since 1.0
 */
public final class SubQuery {
  private final long start_ms;
  private final long end_ms;
  private final List<LabelMatcher> matchers;
  private final ReadHints hints;
  
  private SubQuery(final Builder builder) {
    start_ms = builder.startMs;
    end_ms = builder.endMs;
    matchers = ImmutableList.copyOf(builder.matchers);
    hints = builder.hints;
  }
  
  /** @return The inclusive start time in milliseconds. */
  public long getStartMs() {
    return start_ms;
  }
  
  /** @return The inclusive end time in milliseconds. */
  public long getEndMs() {
    return end_ms;
  }
  
  /** @return The unmodifiable list of matchers. */
  public List<LabelMatcher> getMatchers() {
    return matchers;
  }
  
  /** @return Optional read hints, may be null. */
  public ReadHints getHints() {
    return hints;
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("start=")
        .append(start_ms)
        .append(", end=")
        .append(end_ms)
        .append(", matchers=")
        .append(matchers)
        .toString();
  }
  
  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder {
    private long startMs;
    private long endMs;
    private final List<LabelMatcher> matchers = 
        Lists.newArrayList();
    private ReadHints hints;
    
    public Builder setStartMs(final long start_ms) {
      startMs = start_ms;
      return this;
    }
    
    public Builder setEndMs(final long end_ms) {
      endMs = end_ms;
      return this;
    }
    
    public Builder addMatcher(final LabelMatcher matcher) {
      if (matcher == null) {
        throw new IllegalArgumentException("Matcher cannot be null.");
      }
      matchers.add(matcher);
      return this;
    }
    
    public Builder setHints(final ReadHints hints) {
      this.hints = hints;
      return this;
    }
    
    public SubQuery build() {
      return new SubQuery(this);
    }
  }
}
