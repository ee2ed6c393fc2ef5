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

/**
 * Optional hints a remote-read client may attach to a query. They are not 
 * interpreted here, only handed to the storage engine.
 * 
 * @since 1.0
 */
public final class ReadHints {
  private final long step_ms;
  private final String func;
  private final long start_ms;
  private final long end_ms;
  private final List<String> grouping;
  private final boolean by;
  private final long range_ms;
  
  private ReadHints(final Builder builder) {
    step_ms = builder.stepMs;
    func = builder.func;
    start_ms = builder.startMs;
    end_ms = builder.endMs;
    grouping = builder.grouping == null ? ImmutableList.<String>of() : 
      ImmutableList.copyOf(builder.grouping);
    by = builder.by;
    range_ms = builder.rangeMs;
  }
  
  /** @return The query step in milliseconds. */
  public long getStepMs() {
    return step_ms;
  }
  
  /** @return The surrounding function or aggregation, may be null. */
  public String getFunc() {
    return func;
  }
  
  /** @return The hinted start time in milliseconds. */
  public long getStartMs() {
    return start_ms;
  }
  
  /** @return The hinted end time in milliseconds. */
  public long getEndMs() {
    return end_ms;
  }
  
  /** @return The grouping labels, never null. */
  public List<String> getGrouping() {
    return grouping;
  }
  
  /** @return Whether the grouping is "by" or "without". */
  public boolean isBy() {
    return by;
  }
  
  /** @return The range of a range vector selector in milliseconds. */
  public long getRangeMs() {
    return range_ms;
  }
  
  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder {
    private long stepMs;
    private String func;
    private long startMs;
    private long endMs;
    private List<String> grouping;
    private boolean by;
    private long rangeMs;
    
    public Builder setStepMs(final long step_ms) {
      stepMs = step_ms;
      return this;
    }
    
    public Builder setFunc(final String func) {
      this.func = func;
      return this;
    }
    
    public Builder setStartMs(final long start_ms) {
      startMs = start_ms;
      return this;
    }
    
    public Builder setEndMs(final long end_ms) {
      endMs = end_ms;
      return this;
    }
    
    public Builder setGrouping(final List<String> grouping) {
      this.grouping = grouping;
      return this;
    }
    
    public Builder setBy(final boolean by) {
      this.by = by;
      return this;
    }
    
    public Builder setRangeMs(final long range_ms) {
      rangeMs = range_ms;
      return this;
    }
    
    public ReadHints build() {
      return new ReadHints(this);
    }
  }
}
