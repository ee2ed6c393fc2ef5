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

import net.tsread.data.TimeSeries;

/**
 * The result of one sub query: every matching series, fully materialized.
 * 
 * @since 1.0
 */
public final class QueryResult {
  /** A result without series, used for empty matches and skipped slots. */
  public static final QueryResult EMPTY = 
      new QueryResult(ImmutableList.<TimeSeries>of());
  
  private final List<TimeSeries> series;
  
  /**
   * Default ctor.
   * @param series A non-null, possibly empty list of series.
   */
  public QueryResult(final List<TimeSeries> series) {
    if (series == null) {
      throw new IllegalArgumentException("Series cannot be null.");
    }
    this.series = ImmutableList.copyOf(series);
  }
  
  /** @return The unmodifiable list of series in storage order. */
  public List<TimeSeries> timeSeries() {
    return series;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return series.equals(((QueryResult) o).series);
  }
  
  @Override
  public int hashCode() {
    return series.hashCode();
  }
  
  @Override
  public String toString() {
    return "series=" + series;
  }
}
