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

import java.util.List;

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

/**
 * A fully materialized series: its labels and every sample the storage 
 * iterator yielded, in the order it yielded them.
 * 
 * @since 1.0
 */
public final class TimeSeries {
  private final Labels labels;
  private final List<Sample> samples;
  
  /**
   * Default ctor.
   * @param labels A non-null label set.
   * @param samples A non-null, possibly empty list of samples.
   * @throws IllegalArgumentException if an argument was null.
   */
  public TimeSeries(final Labels labels, final List<Sample> samples) {
    if (labels == null) {
      throw new IllegalArgumentException("Labels cannot be null.");
    }
    if (samples == null) {
      throw new IllegalArgumentException("Samples cannot be null.");
    }
    this.labels = labels;
    this.samples = ImmutableList.copyOf(samples);
  }
  
  /** @return The label set of the series. */
  public Labels labels() {
    return labels;
  }
  
  /** @return The unmodifiable list of samples. */
  public List<Sample> samples() {
    return samples;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final TimeSeries other = (TimeSeries) o;
    return Objects.equal(labels, other.labels)
        && Objects.equal(samples, other.samples);
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(labels, samples);
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("labels=")
        .append(labels)
        .append(", samples=")
        .append(samples)
        .toString();
  }
}
