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

import java.util.Arrays;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * The response to a {@link ReadRequest}. Holds exactly one result per 
 * request query, index aligned with the request.
 * 
 * @since 1.0
 */
public final class ReadResponse {
  private final List<QueryResult> results;
  
  /**
   * Default ctor.
   * @param results A non-null list of results without null entries.
   * @throws IllegalArgumentException if the list or an entry was null.
   */
  public ReadResponse(final List<QueryResult> results) {
    if (results == null) {
      throw new IllegalArgumentException("Results cannot be null.");
    }
    for (int i = 0; i < results.size(); i++) {
      if (results.get(i) == null) {
        throw new IllegalArgumentException("Result at index " + i 
            + " was null.");
      }
    }
    this.results = ImmutableList.copyOf(results);
  }
  
  /**
   * Ctor taking the slot array filled by the executors.
   * @param slots A non-null array of results without null entries.
   */
  public ReadResponse(final QueryResult[] slots) {
    this(Arrays.asList(slots));
  }
  
  /** @return The unmodifiable, index aligned list of results. */
  public List<QueryResult> results() {
    return results;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return results.equals(((ReadResponse) o).results);
  }
  
  @Override
  public int hashCode() {
    return results.hashCode();
  }
  
  @Override
  public String toString() {
    return "results=" + results;
  }
}
