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
 * A batched remote-read request. The position of each {@link SubQuery} is
 * its identity: the result for query {@code i} is returned in slot 
 * {@code i} of the {@link ReadResponse}.
 * 
 * @since 1.0
 */
public final class ReadRequest {
  private final List<SubQuery> queries;
  
  /**
   * Default ctor.
   * @param queries A non-null, possibly empty list of queries.
   */
  public ReadRequest(final List<SubQuery> queries) {
    if (queries == null) {
      throw new IllegalArgumentException("Queries cannot be null.");
    }
    this.queries = ImmutableList.copyOf(queries);
  }
  
  /** @return The ordered, unmodifiable list of queries. */
  public List<SubQuery> queries() {
    return queries;
  }
  
  /** @return The number of queries. */
  public int size() {
    return queries.size();
  }
}
