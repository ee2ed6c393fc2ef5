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
package net.tsread.storage;

import java.io.Closeable;
import java.util.List;

import net.tsread.query.LabelMatcher;

/**
 * A handle on the storage engine bound to a time range.
 * 
 * @since 1.0
 */
public interface Querier extends Closeable {

  /**
   * Selects every series matching all of the matchers. Matching semantics
   * belong to the engine.
   * @param sort_series Whether the set must be sorted by labels.
   * @param hints Non-null hints with the selection range.
   * @param matchers A non-null list of matchers.
   * @return A non-null, lazily produced series set. Errors may be reported 
   * through {@link SeriesSet#err()} instead of being thrown.
   */
  public SeriesSet select(final boolean sort_series, 
                          final SelectHints hints, 
                          final List<LabelMatcher> matchers);
  
}
