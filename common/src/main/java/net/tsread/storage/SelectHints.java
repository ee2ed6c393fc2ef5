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

import net.tsread.query.ReadHints;

/**
 * Hints passed with a series selection. The start and end always mirror the
 * querier's range; the remaining fields come from the client's read hints 
 * when present.
 * 
 * @since 1.0
 */
public final class SelectHints {
  private final long start;
  private final long end;
  private final ReadHints read_hints;
  
  /**
   * Default ctor.
   * @param start The inclusive start time in milliseconds.
   * @param end The inclusive end time in milliseconds.
   * @param read_hints Optional client hints, may be null.
   */
  public SelectHints(final long start, 
                     final long end, 
                     final ReadHints read_hints) {
    this.start = start;
    this.end = end;
    this.read_hints = read_hints;
  }
  
  /** @return The inclusive start time in milliseconds. */
  public long start() {
    return start;
  }
  
  /** @return The inclusive end time in milliseconds. */
  public long end() {
    return end;
  }
  
  /** @return The client hints if sent, null if not. */
  public ReadHints readHints() {
    return read_hints;
  }
  
  @Override
  public String toString() {
    return "start=" + start + ", end=" + end;
  }
}
