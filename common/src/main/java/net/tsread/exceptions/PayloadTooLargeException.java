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
package net.tsread.exceptions;

/**
 * Thrown when a request body, compressed or decompressed, is larger than the
 * configured ceiling. Always a client error.
 * 
 * @since 1.0
 */
public class PayloadTooLargeException extends SerdesException {
  private static final long serialVersionUID = -1872640914416452470L;

  /** The size seen. */
  private final long size;
  
  /** The ceiling. */
  private final long max_size;
  
  /**
   * Default ctor.
   * @param size The size seen.
   * @param max_size The ceiling that was exceeded.
   */
  public PayloadTooLargeException(final long size, final long max_size) {
    super("received message larger than max (" + size + " vs " 
        + max_size + ")", 400);
    this.size = size;
    this.max_size = max_size;
  }
  
  /** @return The size seen. */
  public long getSize() {
    return size;
  }
  
  /** @return The ceiling that was exceeded. */
  public long getMaxSize() {
    return max_size;
  }
}
