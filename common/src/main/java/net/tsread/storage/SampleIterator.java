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

/**
 * A forward-only iterator over the samples of one series. Call 
 * {@link #next()} until it returns false, then check {@link #err()}.
 * 
 * @since 1.0
 */
public interface SampleIterator {

  /** @return True if the accessors now point at a sample. */
  public boolean next();
  
  /** @return The timestamp of the current sample in milliseconds. */
  public long timestamp();
  
  /** @return The value of the current sample. */
  public double value();
  
  /** @return The error that stopped iteration or null if it finished. */
  public Throwable err();
  
}
