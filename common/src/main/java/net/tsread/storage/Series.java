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

import net.tsread.data.Labels;

/**
 * A series as exposed by the storage engine: labels and a sample iterator.
 * 
 * @since 1.0
 */
public interface Series {

  /** @return The non-null label set. */
  public Labels labels();
  
  /** @return A fresh iterator over the samples, oldest first. */
  public SampleIterator iterator();
  
}
