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
package net.tsread.query.execution;

/**
 * How a request behaves when some of its sub-queries fail.
 * 
 * @since 1.0
 */
public enum PartialFailureMode {
  /** Any failure fails the whole request. Completed results are dropped. */
  ALL_OR_NOTHING,
  
  /** Failed slots are returned empty, the failures are logged. */
  BEST_EFFORT
}
