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

import net.tsread.query.QueryContext;

/**
 * The storage engine boundary consumed by the remote-read path. A queryable
 * hands out queriers bound to a time range.
 * <p>
 * Implementations signal failures with unchecked exceptions. To mark a 
 * failure as a server side problem rather than a bad request, throw a
 * {@link net.tsread.exceptions.QueryExecutionException} with a 5xx status.
 * 
 * @since 1.0
 */
public interface Queryable {

  /**
   * Returns a querier over the inclusive time range. Long running work 
   * should watch {@link QueryContext#isCanceled()} or register a listener
   * via {@link QueryContext#addCancelListener(Runnable)}.
   * @param context The non-null request context.
   * @param min_ms The inclusive start time in milliseconds.
   * @param max_ms The inclusive end time in milliseconds.
   * @return A non-null querier the caller must close.
   */
  public Querier querier(final QueryContext context, 
                         final long min_ms, 
                         final long max_ms);
  
}
