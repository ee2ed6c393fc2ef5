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
 * Thrown when the storage engine refuses or fails to hand out a querier
 * for a sub query's time range.
 * 
 * @since 1.0
 */
public class QuerierAcquisitionException extends QueryExecutionException {
  private static final long serialVersionUID = -4629181711953205764L;

  /**
   * Default ctor.
   * @param msg A non-null message to be given.
   * @param status_code The status code to respond with.
   * @param order The index of the failed query in the request.
   * @param t The storage exception.
   */
  public QuerierAcquisitionException(final String msg, 
                                     final int status_code, 
                                     final int order,
                                     final Throwable t) {
    super(msg, status_code, order, t);
  }
  
}
