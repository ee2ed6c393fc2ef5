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

import java.util.Collections;
import java.util.List;

/**
 * High level exception that should be thrown by any portion of the query
 * path to bubble up to the end user. The status code is an HTTP code the
 * transport should respond with.
 * 
 * @since 1.0
 */
public class QueryExecutionException extends RuntimeException {
  private static final long serialVersionUID = 6338254902243113267L;

  /** The index of the sub query within the request that failed or -1 if
   * the exception is not tied to a single query. */
  protected final int order;
  
  /** A status code associated with the exception. */
  protected final int status_code;
  
  /** An optional list of exceptions thrown. */
  protected final List<Throwable> exceptions;
  
  /**
   * Default ctor that sets a message describing this exception.
   * @param msg A non-null message to be given.
   * @param status_code An optional status code reflecting the error state.
   */
  public QueryExecutionException(final String msg, final int status_code) {
    this(msg, status_code, -1);
  }
  
  /**
   * Ctor that sets a query order for the exception.
   * @param msg A non-null message to be given.
   * @param status_code An optional status code reflecting the error state.
   * @param order The index of the failed query in the request.
   */
  public QueryExecutionException(final String msg, 
                                 final int status_code, 
                                 final int order) {
    this(msg, status_code, order, (Throwable) null);
  }
  
  /**
   * Ctor that sets a descriptive message, status code and cause.
   * @param msg A non-null message to be given.
   * @param status_code An optional status code reflecting the error state.
   * @param t The original exception that caused this to be thrown.
   */
  public QueryExecutionException(final String msg, 
                                 final int status_code,
                                 final Throwable t) {
    this(msg, status_code, -1, t);
  }
  
  /**
   * Ctor setting a message, query order, status code and cause.
   * @param msg A non-null message to be given.
   * @param status_code An optional status code reflecting the error state.
   * @param order The index of the failed query in the request.
   * @param t The original exception that caused this to be thrown.
   */
  public QueryExecutionException(final String msg, 
                                 final int status_code, 
                                 final int order,
                                 final Throwable t) {
    super(msg, t);
    this.status_code = status_code;
    this.order = order;
    exceptions = null;
  }
  
  /**
   * Ctor that takes a descriptive message, order, status_code and optional 
   * list of exceptions that triggered this.
   * @param msg A non-null message to be given.
   * @param status_code An optional status code reflecting the error state.
   * @param order The index of the failed query in the request.
   * @param exceptions An optional list of exceptions. May be null or empty.
   */
  public QueryExecutionException(final String msg, 
                                 final int status_code, 
                                 final int order,
                                 final List<Throwable> exceptions) {
    super(msg, exceptions == null || exceptions.isEmpty() ? 
        null : exceptions.get(0));
    this.status_code = status_code;
    this.order = order;
    this.exceptions = exceptions;
  }
  
  /** @return The query index or -1 if not tied to one query. */
  public int getOrder() {
    return order;
  }
  
  /** @return An optional status code, e.g. HTTP code. */
  public int getStatusCode() {
    return status_code;
  }

  /** @return A list of exceptions that triggered this or an empty list. */
  public List<Throwable> getExceptions() {
    return exceptions == null ? Collections.<Throwable>emptyList() : 
      Collections.<Throwable>unmodifiableList(exceptions);
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder()
        .append(getClass())
        .append(": ")
        .append(getMessage());
    if (exceptions != null) {
      buf.append(" subExceptions[");
      for (int i = 0; i < exceptions.size(); i++) {
        if (i > 0) {
          buf.append(", ");
        }
        buf.append(exceptions.get(i).toString());
      }
      buf.append("]");
    }
    return buf.toString();
  }
}
