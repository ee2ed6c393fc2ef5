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

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.tsread.exceptions.QuerierAcquisitionException;
import net.tsread.exceptions.QueryExecutionCanceled;
import net.tsread.exceptions.QueryExecutionException;
import net.tsread.exceptions.StorageIterationException;
import net.tsread.query.QueryContext;
import net.tsread.query.QueryResult;
import net.tsread.query.SubQuery;
import net.tsread.storage.Querier;
import net.tsread.storage.Queryable;
import net.tsread.storage.SelectHints;
import net.tsread.storage.SeriesSet;

/**
 * Resolves a single sub-query against the storage. A querier scoped to the
 * sub-query's time range is acquired, the matchers are selected and every
 * series is materialized before the querier is closed. Either the complete
 * result is returned or an exception is thrown, never a partial result.
 * 
 * @since 1.0
 */
public class SubQueryExecutor {
  private static final Logger LOG = LoggerFactory.getLogger(
      SubQueryExecutor.class);
  
  /** The storage to read from. */
  private final Queryable queryable;
  
  /**
   * Default ctor.
   * @param queryable A non-null storage.
   * @throws IllegalArgumentException if the storage was null.
   */
  public SubQueryExecutor(final Queryable queryable) {
    if (queryable == null) {
      throw new IllegalArgumentException("Queryable cannot be null.");
    }
    this.queryable = queryable;
  }
  
  /**
   * Runs the sub-query synchronously on the calling thread.
   * @param context A non-null query context.
   * @param index The index of the sub-query in the request.
   * @param query A non-null sub-query.
   * @return The materialized result.
   * @throws IllegalArgumentException if the context or query was null.
   * @throws QueryExecutionException with status 400 if the time range was 
   * inverted.
   * @throws QueryExecutionCanceled if the context was canceled.
   * @throws QuerierAcquisitionException if the storage couldn't provide a
   * querier.
   * @throws StorageIterationException if selecting or reading failed.
   */
  public QueryResult execute(final QueryContext context, 
                             final int index, 
                             final SubQuery query) {
    if (context == null) {
      throw new IllegalArgumentException("Context cannot be null.");
    }
    if (query == null) {
      throw new IllegalArgumentException("Query cannot be null.");
    }
    if (query.getStartMs() > query.getEndMs()) {
      throw new QueryExecutionException("Query " + index + " start time " 
          + query.getStartMs() + " is after the end time " 
          + query.getEndMs(), 400, index);
    }
    context.checkCanceled(index);
    
    final Querier querier;
    try {
      querier = queryable.querier(context, query.getStartMs(), 
          query.getEndMs());
    } catch (QueryExecutionCanceled e) {
      throw e;
    } catch (Exception e) {
      throw new QuerierAcquisitionException("Failed to acquire a querier for "
          + "query " + index + ": " + e.getMessage(), 
          SeriesMaterializer.statusCode(e), index, e);
    }
    if (querier == null) {
      throw new QuerierAcquisitionException("Storage returned a null querier "
          + "for query " + index, 500, index, null);
    }
    
    try {
      final SeriesSet set;
      try {
        set = querier.select(false, new SelectHints(query.getStartMs(), 
            query.getEndMs(), query.getHints()), query.getMatchers());
      } catch (QueryExecutionException e) {
        throw e;
      } catch (RuntimeException e) {
        throw new StorageIterationException("Failed to select series for "
            + "query " + index + ": " + e.getMessage(), 
            SeriesMaterializer.statusCode(e), index, e);
      }
      final QueryResult result = SeriesMaterializer.materialize(set, context, 
          index);
      if (LOG.isDebugEnabled()) {
        LOG.debug("Query " + index + " of context " + context.id() 
            + " materialized " + result.timeSeries().size() + " series.");
      }
      return result;
    } finally {
      try {
        querier.close();
      } catch (IOException | RuntimeException e) {
        LOG.warn("Failed to close querier for query " + index 
            + " of context " + context.id(), e);
      }
    }
  }
}
