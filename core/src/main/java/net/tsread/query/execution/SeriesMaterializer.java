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

import java.util.List;

import com.google.common.collect.Lists;

import net.tsread.data.Sample;
import net.tsread.data.TimeSeries;
import net.tsread.exceptions.QueryExecutionException;
import net.tsread.exceptions.StorageIterationException;
import net.tsread.query.QueryContext;
import net.tsread.query.QueryResult;
import net.tsread.storage.SampleIterator;
import net.tsread.storage.Series;
import net.tsread.storage.SeriesSet;

/**
 * Drains lazily produced storage series into fully materialized 
 * {@link TimeSeries}. A storage error at any point fails the whole series
 * (or series set) and the partially read samples are dropped.
 * 
 * @since 1.0
 */
public final class SeriesMaterializer {
  
  /** Status used when storage doesn't tell us better. */
  public static final int DEFAULT_ERROR_STATUS = 400;
  
  private SeriesMaterializer() {
    // static utility
  }
  
  /**
   * Materializes a single series.
   * @param series A non-null series.
   * @return The materialized series.
   * @throws IllegalArgumentException if the series was null.
   * @throws StorageIterationException if the iterator reported an error.
   */
  public static TimeSeries materialize(final Series series) {
    return materialize(series, -1);
  }
  
  /**
   * Materializes a single series.
   * @param series A non-null series.
   * @param order The index of the sub-query the series belongs to.
   * @return The materialized series.
   * @throws IllegalArgumentException if the series was null.
   * @throws StorageIterationException if the iterator reported an error.
   */
  public static TimeSeries materialize(final Series series, final int order) {
    if (series == null) {
      throw new IllegalArgumentException("Series cannot be null.");
    }
    final List<Sample> samples = Lists.newArrayList();
    final Throwable error;
    try {
      final SampleIterator iterator = series.iterator();
      while (iterator.next()) {
        samples.add(new Sample(iterator.timestamp(), iterator.value()));
      }
      error = iterator.err();
    } catch (QueryExecutionException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new StorageIterationException("Failed iterating series " 
          + series.labels() + ": " + e.getMessage(), statusCode(e), order, e);
    }
    if (error != null) {
      throw new StorageIterationException("Failed iterating series " 
          + series.labels() + ": " + error.getMessage(), statusCode(error), 
          order, error);
    }
    return new TimeSeries(series.labels(), samples);
  }
  
  /**
   * Materializes every series of the set, in the order the storage 
   * returns them. Cancellation is checked before each series.
   * @param set A non-null series set.
   * @param context A non-null query context.
   * @return The query result for the set.
   * @throws IllegalArgumentException if the set or context was null.
   * @throws StorageIterationException if the set or one of its series 
   * reported an error.
   * @throws net.tsread.exceptions.QueryExecutionCanceled if the context
   * was canceled.
   */
  public static QueryResult materialize(final SeriesSet set, 
                                        final QueryContext context) {
    return materialize(set, context, -1);
  }
  
  /**
   * Materializes every series of the set, in the order the storage 
   * returns them. Cancellation is checked before each series.
   * @param set A non-null series set.
   * @param context A non-null query context.
   * @param order The index of the sub-query the set belongs to.
   * @return The query result for the set.
   * @throws IllegalArgumentException if the set or context was null.
   * @throws StorageIterationException if the set or one of its series 
   * reported an error.
   * @throws net.tsread.exceptions.QueryExecutionCanceled if the context
   * was canceled.
   */
  public static QueryResult materialize(final SeriesSet set, 
                                        final QueryContext context,
                                        final int order) {
    if (set == null) {
      throw new IllegalArgumentException("Series set cannot be null.");
    }
    if (context == null) {
      throw new IllegalArgumentException("Context cannot be null.");
    }
    final List<TimeSeries> series = Lists.newArrayList();
    while (true) {
      context.checkCanceled(order);
      final Series next;
      try {
        next = set.next() ? set.at() : null;
      } catch (QueryExecutionException e) {
        throw e;
      } catch (RuntimeException e) {
        throw new StorageIterationException("Failed iterating series set: " 
            + e.getMessage(), statusCode(e), order, e);
      }
      if (next == null) {
        break;
      }
      series.add(materialize(next, order));
    }
    final Throwable error;
    try {
      error = set.err();
    } catch (QueryExecutionException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new StorageIterationException("Failed iterating series set: " 
          + e.getMessage(), statusCode(e), order, e);
    }
    if (error != null) {
      throw new StorageIterationException("Failed iterating series set: " 
          + error.getMessage(), statusCode(error), order, error);
    }
    return new QueryResult(series);
  }
  
  /**
   * @param t The storage error.
   * @return The status of a {@link QueryExecutionException} or the default.
   */
  static int statusCode(final Throwable t) {
    if (t instanceof QueryExecutionException) {
      return ((QueryExecutionException) t).getStatusCode();
    }
    return DEFAULT_ERROR_STATUS;
  }
}
