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
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Lists;

import net.tsread.exceptions.QueryExecutionCanceled;
import net.tsread.exceptions.QueryExecutionException;
import net.tsread.query.QueryContext;
import net.tsread.query.QueryResult;
import net.tsread.query.ReadRequest;
import net.tsread.query.ReadResponse;
import net.tsread.threadpools.FixedThreadPoolExecutor;

/**
 * The execution of one remote read request. Holds the slot array of the
 * response and counts completion signals. Every sub-query signals exactly 
 * once, whether it ran, failed, was skipped or was canceled, and the 
 * deferred is only called after the last of the N signals (or right away 
 * on {@link #cancel()}).
 * 
 * @since 1.0
 */
public class RemoteReadExecution extends QueryExecution<ReadResponse> {
  private static final Logger LOG = LoggerFactory.getLogger(
      RemoteReadExecution.class);
  
  /** The context for this request. */
  private final QueryContext context;
  
  /** The request. */
  private final ReadRequest request;
  
  /** Runs each sub-query. */
  private final SubQueryExecutor sub_executor;
  
  /** Where the units run. */
  private final FixedThreadPoolExecutor pool;
  
  /** The policies. */
  private final RemoteReadExecutor.Config config;
  
  /** Results, each index written by its own unit only. */
  private final QueryResult[] slots;
  
  /** Failures by index. */
  private final Throwable[] failures;
  
  /** Failed indices in the order they were observed. */
  private final List<Integer> observed_failures;
  
  /** The index of the next sub-query to launch. Guarded by this. */
  private int next_index;
  
  /** The number of completion signals received. Guarded by this. */
  private int signals;
  
  /** Set once a failure stops launching in all-or-nothing mode. */
  private boolean aborted;
  
  /** The number of units submitted but not yet signaled. Guarded by this. */
  private int in_flight;
  
  /** The max number of units in flight at once. */
  private final int parallels;
  
  /**
   * Package private ctor, use {@link RemoteReadExecutor#executeQuery}.
   * @param context A non-null context.
   * @param request A non-null request.
   * @param sub_executor A non-null sub-query executor.
   * @param pool A non-null worker pool.
   * @param config A non-null config.
   */
  RemoteReadExecution(final QueryContext context,
                      final ReadRequest request,
                      final SubQueryExecutor sub_executor,
                      final FixedThreadPoolExecutor pool,
                      final RemoteReadExecutor.Config config) {
    this.context = context;
    this.request = request;
    this.sub_executor = sub_executor;
    this.pool = pool;
    this.config = config;
    slots = new QueryResult[request.size()];
    failures = new Throwable[request.size()];
    observed_failures = Lists.newArrayList();
    parallels = config.getParallelExecutors() < 1 ? 
        Math.max(1, request.size()) : 
          Math.min(config.getParallelExecutors(), Math.max(1, request.size()));
  }
  
  /**
   * Launches the first batch of units.
   */
  void execute() {
    if (request.size() == 0) {
      callback(new ReadResponse(slots));
      return;
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Launching " + request.size() + " sub-queries for context " 
          + context.id() + " with " + parallels + " in parallel.");
    }
    // locked so a unit that returns before we've launched the initial batch
    // doesn't move the index on us.
    final boolean done;
    synchronized (this) {
      launch();
      done = signals == request.size();
    }
    if (done) {
      finish();
    }
  }
  
  /**
   * Submits pending units until the parallel limit is reached or every unit
   * was launched. A unit the pool rejects is recorded as failed in place and
   * the next one is tried. Once aborted or canceled the remaining units are
   * signaled without running.
   * <b>WARNING:</b> Make sure to synchronize on *this* before executing to
   * avoid a race.
   */
  private void launch() {
    while (next_index < request.size()) {
      if (aborted || context.isCanceled()) {
        signalUnlaunched();
        return;
      }
      if (in_flight >= parallels) {
        return;
      }
      final int idx = next_index++;
      try {
        pool.submit(new Unit(idx));
        in_flight++;
      } catch (RejectedExecutionException e) {
        record(idx, null, new QueryExecutionException("Worker pool rejected "
            + "query " + idx, 503, idx, e));
      }
    }
  }
  
  @Override
  public void cancel() {
    if (LOG.isDebugEnabled()) {
      LOG.debug("Cancelling remote read for context: " + context.id());
    }
    context.cancel();
    final boolean done;
    synchronized (this) {
      signalUnlaunched();
      done = signals == request.size();
    }
    if (!completed.get()) {
      try {
        callback(new QueryExecutionCanceled("Query was cancelled upstream: " 
            + context.id(), QueryContext.CANCELED_STATUS));
      } catch (IllegalStateException e) {
        if (LOG.isDebugEnabled()) {
          LOG.debug("Canceling but already called completed.");
        }
      }
    }
    if (done && LOG.isDebugEnabled()) {
      LOG.debug("All units of context " + context.id() + " signaled.");
    }
  }
  
  /** @return The context of this request. */
  public QueryContext context() {
    return context;
  }
  
  /** @return The number of completion signals received so far. */
  @VisibleForTesting
  synchronized int signals() {
    return signals;
  }
  
  /**
   * Records the completion of a unit and launches the next one or 
   * completes the request.
   * @param index The index of the unit.
   * @param result The result if successful.
   * @param error The error if the unit failed.
   */
  private void complete(final int index, 
                        final QueryResult result, 
                        final Throwable error) {
    final boolean done;
    synchronized (this) {
      in_flight--;
      record(index, result, error);
      launch();
      done = signals == request.size();
    }
    if (done) {
      finish();
    }
  }
  
  /**
   * Writes the slot or the failure of a unit and counts its signal.
   * <b>WARNING:</b> Make sure to synchronize on *this* before executing.
   * @param index The index of the unit.
   * @param result The result if successful.
   * @param error The error if the unit failed.
   */
  private void record(final int index, 
                      final QueryResult result, 
                      final Throwable error) {
    if (error == null) {
      slots[index] = result;
    } else {
      failures[index] = error;
      observed_failures.add(index);
      if (LOG.isDebugEnabled()) {
        LOG.debug("Exception on index " + index + " of context " 
            + context.id(), error);
      }
      if (config.getPartialFailureMode() == PartialFailureMode.ALL_OR_NOTHING) {
        aborted = true;
      }
    }
    signals++;
  }
  
  /**
   * Signals every unit that was never launched. Canceled units are recorded
   * as canceled failures, skipped ones as nothing at all.
   * <b>WARNING:</b> Make sure to synchronize on *this* before executing.
   */
  private void signalUnlaunched() {
    while (next_index < request.size()) {
      final int idx = next_index++;
      if (!aborted) {
        failures[idx] = new QueryExecutionCanceled("Query " + idx 
            + " was canceled before it ran.", QueryContext.CANCELED_STATUS, 
            idx);
        observed_failures.add(idx);
      } else if (LOG.isDebugEnabled()) {
        LOG.debug("Skipping query " + idx + " of context " + context.id() 
            + " after a failure.");
      }
      signals++;
    }
  }
  
  /**
   * Assembles the response or the failure once every unit has signaled.
   */
  private void finish() {
    if (completed.get()) {
      return;
    }
    final Object result;
    synchronized (this) {
      result = assemble();
    }
    try {
      callback(result);
    } catch (IllegalStateException e) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Finished but the execution was already called: " 
            + context.id());
      }
    }
  }
  
  /**
   * <b>WARNING:</b> Make sure to synchronize on *this* before executing.
   * @return The response or the exception to pass upstream.
   */
  private Object assemble() {
    if (context.isCanceled()) {
      return new QueryExecutionCanceled("Query was canceled: " + context.id(), 
          QueryContext.CANCELED_STATUS);
    }
    if (observed_failures.isEmpty()) {
      return new ReadResponse(slots);
    }
    
    if (config.getPartialFailureMode() == PartialFailureMode.BEST_EFFORT) {
      for (int i = 0; i < failures.length; i++) {
        if (failures[i] != null) {
          slots[i] = QueryResult.EMPTY;
        }
      }
      final int first = observed_failures.get(0);
      LOG.warn("Returning empty results for " + observed_failures.size() 
          + " of " + request.size() + " failed queries of context " 
          + context.id() + ", first failure on query " + first, 
          failures[first]);
      return new ReadResponse(slots);
    }
    
    final int selected;
    if (config.getErrorSelection() == ErrorSelection.LAST_OBSERVED) {
      selected = observed_failures.get(observed_failures.size() - 1);
    } else {
      int lowest = Integer.MAX_VALUE;
      for (final int idx : observed_failures) {
        lowest = Math.min(lowest, idx);
      }
      selected = lowest;
    }
    final List<Throwable> exceptions = 
        Lists.newArrayListWithExpectedSize(observed_failures.size());
    exceptions.add(failures[selected]);
    for (int i = 0; i < failures.length; i++) {
      if (failures[i] != null && i != selected) {
        exceptions.add(failures[i]);
      }
    }
    final Throwable error = failures[selected];
    return new QueryExecutionException(error.getMessage(), 
        statusCode(error), selected, exceptions);
  }
  
  /**
   * @param t The failure.
   * @return The status code for the failure.
   */
  private static int statusCode(final Throwable t) {
    if (t instanceof QueryExecutionException) {
      return ((QueryExecutionException) t).getStatusCode();
    }
    return 500;
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("context=")
        .append(context.id())
        .append(", queries=")
        .append(request.size())
        .append(", completed=")
        .append(completed.get())
        .toString();
  }
  
  /** A single sub-query running on the worker pool. */
  class Unit implements Runnable {
    final int index;
    
    Unit(final int index) {
      this.index = index;
    }
    
    @Override
    public void run() {
      final QueryResult result;
      try {
        result = sub_executor.execute(context, index, 
            request.queries().get(index));
      } catch (Exception e) {
        complete(index, null, e);
        return;
      } catch (Error e) {
        complete(index, null, e);
        throw e;
      }
      complete(index, result, null);
    }
  }
}
