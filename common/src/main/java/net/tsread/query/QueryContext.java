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
package net.tsread.query;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.tsread.exceptions.QueryExecutionCanceled;

/**
 * The request scoped context handed to every unit of work and into every
 * storage call of a remote-read request. It carries the cancellation state:
 * once {@link #cancel()} is called the executors stop launching work and 
 * the listeners registered by storage engines are notified so they can 
 * abort blocking calls.
 * 
 * @since 1.0
 */
public class QueryContext {
  private static final Logger LOG = LoggerFactory.getLogger(QueryContext.class);
  
  /** Status code used when a request is canceled. */
  public static final int CANCELED_STATUS = 499;
  
  /** A descriptive ID for logging, e.g. the remote address. */
  private final String id;
  
  /** Flipped once on cancellation. */
  private final AtomicBoolean canceled;
  
  /** Callbacks run on cancellation. */
  private final List<Runnable> listeners;
  
  /**
   * Default ctor.
   * @param id A descriptive ID for logging, may be null.
   */
  public QueryContext(final String id) {
    this.id = id == null ? "" : id;
    canceled = new AtomicBoolean();
    listeners = new CopyOnWriteArrayList<Runnable>();
  }
  
  /** @return The descriptive ID. */
  public String id() {
    return id;
  }
  
  /** @return Whether or not the request was canceled. */
  public boolean isCanceled() {
    return canceled.get();
  }
  
  /**
   * Cancels the request and runs the listeners. Subsequent calls are no-ops.
   */
  public void cancel() {
    if (!canceled.compareAndSet(false, true)) {
      return;
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("Canceling query context: " + id);
    }
    for (final Runnable listener : listeners) {
      try {
        listener.run();
      } catch (Exception e) {
        LOG.warn("Cancellation listener failed for context: " + id, e);
      }
    }
  }
  
  /**
   * Registers a callback to run on cancellation. If the context is already
   * canceled the callback runs right away in the calling thread.
   * @param listener A non-null callback.
   */
  public void addCancelListener(final Runnable listener) {
    if (listener == null) {
      throw new IllegalArgumentException("Listener cannot be null.");
    }
    listeners.add(listener);
    if (canceled.get() && listeners.remove(listener)) {
      listener.run();
    }
  }
  
  /**
   * @param listener A listener to remove, e.g. when a storage call finished.
   */
  public void removeCancelListener(final Runnable listener) {
    listeners.remove(listener);
  }
  
  /**
   * Throws if the context was canceled.
   * @param order The index of the query checking.
   * @throws QueryExecutionCanceled if the context was canceled.
   */
  public void checkCanceled(final int order) {
    if (canceled.get()) {
      throw new QueryExecutionCanceled("Query was canceled: " + id, 
          CANCELED_STATUS, order);
    }
  }
  
  @Override
  public String toString() {
    return "id=" + id + ", canceled=" + canceled.get();
  }
}
