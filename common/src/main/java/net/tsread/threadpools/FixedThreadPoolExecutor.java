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
package net.tsread.threadpools;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import net.tsread.configuration.Configuration;

/**
 * A shared, bounded pool of worker threads. The thread count and queue 
 * bound are read from the configuration using the given key prefix, e.g.
 * {@code tsd.query.remote_read.threads} and 
 * {@code tsd.query.remote_read.queue_size}. Submissions beyond the queue 
 * bound are rejected with a 
 * {@link java.util.concurrent.RejectedExecutionException}.
 * 
 * @since 1.0
 */
public class FixedThreadPoolExecutor {
  private static final Logger LOG = LoggerFactory.getLogger(
      FixedThreadPoolExecutor.class);

  /** Key suffix for the number of worker threads. */
  public static final String THREADS_KEY = "threads";
  
  /** Key suffix for the bound of the work queue. */
  public static final String QUEUE_SIZE_KEY = "queue_size";
  
  /** Default queue bound. */
  public static final int DEFAULT_QUEUE_SIZE = 100000;
  
  /** The key prefix. */
  private final String prefix;
  
  /** The underlying pool. */
  private final ExecutorService fixed_thread_pool;

  /**
   * Default ctor. Registers the pool keys if they aren't already.
   * @param config A non-null configuration.
   * @param prefix A non-null and non-empty key prefix ending in a period.
   * @param name A non-null and non-empty name used for the thread names.
   * @throws IllegalArgumentException if a parameter was null or empty or
   * the configured sizes were less than 1.
   */
  public FixedThreadPoolExecutor(final Configuration config, 
                                 final String prefix,
                                 final String name) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    if (Strings.isNullOrEmpty(prefix)) {
      throw new IllegalArgumentException("Prefix cannot be null or empty.");
    }
    if (Strings.isNullOrEmpty(name)) {
      throw new IllegalArgumentException("Name cannot be null or empty.");
    }
    this.prefix = prefix;
    if (!config.hasProperty(getConfigKey(THREADS_KEY))) {
      config.register(getConfigKey(THREADS_KEY), 
          Runtime.getRuntime().availableProcessors() * 2, false,
          "The number of worker threads in the pool.");
    }
    if (!config.hasProperty(getConfigKey(QUEUE_SIZE_KEY))) {
      config.register(getConfigKey(QUEUE_SIZE_KEY), DEFAULT_QUEUE_SIZE, false,
          "The maximum number of tasks waiting for a worker thread.");
    }
    
    final int threads = config.getInt(getConfigKey(THREADS_KEY));
    final int max_size = config.getInt(getConfigKey(QUEUE_SIZE_KEY));
    if (threads < 1) {
      throw new IllegalArgumentException("Thread count must be at least 1: " 
          + threads);
    }
    if (max_size < 1) {
      throw new IllegalArgumentException("Queue size must be at least 1: " 
          + max_size);
    }
    fixed_thread_pool = new ThreadPoolExecutor(threads, threads, 0L, 
        TimeUnit.MILLISECONDS, new LinkedBlockingQueue<Runnable>(max_size),
        new ThreadFactoryBuilder()
          .setNameFormat(name + "-%d")
          .setDaemon(true)
          .build());
    LOG.info("Initialized new FixedThreadPoolExecutor '{}' with {} threads "
        + "and a queue max capacity of {}", name, threads, max_size);
  }
  
  /**
   * Submits a value-returning task.
   * @param task A non-null task.
   * @return The future of the task.
   * @throws java.util.concurrent.RejectedExecutionException if the queue 
   * was full or the pool shut down.
   */
  public <T> Future<T> submit(final Callable<T> task) {
    return fixed_thread_pool.submit(task);
  }
  
  /**
   * Submits a task.
   * @param task A non-null task.
   * @return The future of the task.
   * @throws java.util.concurrent.RejectedExecutionException if the queue 
   * was full or the pool shut down.
   */
  public Future<?> submit(final Runnable task) {
    return fixed_thread_pool.submit(task);
  }
  
  /** @return Whether or not the pool was shut down. */
  public boolean isShutdown() {
    return fixed_thread_pool.isShutdown();
  }
  
  /**
   * Stops accepting new tasks. Queued tasks still run.
   */
  public void shutdown() {
    if (!fixed_thread_pool.isShutdown()) {
      fixed_thread_pool.shutdown();
      LOG.info("Shutting down FixedThreadPoolExecutor, no more tasks will "
          + "be executed!");
    }
  }
  
  String getConfigKey(final String key) {
    return prefix + key;
  }
}
