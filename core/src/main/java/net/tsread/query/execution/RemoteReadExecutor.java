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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Objects;

import net.tsread.configuration.Configuration;
import net.tsread.query.QueryContext;
import net.tsread.query.ReadRequest;
import net.tsread.storage.Queryable;
import net.tsread.threadpools.FixedThreadPoolExecutor;

/**
 * Fans a remote read request out into one unit of work per sub-query. Units
 * run on a shared bounded worker pool, each writing only the response slot
 * at its own index. Up to {@link Config#getParallelExecutors()} units of a 
 * request are in flight at once; each completion launches the next pending
 * unit. The request completes once every unit has signaled.
 * <p>
 * Errors are handled per {@link PartialFailureMode} and the surfaced error
 * is picked per {@link ErrorSelection}.
 * 
 * @since 1.0
 */
public class RemoteReadExecutor {
  private static final Logger LOG = LoggerFactory.getLogger(
      RemoteReadExecutor.class);
  
  /** Prefix for the config keys. */
  public static final String KEY_PREFIX = "tsd.query.remote_read.";
  
  public static final String PARALLEL_EXECUTORS_KEY = 
      KEY_PREFIX + "parallel_executors";
  public static final String ERROR_SELECTION_KEY = 
      KEY_PREFIX + "error_selection";
  public static final String PARTIAL_FAILURE_MODE_KEY = 
      KEY_PREFIX + "partial_failure_mode";
  
  /** The sub-query executor shared by all requests. */
  private final SubQueryExecutor sub_executor;
  
  /** The worker pool shared by all requests. */
  private final FixedThreadPoolExecutor pool;
  
  /** The policies. */
  private final Config config;
  
  /**
   * Ctor that registers and reads the configuration and builds its own
   * worker pool.
   * @param config A non-null configuration.
   * @param queryable A non-null storage.
   * @throws IllegalArgumentException if a parameter was null or a setting
   * was invalid.
   */
  public RemoteReadExecutor(final Configuration config, 
                            final Queryable queryable) {
    this(queryable, 
        new FixedThreadPoolExecutor(config, KEY_PREFIX, "remote-read"),
        registerConfigs(config));
  }
  
  /**
   * Ctor with explicit collaborators.
   * @param queryable A non-null storage.
   * @param pool A non-null worker pool.
   * @param config A non-null config.
   * @throws IllegalArgumentException if a parameter was null.
   */
  public RemoteReadExecutor(final Queryable queryable,
                            final FixedThreadPoolExecutor pool,
                            final Config config) {
    if (pool == null) {
      throw new IllegalArgumentException("Pool cannot be null.");
    }
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    sub_executor = new SubQueryExecutor(queryable);
    this.pool = pool;
    this.config = config;
    LOG.info("Initialized remote read executor with " + config);
  }
  
  /**
   * Starts executing the request. Returns immediately, the results are 
   * passed to {@link RemoteReadExecution#deferred()}.
   * @param context A non-null context.
   * @param request A non-null request.
   * @return The execution for the request.
   * @throws IllegalArgumentException if the context or request was null.
   */
  public RemoteReadExecution executeQuery(final QueryContext context, 
                                          final ReadRequest request) {
    if (context == null) {
      throw new IllegalArgumentException("Context cannot be null.");
    }
    if (request == null) {
      throw new IllegalArgumentException("Request cannot be null.");
    }
    final RemoteReadExecution execution = new RemoteReadExecution(context, 
        request, sub_executor, pool, config);
    execution.execute();
    return execution;
  }
  
  /** @return The policies in effect. */
  public Config config() {
    return config;
  }
  
  /** Stops the worker pool. */
  public void shutdown() {
    pool.shutdown();
  }
  
  /**
   * Registers the policy keys if needed and builds the config from them.
   * @param config A non-null configuration.
   * @return The config.
   * @throws IllegalArgumentException if the config was null or a value was
   * invalid.
   */
  public static Config registerConfigs(final Configuration config) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    if (!config.hasProperty(PARALLEL_EXECUTORS_KEY)) {
      config.register(PARALLEL_EXECUTORS_KEY, 0, false, 
          "The maximum number of sub-queries of one request to run in "
          + "parallel. 0 runs all of them at once.");
    }
    if (!config.hasProperty(ERROR_SELECTION_KEY)) {
      config.register(ERROR_SELECTION_KEY, 
          ErrorSelection.FIRST_BY_INDEX.toString(), false, 
          "Which failure to surface when several sub-queries fail. Either "
          + "FIRST_BY_INDEX or LAST_OBSERVED.");
    }
    if (!config.hasProperty(PARTIAL_FAILURE_MODE_KEY)) {
      config.register(PARTIAL_FAILURE_MODE_KEY, 
          PartialFailureMode.ALL_OR_NOTHING.toString(), false, 
          "Whether a failed sub-query fails the request, ALL_OR_NOTHING, "
          + "or is returned as an empty result, BEST_EFFORT.");
    }
    return Config.newBuilder()
        .setParallelExecutors(config.getInt(PARALLEL_EXECUTORS_KEY))
        .setErrorSelection(parseEnum(ErrorSelection.class, 
            config.getString(ERROR_SELECTION_KEY)))
        .setPartialFailureMode(parseEnum(PartialFailureMode.class, 
            config.getString(PARTIAL_FAILURE_MODE_KEY)))
        .build();
  }
  
  private static <E extends Enum<E>> E parseEnum(final Class<E> type, 
                                                 final String value) {
    try {
      return Enum.valueOf(type, value.trim().toUpperCase());
    } catch (IllegalArgumentException | NullPointerException e) {
      throw new IllegalArgumentException("Invalid " + type.getSimpleName() 
          + ": " + value, e);
    }
  }
  
  /**
   * Policies for the fan-out.
   */
  public static class Config {
    private final int parallel_executors;
    private final ErrorSelection error_selection;
    private final PartialFailureMode partial_failure_mode;
    
    /**
     * Default ctor.
     * @param builder A non-null builder.
     */
    private Config(final Builder builder) {
      if (builder.parallelExecutors < 0) {
        throw new IllegalArgumentException("Parallel executors cannot be "
            + "negative: " + builder.parallelExecutors);
      }
      if (builder.errorSelection == null) {
        throw new IllegalArgumentException("Error selection cannot be null.");
      }
      if (builder.partialFailureMode == null) {
        throw new IllegalArgumentException("Partial failure mode cannot be "
            + "null.");
      }
      parallel_executors = builder.parallelExecutors;
      error_selection = builder.errorSelection;
      partial_failure_mode = builder.partialFailureMode;
    }
    
    /** @return The number of sub-queries to run in parallel, 0 for all. */
    public int getParallelExecutors() {
      return parallel_executors;
    }
    
    /** @return Which failure is surfaced. */
    public ErrorSelection getErrorSelection() {
      return error_selection;
    }
    
    /** @return How partial failures are handled. */
    public PartialFailureMode getPartialFailureMode() {
      return partial_failure_mode;
    }
    
    @Override
    public boolean equals(final Object o) {
      if (this == o) {
        return true;
      }
      if (o == null || getClass() != o.getClass()) {
        return false;
      }
      final Config config = (Config) o;
      return Objects.equal(parallel_executors, config.parallel_executors)
          && Objects.equal(error_selection, config.error_selection)
          && Objects.equal(partial_failure_mode, config.partial_failure_mode);
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(parallel_executors, error_selection, 
          partial_failure_mode);
    }
    
    @Override
    public String toString() {
      return new StringBuilder()
          .append("parallelExecutors=")
          .append(parallel_executors)
          .append(", errorSelection=")
          .append(error_selection)
          .append(", partialFailureMode=")
          .append(partial_failure_mode)
          .toString();
    }
    
    /** @return A new builder with the defaults set. */
    public static Builder newBuilder() {
      return new Builder();
    }
    
    public static class Builder {
      private int parallelExecutors;
      private ErrorSelection errorSelection = ErrorSelection.FIRST_BY_INDEX;
      private PartialFailureMode partialFailureMode = 
          PartialFailureMode.ALL_OR_NOTHING;
      
      public Builder setParallelExecutors(final int parallel_executors) {
        parallelExecutors = parallel_executors;
        return this;
      }
      
      public Builder setErrorSelection(final ErrorSelection error_selection) {
        errorSelection = error_selection;
        return this;
      }
      
      public Builder setPartialFailureMode(
          final PartialFailureMode partial_failure_mode) {
        partialFailureMode = partial_failure_mode;
        return this;
      }
      
      public Config build() {
        return new Config(this);
      }
    }
  }
}
