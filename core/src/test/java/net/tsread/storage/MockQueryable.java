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

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.google.common.collect.Maps;

import net.tsread.data.Labels;
import net.tsread.exceptions.QueryExecutionCanceled;
import net.tsread.query.LabelMatcher;
import net.tsread.query.QueryContext;

/**
 * A queryable over a {@link MemoryQueryable} that can delay, fail or hang
 * calls keyed on the start time of the querier, and records concurrency.
 */
public class MockQueryable implements Queryable {
  
  /** The data. */
  public final MemoryQueryable data = new MemoryQueryable();
  
  /** Querier acquisition failures by start time. */
  public final Map<Long, RuntimeException> querier_failures = 
      Maps.newConcurrentMap();
  
  /** Samples returned before the iterator reports an error, by start time. */
  public final Map<Long, Integer> iterator_failures = Maps.newConcurrentMap();
  
  /** Fixed delays by start time. */
  public final Map<Long, Long> delays = Maps.newConcurrentMap();
  
  /** Random delay upper bound for every querier call. */
  public volatile long max_random_delay_ms;
  
  /** When set, querier calls wait until the context is canceled. */
  public volatile boolean block_until_canceled;
  
  /** When set, querier calls wait on it, ignoring cancellation. */
  public volatile CountDownLatch hang;
  
  public final AtomicInteger querier_calls = new AtomicInteger();
  public final AtomicInteger closed_queriers = new AtomicInteger();
  public final AtomicInteger in_flight = new AtomicInteger();
  public final AtomicInteger max_in_flight = new AtomicInteger();
  
  @Override
  public Querier querier(final QueryContext context, 
                         final long min_ms, 
                         final long max_ms) {
    querier_calls.incrementAndGet();
    final int current = in_flight.incrementAndGet();
    while (true) {
      final int max = max_in_flight.get();
      if (current <= max || max_in_flight.compareAndSet(max, current)) {
        break;
      }
    }
    try {
      if (hang != null) {
        hang.await(30, TimeUnit.SECONDS);
      }
      if (block_until_canceled) {
        final CountDownLatch latch = new CountDownLatch(1);
        final Runnable listener = new Runnable() {
          @Override
          public void run() {
            latch.countDown();
          }
        };
        context.addCancelListener(listener);
        latch.await(30, TimeUnit.SECONDS);
        context.removeCancelListener(listener);
        throw new QueryExecutionCanceled("Canceled while blocked", 
            QueryContext.CANCELED_STATUS);
      }
      long delay = delays.containsKey(min_ms) ? delays.get(min_ms) : 0;
      if (max_random_delay_ms > 0) {
        delay += ThreadLocalRandom.current().nextLong(max_random_delay_ms);
      }
      if (delay > 0) {
        Thread.sleep(delay);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted", e);
    } finally {
      in_flight.decrementAndGet();
    }
    
    final RuntimeException failure = querier_failures.get(min_ms);
    if (failure != null) {
      throw failure;
    }
    final Querier querier = data.querier(context, min_ms, max_ms);
    final Integer fail_after = iterator_failures.get(min_ms);
    return new Querier() {
      @Override
      public SeriesSet select(final boolean sort_series, 
                              final SelectHints hints,
                              final List<LabelMatcher> matchers) {
        final SeriesSet set = querier.select(sort_series, hints, matchers);
        if (fail_after == null) {
          return set;
        }
        return new FailingSeriesSet(set, fail_after);
      }

      @Override
      public void close() throws IOException {
        closed_queriers.incrementAndGet();
        querier.close();
      }
    };
  }
  
  /** Fails the iterator of the first series after the given samples. */
  static class FailingSeriesSet implements SeriesSet {
    private final SeriesSet set;
    private final int fail_after;
    
    FailingSeriesSet(final SeriesSet set, final int fail_after) {
      this.set = set;
      this.fail_after = fail_after;
    }
    
    @Override
    public boolean next() {
      return set.next();
    }

    @Override
    public Series at() {
      final Series series = set.at();
      return new Series() {
        @Override
        public Labels labels() {
          return series.labels();
        }

        @Override
        public SampleIterator iterator() {
          final SampleIterator iterator = series.iterator();
          return new SampleIterator() {
            int read;
            Throwable err;
            
            @Override
            public boolean next() {
              if (read >= fail_after) {
                err = new IOException("Chunk read failed");
                return false;
              }
              read++;
              return iterator.next();
            }

            @Override
            public long timestamp() {
              return iterator.timestamp();
            }

            @Override
            public double value() {
              return iterator.value();
            }

            @Override
            public Throwable err() {
              return err;
            }
          };
        }
      };
    }

    @Override
    public Throwable err() {
      return set.err();
    }
  }
}
