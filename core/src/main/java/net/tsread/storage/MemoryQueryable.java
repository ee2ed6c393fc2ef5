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

import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.NavigableMap;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.tsread.data.Labels;
import net.tsread.data.Sample;
import net.tsread.data.TimeSeries;
import net.tsread.query.LabelMatcher;
import net.tsread.query.QueryContext;

/**
 * A heap backed {@link Queryable} holding series keyed by their labels. 
 * Samples are kept sorted by timestamp; writing the same timestamp twice 
 * replaces the value. Selects take a snapshot of the matching series so 
 * concurrent writes don't disturb readers.
 * 
 * @since 1.0
 */
public class MemoryQueryable implements Queryable {
  private static final Logger LOG = LoggerFactory.getLogger(
      MemoryQueryable.class);
  
  /** Orders series by their label string form. */
  static final Comparator<TimeSeries> SERIES_COMPARATOR = 
      new Comparator<TimeSeries>() {
    @Override
    public int compare(final TimeSeries a, final TimeSeries b) {
      return a.labels().toString().compareTo(b.labels().toString());
    }
  };
  
  /** The data. Guarded by itself. */
  private final Map<Labels, NavigableMap<Long, Double>> series;
  
  /**
   * Default ctor.
   */
  public MemoryQueryable() {
    series = Maps.newLinkedHashMap();
  }
  
  /**
   * Adds a sample to the series with the given labels.
   * @param labels A non-null set of labels.
   * @param timestamp The timestamp in milliseconds.
   * @param value The value.
   * @throws IllegalArgumentException if the labels were null.
   */
  public void addSample(final Labels labels, 
                        final long timestamp, 
                        final double value) {
    if (labels == null) {
      throw new IllegalArgumentException("Labels cannot be null.");
    }
    synchronized (series) {
      NavigableMap<Long, Double> samples = series.get(labels);
      if (samples == null) {
        samples = new TreeMap<Long, Double>();
        series.put(labels, samples);
      }
      samples.put(timestamp, value);
    }
  }
  
  /**
   * Adds all of the samples of a series.
   * @param time_series A non-null series.
   * @throws IllegalArgumentException if the series was null.
   */
  public void addSeries(final TimeSeries time_series) {
    if (time_series == null) {
      throw new IllegalArgumentException("Series cannot be null.");
    }
    for (final Sample sample : time_series.samples()) {
      addSample(time_series.labels(), sample.timestamp(), sample.value());
    }
  }
  
  /** @return The number of series stored. */
  public int seriesCount() {
    synchronized (series) {
      return series.size();
    }
  }
  
  @Override
  public Querier querier(final QueryContext context, 
                         final long min_ms, 
                         final long max_ms) {
    if (context == null) {
      throw new IllegalArgumentException("Context cannot be null.");
    }
    if (min_ms > max_ms) {
      throw new IllegalArgumentException("Min time " + min_ms 
          + " cannot be greater than the max time " + max_ms);
    }
    return new MemoryQuerier(context, min_ms, max_ms);
  }
  
  /** A querier over a fixed time range. */
  class MemoryQuerier implements Querier {
    private final QueryContext context;
    private final long min_ms;
    private final long max_ms;
    private volatile boolean closed;
    
    MemoryQuerier(final QueryContext context, 
                  final long min_ms, 
                  final long max_ms) {
      this.context = context;
      this.min_ms = min_ms;
      this.max_ms = max_ms;
    }
    
    @Override
    public SeriesSet select(final boolean sort_series, 
                            final SelectHints hints, 
                            final List<LabelMatcher> matchers) {
      if (closed) {
        throw new IllegalStateException("Querier was closed.");
      }
      if (matchers == null) {
        throw new IllegalArgumentException("Matchers cannot be null.");
      }
      final long start = hints == null ? min_ms : Math.max(min_ms, hints.start());
      final long end = hints == null ? max_ms : Math.min(max_ms, hints.end());
      final List<TimeSeries> matched = Lists.newArrayList();
      synchronized (series) {
        for (final Entry<Labels, NavigableMap<Long, Double>> entry : 
            series.entrySet()) {
          if (!matches(entry.getKey(), matchers)) {
            continue;
          }
          final List<Sample> samples = Lists.newArrayList();
          if (start <= end) {
            for (final Entry<Long, Double> sample : 
                entry.getValue().subMap(start, true, end, true).entrySet()) {
              samples.add(new Sample(sample.getKey(), sample.getValue()));
            }
          }
          if (!samples.isEmpty()) {
            matched.add(new TimeSeries(entry.getKey(), samples));
          }
        }
      }
      if (sort_series) {
        Collections.sort(matched, SERIES_COMPARATOR);
      }
      if (LOG.isDebugEnabled()) {
        LOG.debug("Matched " + matched.size() + " series for " + matchers 
            + " in context " + context.id());
      }
      return new ListSeriesSet(matched);
    }

    @Override
    public void close() {
      closed = true;
    }
  }
  
  /**
   * @param labels The labels of a series.
   * @param matchers The matchers, all of which have to match.
   * @return True if the series matched.
   */
  static boolean matches(final Labels labels, 
                         final List<LabelMatcher> matchers) {
    for (final LabelMatcher matcher : matchers) {
      if (!matcher.matches(labels.get(matcher.name()))) {
        return false;
      }
    }
    return true;
  }
  
  /** A series set over a materialized snapshot. */
  static class ListSeriesSet implements SeriesSet {
    private final Iterator<TimeSeries> iterator;
    private TimeSeries current;
    
    ListSeriesSet(final List<TimeSeries> series) {
      iterator = series.iterator();
    }
    
    @Override
    public boolean next() {
      if (!iterator.hasNext()) {
        current = null;
        return false;
      }
      current = iterator.next();
      return true;
    }

    @Override
    public Series at() {
      if (current == null) {
        throw new IllegalStateException("No current series.");
      }
      final TimeSeries snapshot = current;
      return new Series() {
        @Override
        public Labels labels() {
          return snapshot.labels();
        }

        @Override
        public SampleIterator iterator() {
          return new ListSampleIterator(snapshot.samples());
        }
      };
    }

    @Override
    public Throwable err() {
      return null;
    }
  }
  
  /** A sample iterator over a list. */
  static class ListSampleIterator implements SampleIterator {
    private final List<Sample> samples;
    private int index = -1;
    
    ListSampleIterator(final List<Sample> samples) {
      this.samples = samples;
    }
    
    @Override
    public boolean next() {
      if (index + 1 >= samples.size()) {
        index = samples.size();
        return false;
      }
      index++;
      return true;
    }

    @Override
    public long timestamp() {
      return samples.get(index).timestamp();
    }

    @Override
    public double value() {
      return samples.get(index).value();
    }

    @Override
    public Throwable err() {
      return null;
    }
  }
}
