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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.Lists;

import net.tsread.data.Labels;
import net.tsread.query.LabelMatcher;
import net.tsread.query.LabelMatcher.MatchType;
import net.tsread.query.QueryContext;

public class TestMemoryQueryable {
  private MemoryQueryable queryable;
  private QueryContext context;
  
  @Before
  public void before() throws Exception {
    queryable = new MemoryQueryable();
    context = new QueryContext("test");
    queryable.addSample(Labels.of("__name__", "up", "job", "node"), 10, 1);
    queryable.addSample(Labels.of("__name__", "up", "job", "node"), 60, 0);
    queryable.addSample(Labels.of("__name__", "up", "job", "api"), 20, 1);
    queryable.addSample(Labels.of("__name__", "down", "job", "api"), 30, 1);
  }
  
  @Test
  public void selectEqual() throws Exception {
    final SeriesSet set = queryable.querier(context, 0, 100)
        .select(true, new SelectHints(0, 100, null), 
            Lists.newArrayList(new LabelMatcher(MatchType.EQ, "__name__", "up")));
    
    assertTrue(set.next());
    assertEquals("api", set.at().labels().get("job"));
    assertTrue(set.next());
    final Series series = set.at();
    assertEquals("node", series.labels().get("job"));
    final SampleIterator it = series.iterator();
    assertTrue(it.next());
    assertEquals(10, it.timestamp());
    assertEquals(1, it.value(), 0.001);
    assertTrue(it.next());
    assertEquals(60, it.timestamp());
    assertFalse(it.next());
    assertEquals(null, it.err());
    assertFalse(set.next());
    assertEquals(null, set.err());
  }
  
  @Test
  public void timeRangeIsInclusive() throws Exception {
    final SeriesSet set = queryable.querier(context, 10, 10)
        .select(false, null, 
            Lists.newArrayList(new LabelMatcher(MatchType.EQ, "job", "node")));
    assertTrue(set.next());
    final SampleIterator it = set.at().iterator();
    assertTrue(it.next());
    assertEquals(10, it.timestamp());
    assertFalse(it.next());
    assertFalse(set.next());
  }
  
  @Test
  public void regexAndMissingLabels() throws Exception {
    queryable.addSample(Labels.of("__name__", "up"), 40, 1);
    final List<LabelMatcher> matchers = Lists.newArrayList(
        new LabelMatcher(MatchType.RE, "__name__", "u.*"),
        new LabelMatcher(MatchType.NEQ, "job", "node"));
    final SeriesSet set = queryable.querier(context, 0, 100)
        .select(true, null, matchers);
    int count = 0;
    while (set.next()) {
      assertEquals("up", set.at().labels().get("__name__"));
      count++;
    }
    assertEquals(2, count);
  }
  
  @Test
  public void sameTimestampReplaces() throws Exception {
    queryable.addSample(Labels.of("__name__", "up", "job", "node"), 10, 42);
    assertEquals(3, queryable.seriesCount());
    final SeriesSet set = queryable.querier(context, 10, 10)
        .select(false, null, 
            Lists.newArrayList(new LabelMatcher(MatchType.EQ, "job", "node")));
    assertTrue(set.next());
    final SampleIterator it = set.at().iterator();
    assertTrue(it.next());
    assertEquals(42, it.value(), 0.001);
  }
  
  @Test
  public void invalid() throws Exception {
    try {
      queryable.querier(null, 0, 1);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      queryable.querier(context, 2, 1);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    final Querier querier = queryable.querier(context, 0, 1);
    querier.close();
    try {
      querier.select(false, null, Lists.<LabelMatcher>newArrayList());
      fail("Expected IllegalStateException");
    } catch (IllegalStateException e) { }
  }
}
