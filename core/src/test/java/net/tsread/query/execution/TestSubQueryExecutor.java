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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;

import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

import net.tsread.data.Labels;
import net.tsread.exceptions.QuerierAcquisitionException;
import net.tsread.exceptions.QueryExecutionCanceled;
import net.tsread.exceptions.QueryExecutionException;
import net.tsread.exceptions.StorageIterationException;
import net.tsread.query.LabelMatcher;
import net.tsread.query.LabelMatcher.MatchType;
import net.tsread.query.QueryContext;
import net.tsread.query.QueryResult;
import net.tsread.query.ReadHints;
import net.tsread.query.SubQuery;
import net.tsread.storage.Querier;
import net.tsread.storage.Queryable;
import net.tsread.storage.SelectHints;
import net.tsread.storage.SeriesSet;

public class TestSubQueryExecutor {
  private Queryable queryable;
  private Querier querier;
  private QueryContext context;
  private SubQuery query;
  
  @Before
  public void before() throws Exception {
    queryable = mock(Queryable.class);
    querier = mock(Querier.class);
    context = new QueryContext("test");
    query = SubQuery.newBuilder()
        .setStartMs(0)
        .setEndMs(100)
        .addMatcher(new LabelMatcher(MatchType.EQ, "__name__", "up"))
        .setHints(ReadHints.newBuilder()
            .setStepMs(15000)
            .setFunc("rate")
            .build())
        .build();
    when(queryable.querier(any(QueryContext.class), anyLong(), anyLong()))
      .thenReturn(querier);
    when(querier.select(anyBoolean(), any(SelectHints.class), anyList()))
      .thenReturn(TestSeriesMaterializer.set(null, 
          TestSeriesMaterializer.series(Labels.of("__name__", "up"), null, 
              10, 1.0)));
  }
  
  @Test
  public void ctor() throws Exception {
    try {
      new SubQueryExecutor(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void execute() throws Exception {
    final QueryResult result = new SubQueryExecutor(queryable)
        .execute(context, 0, query);
    assertEquals(1, result.timeSeries().size());
    assertEquals(1, result.timeSeries().get(0).samples().size());
    
    verify(queryable, times(1)).querier(context, 0, 100);
    final ArgumentCaptor<SelectHints> hints = 
        ArgumentCaptor.forClass(SelectHints.class);
    verify(querier, times(1)).select(eq(false), hints.capture(), 
        eq(query.getMatchers()));
    assertEquals(0, hints.getValue().start());
    assertEquals(100, hints.getValue().end());
    assertSame(query.getHints(), hints.getValue().readHints());
    verify(querier, times(1)).close();
  }
  
  @Test
  public void invertedRange() throws Exception {
    query = SubQuery.newBuilder()
        .setStartMs(100)
        .setEndMs(0)
        .build();
    try {
      new SubQueryExecutor(queryable).execute(context, 3, query);
      fail("Expected QueryExecutionException");
    } catch (QueryExecutionException e) {
      assertEquals(400, e.getStatusCode());
      assertEquals(3, e.getOrder());
    }
    verify(queryable, never()).querier(any(QueryContext.class), anyLong(), 
        anyLong());
  }
  
  @Test
  public void canceledBeforeAcquisition() throws Exception {
    context.cancel();
    try {
      new SubQueryExecutor(queryable).execute(context, 1, query);
      fail("Expected QueryExecutionCanceled");
    } catch (QueryExecutionCanceled e) {
      assertEquals(1, e.getOrder());
    }
    verify(queryable, never()).querier(any(QueryContext.class), anyLong(), 
        anyLong());
  }
  
  @Test
  public void querierFailure() throws Exception {
    final IllegalStateException cause = new IllegalStateException("No blocks");
    when(queryable.querier(any(QueryContext.class), anyLong(), anyLong()))
      .thenThrow(cause);
    try {
      new SubQueryExecutor(queryable).execute(context, 2, query);
      fail("Expected QuerierAcquisitionException");
    } catch (QuerierAcquisitionException e) {
      assertSame(cause, e.getCause());
      assertEquals(400, e.getStatusCode());
      assertEquals(2, e.getOrder());
    }
  }
  
  @Test
  public void querierFailureServerSide() throws Exception {
    when(queryable.querier(any(QueryContext.class), anyLong(), anyLong()))
      .thenThrow(new QueryExecutionException("Store gateway down", 503));
    try {
      new SubQueryExecutor(queryable).execute(context, 0, query);
      fail("Expected QuerierAcquisitionException");
    } catch (QuerierAcquisitionException e) {
      assertEquals(503, e.getStatusCode());
    }
  }
  
  @Test
  public void nullQuerier() throws Exception {
    when(queryable.querier(any(QueryContext.class), anyLong(), anyLong()))
      .thenReturn(null);
    try {
      new SubQueryExecutor(queryable).execute(context, 0, query);
      fail("Expected QuerierAcquisitionException");
    } catch (QuerierAcquisitionException e) { }
  }
  
  @Test
  public void selectThrows() throws Exception {
    when(querier.select(anyBoolean(), any(SelectHints.class), anyList()))
      .thenThrow(new IllegalStateException("Boo!"));
    try {
      new SubQueryExecutor(queryable).execute(context, 0, query);
      fail("Expected StorageIterationException");
    } catch (StorageIterationException e) { }
    verify(querier, times(1)).close();
  }
  
  @Test
  public void iterationErrorClosesQuerier() throws Exception {
    final SeriesSet set = TestSeriesMaterializer.set(
        new IOException("Boo!"));
    when(querier.select(anyBoolean(), any(SelectHints.class), anyList()))
      .thenReturn(set);
    try {
      new SubQueryExecutor(queryable).execute(context, 0, query);
      fail("Expected StorageIterationException");
    } catch (StorageIterationException e) { }
    verify(querier, times(1)).close();
  }
  
  @Test
  public void closeFailureNotSurfaced() throws Exception {
    doThrow(new IOException("Boo!")).when(querier).close();
    final QueryResult result = new SubQueryExecutor(queryable)
        .execute(context, 0, query);
    assertEquals(1, result.timeSeries().size());
  }
  
  @Test
  public void invalid() throws Exception {
    final SubQueryExecutor executor = new SubQueryExecutor(queryable);
    try {
      executor.execute(null, 0, query);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      executor.execute(context, 0, null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
