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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;

import net.tsread.exceptions.QueryExecutionCanceled;

public class TestQueryContext {

  @Test
  public void cancel() throws Exception {
    final QueryContext context = new QueryContext("q1");
    assertEquals("q1", context.id());
    assertFalse(context.isCanceled());
    context.checkCanceled(0);
    
    final AtomicInteger calls = new AtomicInteger();
    final Runnable listener = new Runnable() {
      @Override
      public void run() {
        calls.incrementAndGet();
      }
    };
    context.addCancelListener(listener);
    context.cancel();
    assertTrue(context.isCanceled());
    assertEquals(1, calls.get());
    
    // only once
    context.cancel();
    assertEquals(1, calls.get());
    
    try {
      context.checkCanceled(3);
      fail("Expected QueryExecutionCanceled");
    } catch (QueryExecutionCanceled e) {
      assertEquals(3, e.getOrder());
      assertEquals(QueryContext.CANCELED_STATUS, e.getStatusCode());
    }
  }
  
  @Test
  public void listenerAfterCancelRunsImmediately() throws Exception {
    final QueryContext context = new QueryContext(null);
    assertEquals("", context.id());
    context.cancel();
    final AtomicInteger calls = new AtomicInteger();
    context.addCancelListener(new Runnable() {
      @Override
      public void run() {
        calls.incrementAndGet();
      }
    });
    assertEquals(1, calls.get());
  }
  
  @Test
  public void removedListenerNotCalled() throws Exception {
    final QueryContext context = new QueryContext("q1");
    final AtomicInteger calls = new AtomicInteger();
    final Runnable listener = new Runnable() {
      @Override
      public void run() {
        calls.incrementAndGet();
      }
    };
    context.addCancelListener(listener);
    context.removeCancelListener(listener);
    context.cancel();
    assertEquals(0, calls.get());
  }
  
  @Test
  public void failingListenerDoesNotStopOthers() throws Exception {
    final QueryContext context = new QueryContext("q1");
    final AtomicInteger calls = new AtomicInteger();
    context.addCancelListener(new Runnable() {
      @Override
      public void run() {
        throw new IllegalStateException("Boo!");
      }
    });
    context.addCancelListener(new Runnable() {
      @Override
      public void run() {
        calls.incrementAndGet();
      }
    });
    context.cancel();
    assertEquals(1, calls.get());
    
    try {
      context.addCancelListener(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
