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
package net.tsread.exceptions;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

import com.google.common.collect.Lists;

public class TestQueryExecutionException {

  @Test
  public void ctors() throws Exception {
    QueryExecutionException e = new QueryExecutionException("Boo!", 400);
    assertEquals("Boo!", e.getMessage());
    assertEquals(400, e.getStatusCode());
    assertEquals(-1, e.getOrder());
    assertTrue(e.getExceptions().isEmpty());
    assertNull(e.getCause());
    
    final IllegalStateException cause = new IllegalStateException("Cause");
    e = new QueryExecutionException("Boo!", 503, 2, cause);
    assertEquals(503, e.getStatusCode());
    assertEquals(2, e.getOrder());
    assertSame(cause, e.getCause());
  }
  
  @Test
  public void subExceptions() throws Exception {
    final List<Throwable> exceptions = Lists.newArrayList(
        new StorageIterationException("First", 400, 1, null),
        new QuerierAcquisitionException("Second", 500, 3, null));
    final QueryExecutionException e = 
        new QueryExecutionException("Boo!", 400, 1, exceptions);
    assertEquals(2, e.getExceptions().size());
    assertSame(exceptions.get(0), e.getCause());
    assertTrue(e.toString().contains("subExceptions["));
    assertTrue(e.toString().contains("Second"));
  }
  
  @Test
  public void serdes() throws Exception {
    final PayloadTooLargeException too_large = 
        new PayloadTooLargeException(2048, 1024);
    assertEquals("received message larger than max (2048 vs 1024)", 
        too_large.getMessage());
    assertEquals(400, too_large.getStatusCode());
    assertEquals(2048, too_large.getSize());
    assertEquals(1024, too_large.getMaxSize());
    
    assertEquals(400, new MalformedPayloadException("Bad").getStatusCode());
    assertEquals(500, new EncodingFailureException("Bad", 
        new IllegalStateException()).getStatusCode());
  }
}
