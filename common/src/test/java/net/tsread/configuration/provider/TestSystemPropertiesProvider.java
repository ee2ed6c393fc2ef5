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
package net.tsread.configuration.provider;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

import org.junit.After;
import org.junit.Test;

public class TestSystemPropertiesProvider {
  private static final String KEY = "tsread.unit.test.sysprop";
  
  @After
  public void after() {
    System.clearProperty(KEY);
  }
  
  @Test
  public void getSetting() throws Exception {
    try (final SystemPropertiesProvider provider = 
        new SystemPropertiesProvider()) {
      assertNull(provider.getSetting(KEY));
      
      System.setProperty(KEY, "foo");
      assertEquals("foo", provider.getSetting(KEY));
      
      try {
        provider.getSetting("");
        fail("Expected IllegalArgumentException");
      } catch (IllegalArgumentException e) { }
    }
  }
}
