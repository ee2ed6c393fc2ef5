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

import java.util.Map;
import java.util.Map.Entry;

import org.junit.Test;

public class TestEnvironmentProvider {
  
  @Test
  public void getSetting() throws Exception {
    try (final EnvironmentProvider provider = new EnvironmentProvider()) {
      assertNull(provider.getSetting("tsread.no.such.environment.key"));
      
      // PATH or whatever the first variable is should be visible as is.
      final Map<String, String> env = System.getenv();
      for (final Entry<String, String> entry : env.entrySet()) {
        assertEquals(entry.getValue(), provider.getSetting(entry.getKey()));
        break;
      }
      
      try {
        provider.getSetting(null);
        fail("Expected IllegalArgumentException");
      } catch (IllegalArgumentException e) { }
      
      try {
        provider.getSetting("");
        fail("Expected IllegalArgumentException");
      } catch (IllegalArgumentException e) { }
    }
  }
}
