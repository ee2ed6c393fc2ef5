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

import org.junit.Test;

public class TestCommandLineProvider {

  @Test
  public void ctor() throws Exception {
    try {
      new CommandLineProvider(null).close();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    new CommandLineProvider(new String[0]).close();
    new CommandLineProvider(new String[] { "--test.conf=foo" }).close();
  }
  
  @Test
  public void getSettings() throws Exception {
    final String[] args = new String[] {
        "--test.conf=foo",
        "--test.bar=42",
        "--test.flag",
        "--test.bar.baz=nope",
        "--test.empty=",
        "--test.conf=bar"
    };
    try (final CommandLineProvider provider = new CommandLineProvider(args)) {
      try {
        provider.getSetting(null);
        fail("Expected IllegalArgumentException");
      } catch (IllegalArgumentException e) { }
      
      try {
        provider.getSetting("");
        fail("Expected IllegalArgumentException");
      } catch (IllegalArgumentException e) { }
      
      assertNull(provider.getSetting("no.such.key"));
      assertEquals("bar", provider.getSetting("test.conf"));
      assertEquals("42", provider.getSetting("test.bar"));
      assertEquals("true", provider.getSetting("test.flag"));
      assertEquals("", provider.getSetting("test.empty"));
      assertNull(provider.getSetting("test"));
      assertEquals(CommandLineProvider.SOURCE, provider.source());
    }
  }
}
