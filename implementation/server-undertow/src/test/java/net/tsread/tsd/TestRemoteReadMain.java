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
package net.tsread.tsd;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;

import java.util.Map;

import org.junit.Test;

import com.google.common.collect.Maps;

import io.undertow.Undertow;
import net.tsread.configuration.UnitTestConfiguration;
import net.tsread.query.execution.RemoteReadExecutor;
import net.tsread.storage.MemoryQueryable;

public class TestRemoteReadMain {

  @Test
  public void registerConfigs() throws Exception {
    final UnitTestConfiguration config = 
        UnitTestConfiguration.getConfiguration();
    RemoteReadMain.registerConfigs(config);
    assertEquals(RemoteReadMain.DEFAULT_PORT, 
        config.getInt(RemoteReadMain.HTTP_PORT_KEY));
    assertEquals("0.0.0.0", config.getString(RemoteReadMain.BIND_KEY));
    assertEquals(RemoteReadMain.DEFAULT_PATH, 
        config.getString(RemoteReadMain.PATH_KEY));
    assertEquals(300000, config.getInt(RemoteReadMain.READ_TO_KEY));
    assertEquals(300000, config.getInt(RemoteReadMain.WRITE_TO_KEY));
    
    // idempotent
    RemoteReadMain.registerConfigs(config);
  }
  
  @Test
  public void buildServerRegistersEverything() throws Exception {
    final Map<String, String> settings = Maps.newHashMap();
    settings.put(RemoteReadMain.HTTP_PORT_KEY, "0");
    settings.put(RemoteReadMain.PATH_KEY, "/read");
    settings.put(RemoteReadExecutor.PARALLEL_EXECUTORS_KEY, "4");
    final UnitTestConfiguration config = 
        UnitTestConfiguration.getConfiguration(settings);
    final Undertow server = RemoteReadMain.buildServer(config, 
        new MemoryQueryable());
    assertNotNull(server);
    assertEquals("/read", config.getString(RemoteReadMain.PATH_KEY));
    assertEquals(4, config.getInt(RemoteReadExecutor.PARALLEL_EXECUTORS_KEY));
    assertEquals(1048576, 
        config.getInt(RemoteReadHandler.MAX_REQUEST_BYTES_KEY));
  }
}
