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

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Strings;

import net.tsread.configuration.ConfigurationException;

/**
 * Loads a Java properties file once at construction.
 * 
 * @since 1.0
 */
public class PropertiesFileProvider extends Provider {
  private static final Logger LOG = LoggerFactory.getLogger(
      PropertiesFileProvider.class);
  
  public static final String SOURCE = 
      PropertiesFileProvider.class.getSimpleName();
  
  /** The file we loaded. */
  private final String file_name;
  
  /** The parsed properties. */
  private final Properties properties;
  
  /**
   * Default ctor.
   * @param file_name A non-null and non-empty path to the file.
   * @throws IllegalArgumentException if the path was null or empty.
   * @throws ConfigurationException if the file could not be read.
   */
  public PropertiesFileProvider(final String file_name) {
    if (Strings.isNullOrEmpty(file_name)) {
      throw new IllegalArgumentException("File name cannot be null or empty.");
    }
    this.file_name = file_name;
    properties = new Properties();
    try (final InputStream stream = new FileInputStream(file_name)) {
      properties.load(stream);
    } catch (IOException e) {
      throw new ConfigurationException("Failed to load properties file: " 
          + file_name, e);
    }
    LOG.info("Loaded " + properties.size() + " settings from file: " 
        + file_name);
  }
  
  @Override
  public String getSetting(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    return properties.getProperty(key);
  }

  @Override
  public String source() {
    return SOURCE + ":" + file_name;
  }
}
