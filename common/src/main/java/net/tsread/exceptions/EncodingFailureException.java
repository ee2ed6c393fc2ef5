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

/**
 * Thrown when a response could not be serialized. Only happens on an 
 * internal bug so it maps to a server error.
 * 
 * @since 1.0
 */
public class EncodingFailureException extends SerdesException {
  private static final long serialVersionUID = -6385516093425716735L;

  /**
   * Default ctor.
   * @param msg A descriptive message.
   * @param cause The serializer or compressor exception.
   */
  public EncodingFailureException(final String msg, final Throwable cause) {
    super(msg, 500, cause);
  }
}
