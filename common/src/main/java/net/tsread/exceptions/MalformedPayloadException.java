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
 * Thrown when a request body could not be decompressed or parsed. Always a
 * client error.
 * 
 * @since 1.0
 */
public class MalformedPayloadException extends SerdesException {
  private static final long serialVersionUID = 3486093519822165212L;

  /**
   * Default ctor.
   * @param msg A descriptive message.
   */
  public MalformedPayloadException(final String msg) {
    super(msg, 400);
  }
  
  /**
   * Ctor with a cause.
   * @param msg A descriptive message.
   * @param cause The parser or decompressor exception.
   */
  public MalformedPayloadException(final String msg, final Throwable cause) {
    super(msg, 400, cause);
  }
}
