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
 * An exception thrown during serialization or deserialization.
 * 
 * @since 1.0
 */
public class SerdesException extends RuntimeException {
  private static final long serialVersionUID = 7578119134399029514L;

  /** A status code the transport should respond with. */
  private final int status_code;
  
  /**
   * Default ctor.
   * @param msg A descriptive message.
   * @param status_code The status code to respond with.
   */
  public SerdesException(final String msg, final int status_code) {
    super(msg);
    this.status_code = status_code;
  }
  
  /**
   * Ctor with a cause.
   * @param msg A descriptive message.
   * @param status_code The status code to respond with.
   * @param cause A non-null cause of the exception.
   */
  public SerdesException(final String msg, 
                         final int status_code, 
                         final Throwable cause) {
    super(msg, cause);
    this.status_code = status_code;
  }
  
  /** @return The status code, e.g. HTTP code. */
  public int getStatusCode() {
    return status_code;
  }
}
