/*
 * Copyright The renterd-client-java Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.renterd.client.common.exceptions;

import java.io.IOException;

/**
 * Base type of every failure reported by the renterd client, whether it comes from the remote API,
 * the transport, or a seekable object stream.
 */
public class ApiException extends IOException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an {@link ApiException}.
   *
   * @param message the detail message
   */
  public ApiException(String message) {
    super(message);
  }

  /**
   * Creates an {@link ApiException} with a cause.
   *
   * @param message the detail message
   * @param cause the cause
   */
  public ApiException(String message, Throwable cause) {
    super(message, cause);
  }
}
