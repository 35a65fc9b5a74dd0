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

/**
 * Connection, timeout or truncated-body failure while talking to the API. Never retried by the
 * client itself.
 */
public class TransportException extends ApiException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates a {@link TransportException}.
   *
   * @param message the detail message
   */
  public TransportException(String message) {
    super(message);
  }

  /**
   * Creates a {@link TransportException} wrapping the underlying failure.
   *
   * @param message the detail message
   * @param cause the underlying failure
   */
  public TransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
