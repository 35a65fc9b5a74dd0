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
 * A ranged response was malformed, lacked a required range or length header, or contradicted a
 * length observed earlier on the same object.
 */
public class ProtocolViolationException extends ApiException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates a {@link ProtocolViolationException}.
   *
   * @param message the detail message
   */
  public ProtocolViolationException(String message) {
    super(message);
  }

  /**
   * Creates a {@link ProtocolViolationException}.
   *
   * @param message the detail message
   * @param cause the cause
   */
  public ProtocolViolationException(String message, Throwable cause) {
    super(message, cause);
  }
}
