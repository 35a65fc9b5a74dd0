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

/** A response carried a body or header that could not be interpreted. */
public class InvalidDataException extends ApiException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an {@link InvalidDataException}.
   *
   * @param message the detail message
   */
  public InvalidDataException(String message) {
    super(message);
  }

  /**
   * Creates an {@link InvalidDataException} with a cause.
   *
   * @param message the detail message
   * @param cause the parsing failure
   */
  public InvalidDataException(String message, Throwable cause) {
    super(message, cause);
  }
}
