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

import lombok.Getter;

/** The API answered with a client or server error status other than 401 and 404. */
public class HttpResponseException extends ApiException {
  private static final long serialVersionUID = 1L;

  /**
   * HTTP status code of the response.
   *
   * @return the status code
   */
  @Getter private final int statusCode;

  /**
   * Trimmed response body text, empty when the body could not be read.
   *
   * @return the body text
   */
  @Getter private final String responseText;

  /**
   * Creates a {@link HttpResponseException}.
   *
   * @param statusCode HTTP status code
   * @param responseText trimmed response body text
   */
  public HttpResponseException(int statusCode, String responseText) {
    super(
        String.format("HTTP response error, status code: `%d`, text: `%s`", statusCode, responseText));
    this.statusCode = statusCode;
    this.responseText = responseText;
  }
}
