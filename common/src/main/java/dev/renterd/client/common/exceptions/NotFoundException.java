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

/** The remote resource does not exist (HTTP 404). */
public class NotFoundException extends ApiException {
  private static final long serialVersionUID = 1L;

  /**
   * Path of the missing resource.
   *
   * @return the path
   */
  @Getter private final String path;

  /**
   * Creates a {@link NotFoundException}.
   *
   * @param path path of the missing resource
   */
  public NotFoundException(String path) {
    super("Server sent 404 not found for " + path);
    this.path = path;
  }
}
