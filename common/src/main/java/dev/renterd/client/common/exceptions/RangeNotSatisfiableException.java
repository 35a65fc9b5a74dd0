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

/**
 * The server refused a range (HTTP 416) for a position that is not the end of the object.
 * Refusals exactly at the object length are reported as end-of-object instead.
 */
public class RangeNotSatisfiableException extends ApiException {
  private static final long serialVersionUID = 1L;

  /**
   * Start of the refused range.
   *
   * @return the start offset
   */
  @Getter private final long position;

  /**
   * Creates a {@link RangeNotSatisfiableException}.
   *
   * @param path object path
   * @param position start of the refused range
   */
  public RangeNotSatisfiableException(String path, long position) {
    super(String.format("Range starting at %d is not satisfiable for %s", position, path));
    this.position = position;
  }
}
