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
package dev.renterd.client;

/** Reference point of a relative {@link RemoteSeekableInputStream#seek(long, SeekOrigin)}. */
public enum SeekOrigin {
  /** Offset counts from the first byte of the object. */
  FROM_START,
  /** Offset counts from the current position; may be negative. */
  FROM_CURRENT,
  /** Offset counts from the end of the object; usually negative or zero. */
  FROM_END
}
