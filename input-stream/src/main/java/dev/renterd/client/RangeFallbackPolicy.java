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

/** What to do when the server answers a ranged request with the whole object (status 200). */
public enum RangeFallbackPolicy {
  /** Read and drop the bytes before the requested position, then continue from the same body. */
  DISCARD_UNTIL_POSITION,
  /** Fail the read with a {@link dev.renterd.client.common.exceptions.NotSeekableException}. */
  FAIL
}
