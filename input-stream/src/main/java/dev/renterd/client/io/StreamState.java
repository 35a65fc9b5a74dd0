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
package dev.renterd.client.io;

/** Lifecycle state of a {@link dev.renterd.client.RemoteSeekableInputStream}. */
public enum StreamState {
  /** No response body is open. Reads are served from buffered bytes or start a new request. */
  IDLE,
  /** A ranged request was sent and its response is awaited. */
  FETCHING,
  /** A response body is open and delivering bytes. */
  STREAMING,
  /** The position is at the known end of the object. */
  EXHAUSTED,
  /** The stream was closed; this is terminal. */
  CLOSED
}
