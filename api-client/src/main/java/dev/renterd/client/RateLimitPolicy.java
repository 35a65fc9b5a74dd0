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

import dev.renterd.client.request.ApiRequest;

/**
 * Hook consulted by a {@link RequestExecutor} before a request is sent. Implementations block
 * until the request may proceed.
 */
@FunctionalInterface
public interface RateLimitPolicy {

  /**
   * Waits for permission to send a request.
   *
   * @param request the request about to be sent
   * @throws InterruptedException if interrupted while waiting
   */
  void acquire(ApiRequest request) throws InterruptedException;
}
