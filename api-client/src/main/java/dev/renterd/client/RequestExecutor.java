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
import dev.renterd.client.request.ApiResponse;
import java.io.Closeable;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Issues single requests against the renterd API.
 *
 * <p>The returned future completes with the raw response for every HTTP status, including error
 * statuses, so that callers can interpret statuses such as 206 or 416 themselves; see {@link
 * ApiResponses} for the common mapping. Connection and timeout failures complete the future
 * exceptionally with a {@link dev.renterd.client.common.exceptions.TransportException}.
 * Cancelling the future releases the in-flight connection.
 */
public interface RequestExecutor extends Closeable {

  /**
   * Executes a request.
   *
   * @param request the request to send
   * @return a future completing with the response; the caller owns and must close it
   */
  CompletableFuture<ApiResponse> execute(ApiRequest request);

  /**
   * The rate limiting policy applied before each request, if this executor has one.
   *
   * @return the policy, or empty
   */
  default Optional<RateLimitPolicy> getRateLimitPolicy() {
    return Optional.empty();
  }
}
