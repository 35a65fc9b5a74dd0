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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.Closeable;
import java.io.IOException;
import lombok.Getter;
import lombok.NonNull;

/**
 * Entry point of the renterd client.
 *
 * <pre>
 * ApiClientConfiguration configuration =
 *     ApiClientConfiguration.builder()
 *         .apiEndpointUrl("http://localhost:9980/api")
 *         .apiPassword(password)
 *         .build();
 * try (RenterdClient client = new RenterdClient(configuration)) {
 *   String workerId = client.getWorker().id();
 * }
 * </pre>
 */
public class RenterdClient implements Closeable {
  /**
   * Executor shared by all endpoints.
   *
   * @return the request executor
   */
  @Getter private final RequestExecutor requestExecutor;

  /**
   * Worker endpoints.
   *
   * @return the worker
   */
  @Getter private final Worker worker;

  /**
   * Creates a client sending requests through an {@link SdkHttpRequestExecutor}.
   *
   * @param configuration client configuration
   */
  public RenterdClient(@NonNull ApiClientConfiguration configuration) {
    this(new SdkHttpRequestExecutor(configuration));
  }

  /**
   * Creates a client on top of an existing executor. The client takes ownership of it.
   *
   * @param requestExecutor executor sending the requests
   */
  public RenterdClient(@NonNull RequestExecutor requestExecutor) {
    this.requestExecutor = requestExecutor;
    this.worker = new Worker(requestExecutor, createObjectMapper());
  }

  static ObjectMapper createObjectMapper() {
    return new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  @Override
  public void close() throws IOException {
    this.requestExecutor.close();
  }
}
