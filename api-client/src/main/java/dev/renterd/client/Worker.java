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

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.renterd.client.model.Memory;
import java.io.IOException;
import lombok.Getter;
import lombok.NonNull;

/** Endpoints of the renterd worker. */
public class Worker {
  static final String ID_PATH = "worker/id";
  static final String MEMORY_PATH = "worker/memory";

  private final RequestExecutor requestExecutor;
  private final ObjectMapper objectMapper;

  /**
   * Object upload, download and deletion.
   *
   * @return the object endpoints
   */
  @Getter private final WorkerObjects objects;

  /**
   * Creates the worker endpoints.
   *
   * @param requestExecutor executor sending the requests
   * @param objectMapper JSON mapper for response bodies
   */
  public Worker(@NonNull RequestExecutor requestExecutor, @NonNull ObjectMapper objectMapper) {
    this.requestExecutor = requestExecutor;
    this.objectMapper = objectMapper;
    this.objects = new WorkerObjects(requestExecutor);
  }

  /**
   * Identifier of the worker.
   *
   * @return the worker id
   * @throws IOException if the request fails
   */
  public String id() throws IOException {
    return ApiResponses.getJson(requestExecutor, objectMapper, ID_PATH, String.class);
  }

  /**
   * Memory available for uploads and downloads.
   *
   * @return memory usage
   * @throws IOException if the request fails
   */
  public Memory memory() throws IOException {
    return ApiResponses.getJson(requestExecutor, objectMapper, MEMORY_PATH, Memory.class);
  }
}
