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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.renterd.client.common.exceptions.ApiException;
import dev.renterd.client.common.exceptions.AuthenticationException;
import dev.renterd.client.common.exceptions.HttpResponseException;
import dev.renterd.client.common.exceptions.InvalidDataException;
import dev.renterd.client.common.exceptions.NotFoundException;
import dev.renterd.client.common.util.Futures;
import dev.renterd.client.request.ApiRequest;
import dev.renterd.client.request.ApiResponse;
import java.io.IOException;
import java.util.Optional;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Maps response statuses to the client's exceptions, and decodes JSON bodies. */
public final class ApiResponses {
  private static final Logger LOG = LoggerFactory.getLogger(ApiResponses.class);

  private ApiResponses() {}

  /**
   * Sends a request and returns the response when it succeeded.
   *
   * @param executor executor sending the request
   * @param request the request
   * @return the successful response; the caller must close it
   * @throws NotFoundException on 404
   * @throws IOException on any other failure
   */
  public static ApiResponse send(@NonNull RequestExecutor executor, @NonNull ApiRequest request)
      throws IOException {
    return sendOptional(executor, request)
        .orElseThrow(() -> new NotFoundException(request.getPath()));
  }

  /**
   * Sends a request and returns the response when it succeeded, or empty on 404.
   *
   * @param executor executor sending the request
   * @param request the request
   * @return the successful response, or empty when the resource does not exist
   * @throws IOException on any other failure
   */
  public static Optional<ApiResponse> sendOptional(
      @NonNull RequestExecutor executor, @NonNull ApiRequest request) throws IOException {
    ApiResponse response = Futures.await(executor.execute(request), ApiResponse::abort);
    if (response.getStatusCode() == 404) {
      response.abort();
      return Optional.empty();
    }
    checkStatus(response, request.getPath());
    return Optional.of(response);
  }

  /**
   * Throws the exception matching an error status. The response is released when it fails the
   * check.
   *
   * @param response the response
   * @param path request path, for messages
   * @throws AuthenticationException on 401
   * @throws NotFoundException on 404
   * @throws HttpResponseException on any other 4xx or 5xx
   */
  public static void checkStatus(@NonNull ApiResponse response, String path) throws ApiException {
    int status = response.getStatusCode();
    if (status == 401) {
      response.abort();
      throw new AuthenticationException(path);
    }
    if (status == 404) {
      response.abort();
      throw new NotFoundException(path);
    }
    if (status >= 400 && status < 600) {
      throw new HttpResponseException(status, readErrorText(response));
    }
  }

  /**
   * Sends a GET request and decodes the JSON response.
   *
   * @param executor executor sending the request
   * @param mapper JSON mapper
   * @param path relative path
   * @param type type to decode into
   * @param <T> decoded type
   * @return the decoded value
   * @throws InvalidDataException if the body does not decode
   * @throws IOException on any other failure
   */
  public static <T> T getJson(
      @NonNull RequestExecutor executor,
      @NonNull ObjectMapper mapper,
      @NonNull String path,
      @NonNull Class<T> type)
      throws IOException {
    try (ApiResponse response = send(executor, ApiRequest.get(path).build())) {
      return decodeJson(mapper, response.bodyAsString(), type);
    }
  }

  static <T> T decodeJson(ObjectMapper mapper, String json, Class<T> type)
      throws InvalidDataException {
    try {
      return mapper.readValue(json, type);
    } catch (JsonProcessingException e) {
      throw new InvalidDataException("Invalid JSON for " + type.getSimpleName(), e);
    }
  }

  private static String readErrorText(ApiResponse response) {
    try {
      return response.bodyAsString().trim();
    } catch (IOException e) {
      LOG.debug("Could not read error response body", e);
      response.abort();
      return "";
    }
  }
}
