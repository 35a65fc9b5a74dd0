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
package dev.renterd.client.request;

import java.util.Map;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import software.amazon.awssdk.http.SdkHttpMethod;

/**
 * A request against the API. The path is relative to the configured endpoint and unencoded, e.g.
 * {@code worker/objects/photos/2024/a b.jpg}.
 */
@Value
@Builder
public class ApiRequest {
  @NonNull SdkHttpMethod method;
  @NonNull String path;
  @Singular Map<String, String> queryParameters;
  @Singular Map<String, String> headers;
  @Nullable RequestContent content;

  /**
   * Starts a GET request.
   *
   * @param path relative path
   * @return builder
   */
  public static ApiRequestBuilder get(String path) {
    return builder().method(SdkHttpMethod.GET).path(path);
  }

  /**
   * Starts a HEAD request.
   *
   * @param path relative path
   * @return builder
   */
  public static ApiRequestBuilder head(String path) {
    return builder().method(SdkHttpMethod.HEAD).path(path);
  }

  /**
   * Starts a PUT request.
   *
   * @param path relative path
   * @return builder
   */
  public static ApiRequestBuilder put(String path) {
    return builder().method(SdkHttpMethod.PUT).path(path);
  }

  /**
   * Starts a POST request.
   *
   * @param path relative path
   * @return builder
   */
  public static ApiRequestBuilder post(String path) {
    return builder().method(SdkHttpMethod.POST).path(path);
  }

  /**
   * Starts a DELETE request.
   *
   * @param path relative path
   * @return builder
   */
  public static ApiRequestBuilder delete(String path) {
    return builder().method(SdkHttpMethod.DELETE).path(path);
  }
}
