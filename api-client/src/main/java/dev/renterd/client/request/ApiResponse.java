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

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.http.Abortable;
import software.amazon.awssdk.utils.IoUtils;

/**
 * Response of a single request: status, headers, and the body as an incremental byte source. The
 * body holds a pooled connection until the response is closed or aborted.
 */
public class ApiResponse implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(ApiResponse.class);

  @Getter private final int statusCode;
  private final Map<String, List<String>> headers;
  @Getter private final InputStream body;

  /**
   * Creates an {@link ApiResponse}.
   *
   * @param statusCode HTTP status code
   * @param headers response headers; names are matched case-insensitively
   * @param body response body
   */
  @Builder
  public ApiResponse(
      int statusCode, Map<String, List<String>> headers, @NonNull InputStream body) {
    this.statusCode = statusCode;
    this.headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    if (headers != null) {
      this.headers.putAll(headers);
    }
    this.body = body;
  }

  /**
   * First value of a header.
   *
   * @param name header name, case-insensitive
   * @return the value, if present
   */
  public Optional<String> header(String name) {
    List<String> values = headers.get(name);
    if (values == null || values.isEmpty()) {
      return Optional.empty();
    }
    return Optional.ofNullable(values.get(0));
  }

  /**
   * All headers.
   *
   * @return an unmodifiable view of the headers
   */
  public Map<String, List<String>> getHeaders() {
    return Collections.unmodifiableMap(headers);
  }

  /**
   * Whether the status is 2xx.
   *
   * @return true for a successful status
   */
  public boolean isSuccessful() {
    return statusCode >= 200 && statusCode < 300;
  }

  /**
   * Reads the whole body as UTF-8 text and closes the response.
   *
   * @return the body text
   * @throws IOException if reading fails
   */
  public String bodyAsString() throws IOException {
    try (InputStream in = body) {
      return IoUtils.toUtf8String(in);
    }
  }

  /**
   * Drops the connection without draining the remaining body. Use when the rest of the body is not
   * wanted; closing instead may read it to the end to reuse the connection.
   */
  public void abort() {
    if (body instanceof Abortable) {
      ((Abortable) body).abort();
    }
    try {
      body.close();
    } catch (IOException e) {
      LOG.debug("Error while closing aborted response body", e);
    }
  }

  @Override
  public void close() throws IOException {
    body.close();
  }
}
