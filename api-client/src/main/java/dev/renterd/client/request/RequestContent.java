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

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.Optional;
import java.util.OptionalLong;
import javax.annotation.Nullable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NonNull;
import software.amazon.awssdk.http.ContentStreamProvider;

/** Body of a request: either a JSON document or a caller-provided byte stream. */
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RequestContent {
  private static final String JSON_CONTENT_TYPE = "application/json";

  @Getter private final ContentStreamProvider streamProvider;
  @Nullable private final String contentType;
  private final long contentLength;

  /**
   * JSON content.
   *
   * @param json serialized document
   * @return content
   */
  public static RequestContent json(byte @NonNull [] json) {
    return new RequestContent(
        () -> new ByteArrayInputStream(json), JSON_CONTENT_TYPE, json.length);
  }

  /**
   * Streamed content of unknown length. The stream is consumed once.
   *
   * @param stream source of the bytes
   * @param contentType content type, or null
   * @return content
   */
  public static RequestContent stream(@NonNull InputStream stream, @Nullable String contentType) {
    return new RequestContent(() -> stream, contentType, -1);
  }

  /**
   * Content type of the body.
   *
   * @return the content type, if any
   */
  public Optional<String> getContentType() {
    return Optional.ofNullable(contentType);
  }

  /**
   * Length of the body.
   *
   * @return the length, or empty when streamed
   */
  public OptionalLong getContentLength() {
    return contentLength < 0 ? OptionalLong.empty() : OptionalLong.of(contentLength);
  }
}
