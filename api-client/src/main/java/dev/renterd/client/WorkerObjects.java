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

import dev.renterd.client.common.exceptions.InvalidDataException;
import dev.renterd.client.request.ApiRequest;
import dev.renterd.client.request.ApiResponse;
import dev.renterd.client.request.HttpHeaders;
import dev.renterd.client.request.RemoteObjectHandle;
import dev.renterd.client.request.RequestContent;
import java.io.IOException;
import java.io.InputStream;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import javax.annotation.Nullable;
import lombok.NonNull;

/**
 * The {@code worker/objects} endpoints. Object paths are appended to {@code worker/objects/} with
 * any leading slash removed; the optional bucket travels as the {@code bucket} query parameter.
 */
public class WorkerObjects {
  static final String OBJECTS_PATH = "worker/objects";
  static final String BUCKET_PARAM = "bucket";
  static final String BATCH_PARAM = "batch";
  private static final String BYTES_UNIT = "bytes";

  private final RequestExecutor requestExecutor;

  /**
   * Creates the object endpoints.
   *
   * @param requestExecutor executor sending the requests
   */
  public WorkerObjects(@NonNull RequestExecutor requestExecutor) {
    this.requestExecutor = requestExecutor;
  }

  /**
   * Looks up a downloadable object with a HEAD request.
   *
   * @param path object path
   * @param bucket bucket, or null for the default bucket
   * @return a handle describing the object, or empty when it does not exist
   * @throws InvalidDataException if the Content-Length or Last-Modified header is malformed
   * @throws IOException on any other failure
   */
  public Optional<RemoteObjectHandle> download(@NonNull String path, @Nullable String bucket)
      throws IOException {
    ApiRequest request = withBucket(ApiRequest.head(objectPath(path)), bucket).build();
    Optional<ApiResponse> found = ApiResponses.sendOptional(requestExecutor, request);
    if (!found.isPresent()) {
      return Optional.empty();
    }
    try (ApiResponse response = found.get()) {
      return Optional.of(toHandle(path, bucket, response));
    }
  }

  /**
   * Opens a plain sequential stream over the whole object.
   *
   * @param handle the object
   * @return the body of the GET response; closing it releases the connection
   * @throws IOException if the request fails
   */
  public InputStream openStream(@NonNull RemoteObjectHandle handle) throws IOException {
    return ApiResponses.send(requestExecutor, getRequest(handle).build()).getBody();
  }

  /**
   * Uploads an object, streaming its content.
   *
   * @param path object path
   * @param contentType content type, or null
   * @param bucket bucket, or null for the default bucket
   * @param content object bytes; consumed but not closed
   * @throws IOException if the request fails
   */
  public void upload(
      @NonNull String path,
      @Nullable String contentType,
      @Nullable String bucket,
      @NonNull InputStream content)
      throws IOException {
    ApiRequest request =
        withBucket(ApiRequest.put(objectPath(path)), bucket)
            .content(RequestContent.stream(content, contentType))
            .build();
    ApiResponses.send(requestExecutor, request).close();
  }

  /**
   * Deletes an object, or with {@code batch} every object under the path prefix.
   *
   * @param path object path
   * @param bucket bucket, or null for the default bucket
   * @param batch whether to delete by prefix
   * @throws IOException if the request fails
   */
  public void delete(@NonNull String path, @Nullable String bucket, boolean batch)
      throws IOException {
    ApiRequest request =
        withBucket(ApiRequest.delete(objectPath(path)), bucket)
            .queryParameter(BATCH_PARAM, Boolean.toString(batch))
            .build();
    ApiResponses.send(requestExecutor, request).close();
  }

  /**
   * A GET request for the object, without a range. Ranged readers add the Range header.
   *
   * @param handle the object
   * @return request builder
   */
  public static ApiRequest.ApiRequestBuilder getRequest(@NonNull RemoteObjectHandle handle) {
    return withBucket(ApiRequest.get(objectPath(handle.getPath())), handle.getBucket().orElse(null));
  }

  static String objectPath(String path) {
    String trimmed = path;
    while (trimmed.startsWith("/")) {
      trimmed = trimmed.substring(1);
    }
    return OBJECTS_PATH + "/" + trimmed;
  }

  private static ApiRequest.ApiRequestBuilder withBucket(
      ApiRequest.ApiRequestBuilder builder, @Nullable String bucket) {
    if (bucket != null) {
      builder.queryParameter(BUCKET_PARAM, bucket);
    }
    return builder;
  }

  static RemoteObjectHandle toHandle(String path, @Nullable String bucket, ApiResponse response)
      throws InvalidDataException {
    boolean acceptsRanges =
        response
            .header(HttpHeaders.ACCEPT_RANGES)
            .map(value -> value.startsWith(BYTES_UNIT))
            .orElse(false);
    Long length = parseContentLength(response.header(HttpHeaders.CONTENT_LENGTH).orElse(null));

    return RemoteObjectHandle.builder()
        .path(path)
        .bucket(bucket)
        .length(length)
        .contentType(nonEmpty(response.header(HttpHeaders.CONTENT_TYPE).orElse(null)))
        .etag(nonEmpty(response.header(HttpHeaders.ETAG).orElse(null)))
        .lastModified(parseLastModified(response.header(HttpHeaders.LAST_MODIFIED).orElse(null)))
        .seekable(acceptsRanges && length != null && length > 0)
        .build();
  }

  @Nullable
  static Long parseContentLength(@Nullable String value) throws InvalidDataException {
    if (value == null) {
      return null;
    }
    try {
      long length = Long.parseLong(value.trim());
      if (length < 0) {
        throw new InvalidDataException("invalid content length header: " + value);
      }
      return length;
    } catch (NumberFormatException e) {
      throw new InvalidDataException("invalid content length header: " + value, e);
    }
  }

  @Nullable
  private static ZonedDateTime parseLastModified(@Nullable String value)
      throws InvalidDataException {
    if (value == null) {
      return null;
    }
    try {
      return ZonedDateTime.parse(value.trim(), DateTimeFormatter.RFC_1123_DATE_TIME);
    } catch (DateTimeParseException e) {
      throw new InvalidDataException("invalid last modified date header: " + value, e);
    }
  }

  @Nullable
  private static String nonEmpty(@Nullable String value) {
    return value == null || value.isEmpty() ? null : value;
  }
}
