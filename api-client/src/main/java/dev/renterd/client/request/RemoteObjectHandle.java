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

import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.OptionalLong;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A downloadable object as announced by the worker: its path, and what the server said about its
 * length, type and range support. Immutable.
 */
@Value
@Builder
public class RemoteObjectHandle {
  @NonNull String path;
  @Nullable String bucket;
  @Nullable Long length;
  @Nullable String contentType;
  @Nullable String etag;
  @Nullable ZonedDateTime lastModified;
  boolean seekable;

  /**
   * Bucket holding the object.
   *
   * @return the bucket, or empty for the default bucket
   */
  public Optional<String> getBucket() {
    return Optional.ofNullable(bucket);
  }

  /**
   * Declared total length.
   *
   * @return the length, or empty when undeclared
   */
  public OptionalLong getLength() {
    return length == null ? OptionalLong.empty() : OptionalLong.of(length);
  }

  /**
   * Declared content type.
   *
   * @return the content type, or empty
   */
  public Optional<String> getContentType() {
    return Optional.ofNullable(contentType);
  }

  /**
   * Entity tag.
   *
   * @return the ETag, or empty
   */
  public Optional<String> getEtag() {
    return Optional.ofNullable(etag);
  }

  /**
   * Last modification time.
   *
   * @return the time, or empty
   */
  public Optional<ZonedDateTime> getLastModified() {
    return Optional.ofNullable(lastModified);
  }
}
