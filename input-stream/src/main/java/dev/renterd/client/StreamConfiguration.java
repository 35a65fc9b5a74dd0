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

import com.google.common.base.Preconditions;
import dev.renterd.client.common.ConnectorConfiguration;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/** Configuration for {@link RemoteSeekableInputStream}. */
@Getter
@Builder
@EqualsAndHashCode
@ToString
public class StreamConfiguration {
  public static final int ONE_KB = 1024;
  public static final int ONE_MB = 1024 * 1024;

  private static final int DEFAULT_BUFFER_SIZE_BYTES = ONE_MB;
  private static final int DEFAULT_READ_CHUNK_SIZE_BYTES = 64 * ONE_KB;
  private static final RangeFallbackPolicy DEFAULT_RANGE_FALLBACK_POLICY =
      RangeFallbackPolicy.DISCARD_UNTIL_POSITION;

  /**
   * Maximum number of bytes buffered ahead of the reader. {@link
   * StreamConfiguration#DEFAULT_BUFFER_SIZE_BYTES} by default.
   */
  @Builder.Default private int bufferSizeBytes = DEFAULT_BUFFER_SIZE_BYTES;

  private static final String BUFFER_SIZE_BYTES_KEY = "buffersizebytes";

  /**
   * Largest single read from the response body. {@link
   * StreamConfiguration#DEFAULT_READ_CHUNK_SIZE_BYTES} by default.
   */
  @Builder.Default private int readChunkSizeBytes = DEFAULT_READ_CHUNK_SIZE_BYTES;

  private static final String READ_CHUNK_SIZE_BYTES_KEY = "readchunksizebytes";

  /**
   * Behaviour when a ranged request gets the whole object back. {@link
   * RangeFallbackPolicy#DISCARD_UNTIL_POSITION} by default.
   */
  @Builder.Default @NonNull
  private RangeFallbackPolicy rangeFallbackPolicy = DEFAULT_RANGE_FALLBACK_POLICY;

  private static final String RANGE_FALLBACK_POLICY_KEY = "rangefallbackpolicy";

  /** Default set of settings for {@link RemoteSeekableInputStream} */
  public static final StreamConfiguration DEFAULT = StreamConfiguration.builder().build();

  /**
   * Constructs {@link StreamConfiguration} from {@link ConnectorConfiguration} object.
   *
   * @param configuration Configuration object to generate StreamConfiguration from
   * @return StreamConfiguration
   */
  public static StreamConfiguration fromConfiguration(@NonNull ConnectorConfiguration configuration) {
    return StreamConfiguration.builder()
        .bufferSizeBytes(configuration.getInt(BUFFER_SIZE_BYTES_KEY, DEFAULT_BUFFER_SIZE_BYTES))
        .readChunkSizeBytes(
            configuration.getInt(READ_CHUNK_SIZE_BYTES_KEY, DEFAULT_READ_CHUNK_SIZE_BYTES))
        .rangeFallbackPolicy(
            configuration.getEnum(RANGE_FALLBACK_POLICY_KEY, DEFAULT_RANGE_FALLBACK_POLICY))
        .build();
  }

  /**
   * Constructs {@link StreamConfiguration}.
   *
   * @param bufferSizeBytes maximum number of buffered bytes
   * @param readChunkSizeBytes largest single read from a response body
   * @param rangeFallbackPolicy behaviour on a full-body answer to a ranged request
   */
  @Builder
  private StreamConfiguration(
      int bufferSizeBytes, int readChunkSizeBytes, @NonNull RangeFallbackPolicy rangeFallbackPolicy) {
    Preconditions.checkArgument(bufferSizeBytes > 0, "`bufferSizeBytes` must be positive");
    Preconditions.checkArgument(readChunkSizeBytes > 0, "`readChunkSizeBytes` must be positive");
    Preconditions.checkArgument(
        readChunkSizeBytes <= bufferSizeBytes,
        "`readChunkSizeBytes` must not be larger than `bufferSizeBytes`");

    this.bufferSizeBytes = bufferSizeBytes;
    this.readChunkSizeBytes = readChunkSizeBytes;
    this.rangeFallbackPolicy = rangeFallbackPolicy;
  }
}
