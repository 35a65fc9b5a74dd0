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
import dev.renterd.client.common.exceptions.NotSeekableException;
import dev.renterd.client.request.RemoteObjectHandle;
import java.io.IOException;
import lombok.Getter;
import lombok.NonNull;

/**
 * Initialises resources to prepare for reading from renterd. Resources initialised in this class
 * are shared across instances of {@link RemoteSeekableInputStream}. For example, this factory
 * holds the request executor that every stream it creates sends its ranged requests through.
 */
@Getter
public class SeekableStreamFactory {
  @NonNull private final RequestExecutor requestExecutor;
  @NonNull private final StreamConfiguration configuration;

  /**
   * Given a request executor, creates a new instance of {@link SeekableStreamFactory}.
   *
   * @param requestExecutor executor shared by the created streams
   * @param configuration {@link RemoteSeekableInputStream} configuration
   */
  public SeekableStreamFactory(
      @NonNull RequestExecutor requestExecutor, @NonNull StreamConfiguration configuration) {
    this.requestExecutor = requestExecutor;
    this.configuration = configuration;
  }

  /**
   * Create an instance of {@link RemoteSeekableInputStream} positioned at the start of the object.
   *
   * @param handle the object to read, as returned by {@link WorkerObjects#download}
   * @return An instance of the input stream.
   * @throws NotSeekableException if the object does not support ranges and the configuration
   *     requires them
   */
  public RemoteSeekableInputStream createStream(@NonNull RemoteObjectHandle handle)
      throws IOException {
    return createStream(handle, 0);
  }

  /**
   * Create an instance of {@link RemoteSeekableInputStream} positioned at {@code initialOffset}.
   * No request is sent until the first read.
   *
   * @param handle the object to read, as returned by {@link WorkerObjects#download}
   * @param initialOffset starting position; clamped to the object length when it is known
   * @return An instance of the input stream.
   * @throws NotSeekableException if the object does not support ranges and the configuration
   *     requires them
   */
  public RemoteSeekableInputStream createStream(
      @NonNull RemoteObjectHandle handle, long initialOffset) throws IOException {
    Preconditions.checkArgument(initialOffset >= 0, "`initialOffset` must not be negative");
    if (configuration.getRangeFallbackPolicy() == RangeFallbackPolicy.FAIL
        && !handle.isSeekable()
        && handle.getLength().orElse(-1) != 0) {
      throw new NotSeekableException(handle.getPath());
    }

    RemoteSeekableInputStream stream =
        new RemoteSeekableInputStream(handle, requestExecutor, configuration);
    if (initialOffset > 0) {
      stream.seek(initialOffset);
    }
    return stream;
  }
}
