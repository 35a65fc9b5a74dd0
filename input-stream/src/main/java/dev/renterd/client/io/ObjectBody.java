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
package dev.renterd.client.io;

import dev.renterd.client.common.exceptions.TransportException;
import dev.renterd.client.request.ApiResponse;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.util.OptionalLong;
import lombok.Getter;
import lombok.NonNull;

/**
 * The live body of a ranged response, positioned at an object offset. Tracks where the next byte
 * comes from and where the server promised the body would end, so a body that stops early is
 * reported instead of being mistaken for the end of the object.
 */
public class ObjectBody {
  private final ApiResponse response;
  private final String path;
  private final long expectedEnd;

  /**
   * Whether the body runs to the end of the object, so that its last byte proves the object
   * length.
   *
   * @return true for the answer to an open-ended request
   */
  @Getter private final boolean toEndOfObject;

  /**
   * Object offset of the next byte the body delivers.
   *
   * @return the offset
   */
  @Getter private long offset;

  /**
   * Whether the body delivered its last byte.
   *
   * @return true once the body reached its end
   */
  @Getter private boolean finished;

  private boolean released;

  /**
   * Creates an {@link ObjectBody}.
   *
   * @param response response whose body delivers the bytes
   * @param path object path, for messages
   * @param offset object offset of the first byte of the body
   * @param expectedEnd offset after the last byte the server promised, or -1 when unknown
   * @param toEndOfObject whether the body runs to the end of the object
   */
  public ObjectBody(
      @NonNull ApiResponse response,
      @NonNull String path,
      long offset,
      long expectedEnd,
      boolean toEndOfObject) {
    this.response = response;
    this.path = path;
    this.offset = offset;
    this.expectedEnd = expectedEnd;
    this.toEndOfObject = toEndOfObject;
  }

  /**
   * Offset after the last byte the server promised.
   *
   * @return the end offset, or empty when the server did not say
   */
  public OptionalLong getExpectedEnd() {
    return expectedEnd < 0 ? OptionalLong.empty() : OptionalLong.of(expectedEnd);
  }

  /**
   * Reads the next bytes of the body. Blocks until at least one byte is available or the body
   * ends. A body that ends before its promised end fails.
   *
   * @param dst destination array
   * @param off offset in the destination array
   * @param len maximum number of bytes to read
   * @return number of bytes read, or -1 once the body ended
   * @throws TransportException if the connection fails or the body ends early
   * @throws InterruptedIOException if the reading thread is interrupted
   */
  public int read(byte[] dst, int off, int len) throws IOException {
    if (finished) {
      return -1;
    }
    int limit = len;
    if (expectedEnd >= 0) {
      limit = (int) Math.min(len, expectedEnd - offset);
      if (limit == 0) {
        finished = true;
        return -1;
      }
    }
    int count;
    try {
      count = response.getBody().read(dst, off, limit);
    } catch (SocketTimeoutException e) {
      throw new TransportException("Timed out reading " + path + " at offset " + offset, e);
    } catch (InterruptedIOException e) {
      throw e;
    } catch (IOException e) {
      throw new TransportException("Failed reading " + path + " at offset " + offset, e);
    }
    if (count < 0) {
      finished = true;
      if (expectedEnd >= 0 && offset < expectedEnd) {
        throw new TransportException(
            String.format(
                "Body of %s ended at offset %d, expected %d bytes more",
                path, offset, expectedEnd - offset));
      }
      return -1;
    }
    offset += count;
    return count;
  }

  /**
   * Reads and drops bytes until the body is positioned at {@code position} or ends.
   *
   * @param position target offset
   * @param scratch buffer receiving the dropped bytes
   * @return true if the body reached the position, false if it ended first
   * @throws IOException if reading fails
   */
  public boolean skipTo(long position, byte @NonNull [] scratch) throws IOException {
    while (offset < position) {
      int count = read(scratch, 0, (int) Math.min(scratch.length, position - offset));
      if (count < 0) {
        return false;
      }
    }
    return true;
  }

  /**
   * Releases the connection without draining what remains of the body. Idempotent.
   */
  public void release() {
    if (!released) {
      released = true;
      response.abort();
    }
  }
}
