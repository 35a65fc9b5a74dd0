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

import java.io.IOException;
import java.io.InputStream;

/**
 * A SeekableInputStream is like a conventional InputStream but equipped with two additional
 * operations: {@link SeekableInputStream#seek(long) seek} and {@link SeekableInputStream#getPos()
 * getPos}. Typically, seekable streams are used for random data access (i.e, data access that is
 * not strictly sequential or requires backwards seeks).
 *
 * <p>Implementations should implement {@link #close()} to release resources.
 */
public abstract class SeekableInputStream extends InputStream {

  /**
   * Seeks (jumps) to a position inside the stream.
   *
   * @param pos The position to jump to in the stream given in bytes (zero-indexed).
   * @throws IOException if the stream is closed
   */
  public abstract void seek(long pos) throws IOException;

  /**
   * Returns the current position in the stream.
   *
   * @return the position in the stream
   */
  public abstract long getPos();

  /**
   * Reads exactly {@code len} bytes starting at {@code position} into a byte array. The stream
   * position is not changed.
   *
   * @param position the position to read from, given in bytes (zero-indexed)
   * @param buf the byte array to read into
   * @param off the offset in the byte array we start reading into
   * @param len the number of bytes to read
   * @throws java.io.EOFException if the object ends before {@code len} bytes were read
   * @throws IOException if the read fails
   */
  public abstract void readFully(long position, byte[] buf, int off, int len) throws IOException;

  /**
   * Reads the last n bytes from the stream into a byte buffer. Blocks until end of stream is
   * reached.
   *
   * @param buf the byte buffer to read into
   * @param off the offset in the byte buffer we start reading into
   * @param n the number of bytes to read; the n-th byte should be the last byte of the stream.
   * @return the number of bytes read
   * @throws IOException if the read fails
   */
  public abstract int readTail(byte[] buf, int off, int n) throws IOException;
}
