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
import com.google.common.math.LongMath;
import dev.renterd.client.common.exceptions.NotFoundException;
import dev.renterd.client.common.exceptions.TransportException;
import dev.renterd.client.common.exceptions.UnknownLengthException;
import dev.renterd.client.common.logging.LogBuilder;
import dev.renterd.client.common.util.Futures;
import dev.renterd.client.io.BufferedWindow;
import dev.renterd.client.io.ByteRange;
import dev.renterd.client.io.ObjectBody;
import dev.renterd.client.io.RangeNegotiator;
import dev.renterd.client.io.ReadPlan;
import dev.renterd.client.io.StreamState;
import dev.renterd.client.request.ApiRequest;
import dev.renterd.client.request.ApiResponse;
import dev.renterd.client.request.HttpHeaders;
import dev.renterd.client.request.RemoteObjectHandle;
import java.io.EOFException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Objects;
import java.util.OptionalLong;
import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link SeekableInputStream} over an object served by the renterd worker.
 *
 * <p>Bytes come from a single open-ended ranged GET ({@code Range: bytes=position-}) that is kept
 * open for as long as the reader moves forward. The body is pulled on demand, never further than
 * the current read asks for. Seeks are lazy: they only move the position, and
 * the next read decides whether the open body still serves it or a new request is needed. At most
 * one response body is open at any time, and at most {@link
 * StreamConfiguration#getBufferSizeBytes()} bytes are buffered.
 *
 * <p>A read that fails, or whose thread is interrupted, leaves the position where it was and
 * releases the open body; calling it again retries. This class is not thread safe.
 */
public class RemoteSeekableInputStream extends SeekableInputStream {
  private static final Logger LOG = LoggerFactory.getLogger(RemoteSeekableInputStream.class);
  private static final long UNKNOWN_LENGTH = -1;

  /**
   * The object this stream reads.
   *
   * @return the object handle
   */
  @Getter private final RemoteObjectHandle handle;

  private final RequestExecutor requestExecutor;
  private final StreamConfiguration configuration;
  private final RangeNegotiator negotiator;
  private final BufferedWindow window;
  private final byte[] singleByte = new byte[1];

  private byte[] chunk;
  private ObjectBody body;
  private long position;
  private long totalLength;
  private volatile boolean fetching;
  private volatile boolean closed;

  /**
   * Creates a stream positioned at the start of the object. No request is sent until the first
   * read.
   *
   * @param handle the object to read
   * @param requestExecutor executor sending the ranged requests; not closed by this stream
   * @param configuration buffering and range settings
   */
  public RemoteSeekableInputStream(
      @NonNull RemoteObjectHandle handle,
      @NonNull RequestExecutor requestExecutor,
      @NonNull StreamConfiguration configuration) {
    this.handle = handle;
    this.requestExecutor = requestExecutor;
    this.configuration = configuration;
    this.negotiator = new RangeNegotiator(configuration.getRangeFallbackPolicy());
    this.window = new BufferedWindow(configuration.getBufferSizeBytes());
    this.totalLength = handle.getLength().orElse(UNKNOWN_LENGTH);
  }

  @Override
  public int read() throws IOException {
    int count = read(singleByte, 0, 1);
    return count < 0 ? -1 : singleByte[0] & 0xFF;
  }

  /**
   * Reads up to {@code len} bytes. Blocks until {@code len} bytes were read or the object ended,
   * so fewer bytes are only returned at the end of the object.
   *
   * @param b the buffer into which the data is read
   * @param off the start offset in the buffer
   * @param len the maximum number of bytes to read
   * @return the number of bytes read, or -1 if the position is at the end of the object
   * @throws NotFoundException if the object does not exist
   * @throws InterruptedIOException if the thread was interrupted; the position is unchanged
   * @throws IOException if the stream is closed or the read fails
   */
  @Override
  public int read(byte @NonNull [] b, int off, int len) throws IOException {
    ensureOpen();
    Objects.checkFromIndexSize(off, len, b.length);
    if (len == 0) {
      return 0;
    }

    int count = readAt(position, b, off, len, false);
    if (count == 0) {
      clampPosition();
      return -1;
    }
    position += count;
    window.dropBefore(position);
    return count;
  }

  /**
   * Moves to an absolute position. Positions past the known end of the object are clamped to it.
   * No request is sent.
   *
   * @param pos the new position
   * @throws IllegalArgumentException if {@code pos} is negative
   * @throws IOException if the stream is closed
   */
  @Override
  public void seek(long pos) throws IOException {
    seek(pos, SeekOrigin.FROM_START);
  }

  /**
   * Moves to a position relative to the start, the current position or the end of the object.
   * Positions past the known end are clamped to it. Only {@link SeekOrigin#FROM_END} on an object
   * of unknown length sends a request, to learn the length.
   *
   * @param offset offset from the origin
   * @param origin reference point of the offset
   * @throws IllegalArgumentException if the resulting position is negative
   * @throws UnknownLengthException if the length is needed and the server does not report it
   * @throws IOException if the stream is closed or the length request fails
   */
  public void seek(long offset, @NonNull SeekOrigin origin) throws IOException {
    ensureOpen();
    long target;
    switch (origin) {
      case FROM_CURRENT:
        target = LongMath.saturatedAdd(position, offset);
        break;
      case FROM_END:
        target = LongMath.saturatedAdd(resolveLength(), offset);
        break;
      default:
        target = offset;
        break;
    }
    Preconditions.checkArgument(target >= 0, "position must be non-negative, got %s", target);

    if (totalLength != UNKNOWN_LENGTH) {
      target = Math.min(target, totalLength);
    }
    // bytes already consumed are never served again
    window.dropBefore(position);
    position = target;
  }

  @Override
  public long getPos() {
    return position;
  }

  /**
   * Moves forward by up to {@code n} bytes without reading them. No request is sent.
   *
   * @param n the number of bytes to skip
   * @return the distance moved; less than {@code n} only at the known end of the object
   * @throws IOException if the stream is closed
   */
  @Override
  public long skip(long n) throws IOException {
    ensureOpen();
    if (n <= 0) {
      return 0;
    }
    long target = LongMath.saturatedAdd(position, n);
    if (totalLength != UNKNOWN_LENGTH) {
      target = Math.max(position, Math.min(target, totalLength));
    }
    long moved = target - position;
    position = target;
    window.dropBefore(position);
    return moved;
  }

  /**
   * Number of bytes buffered at the current position, which a read returns without blocking.
   *
   * @return the number of buffered bytes
   * @throws IOException if the stream is closed
   */
  @Override
  public int available() throws IOException {
    ensureOpen();
    if (!window.contains(position)) {
      return 0;
    }
    return (int) Math.min(window.getEnd() - position, Integer.MAX_VALUE);
  }

  @Override
  public void readFully(long position, byte @NonNull [] buf, int off, int len) throws IOException {
    ensureOpen();
    Preconditions.checkArgument(position >= 0, "position must be non-negative, got %s", position);
    Objects.checkFromIndexSize(off, len, buf.length);
    if (len == 0) {
      return;
    }
    if (totalLength != UNKNOWN_LENGTH && position > totalLength - len) {
      throw eof(position, len);
    }

    int count = readAt(position, buf, off, len, true);
    if (count < len) {
      throw eof(position, len);
    }
  }

  @Override
  public int readTail(byte @NonNull [] buf, int off, int n) throws IOException {
    ensureOpen();
    Objects.checkFromIndexSize(off, n, buf.length);
    long length = resolveLength();
    if (n > length) {
      throw new EOFException(
          String.format("Cannot read the last %d bytes of %s, its length is %d", n, path(), length));
    }
    readFully(length - n, buf, off, n);
    return n;
  }

  /**
   * Length of the object, if a response or the handle reported it. Never sends a request.
   *
   * @return the length, or empty while unknown
   */
  public OptionalLong length() {
    return totalLength == UNKNOWN_LENGTH ? OptionalLong.empty() : OptionalLong.of(totalLength);
  }

  /**
   * Current lifecycle state.
   *
   * @return the state
   */
  public StreamState getState() {
    if (closed) {
      return StreamState.CLOSED;
    }
    if (fetching) {
      return StreamState.FETCHING;
    }
    if (totalLength != UNKNOWN_LENGTH && position >= totalLength) {
      return StreamState.EXHAUSTED;
    }
    return body != null ? StreamState.STREAMING : StreamState.IDLE;
  }

  /**
   * Releases the open response body and the buffered bytes. Closing again has no effect.
   *
   * @throws IOException never; declared by {@link java.io.Closeable}
   */
  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    releaseBody();
    window.discard();
    chunk = null;
    super.close();
  }

  /**
   * Fills {@code b} with the object bytes starting at {@code start}, without moving the position.
   * Stops early only at the end of the object. A failure releases the open body.
   */
  private int readAt(long start, byte[] b, int off, int len, boolean bounded)
      throws IOException {
    long cursor = start;
    int delivered = 0;
    try {
      while (delivered < len) {
        ReadPlan plan =
            negotiator.plan(cursor, len - delivered, window, body != null, length(), bounded);
        switch (plan.getKind()) {
          case SERVE:
            int count = window.copy(cursor, b, off + delivered, plan.getLength());
            cursor += count;
            delivered += count;
            break;
          case PULL:
            pull(len - delivered);
            break;
          case FETCH:
            fetch(plan.getRange());
            break;
          case END_OF_OBJECT:
            releaseBody();
            return delivered;
          default:
            return delivered;
        }
      }
      return delivered;
    } catch (IOException | RuntimeException e) {
      releaseBody();
      throw e;
    }
  }

  /** Pulls up to {@code wanted} bytes from the open body into the window. */
  private void pull(int wanted) throws IOException {
    if (Thread.currentThread().isInterrupted()) {
      throw new InterruptedIOException("Interrupted while reading " + path());
    }
    if (window.remainingCapacity() == 0) {
      window.dropBefore(window.getEnd());
    }
    byte[] buffer = chunk();
    int count =
        body.read(
            buffer, 0, Math.min(wanted, Math.min(buffer.length, window.remainingCapacity())));
    if (count < 0) {
      ObjectBody ended = body;
      releaseBody();
      learnLengthFrom(ended);
      return;
    }
    window.push(buffer, 0, count);
  }

  private void fetch(ByteRange range) throws IOException {
    releaseBody();
    LogBuilder log =
        LogBuilder.start(LOG, "stream.fetch")
            .withParam("path", path())
            .withParam("range", range.toHttpString());
    log.logStart();
    fetching = true;
    try {
      ApiResponse response =
          Futures.await(requestExecutor.execute(rangeRequest(range)), ApiResponse::abort);
      RangeNegotiator.RangeAnswer answer =
          negotiator.interpret(response, range, length(), path());
      if (answer.getTotalLength().isPresent()) {
        totalLength = answer.getTotalLength().getAsLong();
      }
      if (answer.isEndOfObject()) {
        log.withParam("length", totalLength).logEnd();
        return;
      }

      ObjectBody next = answer.getBody();
      if (!skipTo(next, range.getStart())) {
        return;
      }
      window.reset(range.getStart());
      body = next;
      log.withParam("status", response.getStatusCode()).logEnd();
    } catch (IOException | RuntimeException e) {
      log.logFailure(e);
      throw e;
    } finally {
      fetching = false;
    }
  }

  /** Drops the bytes a full-object body sends before {@code start}; false if it ends first. */
  private boolean skipTo(ObjectBody next, long start) throws IOException {
    try {
      if (next.skipTo(start, chunk())) {
        return true;
      }
    } catch (IOException | RuntimeException e) {
      next.release();
      throw e;
    }
    next.release();
    learnLengthFrom(next);
    return false;
  }

  /** A body running to the end of the object proves its length when it ends. */
  private void learnLengthFrom(ObjectBody ended) throws TransportException {
    if (!ended.isToEndOfObject()) {
      return;
    }
    if (totalLength == UNKNOWN_LENGTH) {
      totalLength = ended.getOffset();
    } else if (ended.getOffset() < totalLength && !ended.getExpectedEnd().isPresent()) {
      throw new TransportException(
          String.format(
              "Body of %s ended at offset %d, the object has %d bytes",
              path(), ended.getOffset(), totalLength));
    }
  }

  private long resolveLength() throws IOException {
    if (totalLength != UNKNOWN_LENGTH) {
      return totalLength;
    }
    releaseBody();
    LogBuilder log = LogBuilder.start(LOG, "stream.probe").withParam("path", path());
    log.logStart();
    fetching = true;
    try {
      ApiResponse response =
          Futures.await(
              requestExecutor.execute(rangeRequest(RangeNegotiator.PROBE_RANGE)),
              ApiResponse::abort);
      totalLength = negotiator.resolveLength(response, path());
      log.withParam("length", totalLength).logEnd();
      return totalLength;
    } catch (IOException | RuntimeException e) {
      log.logFailure(e);
      throw e;
    } finally {
      fetching = false;
    }
  }

  private ApiRequest rangeRequest(ByteRange range) {
    return WorkerObjects.getRequest(handle).header(HttpHeaders.RANGE, range.toHttpString()).build();
  }

  private byte[] chunk() {
    if (chunk == null) {
      chunk = new byte[configuration.getReadChunkSizeBytes()];
    }
    return chunk;
  }

  private void releaseBody() {
    if (body != null) {
      body.release();
      body = null;
    }
  }

  private void clampPosition() {
    if (totalLength != UNKNOWN_LENGTH && position > totalLength) {
      position = totalLength;
    }
  }

  private EOFException eof(long position, int len) {
    return new EOFException(
        String.format(
            "Reached the end of %s before reading %d bytes at position %d", path(), len, position));
  }

  private String path() {
    return handle.getPath();
  }

  private void ensureOpen() throws IOException {
    if (closed) {
      throw new IOException("Stream is closed");
    }
  }
}
