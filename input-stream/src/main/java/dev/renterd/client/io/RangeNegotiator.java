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

import com.google.common.base.Preconditions;
import com.google.common.math.LongMath;
import dev.renterd.client.ApiResponses;
import dev.renterd.client.RangeFallbackPolicy;
import dev.renterd.client.common.exceptions.NotSeekableException;
import dev.renterd.client.common.exceptions.ProtocolViolationException;
import dev.renterd.client.common.exceptions.RangeNotSatisfiableException;
import dev.renterd.client.common.exceptions.UnknownLengthException;
import dev.renterd.client.request.ApiResponse;
import dev.renterd.client.request.HttpHeaders;
import java.io.IOException;
import java.util.Optional;
import java.util.OptionalLong;
import javax.annotation.Nullable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides how a read is satisfied: from the buffered window, from the open body, or by a new ranged
 * request. Also interprets the answers to ranged requests: 206 with {@code Content-Range}, 200
 * when the server ignored the range, and 416 for ranges past the end.
 *
 * <p>The negotiator holds no per-stream state; the stream passes its window, body and known length
 * in.
 */
public class RangeNegotiator {
  private static final Logger LOG = LoggerFactory.getLogger(RangeNegotiator.class);

  /** Range of the request that resolves an unknown length. */
  public static final ByteRange PROBE_RANGE = ByteRange.of(0, 1);

  @Getter private final RangeFallbackPolicy fallbackPolicy;

  /**
   * Creates a {@link RangeNegotiator}.
   *
   * @param fallbackPolicy behaviour when a ranged request gets the whole object
   */
  public RangeNegotiator(@NonNull RangeFallbackPolicy fallbackPolicy) {
    this.fallbackPolicy = fallbackPolicy;
  }

  /**
   * Plans the next step of a read.
   *
   * <p>Buffered bytes win whenever the window holds the byte at {@code position}, however few
   * follow it. An open body is pulled further when the window ends exactly at {@code position}.
   * Anything else, including a seek behind the window or past its buffered tail, needs a new
   * request starting at {@code position}.
   *
   * @param position object offset of the next byte
   * @param requestedLen number of bytes the caller still wants
   * @param window buffered bytes
   * @param bodyLive whether the body feeding the window is still open
   * @param totalLength object length, if known
   * @param bounded whether a new request should be limited to {@code requestedLen} bytes
   * @return the plan
   */
  public ReadPlan plan(
      long position,
      int requestedLen,
      @NonNull BufferedWindow window,
      boolean bodyLive,
      @NonNull OptionalLong totalLength,
      boolean bounded) {
    Preconditions.checkArgument(position >= 0, "`position` must not be negative");
    Preconditions.checkArgument(requestedLen >= 0, "`requestedLen` must not be negative");

    if (requestedLen == 0) {
      return ReadPlan.noOp();
    }
    if (totalLength.isPresent() && position >= totalLength.getAsLong()) {
      return ReadPlan.endOfObject();
    }
    if (window.contains(position)) {
      return ReadPlan.serve((int) Math.min(requestedLen, window.getEnd() - position));
    }
    if (bodyLive && window.isValid() && window.getEnd() == position) {
      return ReadPlan.pull();
    }
    if (!bounded) {
      return ReadPlan.fetch(ByteRange.from(position));
    }
    long end = LongMath.saturatedAdd(position, requestedLen);
    if (totalLength.isPresent()) {
      end = Math.min(end, totalLength.getAsLong());
    }
    return ReadPlan.fetch(ByteRange.of(position, end));
  }

  /**
   * Interprets the response to a ranged request. On failure the response is released.
   *
   * @param response the response
   * @param requested the range that was asked for
   * @param totalLength object length known before the request, if any
   * @param path object path, for messages
   * @return the body to read from, or the end of the object
   * @throws ProtocolViolationException if the range headers are missing, malformed or contradict
   *     the request or the known length
   * @throws NotSeekableException if the server ignored the range and the fallback policy is {@link
   *     RangeFallbackPolicy#FAIL}
   * @throws RangeNotSatisfiableException if the server refused a range before the end of the object
   * @throws IOException for any other error status
   */
  public RangeAnswer interpret(
      @NonNull ApiResponse response,
      @NonNull ByteRange requested,
      @NonNull OptionalLong totalLength,
      @NonNull String path)
      throws IOException {
    try {
      switch (response.getStatusCode()) {
        case 206:
          return interpretPartial(response, requested, totalLength, path);
        case 200:
          return interpretFull(response, requested, totalLength, path);
        case 416:
          response.abort();
          return interpretUnsatisfiable(response, requested, totalLength, path);
        default:
          ApiResponses.checkStatus(response, path);
          throw new ProtocolViolationException(
              String.format(
                  "Unexpected status %d for %s of %s",
                  response.getStatusCode(), requested.toHttpString(), path));
      }
    } catch (IOException | RuntimeException e) {
      response.abort();
      throw e;
    }
  }

  /**
   * Reads the object length from the response to a {@link #PROBE_RANGE} request, then releases
   * the response.
   *
   * @param response the response
   * @param path object path, for messages
   * @return the object length
   * @throws UnknownLengthException if the response does not carry the length
   * @throws IOException for error statuses or malformed headers
   */
  public long resolveLength(@NonNull ApiResponse response, @NonNull String path)
      throws IOException {
    try {
      switch (response.getStatusCode()) {
        case 206:
          return contentRange(response, path)
              .getTotal()
              .orElseThrow(() -> new UnknownLengthException(path));
        case 200:
          return contentLength(response, path).orElseThrow(() -> new UnknownLengthException(path));
        case 416:
          Optional<String> header = response.header(HttpHeaders.CONTENT_RANGE);
          if (header.isPresent()) {
            ContentRange range = ContentRange.parse(header.get());
            if (range.isUnsatisfied()) {
              return range.getTotal().getAsLong();
            }
          }
          throw new UnknownLengthException(path);
        default:
          ApiResponses.checkStatus(response, path);
          throw new UnknownLengthException(path);
      }
    } finally {
      response.abort();
    }
  }

  private RangeAnswer interpretPartial(
      ApiResponse response, ByteRange requested, OptionalLong totalLength, String path)
      throws ProtocolViolationException {
    ContentRange range = contentRange(response, path);
    if (range.isUnsatisfied()) {
      throw new ProtocolViolationException(
          "Unsatisfied Content-Range `" + range + "` on a 206 response for " + path);
    }
    if (range.getFirst() != requested.getStart()) {
      throw new ProtocolViolationException(
          String.format(
              "Asked for %s of %s, server sent `%s`", requested.toHttpString(), path, range));
    }
    if (requested.getEnd().isPresent() && range.getEnd() > requested.getEnd().getAsLong()) {
      throw new ProtocolViolationException(
          String.format(
              "Asked for %s of %s, server sent more: `%s`", requested.toHttpString(), path, range));
    }
    OptionalLong total = merge(totalLength, range.getTotal(), path);
    boolean toEndOfObject =
        requested.isOpenEnded() && (!total.isPresent() || range.getEnd() == total.getAsLong());
    return RangeAnswer.body(
        new ObjectBody(response, path, range.getFirst(), range.getEnd(), toEndOfObject), total);
  }

  private RangeAnswer interpretFull(
      ApiResponse response, ByteRange requested, OptionalLong totalLength, String path)
      throws IOException {
    OptionalLong declared = contentLength(response, path);
    OptionalLong total = merge(totalLength, declared, path);
    if (requested.getStart() > 0) {
      if (fallbackPolicy == RangeFallbackPolicy.FAIL) {
        throw new NotSeekableException(path);
      }
      LOG.debug(
          "Server ignored {} for {}, dropping body bytes up to the position",
          requested.toHttpString(),
          path);
    }
    return RangeAnswer.body(
        new ObjectBody(
            response, path, 0, declared.isPresent() ? declared.getAsLong() : -1, true),
        total);
  }

  private static RangeAnswer interpretUnsatisfiable(
      ApiResponse response, ByteRange requested, OptionalLong totalLength, String path)
      throws ProtocolViolationException, RangeNotSatisfiableException {
    OptionalLong total = totalLength;
    Optional<String> header = response.header(HttpHeaders.CONTENT_RANGE);
    if (header.isPresent()) {
      ContentRange range = ContentRange.parse(header.get());
      if (!range.isUnsatisfied()) {
        throw new ProtocolViolationException(
            "Satisfied Content-Range `" + range + "` on a 416 response for " + path);
      }
      total = merge(totalLength, range.getTotal(), path);
    }
    if (total.isPresent() && requested.getStart() >= total.getAsLong()) {
      return RangeAnswer.endOfObject(total.getAsLong());
    }
    throw new RangeNotSatisfiableException(path, requested.getStart());
  }

  private static ContentRange contentRange(ApiResponse response, String path)
      throws ProtocolViolationException {
    String header =
        response
            .header(HttpHeaders.CONTENT_RANGE)
            .orElseThrow(
                () ->
                    new ProtocolViolationException(
                        "Missing Content-Range on a 206 response for " + path));
    return ContentRange.parse(header);
  }

  private static OptionalLong contentLength(ApiResponse response, String path)
      throws ProtocolViolationException {
    Optional<String> header = response.header(HttpHeaders.CONTENT_LENGTH);
    if (!header.isPresent()) {
      return OptionalLong.empty();
    }
    try {
      long length = Long.parseLong(header.get().trim());
      if (length >= 0) {
        return OptionalLong.of(length);
      }
    } catch (NumberFormatException e) {
      throw new ProtocolViolationException(
          "Malformed Content-Length `" + header.get() + "` for " + path, e);
    }
    throw new ProtocolViolationException(
        "Malformed Content-Length `" + header.get() + "` for " + path);
  }

  private static OptionalLong merge(OptionalLong known, OptionalLong reported, String path)
      throws ProtocolViolationException {
    if (known.isPresent()
        && reported.isPresent()
        && known.getAsLong() != reported.getAsLong()) {
      throw new ProtocolViolationException(
          String.format(
              "Length of %s changed from %d to %d", path, known.getAsLong(), reported.getAsLong()));
    }
    return reported.isPresent() ? reported : known;
  }

  /** Outcome of a ranged request: a body to read, or the end of the object. */
  @Getter
  @AllArgsConstructor(access = AccessLevel.PRIVATE)
  public static final class RangeAnswer {
    @Nullable private final ObjectBody body;
    @NonNull private final OptionalLong totalLength;

    static RangeAnswer body(ObjectBody body, OptionalLong totalLength) {
      return new RangeAnswer(body, totalLength);
    }

    static RangeAnswer endOfObject(long totalLength) {
      return new RangeAnswer(null, OptionalLong.of(totalLength));
    }

    /**
     * Whether the requested range starts at or past the end of the object.
     *
     * @return true if there is nothing to read
     */
    public boolean isEndOfObject() {
      return body == null;
    }
  }
}
