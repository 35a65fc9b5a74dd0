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

import dev.renterd.client.common.exceptions.ProtocolViolationException;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.EqualsAndHashCode;
import lombok.NonNull;

/**
 * A parsed {@code Content-Range} response header. Either a satisfied range {@code bytes
 * first-last/total}, where the total may be {@code *}, or the unsatisfied form {@code bytes
 * *&#47;total} sent with status 416.
 */
@EqualsAndHashCode
public final class ContentRange {
  private static final Pattern SATISFIED =
      Pattern.compile("bytes\\s+(\\d+)-(\\d+)/(\\d+|\\*)", Pattern.CASE_INSENSITIVE);
  private static final Pattern UNSATISFIED =
      Pattern.compile("bytes\\s+\\*/(\\d+)", Pattern.CASE_INSENSITIVE);
  private static final long UNKNOWN = -1;

  private final long first;
  private final long last;
  private final long total;

  private ContentRange(long first, long last, long total) {
    this.first = first;
    this.last = last;
    this.total = total;
  }

  /**
   * Parses a header value.
   *
   * @param value the header value
   * @return the parsed range
   * @throws ProtocolViolationException if the value is malformed or inconsistent
   */
  public static ContentRange parse(@NonNull String value) throws ProtocolViolationException {
    String trimmed = value.trim();
    try {
      Matcher satisfied = SATISFIED.matcher(trimmed);
      if (satisfied.matches()) {
        long first = Long.parseLong(satisfied.group(1));
        long last = Long.parseLong(satisfied.group(2));
        long total = "*".equals(satisfied.group(3)) ? UNKNOWN : Long.parseLong(satisfied.group(3));
        if (last < first || (total != UNKNOWN && last >= total)) {
          throw new ProtocolViolationException("Inconsistent Content-Range: " + value);
        }
        return new ContentRange(first, last, total);
      }
      Matcher unsatisfied = UNSATISFIED.matcher(trimmed);
      if (unsatisfied.matches()) {
        return new ContentRange(UNKNOWN, UNKNOWN, Long.parseLong(unsatisfied.group(1)));
      }
    } catch (NumberFormatException e) {
      throw new ProtocolViolationException("Malformed Content-Range: " + value, e);
    }
    throw new ProtocolViolationException("Malformed Content-Range: " + value);
  }

  /**
   * Whether this is the {@code bytes *&#47;total} form.
   *
   * @return true for an unsatisfied range
   */
  public boolean isUnsatisfied() {
    return first == UNKNOWN;
  }

  /**
   * Offset of the first byte sent; only meaningful for a satisfied range.
   *
   * @return the first offset
   */
  public long getFirst() {
    return first;
  }

  /**
   * Offset after the last byte sent; only meaningful for a satisfied range.
   *
   * @return the exclusive end offset
   */
  public long getEnd() {
    return last + 1;
  }

  /**
   * Total length of the object.
   *
   * @return the total, or empty when the server sent {@code *}
   */
  public OptionalLong getTotal() {
    return total == UNKNOWN ? OptionalLong.empty() : OptionalLong.of(total);
  }

  @Override
  public String toString() {
    String totalText = total == UNKNOWN ? "*" : Long.toString(total);
    return isUnsatisfied() ? "bytes */" + totalText : "bytes " + first + "-" + last + "/" + totalText;
  }
}
