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
import java.util.OptionalLong;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A range of object bytes, either bounded {@code [start, end)} or open-ended {@code [start, ∞)}.
 */
@EqualsAndHashCode
public final class ByteRange {
  private static final long OPEN_END = -1;

  /**
   * Offset of the first byte.
   *
   * @return the start offset
   */
  @Getter private final long start;

  private final long end;

  private ByteRange(long start, long end) {
    this.start = start;
    this.end = end;
  }

  /**
   * A range from {@code start} to the end of the object.
   *
   * @param start offset of the first byte
   * @return the range
   */
  public static ByteRange from(long start) {
    Preconditions.checkArgument(start >= 0, "`start` must not be negative");
    return new ByteRange(start, OPEN_END);
  }

  /**
   * The non-empty range {@code [start, end)}.
   *
   * @param start offset of the first byte
   * @param end offset after the last byte
   * @return the range
   */
  public static ByteRange of(long start, long end) {
    Preconditions.checkArgument(start >= 0, "`start` must not be negative");
    Preconditions.checkArgument(end > start, "`end` must be greater than `start`");
    return new ByteRange(start, end);
  }

  /**
   * Whether the range runs to the end of the object.
   *
   * @return true when open-ended
   */
  public boolean isOpenEnded() {
    return end == OPEN_END;
  }

  /**
   * Offset after the last byte.
   *
   * @return the exclusive end, or empty when open-ended
   */
  public OptionalLong getEnd() {
    return isOpenEnded() ? OptionalLong.empty() : OptionalLong.of(end);
  }

  /**
   * Renders the range as the value of a {@code Range} request header, where the last offset is
   * inclusive.
   *
   * @return e.g. {@code bytes=500-} or {@code bytes=0-99}
   */
  public String toHttpString() {
    return isOpenEnded() ? "bytes=" + start + "-" : "bytes=" + start + "-" + (end - 1);
  }

  @Override
  public String toString() {
    return isOpenEnded() ? "[" + start + ", ∞)" : "[" + start + ", " + end + ")";
  }
}
