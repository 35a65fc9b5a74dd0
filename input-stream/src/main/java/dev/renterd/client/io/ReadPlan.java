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
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

/** The next step of a read, as decided by {@link RangeNegotiator#plan}. */
@Getter
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ReadPlan {
  /** Kinds of steps. */
  public enum Kind {
    /** Nothing was asked for. */
    NO_OP,
    /** The position is at or past the end of the object. */
    END_OF_OBJECT,
    /** Serve {@link ReadPlan#getLength()} bytes from the window. */
    SERVE,
    /** Pull more bytes from the open body into the window. */
    PULL,
    /** Release the open body and request {@link ReadPlan#getRange()}. */
    FETCH
  }

  private static final ReadPlan NO_OP = new ReadPlan(Kind.NO_OP, 0, null);
  private static final ReadPlan END_OF_OBJECT = new ReadPlan(Kind.END_OF_OBJECT, 0, null);
  private static final ReadPlan PULL = new ReadPlan(Kind.PULL, 0, null);

  @NonNull private final Kind kind;
  private final int length;
  private final ByteRange range;

  /**
   * A plan that does nothing.
   *
   * @return the plan
   */
  public static ReadPlan noOp() {
    return NO_OP;
  }

  /**
   * A plan that reports the end of the object.
   *
   * @return the plan
   */
  public static ReadPlan endOfObject() {
    return END_OF_OBJECT;
  }

  /**
   * A plan that pulls more bytes from the open body.
   *
   * @return the plan
   */
  public static ReadPlan pull() {
    return PULL;
  }

  /**
   * A plan that serves bytes from the window.
   *
   * @param length number of bytes to serve
   * @return the plan
   */
  public static ReadPlan serve(int length) {
    Preconditions.checkArgument(length > 0, "`length` must be positive");
    return new ReadPlan(Kind.SERVE, length, null);
  }

  /**
   * A plan that requests a new range.
   *
   * @param range range to request
   * @return the plan
   */
  public static ReadPlan fetch(@NonNull ByteRange range) {
    return new ReadPlan(Kind.FETCH, 0, range);
  }

  @Override
  public String toString() {
    switch (kind) {
      case SERVE:
        return "SERVE(" + length + ")";
      case FETCH:
        return "FETCH(" + range.toHttpString() + ")";
      default:
        return kind.name();
    }
  }
}
