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
import lombok.NonNull;

/**
 * Bytes pulled from a response body and not yet given up, covering the object span {@code [start,
 * end)}. The window never holds more than its capacity; once full, {@link #push} accepts nothing
 * until bytes are dropped, which is what stops the reader from pulling a body faster than it is
 * consumed.
 *
 * <p>Bytes before the read position are dropped lazily: {@link #copy} leaves them in place, and
 * {@link #dropBefore} releases them once a read commits.
 */
public class BufferedWindow {
  private final int capacity;
  private byte[] buffer;
  private int head;
  private long start;
  private long end;
  private boolean valid;

  /**
   * Creates an invalid, empty window.
   *
   * @param capacity maximum number of buffered bytes
   */
  public BufferedWindow(int capacity) {
    Preconditions.checkArgument(capacity > 0, "`capacity` must be positive");
    this.capacity = capacity;
  }

  /**
   * Whether the window is anchored at an object offset. A discarded window is not.
   *
   * @return true if the window is valid
   */
  public boolean isValid() {
    return valid;
  }

  /**
   * Offset of the first buffered byte.
   *
   * @return the start offset
   */
  public long getStart() {
    return start;
  }

  /**
   * Offset after the last buffered byte.
   *
   * @return the exclusive end offset
   */
  public long getEnd() {
    return end;
  }

  /**
   * Number of buffered bytes.
   *
   * @return the size
   */
  public int size() {
    return (int) (end - start);
  }

  /**
   * Whether no bytes are buffered.
   *
   * @return true if empty
   */
  public boolean isEmpty() {
    return end == start;
  }

  /**
   * Number of bytes {@link #push} would accept.
   *
   * @return the remaining capacity
   */
  public int remainingCapacity() {
    return capacity - size();
  }

  /**
   * Whether the byte at {@code position} is buffered.
   *
   * @param position object offset
   * @return true if {@code start <= position < end}
   */
  public boolean contains(long position) {
    return valid && position >= start && position < end;
  }

  /**
   * Empties the window and anchors it at {@code start}.
   *
   * @param start object offset of the next pushed byte
   */
  public void reset(long start) {
    Preconditions.checkArgument(start >= 0, "`start` must not be negative");
    this.head = 0;
    this.start = start;
    this.end = start;
    this.valid = true;
  }

  /** Empties the window and releases its memory. */
  public void discard() {
    this.buffer = null;
    this.head = 0;
    this.start = 0;
    this.end = 0;
    this.valid = false;
  }

  /**
   * Appends bytes at the tail.
   *
   * @param src source array
   * @param off offset in the source array
   * @param len number of bytes offered
   * @return number of bytes accepted, at most {@link #remainingCapacity()}
   */
  public int push(byte @NonNull [] src, int off, int len) {
    Preconditions.checkState(valid, "window is not anchored");
    Preconditions.checkPositionIndexes(off, off + len, src.length);
    int accepted = Math.min(len, remainingCapacity());
    if (accepted == 0) {
      return 0;
    }
    if (buffer == null) {
      buffer = new byte[capacity];
    }
    int size = size();
    if (head + size + accepted > capacity) {
      System.arraycopy(buffer, head, buffer, 0, size);
      head = 0;
    }
    System.arraycopy(src, off, buffer, head + size, accepted);
    end += accepted;
    return accepted;
  }

  /**
   * Copies buffered bytes starting at {@code position} without releasing them.
   *
   * @param position object offset of the first byte to copy; {@code start <= position <= end}
   * @param dst destination array
   * @param off offset in the destination array
   * @param n maximum number of bytes to copy
   * @return number of bytes copied
   */
  public int copy(long position, byte @NonNull [] dst, int off, int n) {
    Preconditions.checkState(valid, "window is not anchored");
    Preconditions.checkArgument(
        position >= start && position <= end,
        "position %s is outside of the window [%s, %s)",
        position,
        start,
        end);
    Preconditions.checkPositionIndexes(off, off + n, dst.length);
    int count = (int) Math.min(n, end - position);
    if (count > 0) {
      System.arraycopy(buffer, head + (int) (position - start), dst, off, count);
    }
    return count;
  }

  /**
   * Releases the buffered bytes before {@code position}. Positions before the start are a no-op.
   *
   * @param position object offset
   */
  public void dropBefore(long position) {
    if (!valid || position <= start) {
      return;
    }
    long dropped = Math.min(position, end) - start;
    head += (int) dropped;
    start += dropped;
    if (isEmpty()) {
      head = 0;
    }
  }

  @Override
  public String toString() {
    return valid ? "BufferedWindow[" + start + ", " + end + ")" : "BufferedWindow[discarded]";
  }
}
