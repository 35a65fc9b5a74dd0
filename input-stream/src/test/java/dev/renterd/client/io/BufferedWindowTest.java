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

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import org.junit.jupiter.api.Test;

public class BufferedWindowTest {
  private static final byte[] BYTES = {0, 1, 2, 3, 4, 5, 6, 7, 8, 9};

  @Test
  void testNewWindowIsInvalid() {
    BufferedWindow window = new BufferedWindow(8);

    assertFalse(window.isValid());
    assertEquals(8, window.remainingCapacity());
    assertTrue(window.isEmpty());
    assertFalse(window.contains(0));
    assertThrows(IllegalStateException.class, () -> window.push(BYTES, 0, 1));
    assertThrows(IllegalArgumentException.class, () -> new BufferedWindow(0));
  }

  @Test
  void testPushAndCopy() {
    BufferedWindow window = new BufferedWindow(8);
    window.reset(100);

    assertEquals(4, window.push(BYTES, 0, 4));
    assertEquals(100, window.getStart());
    assertEquals(104, window.getEnd());
    assertTrue(window.contains(103));
    assertFalse(window.contains(104));

    byte[] dst = new byte[10];
    assertEquals(2, window.copy(102, dst, 0, 5));
    assertArrayEquals(new byte[] {2, 3}, Arrays.copyOf(dst, 2));
    assertEquals(4, window.size());
    assertEquals(0, window.copy(104, dst, 0, 5));
  }

  @Test
  void testPushStopsAtCapacity() {
    BufferedWindow window = new BufferedWindow(8);
    window.reset(0);

    assertEquals(8, window.push(BYTES, 0, 10));
    assertEquals(0, window.remainingCapacity());
    assertEquals(0, window.push(BYTES, 8, 2));
    assertEquals(8, window.getEnd());
  }

  @Test
  void testDropBeforeMakesRoom() {
    BufferedWindow window = new BufferedWindow(8);
    window.reset(0);
    window.push(BYTES, 0, 8);

    window.dropBefore(6);
    assertEquals(6, window.getStart());
    assertEquals(6, window.remainingCapacity());

    assertEquals(2, window.push(BYTES, 8, 2));
    byte[] dst = new byte[4];
    assertEquals(4, window.copy(6, dst, 0, 4));
    assertArrayEquals(new byte[] {6, 7, 8, 9}, dst);
  }

  @Test
  void testDropBeforeOutsideWindow() {
    BufferedWindow window = new BufferedWindow(8);
    window.reset(10);
    window.push(BYTES, 0, 4);

    window.dropBefore(5);
    assertEquals(10, window.getStart());

    window.dropBefore(100);
    assertTrue(window.isEmpty());
    assertEquals(14, window.getStart());
    assertTrue(window.isValid());
  }

  @Test
  void testCopyLeavesBytesUntilDropped() {
    BufferedWindow window = new BufferedWindow(8);
    window.reset(0);
    window.push(BYTES, 0, 6);

    byte[] dst = new byte[3];
    assertEquals(3, window.copy(2, dst, 0, 3));
    assertArrayEquals(new byte[] {2, 3, 4}, dst);
    assertEquals(0, window.getStart());
    assertEquals(6, window.size());

    window.dropBefore(5);
    assertEquals(5, window.getStart());
    assertEquals(1, window.size());
  }

  @Test
  void testCopyOutsideWindowFails() {
    BufferedWindow window = new BufferedWindow(8);
    window.reset(10);
    window.push(BYTES, 0, 4);

    assertThrows(IllegalArgumentException.class, () -> window.copy(9, new byte[1], 0, 1));
    assertThrows(IllegalArgumentException.class, () -> window.copy(15, new byte[1], 0, 1));
  }

  @Test
  void testResetAndDiscard() {
    BufferedWindow window = new BufferedWindow(8);
    window.reset(0);
    window.push(BYTES, 0, 5);

    window.reset(50);
    assertTrue(window.isEmpty());
    assertEquals(50, window.getStart());
    assertEquals(8, window.remainingCapacity());

    window.discard();
    assertFalse(window.isValid());
    assertFalse(window.contains(50));
    window.dropBefore(60);
    assertEquals("BufferedWindow[discarded]", window.toString());
  }

  @Test
  void testWrapAroundKeepsOrder() {
    BufferedWindow window = new BufferedWindow(4);
    window.reset(0);
    byte[] dst = new byte[1];
    for (int i = 0; i < BYTES.length; i++) {
      assertEquals(1, window.push(BYTES, i, 1));
      if (window.remainingCapacity() == 0) {
        assertEquals(1, window.copy(window.getStart(), dst, 0, 1));
        window.dropBefore(window.getStart() + 1);
        assertEquals(window.getStart() - 1, dst[0]);
      }
    }
    byte[] rest = new byte[window.size()];
    window.copy(window.getStart(), rest, 0, rest.length);
    assertArrayEquals(new byte[] {7, 8, 9}, rest);
  }
}
