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

import dev.renterd.client.RangeFallbackPolicy;
import dev.renterd.client.common.exceptions.AuthenticationException;
import dev.renterd.client.common.exceptions.HttpResponseException;
import dev.renterd.client.common.exceptions.NotFoundException;
import dev.renterd.client.common.exceptions.NotSeekableException;
import dev.renterd.client.common.exceptions.ProtocolViolationException;
import dev.renterd.client.common.exceptions.RangeNotSatisfiableException;
import dev.renterd.client.common.exceptions.UnknownLengthException;
import dev.renterd.client.request.ApiResponse;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.http.AbortableInputStream;

@SuppressFBWarnings(
    value = "NP_NONNULL_PARAM_VIOLATION",
    justification = "We mean to pass nulls to checks")
public class RangeNegotiatorTest {
  private static final String PATH = "dir/object.bin";
  private static final OptionalLong UNKNOWN = OptionalLong.empty();
  private static final OptionalLong KNOWN = OptionalLong.of(1000);

  private final RangeNegotiator negotiator =
      new RangeNegotiator(RangeFallbackPolicy.DISCARD_UNTIL_POSITION);
  private final AtomicBoolean aborted = new AtomicBoolean();

  @Test
  void testConstructorThrowsOnNull() {
    assertThrows(NullPointerException.class, () -> new RangeNegotiator(null));
    assertEquals(RangeFallbackPolicy.DISCARD_UNTIL_POSITION, negotiator.getFallbackPolicy());
  }

  @Test
  void testPlanZeroLengthIsNoOp() {
    assertEquals(ReadPlan.noOp(), plan(5000, 0, new BufferedWindow(8), false, KNOWN, false));
  }

  @Test
  void testPlanAtOrPastEndIsEndOfObject() {
    BufferedWindow window = new BufferedWindow(8);
    assertEquals(ReadPlan.endOfObject(), plan(1000, 10, window, true, KNOWN, false));
    assertEquals(ReadPlan.endOfObject(), plan(1200, 10, window, false, KNOWN, true));
  }

  @Test
  void testPlanServesBufferedBytes() {
    BufferedWindow window = window(100, 8);

    assertEquals(ReadPlan.serve(8), plan(100, 50, window, true, KNOWN, false));
    assertEquals(ReadPlan.serve(3), plan(105, 50, window, false, KNOWN, false));
    assertEquals(ReadPlan.serve(2), plan(102, 2, window, true, UNKNOWN, true));
  }

  @Test
  void testPlanPullsWhenWindowEndsAtPosition() {
    BufferedWindow window = window(100, 8);

    assertEquals(ReadPlan.pull(), plan(108, 50, window, true, KNOWN, false));
    assertEquals(ReadPlan.pull(), plan(108, 50, window, true, UNKNOWN, true));
  }

  @Test
  void testPlanFetchesWhenBodyIsGone() {
    BufferedWindow window = window(100, 8);

    assertEquals(
        ReadPlan.fetch(ByteRange.from(108)), plan(108, 50, window, false, KNOWN, false));
  }

  @Test
  void testPlanFetchesOnGap() {
    BufferedWindow window = window(100, 8);

    assertEquals(ReadPlan.fetch(ByteRange.from(500)), plan(500, 10, window, true, KNOWN, false));
    assertEquals(ReadPlan.fetch(ByteRange.from(50)), plan(50, 10, window, true, KNOWN, false));
    assertEquals(
        ReadPlan.fetch(ByteRange.from(0)),
        plan(0, 10, new BufferedWindow(8), false, UNKNOWN, false));
  }

  @Test
  void testPlanBoundedFetch() {
    BufferedWindow window = new BufferedWindow(8);

    assertEquals(ReadPlan.fetch(ByteRange.of(300, 350)), plan(300, 50, window, false, KNOWN, true));
    assertEquals(
        ReadPlan.fetch(ByteRange.of(990, 1000)), plan(990, 50, window, false, KNOWN, true));
    assertEquals(
        ReadPlan.fetch(ByteRange.of(990, 1040)), plan(990, 50, window, false, UNKNOWN, true));
  }

  @Test
  void testPlanRejectsNegativeArguments() {
    BufferedWindow window = new BufferedWindow(8);
    assertThrows(
        IllegalArgumentException.class, () -> plan(-1, 10, window, false, KNOWN, false));
    assertThrows(
        IllegalArgumentException.class, () -> plan(0, -1, window, false, KNOWN, false));
  }

  @Test
  void testPartialAnswer() throws IOException {
    RangeNegotiator.RangeAnswer answer =
        negotiator.interpret(
            response(206, "Content-Range", "bytes 500-999/1000"),
            ByteRange.from(500),
            UNKNOWN,
            PATH);

    assertFalse(answer.isEndOfObject());
    assertEquals(KNOWN, answer.getTotalLength());
    ObjectBody body = answer.getBody();
    assertEquals(500, body.getOffset());
    assertEquals(OptionalLong.of(1000), body.getExpectedEnd());
    assertTrue(body.isToEndOfObject());
    assertFalse(aborted.get());
  }

  @Test
  void testPartialAnswerWithUnknownTotal() throws IOException {
    RangeNegotiator.RangeAnswer answer =
        negotiator.interpret(
            response(206, "Content-Range", "bytes 0-99/*"), ByteRange.from(0), UNKNOWN, PATH);

    assertEquals(UNKNOWN, answer.getTotalLength());
    assertTrue(answer.getBody().isToEndOfObject());
    assertEquals(OptionalLong.of(100), answer.getBody().getExpectedEnd());
  }

  @Test
  void testPartialAnswerShorterThanObject() throws IOException {
    RangeNegotiator.RangeAnswer answer =
        negotiator.interpret(
            response(206, "Content-Range", "bytes 0-99/1000"), ByteRange.from(0), KNOWN, PATH);

    assertFalse(answer.getBody().isToEndOfObject());
  }

  @Test
  void testPartialAnswerToBoundedRequest() throws IOException {
    RangeNegotiator.RangeAnswer answer =
        negotiator.interpret(
            response(206, "Content-Range", "bytes 990-999/1000"),
            ByteRange.of(990, 1000),
            KNOWN,
            PATH);

    assertFalse(answer.getBody().isToEndOfObject());
  }

  @Test
  void testPartialAnswerViolations() {
    assertViolation(response(206), ByteRange.from(0), UNKNOWN);
    assertViolation(response(206, "Content-Range", "bytes */1000"), ByteRange.from(0), UNKNOWN);
    assertViolation(
        response(206, "Content-Range", "bytes 10-99/1000"), ByteRange.from(0), UNKNOWN);
    assertViolation(
        response(206, "Content-Range", "bytes 0-99/1000"), ByteRange.of(0, 50), UNKNOWN);
    assertViolation(
        response(206, "Content-Range", "bytes 0-99/2000"), ByteRange.from(0), KNOWN);
    assertViolation(response(206, "Content-Range", "garbage"), ByteRange.from(0), UNKNOWN);
  }

  @Test
  void testFullAnswerFromStart() throws IOException {
    RangeNegotiator.RangeAnswer answer =
        negotiator.interpret(
            response(200, "Content-Length", "1000"), ByteRange.from(0), UNKNOWN, PATH);

    assertEquals(KNOWN, answer.getTotalLength());
    assertEquals(0, answer.getBody().getOffset());
    assertEquals(OptionalLong.of(1000), answer.getBody().getExpectedEnd());
    assertTrue(answer.getBody().isToEndOfObject());
  }

  @Test
  void testFullAnswerWithoutLength() throws IOException {
    RangeNegotiator.RangeAnswer answer =
        negotiator.interpret(response(200), ByteRange.from(300), KNOWN, PATH);

    assertEquals(KNOWN, answer.getTotalLength());
    assertEquals(0, answer.getBody().getOffset());
    assertEquals(OptionalLong.empty(), answer.getBody().getExpectedEnd());
  }

  @Test
  void testFullAnswerUnderFailPolicy() throws IOException {
    RangeNegotiator strict = new RangeNegotiator(RangeFallbackPolicy.FAIL);

    assertThrows(
        NotSeekableException.class,
        () ->
            strict.interpret(
                response(200, "Content-Length", "1000"), ByteRange.from(10), KNOWN, PATH));
    assertTrue(aborted.get());

    RangeNegotiator.RangeAnswer answer =
        strict.interpret(response(200, "Content-Length", "1000"), ByteRange.from(0), KNOWN, PATH);
    assertEquals(0, answer.getBody().getOffset());
  }

  @Test
  void testFullAnswerViolations() {
    assertViolation(response(200, "Content-Length", "abc"), ByteRange.from(0), UNKNOWN);
    assertViolation(response(200, "Content-Length", "-5"), ByteRange.from(0), UNKNOWN);
    assertViolation(response(200, "Content-Length", "999"), ByteRange.from(0), KNOWN);
  }

  @Test
  void testUnsatisfiableAtEndIsEndOfObject() throws IOException {
    RangeNegotiator.RangeAnswer answer =
        negotiator.interpret(
            response(416, "Content-Range", "bytes */1000"), ByteRange.from(1000), UNKNOWN, PATH);

    assertTrue(answer.isEndOfObject());
    assertNull(answer.getBody());
    assertEquals(KNOWN, answer.getTotalLength());
    assertTrue(aborted.get());
  }

  @Test
  void testUnsatisfiableWithoutHeaderUsesKnownLength() throws IOException {
    assertTrue(
        negotiator.interpret(response(416), ByteRange.from(1500), KNOWN, PATH).isEndOfObject());
  }

  @Test
  void testUnsatisfiableBeforeEndFails() {
    RangeNotSatisfiableException thrown =
        assertThrows(
            RangeNotSatisfiableException.class,
            () -> negotiator.interpret(response(416), ByteRange.from(10), UNKNOWN, PATH));
    assertEquals(10, thrown.getPosition());

    assertThrows(
        RangeNotSatisfiableException.class,
        () ->
            negotiator.interpret(
                response(416, "Content-Range", "bytes */1000"), ByteRange.from(10), KNOWN, PATH));
  }

  @Test
  void testUnsatisfiableWithSatisfiedRangeIsViolation() {
    assertViolation(
        response(416, "Content-Range", "bytes 0-9/1000"), ByteRange.from(1000), UNKNOWN);
  }

  @Test
  void testErrorStatuses() {
    assertThrows(
        NotFoundException.class,
        () -> negotiator.interpret(response(404), ByteRange.from(0), KNOWN, PATH));
    assertThrows(
        AuthenticationException.class,
        () -> negotiator.interpret(response(401), ByteRange.from(0), KNOWN, PATH));
    HttpResponseException thrown =
        assertThrows(
            HttpResponseException.class,
            () -> negotiator.interpret(response(503), ByteRange.from(0), KNOWN, PATH));
    assertEquals(503, thrown.getStatusCode());
    assertTrue(aborted.get());
  }

  @Test
  void testUnexpectedSuccessStatusIsViolation() {
    assertViolation(response(204), ByteRange.from(0), KNOWN);
  }

  @Test
  void testResolveLength() throws IOException {
    assertEquals(
        1000, negotiator.resolveLength(response(206, "Content-Range", "bytes 0-0/1000"), PATH));
    assertTrue(aborted.get());
    assertEquals(1000, negotiator.resolveLength(response(200, "Content-Length", "1000"), PATH));
    assertEquals(0, negotiator.resolveLength(response(416, "Content-Range", "bytes */0"), PATH));
  }

  @Test
  void testResolveLengthWithoutLength() {
    assertThrows(
        UnknownLengthException.class,
        () -> negotiator.resolveLength(response(206, "Content-Range", "bytes 0-0/*"), PATH));
    assertThrows(UnknownLengthException.class, () -> negotiator.resolveLength(response(200), PATH));
    assertThrows(UnknownLengthException.class, () -> negotiator.resolveLength(response(416), PATH));
    assertThrows(UnknownLengthException.class, () -> negotiator.resolveLength(response(204), PATH));
  }

  @Test
  void testResolveLengthOfMissingObject() {
    assertThrows(NotFoundException.class, () -> negotiator.resolveLength(response(404), PATH));
    assertTrue(aborted.get());
  }

  private ReadPlan plan(
      long position,
      int len,
      BufferedWindow window,
      boolean bodyLive,
      OptionalLong totalLength,
      boolean bounded) {
    return negotiator.plan(position, len, window, bodyLive, totalLength, bounded);
  }

  private static BufferedWindow window(long start, int size) {
    BufferedWindow window = new BufferedWindow(64);
    window.reset(start);
    window.push(new byte[size], 0, size);
    return window;
  }

  private void assertViolation(ApiResponse response, ByteRange range, OptionalLong totalLength) {
    aborted.set(false);
    assertThrows(
        ProtocolViolationException.class,
        () -> negotiator.interpret(response, range, totalLength, PATH));
    assertTrue(aborted.get());
  }

  private ApiResponse response(int status, String... headers) {
    Map<String, List<String>> headerMap = new HashMap<>();
    for (int i = 0; i + 1 < headers.length; i += 2) {
      headerMap.put(headers[i], Collections.singletonList(headers[i + 1]));
    }
    return ApiResponse.builder()
        .statusCode(status)
        .headers(headerMap)
        .body(
            AbortableInputStream.create(
                new ByteArrayInputStream(new byte[0]), () -> aborted.set(true)))
        .build();
  }
}
