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
package dev.renterd.client.common.logging;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

public class LogBuilderTest {

  @Test
  void testParamsKeepInsertionOrder() {
    Logger logger = mock(Logger.class);
    LogBuilder log =
        LogBuilder.start(logger, "fetch").withParam("path", "a/b").withParam("range", "bytes=0-");

    assertEquals("path: a/b, range: bytes=0-", log.formatParams());
  }

  @Test
  void testNothingLoggedWhenDebugDisabled() {
    Logger logger = mock(Logger.class);
    when(logger.isDebugEnabled()).thenReturn(false);

    LogBuilder log = LogBuilder.start(logger, "fetch").withParam("path", "a/b");
    log.logStart();
    log.logEnd();
    log.logFailure(new RuntimeException("boom"));

    verify(logger, times(3)).isDebugEnabled();
    verifyNoMoreInteractions(logger);
  }

  @Test
  void testStartAndEndLines() {
    Logger logger = mock(Logger.class);
    when(logger.isDebugEnabled()).thenReturn(true);

    LogBuilder log = LogBuilder.start(logger, "lookup").withParam("path", "a/b").withThreadInfo();
    log.logStart();
    verify(logger).debug(eq("STARTED {}: {}"), eq("lookup"), contains("path: a/b"));

    log.logEnd();
    verify(logger).debug(eq("DONE {}: {}"), eq("lookup"), contains("durationMs: "));
  }

  @Test
  void testFailureLine() {
    Logger logger = mock(Logger.class);
    when(logger.isDebugEnabled()).thenReturn(true);

    LogBuilder.start(logger, "fetch").logFailure(new IllegalStateException("boom"));
    verify(logger)
        .debug(eq("FAILED {}: {}, error: {}"), eq("fetch"), anyString(), contains("boom"));
  }
}
