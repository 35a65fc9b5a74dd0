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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;

/**
 * Structured debug logging for a single remote operation. Produces a {@code STARTED} and a {@code
 * DONE} or {@code FAILED} line sharing the same parameters, with the elapsed time on the closing
 * line.
 *
 * <pre>
 * LogBuilder log = LogBuilder.start(LOG, "fetch").withParam("path", path).withParam("range", range);
 * log.logStart();
 * ...
 * log.withParam("status", 206).logEnd();
 * </pre>
 */
public class LogBuilder {
  private static final String DURATION_MS = "durationMs";
  private static final String THREAD_NAME = "thread";

  private final Logger logger;
  private final String operation;
  private final Map<String, Object> params = new LinkedHashMap<>();
  private final long startNanos;

  private LogBuilder(Logger logger, String operation) {
    this.logger = logger;
    this.operation = operation;
    this.startNanos = System.nanoTime();
  }

  /**
   * Creates a new builder; the operation clock starts now.
   *
   * @param logger the SLF4J logger to write to
   * @param operation operation name
   * @return a new {@link LogBuilder}
   */
  public static LogBuilder start(Logger logger, String operation) {
    return new LogBuilder(logger, operation);
  }

  /**
   * Adds a parameter, replacing any earlier value for the same key.
   *
   * @param key parameter name
   * @param value parameter value
   * @return this builder
   */
  public LogBuilder withParam(String key, Object value) {
    params.put(key, value);
    return this;
  }

  /**
   * Adds the name of the calling thread.
   *
   * @return this builder
   */
  public LogBuilder withThreadInfo() {
    params.put(THREAD_NAME, Thread.currentThread().getName());
    return this;
  }

  /** Logs the start of the operation. */
  public void logStart() {
    if (logger.isDebugEnabled()) {
      logger.debug("STARTED {}: {}", operation, formatParams());
    }
  }

  /** Logs the successful end of the operation. */
  public void logEnd() {
    if (logger.isDebugEnabled()) {
      params.put(DURATION_MS, elapsedMillis());
      logger.debug("DONE {}: {}", operation, formatParams());
    }
  }

  /**
   * Logs the failed end of the operation.
   *
   * @param failure the failure
   */
  public void logFailure(Throwable failure) {
    if (logger.isDebugEnabled()) {
      params.put(DURATION_MS, elapsedMillis());
      logger.debug("FAILED {}: {}, error: {}", operation, formatParams(), failure.toString());
    }
  }

  String formatParams() {
    return params.entrySet().stream()
        .map(entry -> entry.getKey() + ": " + entry.getValue())
        .collect(Collectors.joining(", "));
  }

  private long elapsedMillis() {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }
}
