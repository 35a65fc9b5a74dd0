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

import dev.renterd.client.common.exceptions.TransportException;
import dev.renterd.client.common.logging.LogBuilder;
import dev.renterd.client.request.ApiRequest;
import dev.renterd.client.request.ApiResponse;
import dev.renterd.client.request.HttpHeaders;
import dev.renterd.client.request.RequestContent;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.Nullable;
import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.http.AbortableInputStream;
import software.amazon.awssdk.http.ExecutableHttpRequest;
import software.amazon.awssdk.http.HttpExecuteRequest;
import software.amazon.awssdk.http.HttpExecuteResponse;
import software.amazon.awssdk.http.SdkHttpClient;
import software.amazon.awssdk.http.SdkHttpConfigurationOption;
import software.amazon.awssdk.http.SdkHttpFullRequest;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.utils.AttributeMap;
import software.amazon.awssdk.utils.BinaryUtils;
import software.amazon.awssdk.utils.http.SdkHttpUtils;

/**
 * {@link RequestExecutor} on top of the AWS SDK HTTP client SPI.
 *
 * <p>Every request carries basic authentication (user {@code api}, the configured password) and
 * the client's User-Agent. Requests run on a dedicated thread pool; cancelling a returned future
 * aborts the underlying HTTP request, and a response that arrives after cancellation is aborted
 * instead of being handed out.
 */
public class SdkHttpRequestExecutor implements RequestExecutor {
  private static final Logger LOG = LoggerFactory.getLogger(SdkHttpRequestExecutor.class);

  static final String API_USER = "api";
  static final String USER_AGENT = "renterd-client-java";

  @Getter @NonNull private final SdkHttpClient httpClient;
  @NonNull private final ApiClientConfiguration configuration;
  @NonNull private final ExecutorService threadPool;
  @Nullable private final RateLimitPolicy rateLimitPolicy;
  private final boolean closeClient;
  private final String authorization;
  private final String userAgent;

  /**
   * Creates an executor with an Apache HTTP client and a thread pool sized from the configuration.
   * Both are owned and closed by this executor.
   *
   * @param configuration client configuration
   */
  public SdkHttpRequestExecutor(@NonNull ApiClientConfiguration configuration) {
    this(
        createHttpClient(configuration),
        configuration,
        createThreadPool(configuration.getMaxConnections()),
        null,
        true);
  }

  /**
   * Creates an executor.
   *
   * @param httpClient HTTP client sending the requests
   * @param configuration client configuration
   * @param threadPool pool running the blocking HTTP calls; shut down on close
   * @param rateLimitPolicy policy consulted before each request, or null
   * @param closeClient if true, close the HTTP client on close
   */
  public SdkHttpRequestExecutor(
      @NonNull SdkHttpClient httpClient,
      @NonNull ApiClientConfiguration configuration,
      @NonNull ExecutorService threadPool,
      @Nullable RateLimitPolicy rateLimitPolicy,
      boolean closeClient) {
    this.httpClient = httpClient;
    this.configuration = configuration;
    this.threadPool = threadPool;
    this.rateLimitPolicy = rateLimitPolicy;
    this.closeClient = closeClient;
    this.authorization =
        "Basic "
            + BinaryUtils.toBase64(
                (API_USER + ":" + configuration.getApiPassword()).getBytes(StandardCharsets.UTF_8));
    this.userAgent =
        configuration.getUserAgentPrefix().isEmpty()
            ? USER_AGENT
            : configuration.getUserAgentPrefix() + " " + USER_AGENT;
  }

  @Override
  public Optional<RateLimitPolicy> getRateLimitPolicy() {
    return Optional.ofNullable(rateLimitPolicy);
  }

  @Override
  @SuppressFBWarnings(
      value = "RV_RETURN_VALUE_IGNORED_BAD_PRACTICE",
      justification = "The task reports through the returned future")
  public CompletableFuture<ApiResponse> execute(@NonNull ApiRequest request) {
    CompletableFuture<ApiResponse> result = new CompletableFuture<>();
    HttpExecuteRequest httpRequest = toHttpExecuteRequest(request);
    try {
      threadPool.execute(() -> send(request, httpRequest, result));
    } catch (RejectedExecutionException e) {
      result.completeExceptionally(
          new TransportException("Executor is closed, cannot send " + request.getPath(), e));
    }
    return result;
  }

  private void send(
      ApiRequest request, HttpExecuteRequest httpRequest, CompletableFuture<ApiResponse> result) {
    if (result.isDone()) {
      return;
    }
    LogBuilder log =
        LogBuilder.start(LOG, "http." + request.getMethod().name().toLowerCase(Locale.ROOT))
            .withParam("path", request.getPath())
            .withParam("range", request.getHeaders().get(HttpHeaders.RANGE))
            .withThreadInfo();
    log.logStart();
    try {
      if (rateLimitPolicy != null) {
        rateLimitPolicy.acquire(request);
      }
      ExecutableHttpRequest executable = httpClient.prepareRequest(httpRequest);
      result.whenComplete(
          (response, failure) -> {
            if (result.isCancelled()) {
              executable.abort();
            }
          });
      HttpExecuteResponse httpResponse = executable.call();
      ApiResponse response = toApiResponse(httpResponse);
      log.withParam("status", response.getStatusCode()).logEnd();
      if (!result.complete(response)) {
        response.abort();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.logFailure(e);
      result.completeExceptionally(
          new TransportException("Interrupted while sending " + request.getPath(), e));
    } catch (IOException | RuntimeException e) {
      log.logFailure(e);
      result.completeExceptionally(
          new TransportException("Request to " + request.getPath() + " failed", e));
    }
  }

  private HttpExecuteRequest toHttpExecuteRequest(ApiRequest request) {
    URI endpoint = configuration.getEndpointUri();
    SdkHttpFullRequest.Builder builder =
        SdkHttpFullRequest.builder()
            .uri(endpoint)
            .encodedPath(joinPath(endpoint.getRawPath(), request.getPath()))
            .method(request.getMethod())
            .putHeader(HttpHeaders.AUTHORIZATION, authorization)
            .putHeader(HttpHeaders.USER_AGENT, userAgent);

    request.getQueryParameters().forEach(builder::putRawQueryParameter);
    request.getHeaders().forEach(builder::putHeader);

    RequestContent content = request.getContent();
    HttpExecuteRequest.Builder executeRequest = HttpExecuteRequest.builder();
    if (content != null) {
      content.getContentType().ifPresent(type -> builder.putHeader(HttpHeaders.CONTENT_TYPE, type));
      content
          .getContentLength()
          .ifPresent(length -> builder.putHeader(HttpHeaders.CONTENT_LENGTH, Long.toString(length)));
      executeRequest.contentStreamProvider(content.getStreamProvider());
    }
    return executeRequest.request(builder.build()).build();
  }

  static String joinPath(@Nullable String basePath, String path) {
    String base = basePath == null ? "" : basePath;
    while (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    String relative = path;
    while (relative.startsWith("/")) {
      relative = relative.substring(1);
    }
    return base + "/" + SdkHttpUtils.urlEncodeIgnoreSlashes(relative);
  }

  private static ApiResponse toApiResponse(HttpExecuteResponse httpResponse) {
    InputStream body =
        httpResponse.responseBody().isPresent()
            ? httpResponse.responseBody().get()
            : AbortableInputStream.createEmpty();
    return ApiResponse.builder()
        .statusCode(httpResponse.httpResponse().statusCode())
        .headers(httpResponse.httpResponse().headers())
        .body(body)
        .build();
  }

  static SdkHttpClient createHttpClient(ApiClientConfiguration configuration) {
    return ApacheHttpClient.builder()
        .connectionTimeout(configuration.getConnectionTimeout())
        .socketTimeout(configuration.getSocketTimeout())
        .maxConnections(configuration.getMaxConnections())
        .buildWithDefaults(httpClientDefaults(configuration));
  }

  /** Options the Apache client falls back to for anything its builder leaves unset. */
  static AttributeMap httpClientDefaults(ApiClientConfiguration configuration) {
    AttributeMap.Builder defaults = AttributeMap.builder();
    if (configuration.isAcceptInvalidCertificates()) {
      LOG.warn(
          "TLS certificate validation is disabled for {}", configuration.getApiEndpointUrl());
      defaults.put(SdkHttpConfigurationOption.TRUST_ALL_CERTIFICATES, true);
    }
    return defaults.build();
  }

  private static ExecutorService createThreadPool(int size) {
    AtomicInteger counter = new AtomicInteger();
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable, "renterd-http-" + counter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };
    return Executors.newFixedThreadPool(size, threadFactory);
  }

  /**
   * Shuts down the thread pool, and closes the HTTP client if instructed by the constructor.
   *
   * @throws IOException never; declared by {@link java.io.Closeable}
   */
  @Override
  public void close() throws IOException {
    try {
      this.threadPool.shutdownNow();
    } finally {
      if (this.closeClient) {
        this.httpClient.close();
      }
    }
  }
}
