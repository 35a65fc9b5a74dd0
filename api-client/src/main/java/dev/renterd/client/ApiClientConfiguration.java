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

import com.google.common.base.Preconditions;
import dev.renterd.client.common.ConnectorConfiguration;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Configuration of the HTTP side of the client: where the API lives and how to reach it. */
@Getter
@EqualsAndHashCode
@ToString(exclude = "apiPassword")
public class ApiClientConfiguration {
  private static final String DEFAULT_USER_AGENT_PREFIX = "";
  private static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(10);
  private static final Duration DEFAULT_SOCKET_TIMEOUT = Duration.ofSeconds(60);
  private static final int DEFAULT_MAX_CONNECTIONS = 16;
  private static final boolean DEFAULT_ACCEPT_INVALID_CERTIFICATES = false;

  private static final String API_ENDPOINT_URL_KEY = "endpoint";
  private static final String API_PASSWORD_KEY = "password";
  private static final String USER_AGENT_PREFIX_KEY = "useragentprefix";
  private static final String CONNECTION_TIMEOUT_KEY = "connectiontimeoutmillis";
  private static final String SOCKET_TIMEOUT_KEY = "sockettimeoutmillis";
  private static final String MAX_CONNECTIONS_KEY = "maxconnections";
  private static final String ACCEPT_INVALID_CERTIFICATES_KEY = "acceptinvalidcertificates";

  /** Base URL of the API, e.g. {@code http://localhost:9980/api}. */
  private final String apiEndpointUrl;

  /** Password sent with basic authentication on every request. */
  private final String apiPassword;

  /** Prefix prepended to the client's User-Agent header. */
  private final String userAgentPrefix;

  /** Time allowed to establish a connection. */
  private final Duration connectionTimeout;

  /** Time allowed between two packets of a response. */
  private final Duration socketTimeout;

  /** Size of the connection pool, and of the thread pool issuing requests. */
  private final int maxConnections;

  /** Whether TLS certificates are trusted without validation. Only for self-signed test nodes. */
  private final boolean acceptInvalidCertificates;

  /** Parsed {@link #apiEndpointUrl}. */
  @EqualsAndHashCode.Exclude private final URI endpointUri;

  /**
   * Constructs {@link ApiClientConfiguration}.
   *
   * @param apiEndpointUrl base URL of the API; must be http or https with a host
   * @param apiPassword API password
   * @param userAgentPrefix User-Agent prefix
   * @param connectionTimeout connection timeout
   * @param socketTimeout socket timeout
   * @param maxConnections connection pool size
   * @param acceptInvalidCertificates whether to skip TLS certificate validation
   */
  @Builder
  private ApiClientConfiguration(
      String apiEndpointUrl,
      String apiPassword,
      String userAgentPrefix,
      Duration connectionTimeout,
      Duration socketTimeout,
      int maxConnections,
      boolean acceptInvalidCertificates) {
    Preconditions.checkArgument(
        apiEndpointUrl != null,
        "api endpoint is missing, you need to specify a valid url before building the client");
    Preconditions.checkArgument(
        apiPassword != null,
        "api password is missing, you need to specify a password before building the client");
    Preconditions.checkArgument(
        isPositive(connectionTimeout), "`connectionTimeout` must be positive");
    Preconditions.checkArgument(isPositive(socketTimeout), "`socketTimeout` must be positive");
    Preconditions.checkArgument(maxConnections > 0, "`maxConnections` must be positive");

    this.endpointUri = parseEndpoint(apiEndpointUrl);
    this.apiEndpointUrl = apiEndpointUrl;
    this.apiPassword = apiPassword;
    this.userAgentPrefix = userAgentPrefix == null ? DEFAULT_USER_AGENT_PREFIX : userAgentPrefix;
    this.connectionTimeout = connectionTimeout;
    this.socketTimeout = socketTimeout;
    this.maxConnections = maxConnections;
    this.acceptInvalidCertificates = acceptInvalidCertificates;
  }

  /**
   * Constructs {@link ApiClientConfiguration} from a {@link ConnectorConfiguration} scoped to the
   * http settings, e.g. {@code renterd.client.http}.
   *
   * @param configuration configuration to read from
   * @return ApiClientConfiguration
   */
  public static ApiClientConfiguration fromConfiguration(ConnectorConfiguration configuration) {
    return ApiClientConfiguration.builder()
        .apiEndpointUrl(configuration.getString(API_ENDPOINT_URL_KEY, null))
        .apiPassword(configuration.getString(API_PASSWORD_KEY, null))
        .userAgentPrefix(configuration.getString(USER_AGENT_PREFIX_KEY, DEFAULT_USER_AGENT_PREFIX))
        .connectionTimeout(
            configuration.getDurationMillis(CONNECTION_TIMEOUT_KEY, DEFAULT_CONNECTION_TIMEOUT))
        .socketTimeout(configuration.getDurationMillis(SOCKET_TIMEOUT_KEY, DEFAULT_SOCKET_TIMEOUT))
        .maxConnections(configuration.getInt(MAX_CONNECTIONS_KEY, DEFAULT_MAX_CONNECTIONS))
        .acceptInvalidCertificates(
            configuration.getBoolean(
                ACCEPT_INVALID_CERTIFICATES_KEY, DEFAULT_ACCEPT_INVALID_CERTIFICATES))
        .build();
  }

  private static URI parseEndpoint(String apiEndpointUrl) {
    URI uri;
    try {
      uri = new URI(apiEndpointUrl);
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("api endpoint `" + apiEndpointUrl + "` is invalid", e);
    }
    String scheme = uri.getScheme();
    Preconditions.checkArgument(
        scheme != null
            && (scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
            && uri.getHost() != null,
        "api endpoint `%s` is invalid",
        apiEndpointUrl);
    return uri;
  }

  private static boolean isPositive(Duration duration) {
    return duration != null && !duration.isNegative() && !duration.isZero();
  }

  /** Builder with the defaults pre-filled. */
  public static class ApiClientConfigurationBuilder {
    private String userAgentPrefix = DEFAULT_USER_AGENT_PREFIX;
    private Duration connectionTimeout = DEFAULT_CONNECTION_TIMEOUT;
    private Duration socketTimeout = DEFAULT_SOCKET_TIMEOUT;
    private int maxConnections = DEFAULT_MAX_CONNECTIONS;
    private boolean acceptInvalidCertificates = DEFAULT_ACCEPT_INVALID_CERTIFICATES;
  }
}
