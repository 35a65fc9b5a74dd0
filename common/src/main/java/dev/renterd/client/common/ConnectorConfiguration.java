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
package dev.renterd.client.common;

import com.google.common.base.Preconditions;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;
import lombok.Getter;
import lombok.NonNull;

/**
 * A map based client configuration. Every key starts with a common prefix, and lookups take the
 * suffix only.
 *
 * <p>Given the entries {@code renterd.client.http.endpoint = http://localhost:9980/api} and {@code
 * renterd.client.stream.buffersizebytes = 65536}, a configuration created with the prefix {@code
 * renterd.client} answers {@code getString("http.endpoint", null)}, and its sub-configuration
 * {@code map("stream")} answers {@code getLong("buffersizebytes", 0)}.
 */
public class ConnectorConfiguration {
  /** Default prefix for all renterd client properties. */
  public static final String DEFAULT_PREFIX = "renterd.client";

  /**
   * Prefix shared by every key of this configuration.
   *
   * @return the prefix
   */
  @Getter private final String prefix;

  private final Map<String, String> configuration;

  /**
   * Constructs {@link ConnectorConfiguration} from a map. Keys not starting with the prefix are
   * dropped.
   *
   * @param configurationMap raw configuration entries
   * @param prefix prefix of the relevant keys
   */
  public ConnectorConfiguration(@NonNull Map<String, String> configurationMap, String prefix) {
    this(configurationMap.entrySet(), prefix);
  }

  /**
   * Constructs {@link ConnectorConfiguration} from entries. Keys not starting with the prefix are
   * dropped.
   *
   * @param entries raw configuration entries
   * @param prefix prefix of the relevant keys
   */
  public ConnectorConfiguration(
      @NonNull Iterable<Map.Entry<String, String>> entries, @NonNull String prefix) {
    Preconditions.checkArgument(!prefix.isEmpty(), "`prefix` must not be empty");
    this.prefix = prefix;
    this.configuration =
        StreamSupport.stream(entries.spliterator(), false)
            .filter(entry -> entry.getKey().startsWith(prefix + '.'))
            .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> b));
  }

  /**
   * Creates a configuration from system-style {@link Properties}.
   *
   * @param properties the properties
   * @param prefix prefix of the relevant keys
   * @return a new {@link ConnectorConfiguration}
   */
  public static ConnectorConfiguration fromProperties(
      @NonNull Properties properties, @NonNull String prefix) {
    return new ConnectorConfiguration(
        properties.stringPropertyNames().stream()
            .collect(Collectors.toMap(name -> name, properties::getProperty)),
        prefix);
  }

  /**
   * Returns a sub-configuration whose prefix is {@code getPrefix() + "." + appendPrefix}.
   *
   * @param appendPrefix segment to append to the prefix
   * @return the sub-configuration
   */
  public ConnectorConfiguration map(@NonNull String appendPrefix) {
    return new ConnectorConfiguration(this.configuration, constructKey(appendPrefix));
  }

  /**
   * Integer value for a key, or the default when absent.
   *
   * @param key key suffix
   * @param defaultValue value returned when the key is absent
   * @return the value
   * @throws NumberFormatException if the value is not an integer
   */
  public int getInt(String key, int defaultValue) {
    String value = lookup(key);
    return value != null ? Integer.parseInt(value) : defaultValue;
  }

  /**
   * Long value for a key, or the default when absent.
   *
   * @param key key suffix
   * @param defaultValue value returned when the key is absent
   * @return the value
   * @throws NumberFormatException if the value is not a long
   */
  public long getLong(String key, long defaultValue) {
    String value = lookup(key);
    return value != null ? Long.parseLong(value) : defaultValue;
  }

  /**
   * String value for a key, or the default when absent.
   *
   * @param key key suffix
   * @param defaultValue value returned when the key is absent
   * @return the value
   */
  public String getString(String key, String defaultValue) {
    String value = lookup(key);
    return value != null ? value : defaultValue;
  }

  /**
   * Boolean value for a key, or the default when absent.
   *
   * @param key key suffix
   * @param defaultValue value returned when the key is absent
   * @return the value
   */
  public boolean getBoolean(String key, boolean defaultValue) {
    String value = lookup(key);
    return value != null ? Boolean.parseBoolean(value) : defaultValue;
  }

  /**
   * Duration value for a key, expressed in milliseconds, or the default when absent.
   *
   * @param key key suffix
   * @param defaultValue value returned when the key is absent
   * @return the value
   * @throws NumberFormatException if the value is not a long
   */
  public Duration getDurationMillis(String key, Duration defaultValue) {
    String value = lookup(key);
    return value != null ? Duration.ofMillis(Long.parseLong(value)) : defaultValue;
  }

  /**
   * Enum value for a key, matched case-insensitively, or the default when absent.
   *
   * @param key key suffix
   * @param defaultValue value returned when the key is absent
   * @param <E> enum type
   * @return the value
   * @throws IllegalArgumentException if the value names no constant
   */
  public <E extends Enum<E>> E getEnum(String key, @NonNull E defaultValue) {
    String value = lookup(key);
    if (value == null) {
      return defaultValue;
    }
    return Enum.valueOf(defaultValue.getDeclaringClass(), value.trim().toUpperCase(Locale.ROOT));
  }

  private String lookup(String key) {
    return configuration.get(constructKey(key));
  }

  private String constructKey(String key) {
    return this.prefix + '.' + key;
  }
}
