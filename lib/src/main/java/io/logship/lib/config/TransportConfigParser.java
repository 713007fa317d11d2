/**
 * Copyright 2025 Fleak Tech Inc.
 *
 * <p>Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file
 * except in compliance with the License. You may obtain a copy of the License at
 *
 * <p>http://www.apache.org/licenses/LICENSE-2.0
 *
 * <p>Unless required by applicable law or agreed to in writing, software distributed under the
 * License is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.logship.lib.config;

import com.fasterxml.jackson.core.type.TypeReference;
import io.logship.lib.utils.JsonUtils;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;

/**
 * Reads a {@link TransportConfig} from a flat option map (or its JSON form). Durations are given in
 * seconds, fractions allowed. Options not present keep their defaults.
 */
public class TransportConfigParser {

  public static final String KEY_URL = "url";
  public static final String KEY_CHANNEL = "channel";
  public static final String KEY_BATCH_SIZE = "batch_size";
  public static final String KEY_FLUSH_INTERVAL = "flush_interval";
  public static final String KEY_TIMEOUT = "timeout";
  public static final String KEY_HEADERS = "headers";
  public static final String KEY_SECRET_KEY = "secret_key";
  public static final String KEY_POLL_INTERVAL = "poll_interval";
  public static final String KEY_SHUTDOWN_TIMEOUT = "shutdown_timeout";
  public static final String KEY_REGISTER_SHUTDOWN_HOOK = "register_shutdown_hook";

  private static final Set<String> KNOWN_KEYS =
      Set.of(
          KEY_URL,
          KEY_CHANNEL,
          KEY_BATCH_SIZE,
          KEY_FLUSH_INTERVAL,
          KEY_TIMEOUT,
          KEY_HEADERS,
          KEY_SECRET_KEY,
          KEY_POLL_INTERVAL,
          KEY_SHUTDOWN_TIMEOUT,
          KEY_REGISTER_SHUTDOWN_HOOK);

  public TransportConfig parseJson(String json) {
    Map<String, Object> options;
    try {
      options = JsonUtils.fromJsonString(json, new TypeReference<>() {});
    } catch (RuntimeException e) {
      throw new IllegalArgumentException("invalid transport config json", e);
    }
    return parse(options);
  }

  public TransportConfig parse(Map<String, Object> options) {
    TransportConfig.TransportConfigBuilder builder = TransportConfig.builder();
    if (options == null) {
      return builder.build();
    }
    for (Map.Entry<String, Object> option : options.entrySet()) {
      String key = option.getKey();
      Object value = option.getValue();
      if (!KNOWN_KEYS.contains(key)) {
        throw new IllegalArgumentException("unknown transport option: " + key);
      }
      if (value == null) {
        continue;
      }
      switch (key) {
        case KEY_URL -> builder.url(value.toString());
        case KEY_CHANNEL -> builder.channel(value.toString());
        case KEY_BATCH_SIZE -> builder.batchSize(toInt(key, value));
        case KEY_FLUSH_INTERVAL -> builder.flushInterval(toDuration(key, value));
        case KEY_TIMEOUT -> builder.timeout(toDuration(key, value));
        case KEY_HEADERS -> builder.headers(toHeaders(value));
        case KEY_SECRET_KEY -> builder.secretKey(StringUtils.trimToNull(value.toString()));
        case KEY_POLL_INTERVAL -> builder.pollInterval(toDuration(key, value));
        case KEY_SHUTDOWN_TIMEOUT -> builder.shutdownTimeout(toDuration(key, value));
        case KEY_REGISTER_SHUTDOWN_HOOK -> builder.registerShutdownHook(toBoolean(key, value));
        default -> throw new IllegalStateException("unhandled option: " + key);
      }
    }
    return builder.build();
  }

  static Duration toDuration(String key, Object value) {
    double seconds = toDouble(key, value);
    return Duration.ofNanos(Math.round(seconds * 1_000_000_000d));
  }

  private static double toDouble(String key, Object value) {
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    try {
      return Double.parseDouble(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(key + " must be a number of seconds: " + value, e);
    }
  }

  private static int toInt(String key, Object value) {
    if (value instanceof Number number) {
      return number.intValue();
    }
    try {
      return Integer.parseInt(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(key + " must be an integer: " + value, e);
    }
  }

  private static boolean toBoolean(String key, Object value) {
    if (value instanceof Boolean bool) {
      return bool;
    }
    String text = value.toString().trim();
    if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
      return Boolean.parseBoolean(text);
    }
    throw new IllegalArgumentException(key + " must be true or false: " + value);
  }

  private static Map<String, String> toHeaders(Object value) {
    if (!(value instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException("headers must be an object of name/value pairs");
    }
    Map<String, String> headers = new LinkedHashMap<>();
    raw.forEach(
        (name, headerValue) -> headers.put(String.valueOf(name), String.valueOf(headerValue)));
    return headers;
  }
}
