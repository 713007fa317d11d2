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

import java.time.Duration;
import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/** Immutable settings of one {@code LogTransport}. */
@Value
@Builder(toBuilder = true)
public class TransportConfig {
  public static final String DEFAULT_URL = "http://localhost:4000/api/logs";
  public static final String DEFAULT_CHANNEL = "default";
  public static final int DEFAULT_BATCH_SIZE = 10;
  public static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofSeconds(1);
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
  public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);
  public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

  /** Collector endpoint receiving {@code {"logs": [...]}} POSTs. */
  @NonNull @Builder.Default String url = DEFAULT_URL;

  /** Routing label, sent as the {@code X-Channel} header. */
  @NonNull @Builder.Default String channel = DEFAULT_CHANNEL;

  @Builder.Default int batchSize = DEFAULT_BATCH_SIZE;
  @NonNull @Builder.Default Duration flushInterval = DEFAULT_FLUSH_INTERVAL;

  /** Per-request timeout of the HTTP POST. */
  @NonNull @Builder.Default Duration timeout = DEFAULT_TIMEOUT;

  /** Extra request headers; these override the default ones. Copied into an immutable map. */
  @Singular Map<String, String> headers;

  /** When set, every entry is sent encrypted. */
  String secretKey;

  @NonNull @Builder.Default Duration pollInterval = DEFAULT_POLL_INTERVAL;
  @NonNull @Builder.Default Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;
  @Builder.Default boolean registerShutdownHook = true;

  public static TransportConfig defaults() {
    return TransportConfig.builder().build();
  }

  public boolean isEncrypted() {
    return secretKey != null && !secretKey.isEmpty();
  }
}
