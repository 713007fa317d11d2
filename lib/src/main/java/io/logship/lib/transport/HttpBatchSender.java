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
package io.logship.lib.transport;

import com.google.common.annotations.VisibleForTesting;
import io.logship.api.LogEntry;
import io.logship.lib.config.TransportConfig;
import io.logship.lib.crypto.PayloadEncryptor;
import io.logship.lib.utils.JsonUtils;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import lombok.extern.slf4j.Slf4j;

/**
 * Posts a batch as {@code {"logs": [...]}} to the collector. Best effort: every failure becomes a
 * {@link SendResult} and a debug log line, nothing is retried or thrown.
 */
@Slf4j
public class HttpBatchSender implements BatchSender {
  public static final String HEADER_CONTENT_TYPE = "Content-Type";
  public static final String HEADER_CHANNEL = "X-Channel";
  public static final String HEADER_ENCRYPTED = "X-Encrypted";
  public static final String FIELD_LOGS = "logs";
  public static final String FIELD_ENCRYPTED = "encrypted";

  private final URI endpoint;
  private final Duration timeout;
  private final Map<String, String> headers;
  private final HttpClient httpClient;
  private final ExecutorService clientExecutor;
  private final PayloadEncryptor encryptor;

  @VisibleForTesting
  public HttpBatchSender(
      TransportConfig config, HttpClient httpClient, ExecutorService clientExecutor) {
    this.endpoint = URI.create(config.getUrl());
    this.timeout = config.getTimeout();
    this.headers = buildHeaders(config);
    this.httpClient = httpClient;
    this.clientExecutor = clientExecutor;
    this.encryptor = config.isEncrypted() ? new PayloadEncryptor(config.getSecretKey()) : null;
  }

  public static HttpBatchSender create(TransportConfig config) {
    ExecutorService executor =
        Executors.newCachedThreadPool(
            r -> {
              Thread t = new Thread(r, "logship-http-" + config.getChannel());
              t.setDaemon(true);
              return t;
            });
    HttpClient httpClient =
        HttpClient.newBuilder()
            .connectTimeout(config.getTimeout())
            .followRedirects(HttpClient.Redirect.NEVER)
            .executor(executor)
            .build();
    return new HttpBatchSender(config, httpClient, executor);
  }

  /** Default headers first; user headers replace defaults regardless of name case. */
  static Map<String, String> buildHeaders(TransportConfig config) {
    Map<String, String> merged = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    merged.put(HEADER_CONTENT_TYPE, "application/json");
    merged.put(HEADER_CHANNEL, config.getChannel());
    merged.put(HEADER_ENCRYPTED, Boolean.toString(config.isEncrypted()));
    merged.putAll(config.getHeaders());
    return Collections.unmodifiableMap(merged);
  }

  @Override
  public SendResult sendBatch(List<LogEntry> entries) {
    if (entries == null || entries.isEmpty()) {
      return SendResult.skipped();
    }
    int count = entries.size();
    try {
      HttpRequest request = buildRequest(serialize(entries));
      HttpResponse<Void> response =
          httpClient.send(request, HttpResponse.BodyHandlers.discarding());
      int code = response.statusCode();
      if (code < 200 || code >= 300) {
        log.debug("Log collector {} answered {} for {} entries", endpoint, code, count);
        return SendResult.failure(count, code, "http status " + code);
      }
      log.debug("Delivered {} entries to {}", count, endpoint);
      return SendResult.success(count, code);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.debug("Interrupted while sending {} entries to {}", count, endpoint);
      return SendResult.failure(count, null, "interrupted");
    } catch (HttpTimeoutException e) {
      log.debug("Timed out after {} sending {} entries to {}", timeout, count, endpoint);
      return SendResult.failure(count, null, "timeout: " + e.getMessage());
    } catch (IOException | RuntimeException e) {
      log.debug("Failed to send {} entries to {}", count, endpoint, e);
      return SendResult.failure(count, null, e.toString());
    }
  }

  @VisibleForTesting
  byte[] serialize(List<LogEntry> entries) throws IOException {
    List<Object> logs = new ArrayList<>(entries.size());
    for (LogEntry entry : entries) {
      Map<String, Object> payload = entry.toPayload();
      if (encryptor == null) {
        logs.add(payload);
      } else {
        logs.add(Map.of(FIELD_ENCRYPTED, encryptor.encrypt(JsonUtils.toJsonString(payload))));
      }
    }
    return JsonUtils.toJsonBytes(Map.of(FIELD_LOGS, logs));
  }

  private HttpRequest buildRequest(byte[] body) {
    HttpRequest.Builder builder =
        HttpRequest.newBuilder()
            .uri(endpoint)
            .timeout(timeout)
            .POST(HttpRequest.BodyPublishers.ofByteArray(body));
    headers.forEach(builder::setHeader);
    return builder.build();
  }

  public Map<String, String> getHeaders() {
    return headers;
  }

  @Override
  public void close() {
    if (clientExecutor != null) {
      clientExecutor.shutdownNow();
    }
  }
}
