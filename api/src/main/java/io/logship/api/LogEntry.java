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
package io.logship.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

/**
 * The canonical log record moved through the transport. Instances are immutable; the {@code with*}
 * methods return modified copies.
 */
@Value
@With
public class LogEntry {
  public static final String FIELD_ID = "id";
  public static final String FIELD_LEVEL = "level";
  public static final String FIELD_TIME = "time";
  public static final String FIELD_MSG = "msg";
  public static final String FIELD_NAME = "name";
  public static final String FIELD_ERROR = "error";

  String id;
  LogLevel level;
  long time;
  String msg;
  String name;
  ErrorInfo error;
  Map<String, Object> extra;

  @Builder(toBuilder = true)
  private LogEntry(
      @NonNull String id,
      @NonNull LogLevel level,
      long time,
      @NonNull String msg,
      String name,
      ErrorInfo error,
      Map<String, Object> extra) {
    this.id = id;
    this.level = level;
    this.time = time;
    this.msg = msg;
    this.name = name;
    this.error = error;
    this.extra =
        extra == null || extra.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
  }

  /**
   * Renders the wire object. {@code name} and {@code error} are omitted when absent, and extra
   * fields are merged last so they win over reserved keys of the same name.
   */
  public Map<String, Object> toPayload() {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put(FIELD_ID, id);
    payload.put(FIELD_LEVEL, level.getValue());
    payload.put(FIELD_TIME, time);
    payload.put(FIELD_MSG, msg);
    if (name != null) {
      payload.put(FIELD_NAME, name);
    }
    if (error != null) {
      payload.put(FIELD_ERROR, error.toPayload());
    }
    payload.putAll(extra);
    return payload;
  }
}
