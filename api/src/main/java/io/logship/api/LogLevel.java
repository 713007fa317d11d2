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

import java.util.Locale;
import java.util.Map;
import lombok.Getter;

/** Canonical severity scale shared by every log entry, whatever front-end produced it. */
public enum LogLevel {
  TRACE(10),
  DEBUG(20),
  INFO(30),
  WARN(40),
  ERROR(50),
  FATAL(60);

  private static final Map<String, LogLevel> BY_NAME =
      Map.of(
          "trace", TRACE,
          "debug", DEBUG,
          "info", INFO,
          "warning", WARN,
          "warn", WARN,
          "error", ERROR,
          "fatal", FATAL,
          "critical", FATAL);

  @Getter private final int value;

  LogLevel(int value) {
    this.value = value;
  }

  /**
   * Resolves a symbolic level name, case-insensitively.
   *
   * @param name level name such as {@code "warn"} or {@code "CRITICAL"}
   * @return the matching level, or {@link #INFO} when the name is null or not recognized
   */
  public static LogLevel fromName(String name) {
    if (name == null) {
      return INFO;
    }
    return BY_NAME.getOrDefault(name.trim().toLowerCase(Locale.ROOT), INFO);
  }

  /** Resolves a value already expressed on the canonical scale; anything else maps to INFO. */
  public static LogLevel fromValue(int value) {
    for (LogLevel level : values()) {
      if (level.value == value) {
        return level;
      }
    }
    return INFO;
  }
}
