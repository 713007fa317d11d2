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

import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import org.apache.commons.lang3.StringUtils;

/**
 * Builds canonical {@link LogEntry} values from a level, a message, an optional source name and a
 * bag of extra fields. Level resolution never fails: anything unrecognized becomes INFO.
 */
public class EntryNormalizer {

  public static final EntryNormalizer DEFAULT =
      new EntryNormalizer(Clock.systemUTC(), () -> UUID.randomUUID().toString());

  private final Clock clock;
  private final Supplier<String> idGenerator;

  @VisibleForTesting
  public EntryNormalizer(Clock clock, Supplier<String> idGenerator) {
    this.clock = clock;
    this.idGenerator = idGenerator;
  }

  public static LogEntry normalize(
      String level, String msg, String name, Map<String, Object> extra) {
    return DEFAULT.create(LogLevel.fromName(level), msg, name, extra);
  }

  /** Numeric levels without an explicit scale are read on the stdlib-style scale. */
  public static LogEntry normalize(int level, String msg, String name, Map<String, Object> extra) {
    return normalize(level, NumericLevelScale.STANDARD, msg, name, extra);
  }

  public static LogEntry normalize(
      int level, NumericLevelScale scale, String msg, String name, Map<String, Object> extra) {
    return DEFAULT.create(scale.toCanonical(level), msg, name, extra);
  }

  public static LogEntry normalize(
      LogLevel level, String msg, String name, Map<String, Object> extra) {
    return DEFAULT.create(level, msg, name, extra);
  }

  public LogEntry create(LogLevel level, String msg, String name, Map<String, Object> extra) {
    return LogEntry.builder()
        .id(idGenerator.get())
        .level(level == null ? LogLevel.INFO : level)
        .time(clock.millis())
        .msg(msg == null ? StringUtils.EMPTY : msg)
        .name(StringUtils.trimToNull(name))
        .extra(extra)
        .build();
  }
}
