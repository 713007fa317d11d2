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

import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.function.IntFunction;

/**
 * Numeric level vocabularies of the logging front-ends, each remapped onto the canonical {@link
 * LogLevel} scale. Front-ends disagree on numbers (for example 40 is ERROR on the stdlib-style
 * scale but WARN on the canonical one), so a bare number is only meaningful together with its
 * scale.
 */
public enum NumericLevelScale {

  /** Stdlib-style scale: 10 debug .. 50 critical. Also matches SLF4J's {@code Level.toInt()}. */
  STANDARD(
      exact(
          Map.of(
              0, LogLevel.TRACE,
              10, LogLevel.DEBUG,
              20, LogLevel.INFO,
              30, LogLevel.WARN,
              40, LogLevel.ERROR,
              50, LogLevel.FATAL))),

  /** {@code java.util.logging.Level#intValue()}; custom levels fall to the next lower threshold. */
  JUL(
      threshold(
          Map.of(
              Integer.MIN_VALUE, LogLevel.TRACE,
              500, LogLevel.DEBUG,
              700, LogLevel.INFO,
              900, LogLevel.WARN,
              1000, LogLevel.ERROR))),

  /**
   * Log4j2 {@code Level#intLevel()}, where smaller numbers are more severe. Custom levels fall to
   * the next more severe standard level, as {@code StandardLevel.getStandardLevel} does.
   */
  LOG4J(
      threshold(
          Map.of(
              Integer.MIN_VALUE, LogLevel.FATAL,
              200, LogLevel.ERROR,
              300, LogLevel.WARN,
              400, LogLevel.INFO,
              500, LogLevel.DEBUG,
              600, LogLevel.TRACE))),

  /** Values already on the canonical scale. */
  CANONICAL(LogLevel::fromValue);

  private final IntFunction<LogLevel> mapping;

  NumericLevelScale(IntFunction<LogLevel> mapping) {
    this.mapping = mapping;
  }

  /** Maps a level number of this scale onto the canonical scale; unknown numbers become INFO. */
  public LogLevel toCanonical(int level) {
    return mapping.apply(level);
  }

  private static IntFunction<LogLevel> exact(Map<Integer, LogLevel> table) {
    return level -> table.getOrDefault(level, LogLevel.INFO);
  }

  private static IntFunction<LogLevel> threshold(Map<Integer, LogLevel> table) {
    NavigableMap<Integer, LogLevel> floors = new TreeMap<>(table);
    return level -> floors.floorEntry(level).getValue();
  }
}
