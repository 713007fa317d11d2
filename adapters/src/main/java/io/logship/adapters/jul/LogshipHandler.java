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
package io.logship.adapters.jul;

import io.logship.api.EntryNormalizer;
import io.logship.api.ErrorInfo;
import io.logship.api.LogAdapter;
import io.logship.api.LogEntry;
import io.logship.api.LogSink;
import io.logship.api.NumericLevelScale;
import io.logship.lib.config.TransportConfig;
import io.logship.lib.transport.LogTransport;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.ErrorManager;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.LogRecord;
import java.util.logging.SimpleFormatter;

/**
 * {@code java.util.logging} handler shipping records through a {@link LogSink}.
 *
 * <pre>{@code
 * Logger logger = Logger.getLogger("my-app");
 * logger.addHandler(new LogshipHandler(TransportConfig.builder().channel("my-app").build()));
 * }</pre>
 */
public class LogshipHandler extends Handler implements LogAdapter<LogRecord> {
  static final String OWN_LOGGER_PREFIX = "io.logship";
  static final String FIELD_SOURCE_CLASS = "sourceClass";
  static final String FIELD_SOURCE_METHOD = "sourceMethod";

  private static final Formatter MESSAGE_FORMATTER = new SimpleFormatter();

  private final LogSink sink;
  private final LogTransport owned;

  public LogshipHandler(TransportConfig config) {
    this(LogTransport.create(config), true);
  }

  /** Publishes into a sink owned by the caller; {@link #close()} leaves it running. */
  public LogshipHandler(LogSink sink) {
    this(sink, false);
  }

  private LogshipHandler(LogSink sink, boolean owning) {
    this.sink = sink;
    this.owned = owning ? (LogTransport) sink : null;
  }

  /** Publishes into {@code transport} and shuts it down on {@link #close()}. */
  static LogshipHandler owning(LogTransport transport) {
    return new LogshipHandler(transport, true);
  }

  @Override
  public void publish(LogRecord record) {
    if (record == null || !isLoggable(record)) {
      return;
    }
    String loggerName = record.getLoggerName();
    if (loggerName != null && loggerName.startsWith(OWN_LOGGER_PREFIX)) {
      return;
    }
    try {
      sink.send(toEntry(record));
    } catch (Exception e) {
      reportError("Failed to ship log record", e, ErrorManager.WRITE_FAILURE);
    }
  }

  LogEntry toEntry(LogRecord record) {
    Map<String, Object> extra = new LinkedHashMap<>();
    if (record.getSourceClassName() != null) {
      extra.put(FIELD_SOURCE_CLASS, record.getSourceClassName());
    }
    if (record.getSourceMethodName() != null) {
      extra.put(FIELD_SOURCE_METHOD, record.getSourceMethodName());
    }
    LogEntry entry =
        EntryNormalizer.normalize(
                record.getLevel().intValue(),
                NumericLevelScale.JUL,
                formatMessage(record),
                record.getLoggerName(),
                extra)
            .withTime(record.getMillis());
    if (record.getThrown() != null) {
      entry = entry.withError(ErrorInfo.fromThrowable(record.getThrown()));
    }
    return entry;
  }

  private String formatMessage(LogRecord record) {
    Formatter formatter = getFormatter();
    return formatter != null ? formatter.format(record) : MESSAGE_FORMATTER.formatMessage(record);
  }

  @Override
  public void flush() {}

  @Override
  public void close() {
    if (owned == null) {
      return;
    }
    try {
      owned.shutdown();
    } catch (Exception e) {
      reportError("Failed to shut down log transport", e, ErrorManager.CLOSE_FAILURE);
    }
  }
}
