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
package io.logship.adapters.log4j;

import io.logship.api.EntryNormalizer;
import io.logship.api.ErrorInfo;
import io.logship.api.LogAdapter;
import io.logship.api.LogEntry;
import io.logship.api.LogSink;
import io.logship.api.NumericLevelScale;
import io.logship.lib.config.TransportConfig;
import io.logship.lib.config.TransportConfigParser;
import io.logship.lib.transport.LogTransport;
import java.io.Serializable;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.core.Appender;
import org.apache.logging.log4j.core.Core;
import org.apache.logging.log4j.core.Filter;
import org.apache.logging.log4j.core.Layout;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.StringLayout;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Property;
import org.apache.logging.log4j.core.config.plugins.Plugin;
import org.apache.logging.log4j.core.config.plugins.PluginBuilderAttribute;
import org.apache.logging.log4j.core.config.plugins.PluginBuilderFactory;

/**
 * Log4j2 appender shipping events through a {@link LogSink}. Configured as {@code <Logship
 * name="..." url="..." channel="..."/>}; nested {@code <Property>} elements become request
 * headers.
 */
@Plugin(
    name = LogshipAppender.PLUGIN_NAME,
    category = Core.CATEGORY_NAME,
    elementType = Appender.ELEMENT_TYPE,
    printObject = true)
public final class LogshipAppender extends AbstractAppender implements LogAdapter<LogEvent> {
  public static final String PLUGIN_NAME = "Logship";
  static final String OWN_LOGGER_PREFIX = "io.logship";
  static final String FIELD_THREAD = "thread";

  private final LogSink sink;
  private final LogTransport owned;

  private LogshipAppender(
      String name,
      Filter filter,
      Layout<? extends Serializable> layout,
      boolean ignoreExceptions,
      Property[] properties,
      LogSink sink,
      LogTransport owned) {
    super(name, filter, layout, ignoreExceptions, properties);
    this.sink = sink;
    this.owned = owned;
  }

  @PluginBuilderFactory
  public static Builder newBuilder() {
    return new Builder();
  }

  @Override
  public void append(LogEvent event) {
    publish(event);
  }

  @Override
  public void publish(LogEvent event) {
    String loggerName = event.getLoggerName();
    if (loggerName != null && loggerName.startsWith(OWN_LOGGER_PREFIX)) {
      return;
    }
    sink.send(toEntry(event));
  }

  LogEntry toEntry(LogEvent event) {
    Map<String, Object> extra = new LinkedHashMap<>(event.getContextData().toMap());
    if (event.getThreadName() != null) {
      extra.put(FIELD_THREAD, event.getThreadName());
    }
    LogEntry entry =
        EntryNormalizer.normalize(
                event.getLevel().intLevel(),
                NumericLevelScale.LOG4J,
                renderMessage(event),
                event.getLoggerName(),
                extra)
            .withTime(event.getTimeMillis());
    if (event.getThrown() != null) {
      entry = entry.withError(ErrorInfo.fromThrowable(event.getThrown()));
    }
    return entry;
  }

  private String renderMessage(LogEvent event) {
    Layout<? extends Serializable> layout = getLayout();
    if (layout instanceof StringLayout) {
      return ((StringLayout) layout).toSerializable(event);
    }
    if (layout != null) {
      return String.valueOf(layout.toSerializable(event));
    }
    return event.getMessage().getFormattedMessage();
  }

  @Override
  public boolean stop(long timeout, TimeUnit timeUnit) {
    setStopping();
    boolean stopped = super.stop(timeout, timeUnit, false);
    if (owned != null) {
      owned.shutdown(
          timeout > 0
              ? Duration.ofNanos(timeUnit.toNanos(timeout))
              : owned.getConfig().getShutdownTimeout());
    }
    setStopped();
    return stopped;
  }

  public static class Builder extends AbstractAppender.Builder<Builder>
      implements org.apache.logging.log4j.core.util.Builder<LogshipAppender> {

    @PluginBuilderAttribute private String url = TransportConfig.DEFAULT_URL;

    @PluginBuilderAttribute private String channel = TransportConfig.DEFAULT_CHANNEL;

    @PluginBuilderAttribute private int batchSize = TransportConfig.DEFAULT_BATCH_SIZE;

    /** Seconds. */
    @PluginBuilderAttribute private double flushInterval = 1.0;

    /** Seconds. */
    @PluginBuilderAttribute private double timeout = 5.0;

    @PluginBuilderAttribute(sensitive = true)
    private String secretKey;

    private LogSink sink;

    private LogTransport transport;

    public Builder setUrl(String url) {
      this.url = url;
      return this;
    }

    public Builder setChannel(String channel) {
      this.channel = channel;
      return this;
    }

    public Builder setBatchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    public Builder setFlushInterval(double flushInterval) {
      this.flushInterval = flushInterval;
      return this;
    }

    public Builder setTimeout(double timeout) {
      this.timeout = timeout;
      return this;
    }

    public Builder setSecretKey(String secretKey) {
      this.secretKey = secretKey;
      return this;
    }

    /** Publishes into a caller-owned sink instead of creating a transport. */
    public Builder setSink(LogSink sink) {
      this.sink = sink;
      return this;
    }

    /** Publishes into {@code transport} and shuts it down when the appender stops. */
    Builder setTransport(LogTransport transport) {
      this.transport = transport;
      return this;
    }

    TransportConfig toTransportConfig() {
      Map<String, Object> options = new LinkedHashMap<>();
      options.put(TransportConfigParser.KEY_URL, url);
      options.put(TransportConfigParser.KEY_CHANNEL, channel);
      options.put(TransportConfigParser.KEY_BATCH_SIZE, batchSize);
      options.put(TransportConfigParser.KEY_FLUSH_INTERVAL, flushInterval);
      options.put(TransportConfigParser.KEY_TIMEOUT, timeout);
      options.put(TransportConfigParser.KEY_SECRET_KEY, secretKey);
      Map<String, Object> headers = new LinkedHashMap<>();
      Property[] properties = getPropertyArray();
      if (properties != null) {
        for (Property property : properties) {
          headers.put(property.getName(), property.getValue());
        }
      }
      options.put(TransportConfigParser.KEY_HEADERS, headers);
      // the appender stops the transport with the logging context
      options.put(TransportConfigParser.KEY_REGISTER_SHUTDOWN_HOOK, false);
      return new TransportConfigParser().parse(options);
    }

    @Override
    public LogshipAppender build() {
      LogTransport owned = null;
      LogSink target = sink;
      if (target == null) {
        owned = transport != null ? transport : LogTransport.create(toTransportConfig());
        target = owned;
      }
      return new LogshipAppender(
          getName(),
          getFilter(),
          getLayout(),
          isIgnoreExceptions(),
          Property.EMPTY_ARRAY,
          target,
          owned);
    }
  }
}
