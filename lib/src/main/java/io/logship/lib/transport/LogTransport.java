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
import io.logship.api.LogSink;
import io.logship.lib.config.TransportConfig;
import io.logship.lib.config.TransportConfigValidator;
import java.io.Closeable;
import java.time.Duration;
import java.util.Collection;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Asynchronous, batching log transport. Callers {@link #send(LogEntry)} from any thread without
 * blocking; one background worker batches the entries and posts them through a {@link
 * BatchSender}. Delivery is best effort and errors never reach the caller.
 *
 * <p>Lifecycle: {@link #start()} spawns the worker and (optionally) a JVM shutdown hook; {@link
 * #shutdown(Duration)} stops accepting entries, drains what is buffered with one final flush and
 * releases the sender. Both are idempotent.
 */
@Slf4j
public class LogTransport implements LogSink, Closeable {

  @Getter private final TransportConfig config;
  private final BatchQueue<LogEntry> queue = new BatchQueue<>();
  private final TransportCounters counters = new TransportCounters();
  private final BatchSender sender;
  private final FlushLoop flushLoop;

  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean shutdown = new AtomicBoolean(false);
  private ExecutorService worker;
  private Thread shutdownHook;

  @VisibleForTesting
  public LogTransport(TransportConfig config, BatchSender sender) {
    new TransportConfigValidator().validateConfig(config);
    this.config = config;
    this.sender = sender;
    this.flushLoop =
        new FlushLoop(
            queue,
            sender,
            config.getBatchSize(),
            config.getFlushInterval(),
            config.getPollInterval(),
            counters);
  }

  /** Builds an HTTP transport for {@code config} and starts it. */
  public static LogTransport create(TransportConfig config) {
    new TransportConfigValidator().validateConfig(config);
    LogTransport transport = new LogTransport(config, HttpBatchSender.create(config));
    transport.start();
    return transport;
  }

  public synchronized void start() {
    if (shutdown.get()) {
      log.warn("LogTransport for channel {} already shut down, not starting", config.getChannel());
      return;
    }
    if (!started.compareAndSet(false, true)) {
      log.debug("LogTransport already started, skipping");
      return;
    }
    worker =
        Executors.newSingleThreadExecutor(
            r -> {
              Thread t = new Thread(r, "logship-flush-" + config.getChannel());
              t.setDaemon(true);
              return t;
            });
    worker.execute(flushLoop);

    if (config.isRegisterShutdownHook()) {
      shutdownHook = new Thread(this::shutdown, "logship-shutdown-" + config.getChannel());
      Runtime.getRuntime().addShutdownHook(shutdownHook);
    }
    log.info(
        "Started log transport to {} (channel={}, batchSize={}, flushInterval={})",
        config.getUrl(),
        config.getChannel(),
        config.getBatchSize(),
        config.getFlushInterval());
  }

  /** Queues an entry for delivery. Entries sent after shutdown are dropped. */
  @Override
  public void send(LogEntry entry) {
    if (queue.offer(entry)) {
      counters.increaseEnqueued();
    } else {
      counters.increaseDropped();
    }
  }

  public void sendAll(Collection<LogEntry> entries) {
    if (entries == null) {
      return;
    }
    entries.forEach(this::send);
  }

  public void shutdown() {
    shutdown(config.getShutdownTimeout());
  }

  /**
   * Stops accepting entries, flushes what is buffered and releases the sender. Waits at most
   * {@code timeout} for the final flush; past that it returns and leaves the worker to finish on
   * its own. Calls after the first are no-ops.
   */
  public synchronized void shutdown(Duration timeout) {
    if (!shutdown.compareAndSet(false, true)) {
      return;
    }
    queue.close();
    flushLoop.requestStop();

    if (started.get()) {
      worker.shutdown();
      try {
        if (!flushLoop.awaitStopped(timeout)) {
          log.warn(
              "Log transport for channel {} did not drain within {}, {} entries may be lost",
              config.getChannel(),
              timeout,
              queue.size());
        }
      } catch (InterruptedException e) {
        log.warn("Interrupted while draining log transport for channel {}", config.getChannel());
        Thread.currentThread().interrupt();
      }
    } else {
      // never started: drain on the caller's thread
      flushLoop.run();
    }
    sender.close();
    removeShutdownHook();
    log.info("Log transport for channel {} shut down: {}", config.getChannel(), getStats());
  }

  @Override
  public void close() {
    shutdown();
  }

  private void removeShutdownHook() {
    if (shutdownHook == null || Thread.currentThread() == shutdownHook) {
      return;
    }
    try {
      Runtime.getRuntime().removeShutdownHook(shutdownHook);
    } catch (IllegalStateException e) {
      log.debug("JVM already shutting down, keeping shutdown hook");
    }
  }

  public FlushLoop.State getState() {
    return flushLoop.getState();
  }

  public boolean isShutdown() {
    return shutdown.get();
  }

  public TransportStats getStats() {
    return counters.snapshot();
  }

  @VisibleForTesting
  int queuedCount() {
    return queue.size();
  }
}
