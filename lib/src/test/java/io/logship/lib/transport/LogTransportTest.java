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

import static org.junit.jupiter.api.Assertions.*;

import io.logship.api.EntryNormalizer;
import io.logship.api.LogEntry;
import io.logship.lib.config.TransportConfig;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class LogTransportTest {

  private final RecordingBatchSender sender = new RecordingBatchSender();

  private static TransportConfig.TransportConfigBuilder config() {
    return TransportConfig.builder()
        .channel("test-channel")
        .pollInterval(Duration.ofMillis(20))
        .registerShutdownHook(false);
  }

  private static LogEntry entry(String msg) {
    return EntryNormalizer.normalize("info", msg, null, null);
  }

  private LogTransport started(TransportConfig config) {
    LogTransport transport = new LogTransport(config, sender);
    transport.start();
    return transport;
  }

  @Test
  void testBatchSizeFlush() throws InterruptedException {
    try (LogTransport transport =
        started(config().batchSize(2).flushInterval(Duration.ofSeconds(10)).build())) {
      transport.send(entry("test1"));
      transport.send(entry("test2"));

      assertTrue(sender.awaitBatches(1, Duration.ofSeconds(2)));
      assertEquals(List.of("test1", "test2"), sender.sentMessages());
    }
  }

  @Test
  void testIntervalFlush() throws InterruptedException {
    try (LogTransport transport =
        started(config().batchSize(100).flushInterval(Duration.ofMillis(100)).build())) {
      transport.send(entry("only"));
      TimeUnit.MILLISECONDS.sleep(300);

      assertEquals(1, sender.batches.size());
      assertEquals(1, sender.batches.get(0).size());
    }
  }

  @Test
  void testShutdownFlushesRemaining() {
    LogTransport transport =
        started(config().batchSize(100).flushInterval(Duration.ofSeconds(10)).build());
    transport.send(entry("test"));

    transport.shutdown(Duration.ofSeconds(2));

    assertEquals(1, sender.batches.size());
    assertEquals(List.of("test"), sender.sentMessages());
    assertEquals(FlushLoop.State.STOPPED, transport.getState());
    assertTrue(transport.isShutdown());
  }

  @Test
  void testDoubleShutdownFlushesOnce() {
    LogTransport transport =
        started(config().batchSize(100).flushInterval(Duration.ofSeconds(10)).build());
    transport.send(entry("test"));

    transport.shutdown(Duration.ofSeconds(2));
    transport.shutdown(Duration.ofSeconds(2));
    transport.close();

    assertEquals(1, sender.batches.size());
    assertEquals(1, sender.closeCount.get());
  }

  @Test
  void testSendAfterShutdownIsDropped() {
    LogTransport transport = started(config().build());
    transport.shutdown(Duration.ofSeconds(2));

    assertDoesNotThrow(() -> transport.send(entry("late")));

    assertTrue(sender.batches.isEmpty());
    TransportStats stats = transport.getStats();
    assertEquals(0, stats.enqueued());
    assertEquals(1, stats.dropped());
  }

  @Test
  void testShutdownWithoutStartDrainsOnCallerThread() {
    LogTransport transport = new LogTransport(config().build(), sender);
    transport.sendAll(List.of(entry("a"), entry("b")));
    assertEquals(2, transport.queuedCount());

    transport.shutdown(Duration.ofSeconds(1));

    assertEquals(List.of("a", "b"), sender.sentMessages());
  }

  @Test
  void testShutdownReturnsWhenDrainTimesOut() throws InterruptedException {
    CountDownLatch release = new CountDownLatch(1);
    CountDownLatch sending = new CountDownLatch(1);
    BatchSender stuck =
        entries -> {
          sending.countDown();
          try {
            release.await(10, TimeUnit.SECONDS);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          return SendResult.success(entries.size(), 200);
        };
    LogTransport transport = new LogTransport(config().batchSize(1).build(), stuck);
    transport.start();
    transport.send(entry("blocked"));
    assertTrue(sending.await(2, TimeUnit.SECONDS));

    long start = System.nanoTime();
    transport.shutdown(Duration.ofMillis(200));
    long elapsed = System.nanoTime() - start;

    assertTrue(elapsed < Duration.ofSeconds(5).toNanos());
    assertNotEquals(FlushLoop.State.STOPPED, transport.getState());
    release.countDown();
  }

  @Test
  void testStatsCountDeliveredEntries() {
    LogTransport transport = started(config().batchSize(3).build());
    for (int i = 0; i < 7; i++) {
      transport.send(entry("m" + i));
    }
    transport.shutdown(Duration.ofSeconds(2));

    TransportStats stats = transport.getStats();
    assertEquals(7, stats.enqueued());
    assertEquals(7, stats.entriesSent());
    assertEquals(0, stats.entriesFailed());
    assertEquals(sender.batches.size(), stats.batchesSent());
    assertEquals(7, sender.sentCount());
  }

  @Test
  void testStartIsIdempotent() {
    LogTransport transport = started(config().build());
    transport.start();
    transport.send(entry("once"));
    transport.shutdown(Duration.ofSeconds(2));

    assertEquals(List.of("once"), sender.sentMessages());
  }

  @Test
  void testShutdownHookIsRemovedOnShutdown() {
    LogTransport transport = started(config().registerShutdownHook(true).build());
    assertDoesNotThrow(() -> transport.shutdown(Duration.ofSeconds(1)));
  }

  @Test
  void testInvalidConfigIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new LogTransport(config().batchSize(0).build(), sender));
  }
}
