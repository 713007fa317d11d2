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

import io.logship.api.LogEntry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Single consumer of a {@link BatchQueue}. Collects entries into a batch and hands the batch to a
 * {@link BatchSender} when it reaches {@code batchSize} entries or when {@code flushInterval} has
 * passed since the previous flush, whichever comes first. After {@link #requestStop()} it drains
 * what is left with one final flush and stops.
 */
@Slf4j
public class FlushLoop implements Runnable {

  public enum State {
    RUNNING,
    DRAINING,
    STOPPED
  }

  private final BatchQueue<LogEntry> queue;
  private final BatchSender sender;
  private final int batchSize;
  private final long flushIntervalNanos;
  private final Duration pollInterval;
  private final TransportCounters counters;

  private final CountDownLatch stopped = new CountDownLatch(1);
  private volatile boolean stopRequested = false;
  private volatile State state = State.RUNNING;

  FlushLoop(
      BatchQueue<LogEntry> queue,
      BatchSender sender,
      int batchSize,
      Duration flushInterval,
      Duration pollInterval,
      TransportCounters counters) {
    this.queue = queue;
    this.sender = sender;
    this.batchSize = batchSize;
    this.flushIntervalNanos = flushInterval.toNanos();
    this.pollInterval = pollInterval;
    this.counters = counters;
  }

  @Override
  public void run() {
    List<LogEntry> batch = new ArrayList<>();
    long lastFlush = System.nanoTime();
    try {
      while (!stopRequested) {
        LogEntry entry;
        try {
          entry = queue.poll(pollInterval);
        } catch (InterruptedException e) {
          log.debug("Flush loop interrupted, draining");
          Thread.currentThread().interrupt();
          break;
        }

        if (entry != null) {
          batch.add(entry);
          if (batch.size() >= batchSize) {
            flush(batch);
            batch = new ArrayList<>();
            lastFlush = System.nanoTime();
            continue;
          }
        }

        if (!batch.isEmpty() && System.nanoTime() - lastFlush >= flushIntervalNanos) {
          flush(batch);
          batch = new ArrayList<>();
          lastFlush = System.nanoTime();
        }
      }

      state = State.DRAINING;
      int remaining = queue.drainTo(batch);
      log.debug(
          "Final flush: {} buffered, {} drained from queue", batch.size() - remaining, remaining);
      flush(batch);
    } finally {
      state = State.STOPPED;
      stopped.countDown();
    }
  }

  /** Asks the loop to drain and stop; observed on the next iteration. */
  public void requestStop() {
    stopRequested = true;
  }

  /**
   * @return true if the loop reached {@link State#STOPPED} within the timeout
   */
  public boolean awaitStopped(Duration timeout) throws InterruptedException {
    return stopped.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  public State getState() {
    return state;
  }

  private void flush(List<LogEntry> batch) {
    if (batch.isEmpty()) {
      return;
    }
    log.debug("Flushing {} entries", batch.size());
    SendResult result;
    try {
      result = sender.sendBatch(List.copyOf(batch));
    } catch (Exception e) {
      log.error("Batch sender failed unexpectedly", e);
      result = SendResult.failure(batch.size(), null, e.toString());
    }
    counters.record(result);
  }
}
