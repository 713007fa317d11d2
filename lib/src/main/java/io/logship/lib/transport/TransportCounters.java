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

import java.util.concurrent.atomic.AtomicLong;

class TransportCounters {
  private final AtomicLong enqueued = new AtomicLong();
  private final AtomicLong dropped = new AtomicLong();
  private final AtomicLong batchesSent = new AtomicLong();
  private final AtomicLong batchesFailed = new AtomicLong();
  private final AtomicLong entriesSent = new AtomicLong();
  private final AtomicLong entriesFailed = new AtomicLong();

  void increaseEnqueued() {
    enqueued.incrementAndGet();
  }

  void increaseDropped() {
    dropped.incrementAndGet();
  }

  void record(SendResult result) {
    switch (result.status()) {
      case SUCCESS -> {
        batchesSent.incrementAndGet();
        entriesSent.addAndGet(result.entryCount());
      }
      case FAILURE -> {
        batchesFailed.incrementAndGet();
        entriesFailed.addAndGet(result.entryCount());
      }
      case SKIPPED -> {}
    }
  }

  TransportStats snapshot() {
    return new TransportStats(
        enqueued.get(),
        dropped.get(),
        batchesSent.get(),
        batchesFailed.get(),
        entriesSent.get(),
        entriesFailed.get());
  }
}
