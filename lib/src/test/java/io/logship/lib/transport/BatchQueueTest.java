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

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class BatchQueueTest {

  @Test
  void testFifoOrder() throws InterruptedException {
    BatchQueue<String> queue = new BatchQueue<>();
    queue.offer("a");
    queue.offer("b");
    queue.offer("c");

    assertEquals("a", queue.poll(Duration.ofMillis(10)));
    assertEquals("b", queue.poll(Duration.ofMillis(10)));
    assertEquals("c", queue.poll(Duration.ofMillis(10)));
  }

  @Test
  void testPollTimesOutWithNull() throws InterruptedException {
    BatchQueue<String> queue = new BatchQueue<>();
    long start = System.nanoTime();
    assertNull(queue.poll(Duration.ofMillis(50)));
    assertTrue(System.nanoTime() - start >= Duration.ofMillis(40).toNanos());
  }

  @Test
  void testOfferAfterCloseIsDropped() {
    BatchQueue<String> queue = new BatchQueue<>();
    assertTrue(queue.offer("kept"));
    queue.close();

    assertFalse(queue.offer("dropped"));
    assertTrue(queue.isClosed());
    assertEquals(1, queue.size());
  }

  @Test
  void testNullIsDropped() {
    BatchQueue<String> queue = new BatchQueue<>();
    assertFalse(queue.offer(null));
    assertEquals(0, queue.size());
  }

  @Test
  void testDrainKeepsOrderAfterClose() {
    BatchQueue<String> queue = new BatchQueue<>();
    queue.offer("x");
    queue.offer("y");
    queue.close();

    List<String> drained = new ArrayList<>(List.of("w"));
    assertEquals(2, queue.drainTo(drained));
    assertEquals(List.of("w", "x", "y"), drained);
  }

  @Test
  void testNoOfferLandsAfterClose() throws InterruptedException {
    BatchQueue<Integer> queue = new BatchQueue<>();
    AtomicInteger accepted = new AtomicInteger();
    CountDownLatch go = new CountDownLatch(1);
    ExecutorService producers = Executors.newFixedThreadPool(4);
    for (int p = 0; p < 4; p++) {
      producers.execute(
          () -> {
            try {
              go.await();
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
              return;
            }
            for (int i = 0; i < 50_000; i++) {
              if (queue.offer(i)) {
                accepted.incrementAndGet();
              }
            }
          });
    }
    go.countDown();
    Thread.sleep(5);
    queue.close();
    List<Integer> drained = new ArrayList<>();
    queue.drainTo(drained);

    producers.shutdown();
    assertTrue(producers.awaitTermination(30, TimeUnit.SECONDS));
    assertEquals(0, queue.size());
    assertEquals(accepted.get(), drained.size());
  }
}
