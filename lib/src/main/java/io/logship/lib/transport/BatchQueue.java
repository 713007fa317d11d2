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

import java.time.Duration;
import java.util.Collection;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Unbounded FIFO between producer threads and the single flush-loop consumer. Offers never block;
 * once closed, new offers are dropped while already queued elements stay available to drain.
 */
public class BatchQueue<T> {
  private final LinkedBlockingQueue<T> queue = new LinkedBlockingQueue<>();
  // offers share the read lock; close takes the write lock so no offer lands after it returns
  private final ReadWriteLock closeLock = new ReentrantReadWriteLock();
  private volatile boolean closed = false;

  /**
   * @return false if the element was dropped because it is null or the queue is closed
   */
  public boolean offer(T element) {
    if (element == null) {
      return false;
    }
    closeLock.readLock().lock();
    try {
      return !closed && queue.offer(element);
    } finally {
      closeLock.readLock().unlock();
    }
  }

  /** Waits up to {@code timeout} for the next element; returns null when none arrived. */
  public T poll(Duration timeout) throws InterruptedException {
    return queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  public int drainTo(Collection<? super T> target) {
    return queue.drainTo(target);
  }

  public void close() {
    closeLock.writeLock().lock();
    try {
      closed = true;
    } finally {
      closeLock.writeLock().unlock();
    }
  }

  public boolean isClosed() {
    return closed;
  }

  public int size() {
    return queue.size();
  }
}
