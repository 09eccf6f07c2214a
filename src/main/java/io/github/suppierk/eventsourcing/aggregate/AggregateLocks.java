/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.suppierk.eventsourcing.aggregate;

import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfBlank;
import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfNull;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Pessimistic alternative to optimistic concurrency: grants exclusive access to one aggregate at a
 * time within this process.
 *
 * <p>Waiting is always bounded by the configured timeout. Locks of different aggregates are
 * independent, and a lock is dropped once nobody holds or waits for it.
 */
public final class AggregateLocks {
  private final ConcurrentMap<String, UsageCountedLock> locks;
  private final Duration timeout;

  /**
   * @param timeout maximum time to wait for the lock of one aggregate
   */
  public AggregateLocks(final Duration timeout) {
    final Duration nonNullTimeout = throwIllegalArgumentIfNull(timeout, "Lock timeout");
    if (nonNullTimeout.isNegative() || nonNullTimeout.isZero()) {
      throw new IllegalArgumentException("Lock timeout must be positive, got " + nonNullTimeout);
    }

    this.locks = new ConcurrentHashMap<>();
    this.timeout = nonNullTimeout;
  }

  /**
   * @param aggregateId to lock
   * @param action to run while holding the lock
   * @param <T> is the type of the action result
   * @return the result of the action
   * @throws LockTimeoutException if the lock was not acquired within the timeout or the waiting
   *     thread was interrupted
   */
  public <T> T withLock(final String aggregateId, final Supplier<T> action) {
    throwIllegalArgumentIfBlank(aggregateId, "Aggregate ID");
    throwIllegalArgumentIfNull(action, "Action");

    final UsageCountedLock lock =
        locks.compute(
            aggregateId,
            (id, existing) -> {
              final UsageCountedLock used = existing == null ? new UsageCountedLock() : existing;
              used.users++;
              return used;
            });

    try {
      acquire(aggregateId, lock.lock);
      try {
        return action.get();
      } finally {
        lock.lock.unlock();
      }
    } finally {
      locks.computeIfPresent(
          aggregateId, (id, existing) -> --existing.users == 0 ? null : existing);
    }
  }

  /**
   * @return number of aggregates currently locked or awaited
   */
  int size() {
    return locks.size();
  }

  private void acquire(final String aggregateId, final ReentrantLock lock) {
    final boolean acquired;
    try {
      acquired = lock.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new LockTimeoutException(aggregateId, timeout, e);
    }

    if (!acquired) {
      throw new LockTimeoutException(aggregateId, timeout);
    }
  }

  /** Mutated only inside {@link ConcurrentMap#compute} of its key. */
  private static final class UsageCountedLock {
    private final ReentrantLock lock = new ReentrantLock();
    private int users;
  }
}
