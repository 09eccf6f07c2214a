package io.github.suppierk.eventsourcing.aggregate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class AggregateLocksTest {
  @Test
  void action_result_must_be_returned_and_lock_released() {
    final var locks = new AggregateLocks(Duration.ofSeconds(1));

    assertEquals("done", locks.withLock("idea-1", () -> "done"));
    assertEquals(0, locks.size());
  }

  @Test
  void lock_must_be_released_when_action_fails() {
    final var locks = new AggregateLocks(Duration.ofSeconds(1));

    assertThrows(
        IllegalStateException.class,
        () ->
            locks.withLock(
                "idea-1",
                () -> {
                  throw new IllegalStateException("Failure");
                }));
    assertEquals(0, locks.size());
    assertEquals(1, locks.withLock("idea-1", () -> 1));
  }

  @Test
  void actions_on_the_same_aggregate_must_not_overlap() throws Exception {
    final var locks = new AggregateLocks(Duration.ofSeconds(10));
    final var executor = Executors.newFixedThreadPool(4);
    final var active = new AtomicInteger();
    final var maxActive = new AtomicInteger();

    try {
      final List<Future<Integer>> futures = new ArrayList<>();
      for (int i = 0; i < 20; i++) {
        futures.add(
            executor.submit(
                () ->
                    locks.withLock(
                        "idea-1",
                        () -> {
                          maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
                          Thread.yield();
                          return active.decrementAndGet();
                        })));
      }

      for (Future<Integer> future : futures) {
        future.get(10, TimeUnit.SECONDS);
      }

      assertEquals(1, maxActive.get());
      assertEquals(0, locks.size());
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void waiting_longer_than_timeout_must_fail_with_lock_timeout() throws Exception {
    final var locks = new AggregateLocks(Duration.ofMillis(50));
    final var executor = Executors.newSingleThreadExecutor();
    final var acquired = new CountDownLatch(1);
    final var release = new CountDownLatch(1);

    try {
      final Future<Boolean> holder =
          executor.submit(
              () ->
                  locks.withLock(
                      "idea-1",
                      () -> {
                        acquired.countDown();
                        try {
                          return release.await(10, TimeUnit.SECONDS);
                        } catch (InterruptedException e) {
                          Thread.currentThread().interrupt();
                          throw new IllegalStateException(e);
                        }
                      }));
      assertTrue(acquired.await(10, TimeUnit.SECONDS));

      final var exception =
          assertThrows(LockTimeoutException.class, () -> locks.withLock("idea-1", () -> 1));
      assertEquals("idea-1", exception.getAggregateId());
      assertEquals(503, exception.getStatusCode());

      assertEquals(2, locks.withLock("idea-2", () -> 2));

      release.countDown();
      assertTrue(holder.get(10, TimeUnit.SECONDS));
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void when_timeout_is_not_positive_illegal_argument_must_be_thrown() {
    assertThrows(IllegalArgumentException.class, () -> new AggregateLocks(Duration.ZERO));
    assertThrows(IllegalArgumentException.class, () -> new AggregateLocks(null));
  }
}
