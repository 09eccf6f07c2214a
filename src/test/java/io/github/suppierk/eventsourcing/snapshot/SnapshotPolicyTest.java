package io.github.suppierk.eventsourcing.snapshot;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class SnapshotPolicyTest {
  @Test
  void every_n_events_must_fire_once_per_crossed_multiple() {
    final var policy = SnapshotPolicy.everyNEvents(100);
    final List<Long> snapshotVersions = new ArrayList<>();

    for (long version = 1; version <= 250; version++) {
      if (policy.shouldSnapshot(version - 1, version)) {
        snapshotVersions.add(version);
      }
    }

    assertEquals(List.of(100L, 200L), snapshotVersions);
  }

  @Test
  void batch_crossing_a_multiple_must_fire() {
    final var policy = SnapshotPolicy.everyNEvents(100);

    assertTrue(policy.shouldSnapshot(98, 103));
    assertFalse(policy.shouldSnapshot(100, 150));
    assertFalse(policy.shouldSnapshot(0, 0));
  }

  @Test
  void never_must_not_fire() {
    assertFalse(SnapshotPolicy.never().shouldSnapshot(0, 1_000));
  }

  @Test
  void when_interval_is_not_positive_illegal_argument_must_be_thrown() {
    assertThrows(IllegalArgumentException.class, () -> SnapshotPolicy.everyNEvents(0));
  }

  @Test
  void disabled_store_must_keep_nothing() {
    final var store = SnapshotStore.disabled();

    store.save(new Snapshot("user-1", "ClusterUser", 1, "{}", Instant.now()));

    assertEquals(Optional.empty(), store.latestSnapshot("user-1"));
  }
}
