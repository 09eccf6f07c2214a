package io.github.suppierk.eventsourcing.snapshot;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Behavior every {@link SnapshotStore} implementation must share. */
public abstract class SnapshotStoreContract {
  static final Instant NOW = Instant.parse("2024-05-01T10:15:30.123Z");

  protected SnapshotStore store;

  protected abstract SnapshotStore createStore();

  @BeforeEach
  protected void setUp() {
    store = createStore();
  }

  static Snapshot snapshot(String aggregateId, long version, String state) {
    return new Snapshot(aggregateId, "ClusterUser", version, state, NOW);
  }

  @Test
  void latest_snapshot_must_be_empty_for_unknown_aggregate() {
    assertEquals(Optional.empty(), store.latestSnapshot("user-1"));
  }

  @Test
  void latest_snapshot_must_have_the_highest_version() {
    store.save(snapshot("user-1", 200, "{\"n\":200}"));
    store.save(snapshot("user-1", 100, "{\"n\":100}"));
    store.save(snapshot("user-2", 300, "{\"n\":300}"));

    final var latest = store.latestSnapshot("user-1").orElseThrow();

    assertEquals(200L, latest.version());
    assertEquals("{\"n\":200}", latest.state());
    assertEquals(NOW, latest.createdAt());
  }

  @Test
  void saving_the_same_snapshot_twice_must_be_accepted() {
    store.save(snapshot("user-1", 100, "{\"n\":100}"));

    assertDoesNotThrow(() -> store.save(snapshot("user-1", 100, "{\"n\":100}")));
    assertTrue(store.latestSnapshot("user-1").isPresent());
  }

  @Test
  void when_different_snapshot_exists_at_the_same_version_illegal_state_must_be_thrown() {
    store.save(snapshot("user-1", 100, "{\"n\":100}"));
    final var different = snapshot("user-1", 100, "{\"n\":-1}");

    assertThrows(IllegalStateException.class, () -> store.save(different));
    assertEquals("{\"n\":100}", store.latestSnapshot("user-1").orElseThrow().state());
  }

  @Test
  void when_arguments_are_missing_illegal_argument_must_be_thrown() {
    assertThrows(IllegalArgumentException.class, () -> store.save(null));
    assertThrows(IllegalArgumentException.class, () -> store.latestSnapshot(" "));
  }
}
