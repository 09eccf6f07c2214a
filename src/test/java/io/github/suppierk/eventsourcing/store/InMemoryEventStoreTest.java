package io.github.suppierk.eventsourcing.store;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.github.suppierk.eventsourcing.event.EventRecord;
import java.util.List;
import org.junit.jupiter.api.Test;

class InMemoryEventStoreTest extends EventStoreContract {
  @Override
  protected EventStore createStore() {
    return new InMemoryEventStore();
  }

  @Test
  void global_positions_must_start_from_one() {
    final var committed = store.append("idea-1", 0, ratings("idea-1", 1, 1, 2));

    assertEquals(List.of(1L, 2L), committed.stream().map(EventRecord::globalPosition).toList());
  }
}
