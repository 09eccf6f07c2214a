package io.github.suppierk.eventsourcing.jooq;

import io.github.suppierk.eventsourcing.snapshot.SnapshotStore;
import io.github.suppierk.eventsourcing.snapshot.SnapshotStoreContract;
import io.github.suppierk.test.TestDatabase;

class JooqSnapshotStoreTest extends SnapshotStoreContract {
  @Override
  protected SnapshotStore createStore() {
    return new JooqSnapshotStore(TestDatabase.create());
  }
}
