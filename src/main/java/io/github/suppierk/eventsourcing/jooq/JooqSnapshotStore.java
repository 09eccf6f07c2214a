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

package io.github.suppierk.eventsourcing.jooq;

import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfBlank;
import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfNull;

import io.github.suppierk.eventsourcing.jooq.EventStoreSchema.Snapshots;
import io.github.suppierk.eventsourcing.snapshot.Snapshot;
import io.github.suppierk.eventsourcing.snapshot.SnapshotStore;
import io.github.suppierk.eventsourcing.store.StoreUnavailableException;
import java.util.Optional;
import org.jooq.DSLContext;
import org.jooq.Record;
import org.jooq.exception.DataAccessException;
import org.jooq.exception.SQLStateClass;

/** {@link SnapshotStore} persisted through jOOQ. */
public final class JooqSnapshotStore implements SnapshotStore {
  private final DSLContext dsl;

  public JooqSnapshotStore(final DSLContext dsl) {
    this.dsl = throwIllegalArgumentIfNull(dsl, "DSLContext");
  }

  /** {@inheritDoc} */
  @Override
  public Optional<Snapshot> latestSnapshot(final String aggregateId) {
    throwIllegalArgumentIfBlank(aggregateId, "Aggregate ID");

    try {
      return dsl.select(
              Snapshots.AGGREGATE_ID,
              Snapshots.AGGREGATE_TYPE,
              Snapshots.VERSION,
              Snapshots.STATE,
              Snapshots.CREATED_AT)
          .from(Snapshots.TABLE)
          .where(Snapshots.AGGREGATE_ID.eq(aggregateId))
          .orderBy(Snapshots.VERSION.desc())
          .limit(1)
          .fetchOptional()
          .map(JooqSnapshotStore::toSnapshot);
    } catch (DataAccessException e) {
      throw new StoreUnavailableException(
          "Failed to read the snapshot of '%s'".formatted(aggregateId), e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void save(final Snapshot snapshot) {
    final Snapshot nonNullSnapshot = throwIllegalArgumentIfNull(snapshot, "Snapshot");

    try {
      dsl.insertInto(Snapshots.TABLE)
          .set(Snapshots.AGGREGATE_ID, nonNullSnapshot.aggregateId())
          .set(Snapshots.VERSION, nonNullSnapshot.version())
          .set(Snapshots.AGGREGATE_TYPE, nonNullSnapshot.aggregateType())
          .set(Snapshots.STATE, nonNullSnapshot.state())
          .set(Snapshots.CREATED_AT, EventStoreSchema.toUtc(nonNullSnapshot.createdAt()))
          .execute();
    } catch (DataAccessException e) {
      if (e.sqlStateClass() != SQLStateClass.C23_INTEGRITY_CONSTRAINT_VIOLATION) {
        throw new StoreUnavailableException(
            "Failed to save the snapshot of '%s'".formatted(nonNullSnapshot.aggregateId()), e);
      }

      verifySameContent(nonNullSnapshot, e);
    }
  }

  private void verifySameContent(final Snapshot snapshot, final DataAccessException cause) {
    final Optional<Snapshot> existing =
        dsl.select(
                Snapshots.AGGREGATE_ID,
                Snapshots.AGGREGATE_TYPE,
                Snapshots.VERSION,
                Snapshots.STATE,
                Snapshots.CREATED_AT)
            .from(Snapshots.TABLE)
            .where(Snapshots.AGGREGATE_ID.eq(snapshot.aggregateId()))
            .and(Snapshots.VERSION.eq(snapshot.version()))
            .fetchOptional()
            .map(JooqSnapshotStore::toSnapshot);

    if (existing.isEmpty() || !existing.get().hasSameContentAs(snapshot)) {
      throw new IllegalStateException(
          "Aggregate '%s' already has a different snapshot at version %d"
              .formatted(snapshot.aggregateId(), snapshot.version()),
          cause);
    }
  }

  private static Snapshot toSnapshot(final Record row) {
    return new Snapshot(
        row.get(Snapshots.AGGREGATE_ID),
        row.get(Snapshots.AGGREGATE_TYPE),
        row.get(Snapshots.VERSION),
        row.get(Snapshots.STATE),
        EventStoreSchema.fromUtc(row.get(Snapshots.CREATED_AT)));
  }
}
