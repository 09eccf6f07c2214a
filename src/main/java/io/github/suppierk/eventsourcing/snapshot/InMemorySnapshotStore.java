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

package io.github.suppierk.eventsourcing.snapshot;

import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfBlank;
import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfNull;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/** {@link SnapshotStore} kept in memory. */
public final class InMemorySnapshotStore implements SnapshotStore {
  private final ConcurrentMap<String, ConcurrentNavigableMap<Long, Snapshot>> snapshots;

  public InMemorySnapshotStore() {
    this.snapshots = new ConcurrentHashMap<>();
  }

  /** {@inheritDoc} */
  @Override
  public Optional<Snapshot> latestSnapshot(final String aggregateId) {
    throwIllegalArgumentIfBlank(aggregateId, "Aggregate ID");

    return Optional.ofNullable(snapshots.get(aggregateId))
        .map(ConcurrentNavigableMap::lastEntry)
        .map(Map.Entry::getValue);
  }

  /** {@inheritDoc} */
  @Override
  public void save(final Snapshot snapshot) {
    final Snapshot nonNullSnapshot = throwIllegalArgumentIfNull(snapshot, "Snapshot");

    final Snapshot existing =
        snapshots
            .computeIfAbsent(nonNullSnapshot.aggregateId(), id -> new ConcurrentSkipListMap<>())
            .putIfAbsent(nonNullSnapshot.version(), nonNullSnapshot);

    if (existing != null && !existing.hasSameContentAs(nonNullSnapshot)) {
      throw new IllegalStateException(
          "Aggregate '%s' already has a different snapshot at version %d"
              .formatted(nonNullSnapshot.aggregateId(), nonNullSnapshot.version()));
    }
  }
}
