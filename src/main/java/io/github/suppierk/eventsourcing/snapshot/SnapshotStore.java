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

import java.util.Optional;

/**
 * Storage of {@link Snapshot}s.
 *
 * <p>Snapshots are derived data: losing one only makes loading slower. Loading code must work
 * with any implementation, including {@link #disabled()}.
 */
public interface SnapshotStore {
  /**
   * @return an instance of store which keeps nothing
   */
  static SnapshotStore disabled() {
    return Disabled.INSTANCE;
  }

  /**
   * @param aggregateId to look up
   * @return snapshot with the highest version, if any
   */
  Optional<Snapshot> latestSnapshot(final String aggregateId);

  /**
   * Saving the same content twice is allowed.
   *
   * @param snapshot to save
   * @throws IllegalStateException if a snapshot with different content exists for the same
   *     aggregate and version
   */
  void save(final Snapshot snapshot);

  /** Default implementation of the store which keeps nothing */
  final class Disabled implements SnapshotStore {
    private static final SnapshotStore INSTANCE = new Disabled();

    private Disabled() {
      // Cannot be instantiated from the outside
    }

    @Override
    public Optional<Snapshot> latestSnapshot(final String aggregateId) {
      return Optional.empty();
    }

    @Override
    public void save(final Snapshot snapshot) {
      // Do nothing
    }
  }
}
