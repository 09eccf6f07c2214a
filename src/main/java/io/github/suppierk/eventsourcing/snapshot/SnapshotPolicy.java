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

import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfNotPositive;

/** Decides after which commits a new {@link Snapshot} is captured. */
@FunctionalInterface
public interface SnapshotPolicy {
  /**
   * @return policy which never captures snapshots
   */
  static SnapshotPolicy never() {
    return (versionBefore, versionAfter) -> false;
  }

  /**
   * A commit which brings an aggregate from version 95 to 105 crosses 100 and is captured with
   * {@code eventsPerSnapshot = 100}, even though 105 itself is not a multiple of 100.
   *
   * @param eventsPerSnapshot interval between snapshots
   * @return policy which captures a snapshot whenever a commit crosses a multiple of the interval
   */
  static SnapshotPolicy everyNEvents(final int eventsPerSnapshot) {
    final int interval =
        throwIllegalArgumentIfNotPositive(eventsPerSnapshot, "Events per snapshot");
    return (versionBefore, versionAfter) -> versionBefore / interval < versionAfter / interval;
  }

  /**
   * @param versionBefore of the aggregate before the commit
   * @param versionAfter of the aggregate after the commit
   * @return {@code true} if the state after the commit should be captured
   */
  boolean shouldSnapshot(final long versionBefore, final long versionAfter);
}
