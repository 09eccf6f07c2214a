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

package io.github.suppierk.eventsourcing.store;

import io.github.suppierk.eventsourcing.event.EventRecord;
import java.util.List;
import java.util.stream.Stream;

/**
 * Append-only log of {@link EventRecord}s, partitioned into one stream per aggregate.
 *
 * <p>Implementations must guarantee:
 *
 * <ul>
 *   <li>events are never updated or deleted once appended;
 *   <li>versions of one aggregate form a gapless sequence starting from {@code 1};
 *   <li>an append either stores all given events or none of them;
 *   <li>{@link #readAll(long)} never exposes part of a batch and never skips a batch which is
 *       still being committed.
 * </ul>
 *
 * <p>The store never retries: conflicts are reported to the caller, which decides what to do.
 */
public interface EventStore {
  /**
   * Atomically appends events to the stream of the given aggregate.
   *
   * <p>Appending an empty list only verifies the expected version.
   *
   * @param aggregateId of the stream to append to
   * @param expectedVersion the version the caller has based its decision on, {@code 0} for a new
   *     aggregate
   * @param newEvents to append, with versions {@code expectedVersion + 1} and onwards
   * @return appended events with global positions assigned, in the same order
   * @throws ConcurrencyConflictException if the stored version differs from {@code
   *     expectedVersion}
   * @throws StoreUnavailableException if the underlying storage failed
   * @throws IllegalArgumentException if events belong to another aggregate or are out of sequence
   */
  List<EventRecord> append(
      final String aggregateId, final long expectedVersion, final List<EventRecord> newEvents);

  /**
   * The returned stream may hold resources and should be used within try-with-resources.
   *
   * @param aggregateId of the stream to read
   * @param sinceVersion exclusive lower bound, {@code 0} to read from the beginning
   * @return events of the aggregate in version order, empty for unknown aggregates
   */
  Stream<EventRecord> readStream(final String aggregateId, final long sinceVersion);

  /**
   * The returned stream may hold resources and should be used within try-with-resources.
   *
   * @param sinceGlobalPosition exclusive lower bound, {@code 0} to read from the beginning
   * @return committed events of all aggregates in global commit order
   */
  Stream<EventRecord> readAll(final long sinceGlobalPosition);

  /**
   * @param aggregateId to check
   * @return the latest stored version of the aggregate, {@code 0} if it has no events
   */
  long currentVersion(final String aggregateId);
}
