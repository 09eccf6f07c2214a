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

import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfBlank;
import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfNegative;
import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfNull;

import io.github.suppierk.eventsourcing.event.EventRecord;
import java.util.List;

/** Argument checks shared by {@link EventStore} implementations. */
public final class AppendableEvents {
  private AppendableEvents() {
    // No instance
  }

  /**
   * @param aggregateId of the stream to append to
   * @param expectedVersion the caller has based its decision on
   * @param newEvents to append
   * @return immutable copy of the events
   * @throws IllegalArgumentException if any argument is invalid, events belong to another
   *     aggregate, were committed before or do not continue the stream from {@code
   *     expectedVersion}
   */
  public static List<EventRecord> verify(
      final String aggregateId, final long expectedVersion, final List<EventRecord> newEvents) {
    throwIllegalArgumentIfBlank(aggregateId, "Aggregate ID");
    throwIllegalArgumentIfNegative(expectedVersion, "Expected version");

    final List<EventRecord> events = List.copyOf(throwIllegalArgumentIfNull(newEvents, "Events"));

    for (int i = 0; i < events.size(); i++) {
      final EventRecord event = events.get(i);

      if (!aggregateId.equals(event.aggregateId())) {
        throw new IllegalArgumentException(
            "Event '%s' belongs to aggregate '%s', not '%s'"
                .formatted(event.eventId(), event.aggregateId(), aggregateId));
      }

      if (event.isCommitted()) {
        throw new IllegalArgumentException(
            "Event '%s' is already committed at position %d"
                .formatted(event.eventId(), event.globalPosition()));
      }

      final long nextVersion = expectedVersion + i + 1;
      if (event.version() != nextVersion) {
        throw new IllegalArgumentException(
            "Event '%s' of aggregate '%s' must have version %d, got %d"
                .formatted(event.eventId(), aggregateId, nextVersion, event.version()));
      }
    }

    return events;
  }
}
