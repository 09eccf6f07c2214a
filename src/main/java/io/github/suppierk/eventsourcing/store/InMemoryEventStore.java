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

import io.github.suppierk.eventsourcing.event.EventRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.LongStream;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventStore} kept in memory, suitable for tests and single-process applications.
 *
 * <p>Appends to the same aggregate are serialized by {@link ConcurrentMap#compute}, appends to
 * different aggregates never wait for each other.
 *
 * <p>Global positions are reserved up front for the whole batch and the batch is published into
 * the global log from its last event to its first one. Readers of {@link #readAll(long)} stop at
 * the first missing position, so they observe either a whole batch or nothing of it, and never
 * jump over a batch which is still being written.
 */
public final class InMemoryEventStore implements EventStore {
  private static final Logger LOG = LoggerFactory.getLogger(InMemoryEventStore.class);

  private final ConcurrentMap<String, List<EventRecord>> streams;
  private final ConcurrentNavigableMap<Long, EventRecord> globalLog;
  private final AtomicLong lastReservedPosition;

  public InMemoryEventStore() {
    this.streams = new ConcurrentHashMap<>();
    this.globalLog = new ConcurrentSkipListMap<>();
    this.lastReservedPosition = new AtomicLong();
  }

  /** {@inheritDoc} */
  @Override
  public List<EventRecord> append(
      final String aggregateId, final long expectedVersion, final List<EventRecord> newEvents) {
    final List<EventRecord> events =
        AppendableEvents.verify(aggregateId, expectedVersion, newEvents);
    final List<EventRecord> committed = new ArrayList<>(events.size());

    streams.compute(
        aggregateId,
        (id, stream) -> {
          final List<EventRecord> current = stream == null ? List.of() : stream;
          if (current.size() != expectedVersion) {
            throw new ConcurrencyConflictException(id, expectedVersion, current.size());
          }

          if (events.isEmpty()) {
            return stream;
          }

          final long firstPosition = lastReservedPosition.getAndAdd(events.size()) + 1;
          for (int i = 0; i < events.size(); i++) {
            committed.add(events.get(i).committedAt(firstPosition + i));
          }

          for (int i = committed.size() - 1; i >= 0; i--) {
            final EventRecord event = committed.get(i);
            globalLog.put(event.globalPosition(), event);
          }

          final List<EventRecord> appended = new ArrayList<>(current.size() + committed.size());
          appended.addAll(current);
          appended.addAll(committed);
          return List.copyOf(appended);
        });

    if (!committed.isEmpty() && LOG.isDebugEnabled()) {
      LOG.debug(
          "Appended {} event(s) to '{}' at versions {}..{}",
          committed.size(),
          aggregateId,
          committed.get(0).version(),
          committed.get(committed.size() - 1).version());
    }

    return List.copyOf(committed);
  }

  /** {@inheritDoc} */
  @Override
  public Stream<EventRecord> readStream(final String aggregateId, final long sinceVersion) {
    throwIllegalArgumentIfBlank(aggregateId, "Aggregate ID");
    throwIllegalArgumentIfNegative(sinceVersion, "Since version");

    return streams.getOrDefault(aggregateId, List.of()).stream()
        .filter(event -> event.version() > sinceVersion);
  }

  /** {@inheritDoc} */
  @Override
  public Stream<EventRecord> readAll(final long sinceGlobalPosition) {
    throwIllegalArgumentIfNegative(sinceGlobalPosition, "Since global position");

    return LongStream.iterate(sinceGlobalPosition + 1, position -> position + 1)
        .mapToObj(globalLog::get)
        .takeWhile(Objects::nonNull);
  }

  /** {@inheritDoc} */
  @Override
  public long currentVersion(final String aggregateId) {
    throwIllegalArgumentIfBlank(aggregateId, "Aggregate ID");

    return streams.getOrDefault(aggregateId, List.of()).size();
  }
}
