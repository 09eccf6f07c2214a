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
import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfNegative;
import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfNotPositive;
import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfNull;
import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalStateIfNull;

import io.github.suppierk.eventsourcing.codec.EventCodec;
import io.github.suppierk.eventsourcing.codec.SerializedEvent;
import io.github.suppierk.eventsourcing.event.EventRecord;
import io.github.suppierk.eventsourcing.jooq.EventStoreSchema.Events;
import io.github.suppierk.eventsourcing.jooq.EventStoreSchema.Positions;
import io.github.suppierk.eventsourcing.jooq.EventStoreSchema.Streams;
import io.github.suppierk.eventsourcing.store.AppendableEvents;
import io.github.suppierk.eventsourcing.store.ConcurrencyConflictException;
import io.github.suppierk.eventsourcing.store.EventStore;
import io.github.suppierk.eventsourcing.store.StoreUnavailableException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.ToLongFunction;
import java.util.stream.Stream;
import org.jooq.Condition;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.InsertValuesStepN;
import org.jooq.Query;
import org.jooq.Record;
import org.jooq.exception.DataAccessException;
import org.jooq.exception.SQLStateClass;
import org.jooq.impl.DSL;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventStore} persisted through jOOQ.
 *
 * <p>An append runs in its own transaction which locks only the row of its aggregate in {@link
 * Streams#TABLE}, so appends to different aggregates never wait for each other. Two appends racing
 * to create the same aggregate collide on its primary key, and the unique {@code (aggregate_id,
 * version)} constraint backs up the version check.
 *
 * <p>Global positions are not part of the append transaction. Once an append is committed, its
 * events are sequenced in a short transaction which locks the single row of {@link
 * Positions#TABLE} and numbers all committed, not yet sequenced events in insertion order. Only
 * committed events can be sequenced, so the sequenced events always form a gapless prefix of the
 * log and {@link #readAll(long)} never jumps over an event which commits later. Sequencing never
 * waits for a pending append.
 *
 * <p>Events of a committed append which was not sequenced, for example because the connection was
 * lost right after the commit, are sequenced by the next append or {@link #readAll(long)}. Until
 * then {@link #readStream(String, long)} returns them with position {@code 0}.
 *
 * <p>Reads are paged: every page is a separate query of at most {@code pageSize} events, fetched
 * when the previous page has been consumed.
 *
 * <p>Payloads are stored as JSON text produced by the given {@link EventCodec}.
 */
public final class JooqEventStore implements EventStore {
  private static final Logger LOG = LoggerFactory.getLogger(JooqEventStore.class);

  static final int DEFAULT_PAGE_SIZE = 100;

  /** Reported by H2 when a unique key is taken by a pending transaction. */
  private static final String H2_CONCURRENT_UPDATE = "90131";

  private final DSLContext dsl;
  private final EventCodec codec;
  private final int pageSize;

  public JooqEventStore(final DSLContext dsl, final EventCodec codec) {
    this(dsl, codec, DEFAULT_PAGE_SIZE);
  }

  public JooqEventStore(final DSLContext dsl, final EventCodec codec, final int pageSize) {
    this.dsl = throwIllegalArgumentIfNull(dsl, "DSLContext");
    this.codec = throwIllegalArgumentIfNull(codec, "Event codec");
    this.pageSize = throwIllegalArgumentIfNotPositive(pageSize, "Page size");
  }

  /** {@inheritDoc} */
  @Override
  public List<EventRecord> append(
      final String aggregateId, final long expectedVersion, final List<EventRecord> newEvents) {
    final List<EventRecord> events =
        AppendableEvents.verify(aggregateId, expectedVersion, newEvents);

    try {
      dsl.transaction(
          configuration -> {
            final DSLContext transactionalDsl = configuration.dsl();

            final boolean streamExists =
                transactionalDsl
                    .select(Streams.AGGREGATE_ID)
                    .from(Streams.TABLE)
                    .where(Streams.AGGREGATE_ID.eq(aggregateId))
                    .forUpdate()
                    .fetchOptional()
                    .isPresent();

            final long actualVersion =
                streamExists ? currentVersion(transactionalDsl, aggregateId) : 0L;
            if (actualVersion != expectedVersion) {
              throw new ConcurrencyConflictException(aggregateId, expectedVersion, actualVersion);
            }

            if (events.isEmpty()) {
              return;
            }

            final long newVersion = expectedVersion + events.size();
            if (streamExists) {
              transactionalDsl
                  .update(Streams.TABLE)
                  .set(Streams.VERSION, newVersion)
                  .where(Streams.AGGREGATE_ID.eq(aggregateId))
                  .execute();
            } else {
              transactionalDsl
                  .insertInto(Streams.TABLE)
                  .columns(Streams.AGGREGATE_ID, Streams.VERSION)
                  .values(aggregateId, newVersion)
                  .execute();
            }

            InsertValuesStepN<Record> insert =
                transactionalDsl.insertInto(Events.TABLE).columns(Events.INSERT_COLUMNS);
            for (EventRecord event : events) {
              insert = insert.values(toRow(codec.serialize(event)));
            }

            insert.execute();
          });
    } catch (DataAccessException e) {
      if (isConflict(e)) {
        throw new ConcurrencyConflictException(aggregateId, expectedVersion, -1L, e);
      }

      throw new StoreUnavailableException(
          "Failed to append %d event(s) to '%s'".formatted(events.size(), aggregateId), e);
    }

    if (events.isEmpty()) {
      return List.of();
    }

    final List<EventRecord> committed = sequence(aggregateId, events);

    LOG.debug(
        "Appended {} event(s) to '{}' up to global position {}",
        committed.size(),
        aggregateId,
        committed.get(committed.size() - 1).globalPosition());

    return committed;
  }

  /** {@inheritDoc} */
  @Override
  public Stream<EventRecord> readStream(final String aggregateId, final long sinceVersion) {
    throwIllegalArgumentIfBlank(aggregateId, "Aggregate ID");
    throwIllegalArgumentIfNegative(sinceVersion, "Since version");

    return readPages(
        Events.AGGREGATE_ID.eq(aggregateId), Events.VERSION, EventRecord::version, sinceVersion);
  }

  /** {@inheritDoc} */
  @Override
  public Stream<EventRecord> readAll(final long sinceGlobalPosition) {
    throwIllegalArgumentIfNegative(sinceGlobalPosition, "Since global position");

    assignGlobalPositions();
    return readPages(
        DSL.noCondition(),
        Events.GLOBAL_POSITION,
        EventRecord::globalPosition,
        sinceGlobalPosition);
  }

  /** {@inheritDoc} */
  @Override
  public long currentVersion(final String aggregateId) {
    throwIllegalArgumentIfBlank(aggregateId, "Aggregate ID");

    try {
      return currentVersion(dsl, aggregateId);
    } catch (DataAccessException e) {
      throw new StoreUnavailableException(
          "Failed to read the version of '%s'".formatted(aggregateId), e);
    }
  }

  private List<EventRecord> sequence(final String aggregateId, final List<EventRecord> events) {
    assignGlobalPositions();

    final List<UUID> eventIds = events.stream().map(EventRecord::eventId).toList();
    final Map<UUID, Long> positions;
    try {
      positions =
          dsl.select(Events.EVENT_ID, Events.GLOBAL_POSITION)
              .from(Events.TABLE)
              .where(Events.EVENT_ID.in(eventIds))
              .fetchMap(Events.EVENT_ID, Events.GLOBAL_POSITION);
    } catch (DataAccessException e) {
      throw new StoreUnavailableException(
          "Appended %d event(s) to '%s', but failed to read their global positions"
              .formatted(events.size(), aggregateId),
          e);
    }

    final List<EventRecord> committed = new ArrayList<>(events.size());
    for (EventRecord event : events) {
      committed.add(
          event.committedAt(
              throwIllegalStateIfNull(positions.get(event.eventId()), "Global position")));
    }

    return List.copyOf(committed);
  }

  private void assignGlobalPositions() {
    try {
      dsl.transaction(
          configuration -> {
            final DSLContext transactionalDsl = configuration.dsl();

            long lastPosition =
                throwIllegalStateIfNull(
                    transactionalDsl
                        .select(Positions.POSITION)
                        .from(Positions.TABLE)
                        .where(Positions.ID.eq(Positions.ROW_ID))
                        .forUpdate()
                        .fetchOne(Positions.POSITION),
                    "Global position row");

            final List<Long> pending =
                transactionalDsl
                    .select(Events.APPEND_ID)
                    .from(Events.TABLE)
                    .where(Events.GLOBAL_POSITION.isNull())
                    .orderBy(Events.APPEND_ID.asc())
                    .fetch(Events.APPEND_ID);

            if (pending.isEmpty()) {
              return;
            }

            final List<Query> updates = new ArrayList<>(pending.size() + 1);
            for (Long appendId : pending) {
              lastPosition++;
              updates.add(
                  transactionalDsl
                      .update(Events.TABLE)
                      .set(Events.GLOBAL_POSITION, lastPosition)
                      .where(Events.APPEND_ID.eq(appendId)));
            }

            updates.add(
                transactionalDsl
                    .update(Positions.TABLE)
                    .set(Positions.POSITION, lastPosition)
                    .where(Positions.ID.eq(Positions.ROW_ID)));

            transactionalDsl.batch(updates).execute();

            LOG.debug(
                "Sequenced {} event(s) up to global position {}", pending.size(), lastPosition);
          });
    } catch (DataAccessException e) {
      throw new StoreUnavailableException("Failed to assign global positions", e);
    }
  }

  private Stream<EventRecord> readPages(
      final Condition condition,
      final Field<Long> key,
      final ToLongFunction<EventRecord> keyOf,
      final long after) {
    return Stream.iterate(
            page(condition, key, after),
            current -> !current.isEmpty(),
            current ->
                current.size() < pageSize
                    ? List.of()
                    : page(condition, key, keyOf.applyAsLong(current.get(current.size() - 1))))
        .flatMap(List::stream);
  }

  private List<EventRecord> page(
      final Condition condition, final Field<Long> key, final long after) {
    try {
      return dsl.select(Events.COLUMNS)
          .from(Events.TABLE)
          .where(condition.and(key.gt(after)))
          .orderBy(key.asc())
          .limit(pageSize)
          .fetch(this::toEventRecord);
    } catch (DataAccessException e) {
      throw new StoreUnavailableException("Failed to read events", e);
    }
  }

  private EventRecord toEventRecord(final Record row) {
    final Long globalPosition = row.get(Events.GLOBAL_POSITION);

    return codec.deserialize(
        new SerializedEvent(
            row.get(Events.EVENT_ID),
            row.get(Events.AGGREGATE_ID),
            row.get(Events.AGGREGATE_TYPE),
            row.get(Events.EVENT_TYPE),
            row.get(Events.VERSION),
            EventStoreSchema.fromUtc(row.get(Events.OCCURRED_AT)),
            row.get(Events.PAYLOAD_VERSION),
            row.get(Events.PAYLOAD),
            row.get(Events.CAUSATION_ID),
            globalPosition == null ? 0L : globalPosition));
  }

  private static boolean isConflict(final DataAccessException e) {
    return e.sqlStateClass() == SQLStateClass.C23_INTEGRITY_CONSTRAINT_VIOLATION
        || H2_CONCURRENT_UPDATE.equals(e.sqlState());
  }

  private static long currentVersion(final DSLContext dsl, final String aggregateId) {
    return dsl.select(Streams.VERSION)
        .from(Streams.TABLE)
        .where(Streams.AGGREGATE_ID.eq(aggregateId))
        .fetchOptional(Streams.VERSION)
        .orElse(0L);
  }

  private static List<Object> toRow(final SerializedEvent event) {
    final List<Object> row = new ArrayList<>(Events.INSERT_COLUMNS.size());
    row.add(event.eventId());
    row.add(event.aggregateId());
    row.add(event.aggregateType());
    row.add(event.eventType());
    row.add(event.version());
    row.add(EventStoreSchema.toUtc(event.occurredAt()));
    row.add(event.payloadVersion());
    row.add(event.payload());
    row.add(event.causationId());
    return row;
  }
}
