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

package io.github.suppierk.eventsourcing.aggregate;

import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfBlank;
import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfNull;
import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalStateIfNull;

import io.github.suppierk.eventsourcing.codec.SnapshotSerializer;
import io.github.suppierk.eventsourcing.event.EventRecord;
import io.github.suppierk.eventsourcing.snapshot.Snapshot;
import io.github.suppierk.eventsourcing.snapshot.SnapshotPolicy;
import io.github.suppierk.eventsourcing.snapshot.SnapshotStore;
import io.github.suppierk.eventsourcing.store.ConcurrencyConflictException;
import io.github.suppierk.eventsourcing.store.EventStore;
import io.github.suppierk.java.Try;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads and saves {@link AggregateRoot}s of one type through an {@link EventStore}.
 *
 * <p>Loading restores the latest {@link Snapshot} when the aggregate is {@link SnapshotCapable}
 * and replays the events after it. Snapshots are an optimization only: if one cannot be read or
 * restored, the aggregate is rebuilt from its full history.
 *
 * <p>Saving appends uncommitted events with the version the aggregate was loaded at as the
 * expected version, then, once the events are committed:
 *
 * <ol>
 *   <li>captures a snapshot if the {@link SnapshotPolicy} asks for it;
 *   <li>notifies the {@link CommitListener}.
 * </ol>
 *
 * <p>Failures of both steps are logged and never turn a successful commit into a failure.
 *
 * @param <A> is the type of the aggregate
 */
public final class EventSourcedRepository<A extends AggregateRoot> {
  private static final Logger LOG = LoggerFactory.getLogger(EventSourcedRepository.class);

  private final Function<String, A> aggregateFactory;
  private final EventStore eventStore;
  private final SnapshotStore snapshotStore;
  private final SnapshotPolicy snapshotPolicy;
  private final SnapshotSerializer snapshotSerializer;
  private final CommitListener commitListener;
  private final Clock clock;

  /**
   * Creates a repository without snapshots and commit notifications.
   *
   * @param aggregateFactory creating an empty aggregate for the given identifier
   * @param eventStore to load and save events with
   */
  public EventSourcedRepository(
      final Function<String, A> aggregateFactory, final EventStore eventStore) {
    this(aggregateFactory, eventStore, CommitListener.empty());
  }

  public EventSourcedRepository(
      final Function<String, A> aggregateFactory,
      final EventStore eventStore,
      final CommitListener commitListener) {
    this(
        aggregateFactory,
        eventStore,
        SnapshotStore.disabled(),
        SnapshotPolicy.never(),
        new SnapshotSerializer(),
        commitListener,
        Clock.systemUTC());
  }

  public EventSourcedRepository(
      final Function<String, A> aggregateFactory,
      final EventStore eventStore,
      final SnapshotStore snapshotStore,
      final SnapshotPolicy snapshotPolicy,
      final SnapshotSerializer snapshotSerializer,
      final CommitListener commitListener,
      final Clock clock) {
    this.aggregateFactory = throwIllegalArgumentIfNull(aggregateFactory, "Aggregate factory");
    this.eventStore = throwIllegalArgumentIfNull(eventStore, "Event store");
    this.snapshotStore = throwIllegalArgumentIfNull(snapshotStore, "Snapshot store");
    this.snapshotPolicy = throwIllegalArgumentIfNull(snapshotPolicy, "Snapshot policy");
    this.snapshotSerializer = throwIllegalArgumentIfNull(snapshotSerializer, "Snapshot serializer");
    this.commitListener = throwIllegalArgumentIfNull(commitListener, "Commit listener");
    this.clock = throwIllegalArgumentIfNull(clock, "Clock");
  }

  /**
   * @param aggregateId to load
   * @return the aggregate with all committed events applied, or empty if it has no events
   */
  public Optional<A> find(final String aggregateId) {
    throwIllegalArgumentIfBlank(aggregateId, "Aggregate ID");

    A aggregate = newAggregate(aggregateId);
    if (aggregate instanceof SnapshotCapable<?>) {
      aggregate = restoreFromSnapshot(aggregate);
    }

    try (Stream<EventRecord> tail =
        eventStore.readStream(aggregateId, aggregate.currentVersion())) {
      aggregate.applyHistory(tail.iterator());
    }

    return aggregate.exists() ? Optional.of(aggregate) : Optional.empty();
  }

  /**
   * @param aggregateId to load
   * @return the aggregate with all committed events applied
   * @throws AggregateNotFoundException if the aggregate has no events
   */
  public A load(final String aggregateId) {
    return find(aggregateId).orElseThrow(() -> new AggregateNotFoundException(aggregateId));
  }

  /**
   * Same as {@link #save(AggregateRoot, String)} without causation tracking.
   *
   * @param aggregate to save
   * @return committed events
   */
  public List<EventRecord> save(final A aggregate) {
    return persist(throwIllegalArgumentIfNull(aggregate, "Aggregate"), null);
  }

  /**
   * Appends uncommitted events of the aggregate.
   *
   * @param aggregate to save
   * @param causationId identifier of the command which produced the events
   * @return committed events, empty if the aggregate had nothing to save
   * @throws OptimisticLockException if the aggregate was changed after it was loaded, in which case
   *     the given instance must be discarded
   * @throws io.github.suppierk.eventsourcing.store.StoreUnavailableException if the outcome is
   *     unknown, see {@link #wasCommitted(String, String)}
   */
  public List<EventRecord> save(final A aggregate, final String causationId) {
    return persist(
        throwIllegalArgumentIfNull(aggregate, "Aggregate"),
        throwIllegalArgumentIfBlank(causationId, "Causation ID"));
  }

  /**
   * Resolves the unknown outcome of a save which failed with a storage error.
   *
   * @param aggregateId which was saved
   * @param causationId given to {@link #save(AggregateRoot, String)}
   * @return {@code true} if events produced by the command were committed
   */
  public boolean wasCommitted(final String aggregateId, final String causationId) {
    throwIllegalArgumentIfBlank(aggregateId, "Aggregate ID");
    throwIllegalArgumentIfBlank(causationId, "Causation ID");

    try (Stream<EventRecord> stream = eventStore.readStream(aggregateId, 0L)) {
      return stream.anyMatch(event -> causationId.equals(event.causationId()));
    }
  }

  private List<EventRecord> persist(final A aggregate, final String causationId) {
    final List<EventRecord> uncommitted = aggregate.uncommittedEvents();
    if (uncommitted.isEmpty()) {
      return List.of();
    }

    final String aggregateId = aggregate.aggregateId();
    final long expectedVersion = aggregate.currentVersion() - uncommitted.size();
    final List<EventRecord> toAppend =
        causationId == null
            ? uncommitted
            : uncommitted.stream().map(event -> event.withCausationId(causationId)).toList();

    final List<EventRecord> committed;
    try {
      committed = eventStore.append(aggregateId, expectedVersion, toAppend);
    } catch (ConcurrencyConflictException e) {
      LOG.debug("Concurrent modification of '{}' at version {}", aggregateId, expectedVersion);
      throw new OptimisticLockException(aggregateId, expectedVersion, e);
    }

    aggregate.markCommitted();
    captureSnapshotIfDue(aggregate, expectedVersion);
    notifyCommitListener(aggregateId, committed);
    return committed;
  }

  private A newAggregate(final String aggregateId) {
    final A aggregate = throwIllegalStateIfNull(aggregateFactory.apply(aggregateId), "Aggregate");

    if (!aggregateId.equals(aggregate.aggregateId()) || aggregate.currentVersion() != 0) {
      throw new IllegalStateException(
          "Aggregate factory must create an empty aggregate with ID '%s'".formatted(aggregateId));
    }

    return aggregate;
  }

  private A restoreFromSnapshot(final A aggregate) {
    final AtomicBoolean failed = new AtomicBoolean(false);
    final Try<Boolean> restored = Try.of(() -> restoreSnapshot(aggregate));

    restored.ifFailure(
        reason -> {
          failed.set(true);
          LOG.warn(
              "Failed to restore snapshot of '{}', replaying all events",
              aggregate.aggregateId(),
              reason);
        });

    // Restoring may have failed halfway through
    return failed.get() ? newAggregate(aggregate.aggregateId()) : aggregate;
  }

  private boolean restoreSnapshot(final A aggregate) {
    final Optional<Snapshot> latest = snapshotStore.latestSnapshot(aggregate.aggregateId());
    if (latest.isEmpty()) {
      return false;
    }

    final Snapshot snapshot = latest.get();
    if (!snapshot.aggregateType().equals(aggregate.aggregateType())) {
      throw new IllegalStateException(
          "Snapshot of '%s' has type '%s', expected '%s'"
              .formatted(
                  snapshot.aggregateId(), snapshot.aggregateType(), aggregate.aggregateType()));
    }

    restoreState((SnapshotCapable<?>) aggregate, snapshot.state());
    aggregate.restoredAt(snapshot.version());
    LOG.debug(
        "Restored '{}' from snapshot at version {}", snapshot.aggregateId(), snapshot.version());
    return true;
  }

  private <S> void restoreState(final SnapshotCapable<S> aggregate, final String state) {
    aggregate.restoreSnapshotState(
        throwIllegalStateIfNull(
            snapshotSerializer.deserialize(state, aggregate.snapshotStateType()),
            "Snapshot state"));
  }

  private void captureSnapshotIfDue(final A aggregate, final long versionBefore) {
    if (!(aggregate instanceof SnapshotCapable<?> capable)
        || !snapshotPolicy.shouldSnapshot(versionBefore, aggregate.currentVersion())) {
      return;
    }

    final Try<Snapshot> captured =
        Try.of(
            () -> {
              final Snapshot snapshot =
                  new Snapshot(
                      aggregate.aggregateId(),
                      aggregate.aggregateType(),
                      aggregate.currentVersion(),
                      snapshotSerializer.serialize(
                          throwIllegalStateIfNull(
                              capable.captureSnapshotState(), "Snapshot state")),
                      clock.instant());
              snapshotStore.save(snapshot);
              return snapshot;
            });

    captured.ifSuccess(
        snapshot ->
            LOG.debug(
                "Captured snapshot of '{}' at version {}",
                snapshot.aggregateId(),
                snapshot.version()));
    captured.ifFailure(
        reason ->
            LOG.warn(
                "Failed to capture snapshot of '{}' at version {}",
                aggregate.aggregateId(),
                aggregate.currentVersion(),
                reason));
  }

  private void notifyCommitListener(
      final String aggregateId, final List<EventRecord> committedEvents) {
    final Try<List<EventRecord>> notified =
        Try.of(
            () -> {
              commitListener.onCommitted(aggregateId, committedEvents);
              return committedEvents;
            });

    notified.ifFailure(
        reason ->
            LOG.warn(
                "Commit listener failed for {} event(s) of '{}'",
                committedEvents.size(),
                aggregateId,
                reason));
  }
}
