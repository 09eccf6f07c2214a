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

import io.github.suppierk.eventsourcing.event.DomainEvent;
import io.github.suppierk.eventsourcing.event.EventRecord;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Base class of event sourced aggregates.
 *
 * <p>The state of an aggregate changes only by applying {@link DomainEvent}s:
 *
 * <ul>
 *   <li>Business methods verify invariants first, throwing {@link InvariantViolationException}
 *       before anything is recorded, and then call {@link #recordAndApply(DomainEvent)}.
 *   <li>Handlers registered with {@link #on(Class, Consumer)} mutate the state and must never
 *       fail for an event which has been recorded once, because the same handlers replay history.
 * </ul>
 *
 * <p>Handlers are registered in the constructor of the subclass:
 *
 * <pre>{@code
 * public final class Idea extends AggregateRoot {
 *   private int ratings;
 *
 *   public Idea(String id) {
 *     super(id);
 *     on(IdeaRated.class, event -> ratings++);
 *   }
 * }
 * }</pre>
 *
 * <p>Instances are not thread-safe and must not be shared between concurrent operations: every
 * operation loads its own copy from {@link EventSourcedRepository}.
 */
public abstract class AggregateRoot {
  private final String aggregateId;
  private final Clock clock;
  private final Map<Class<? extends DomainEvent>, Consumer<DomainEvent>> handlers;
  private final List<EventRecord> uncommittedEvents;

  private long currentVersion;

  protected AggregateRoot(final String aggregateId) {
    this(aggregateId, Clock.systemUTC());
  }

  protected AggregateRoot(final String aggregateId, final Clock clock) {
    this.aggregateId = throwIllegalArgumentIfBlank(aggregateId, "Aggregate ID");
    this.clock = throwIllegalArgumentIfNull(clock, "Clock");
    this.handlers = new HashMap<>();
    this.uncommittedEvents = new ArrayList<>();
    this.currentVersion = 0L;
  }

  /**
   * @return the type name stored along with the events of this aggregate
   */
  public abstract String aggregateType();

  public final String aggregateId() {
    return aggregateId;
  }

  /**
   * @return version of the latest applied event, including uncommitted ones
   */
  public final long currentVersion() {
    return currentVersion;
  }

  /**
   * @return {@code true} if at least one event was applied to this aggregate
   */
  public final boolean exists() {
    return currentVersion > 0;
  }

  /**
   * @return events recorded since this aggregate was loaded or last saved, oldest first
   */
  public final List<EventRecord> uncommittedEvents() {
    return List.copyOf(uncommittedEvents);
  }

  /**
   * Registers the state transition for an event class.
   *
   * @param eventClass to handle
   * @param handler applying the event to the state
   * @param <E> is the type of the event
   * @throws IllegalStateException if a handler for the class is already registered
   */
  protected final <E extends DomainEvent> void on(
      final Class<E> eventClass, final Consumer<E> handler) {
    final Class<E> nonNullEventClass = throwIllegalArgumentIfNull(eventClass, "Event class");
    final Consumer<E> nonNullHandler = throwIllegalArgumentIfNull(handler, "Event handler");

    final Consumer<DomainEvent> previous =
        handlers.putIfAbsent(
            nonNullEventClass, event -> nonNullHandler.accept(nonNullEventClass.cast(event)));

    if (previous != null) {
      throw new IllegalStateException(
          "Handler for '%s' is already registered in '%s'"
              .formatted(nonNullEventClass.getSimpleName(), aggregateType()));
    }
  }

  /**
   * Applies a new event and keeps it for saving.
   *
   * @param event to record
   * @return the recorded event with the next version of this aggregate
   * @throws IllegalStateException if there is no handler for the event
   */
  protected final EventRecord recordAndApply(final DomainEvent event) {
    final EventRecord eventRecord =
        EventRecord.uncommitted(
            aggregateId,
            aggregateType(),
            currentVersion + 1,
            clock.instant(),
            throwIllegalArgumentIfNull(event, "Event"));

    apply(eventRecord);
    uncommittedEvents.add(eventRecord);
    return eventRecord;
  }

  /**
   * Replays stored events without recording them.
   *
   * @param history events following {@link #currentVersion()}
   * @throws IllegalStateException if an event belongs to another aggregate or does not continue
   *     the version sequence
   */
  final void applyHistory(final Iterator<EventRecord> history) {
    while (history.hasNext()) {
      final EventRecord eventRecord = history.next();

      if (!aggregateId.equals(eventRecord.aggregateId())) {
        throw new IllegalStateException(
            "Event of aggregate '%s' cannot be applied to '%s'"
                .formatted(eventRecord.aggregateId(), aggregateId));
      }

      if (eventRecord.version() != currentVersion + 1) {
        throw new IllegalStateException(
            "Aggregate '%s' at version %d cannot apply event with version %d"
                .formatted(aggregateId, currentVersion, eventRecord.version()));
      }

      apply(eventRecord);
    }
  }

  /** Sets the version after the state was restored from a snapshot. */
  final void restoredAt(final long version) {
    if (currentVersion != 0 || !uncommittedEvents.isEmpty()) {
      throw new IllegalStateException(
          "Aggregate '%s' can only be restored before any event is applied".formatted(aggregateId));
    }

    currentVersion = version;
  }

  final void markCommitted() {
    uncommittedEvents.clear();
  }

  private void apply(final EventRecord eventRecord) {
    final Consumer<DomainEvent> handler = handlers.get(eventRecord.payload().getClass());
    if (handler == null) {
      throw new IllegalStateException(
          "'%s' has no handler for '%s'".formatted(aggregateType(), eventRecord.eventType()));
    }

    handler.accept(eventRecord.payload());
    currentVersion = eventRecord.version();
  }
}
