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

package io.github.suppierk.eventsourcing.projection;

import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfBlank;
import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfNull;
import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalStateIfNull;

import io.github.suppierk.eventsourcing.event.EventRecord;
import io.github.suppierk.eventsourcing.store.EventStore;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatches events to {@link ProjectionHandler}s by event type.
 *
 * <p>Events are expected in commit order. The engine remembers the last applied version of every
 * aggregate and skips events at or below it, so redelivered events are applied only once. Events
 * without handlers are skipped as well.
 *
 * <p>Only {@link Projection}s take part in {@link #rebuild(EventStore)}: handlers registered on
 * their own cannot be reset, so they receive live events only.
 *
 * <p>All methods are synchronized: handlers never run concurrently.
 */
public final class ProjectionEngine {
  private static final Logger LOG = LoggerFactory.getLogger(ProjectionEngine.class);

  private final Map<String, List<ProjectionHandler>> handlers;
  private final Map<String, List<ProjectionHandler>> projectionHandlers;
  private final List<Projection> projections;
  private final Map<String, Long> appliedVersions;

  public ProjectionEngine() {
    this.handlers = new HashMap<>();
    this.projectionHandlers = new HashMap<>();
    this.projections = new ArrayList<>();
    this.appliedVersions = new HashMap<>();
  }

  /**
   * Registers a handler of live events, which is not called by {@link #rebuild(EventStore)}.
   *
   * @param eventType to handle
   * @param handler to register
   * @throws IllegalStateException if the same handler is already registered for the type
   */
  public synchronized void register(final String eventType, final ProjectionHandler handler) {
    add(handlers, eventType, handler);
  }

  /**
   * Registers all handlers of the projection and includes it into {@link #rebuild(EventStore)}.
   *
   * @param projection to register
   */
  public synchronized void register(final Projection projection) {
    final Projection nonNullProjection = throwIllegalArgumentIfNull(projection, "Projection");
    final Map<String, ProjectionHandler> registeredHandlers =
        throwIllegalStateIfNull(nonNullProjection.handlers(), "Projection handlers");

    registeredHandlers.forEach(
        (eventType, handler) -> {
          add(handlers, eventType, handler);
          add(projectionHandlers, eventType, handler);
        });
    projections.add(nonNullProjection);
  }

  /**
   * @param event to apply
   * @return {@code true} if the event was handled, {@code false} if it was skipped
   */
  public synchronized boolean apply(final EventRecord event) {
    return apply(throwIllegalArgumentIfNull(event, "Event"), handlers);
  }

  private boolean apply(
      final EventRecord nonNullEvent, final Map<String, List<ProjectionHandler>> candidates) {
    final long appliedVersion = appliedVersions.getOrDefault(nonNullEvent.aggregateId(), 0L);
    if (nonNullEvent.version() <= appliedVersion) {
      LOG.debug(
          "Skipped '{}' of '{}' at version {}, already applied up to {}",
          nonNullEvent.eventType(),
          nonNullEvent.aggregateId(),
          nonNullEvent.version(),
          appliedVersion);
      return false;
    }

    final List<ProjectionHandler> eventHandlers =
        candidates.getOrDefault(nonNullEvent.eventType(), List.of());
    for (ProjectionHandler handler : eventHandlers) {
      handler.handle(nonNullEvent);
    }

    appliedVersions.put(nonNullEvent.aggregateId(), nonNullEvent.version());
    return !eventHandlers.isEmpty();
  }

  /**
   * Resets all registered {@link Projection}s and replays the whole event log into their
   * handlers.
   *
   * @param eventStore to replay
   * @return number of events replayed
   */
  public synchronized long rebuild(final EventStore eventStore) {
    final EventStore nonNullEventStore = throwIllegalArgumentIfNull(eventStore, "Event store");

    projections.forEach(Projection::reset);
    appliedVersions.clear();

    long replayed = 0;
    try (Stream<EventRecord> events = nonNullEventStore.readAll(0L)) {
      for (EventRecord event : (Iterable<EventRecord>) events::iterator) {
        apply(event, projectionHandlers);
        replayed++;
      }
    }

    LOG.info("Rebuilt {} projection(s) from {} event(s)", projections.size(), replayed);
    return replayed;
  }

  /**
   * @param aggregateId to look up
   * @return the last version of the aggregate seen by this engine, {@code 0} if none
   */
  public synchronized long appliedVersion(final String aggregateId) {
    return appliedVersions.getOrDefault(
        throwIllegalArgumentIfBlank(aggregateId, "Aggregate ID"), 0L);
  }

  private static void add(
      final Map<String, List<ProjectionHandler>> target,
      final String eventType,
      final ProjectionHandler handler) {
    final String nonBlankEventType = throwIllegalArgumentIfBlank(eventType, "Event type");
    final ProjectionHandler nonNullHandler =
        throwIllegalArgumentIfNull(handler, "Projection handler");

    final List<ProjectionHandler> registered =
        target.computeIfAbsent(nonBlankEventType, type -> new ArrayList<>());
    if (registered.contains(nonNullHandler)) {
      throw new IllegalStateException(
          "Handler is already registered for '%s'".formatted(nonBlankEventType));
    }

    registered.add(nonNullHandler);
  }
}
