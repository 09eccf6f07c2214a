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

package io.github.suppierk.eventsourcing.codec;

import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfBlank;
import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfNull;

import io.github.suppierk.eventsourcing.event.DomainEvent;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Explicit registration table of event type tags.
 *
 * <p>Maps every tag to exactly one payload class together with the current payload version, and
 * keeps the {@link EventUpcaster}s used to migrate older payload versions. Resolving a type never
 * relies on class names found in the stored data.
 */
public final class EventTypeRegistry {
  private final ConcurrentMap<String, Registration> registrations;
  private final ConcurrentMap<UpcasterKey, EventUpcaster> upcasters;

  public EventTypeRegistry() {
    this.registrations = new ConcurrentHashMap<>();
    this.upcasters = new ConcurrentHashMap<>();
  }

  /**
   * Registers the event under its simple class name with payload version {@code 1}, which matches
   * the defaults of {@link DomainEvent}.
   *
   * @param eventClass to register
   * @param <E> is the type of the event
   * @return this registry for chaining
   * @throws IllegalStateException if the tag is already registered for another class
   */
  public <E extends DomainEvent> EventTypeRegistry register(final Class<E> eventClass) {
    final Class<E> nonNullEventClass = throwIllegalArgumentIfNull(eventClass, "Event class");
    return register(nonNullEventClass.getSimpleName(), nonNullEventClass, 1);
  }

  /**
   * @param eventType tag as returned by {@link DomainEvent#eventType()}
   * @param eventClass to register
   * @param currentPayloadVersion as returned by {@link DomainEvent#payloadVersion()}
   * @param <E> is the type of the event
   * @return this registry for chaining
   * @throws IllegalStateException if the tag is already registered for another class
   */
  public <E extends DomainEvent> EventTypeRegistry register(
      final String eventType, final Class<E> eventClass, final int currentPayloadVersion) {
    final String nonBlankEventType = throwIllegalArgumentIfBlank(eventType, "Event type");
    final Class<E> nonNullEventClass = throwIllegalArgumentIfNull(eventClass, "Event class");

    if (currentPayloadVersion < 1) {
      throw new IllegalArgumentException(
          "Payload version must start from 1, got %d".formatted(currentPayloadVersion));
    }

    final Registration registration = new Registration(nonNullEventClass, currentPayloadVersion);
    final Registration existing = registrations.putIfAbsent(nonBlankEventType, registration);
    if (existing != null && !existing.equals(registration)) {
      throw new IllegalStateException(
          "Event type '%s' is already registered for '%s'"
              .formatted(nonBlankEventType, existing.eventClass().getName()));
    }

    return this;
  }

  /**
   * @param upcaster to register
   * @return this registry for chaining
   * @throws IllegalStateException if an upcaster for the same type and version already exists
   */
  public EventTypeRegistry registerUpcaster(final EventUpcaster upcaster) {
    final EventUpcaster nonNullUpcaster = throwIllegalArgumentIfNull(upcaster, "Upcaster");
    final UpcasterKey key =
        new UpcasterKey(nonNullUpcaster.eventType(), nonNullUpcaster.fromPayloadVersion());

    if (upcasters.putIfAbsent(key, nonNullUpcaster) != null) {
      throw new IllegalStateException(
          "Upcaster for '%s' version %d is already registered"
              .formatted(key.eventType(), key.fromPayloadVersion()));
    }

    return this;
  }

  /**
   * @param eventType to resolve
   * @return the payload class registered for the tag
   * @throws CodecException if the tag is not registered
   */
  public Class<? extends DomainEvent> resolve(final String eventType) {
    return registration(eventType).eventClass();
  }

  /**
   * @param eventType to look up
   * @return the payload version new events of this type are written with
   * @throws CodecException if the tag is not registered
   */
  public int currentPayloadVersion(final String eventType) {
    return registration(eventType).currentPayloadVersion();
  }

  /**
   * @param eventType to look up
   * @param fromPayloadVersion the stored payload version
   * @return an upcaster migrating from the given version, if registered
   */
  public Optional<EventUpcaster> upcasterFor(final String eventType, final int fromPayloadVersion) {
    return Optional.ofNullable(upcasters.get(new UpcasterKey(eventType, fromPayloadVersion)));
  }

  /**
   * @return all registered tags
   */
  public Set<String> registeredEventTypes() {
    return Set.copyOf(registrations.keySet());
  }

  private Registration registration(final String eventType) {
    final Registration registration =
        registrations.get(throwIllegalArgumentIfBlank(eventType, "Event type"));
    if (registration == null) {
      throw new CodecException("Event type '%s' is not registered".formatted(eventType));
    }

    return registration;
  }

  private record Registration(Class<? extends DomainEvent> eventClass, int currentPayloadVersion) {}

  private record UpcasterKey(String eventType, int fromPayloadVersion) {}
}
