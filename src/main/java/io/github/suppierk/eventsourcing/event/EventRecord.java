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

package io.github.suppierk.eventsourcing.event;

import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfBlank;
import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfNegative;
import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfNull;

import java.io.Serial;
import java.io.Serializable;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable envelope of a {@link DomainEvent} which carries everything the event store needs to
 * know about it.
 *
 * <p>The record goes through two stages:
 *
 * <ul>
 *   <li><b>Uncommitted</b>: created by an aggregate, {@link #globalPosition()} is {@code 0}.
 *   <li><b>Committed</b>: returned by the event store, {@link #globalPosition()} reflects the
 *       global commit order.
 * </ul>
 *
 * <p><b>Design note</b>: equality is defined by {@link #aggregateId()} and {@link #version()} only,
 * because this pair uniquely identifies an occurrence and is what consumers deduplicate by.
 *
 * @param eventId unique identifier of this occurrence
 * @param aggregateId of the aggregate this event belongs to
 * @param aggregateType of the aggregate this event belongs to
 * @param eventType tag used to resolve the payload type
 * @param version of the aggregate produced by this event, starting from {@code 1}
 * @param occurredAt time of the occurrence, truncated to milliseconds
 * @param payloadVersion schema version of the payload
 * @param payload the business data
 * @param causationId identifier of the command which produced this event, can be {@code null}
 * @param globalPosition commit order position, {@code 0} when not committed yet
 */
public record EventRecord(
    UUID eventId,
    String aggregateId,
    String aggregateType,
    String eventType,
    long version,
    Instant occurredAt,
    int payloadVersion,
    DomainEvent payload,
    String causationId,
    long globalPosition)
    implements Serializable {
  @Serial private static final long serialVersionUID = 4671913185032775108L;

  public EventRecord {
    throwIllegalArgumentIfNull(eventId, "Event ID");
    throwIllegalArgumentIfBlank(aggregateId, "Aggregate ID");
    throwIllegalArgumentIfBlank(aggregateType, "Aggregate type");
    throwIllegalArgumentIfBlank(eventType, "Event type");
    throwIllegalArgumentIfNull(occurredAt, "Occurrence time");
    throwIllegalArgumentIfNull(payload, "Event payload");
    throwIllegalArgumentIfNegative(globalPosition, "Global position");

    if (version < 1) {
      throw new IllegalArgumentException(
          "Event version must start from 1, got %d".formatted(version));
    }

    if (payloadVersion < 1) {
      throw new IllegalArgumentException(
          "Payload version must start from 1, got %d".formatted(payloadVersion));
    }

    occurredAt = occurredAt.truncatedTo(ChronoUnit.MILLIS);
  }

  /**
   * Creates a new uncommitted record for the given payload.
   *
   * @param aggregateId of the aggregate producing the event
   * @param aggregateType of the aggregate producing the event
   * @param version the event will bring the aggregate to
   * @param occurredAt time of the occurrence
   * @param payload the business data
   * @return a new uncommitted record
   */
  public static EventRecord uncommitted(
      final String aggregateId,
      final String aggregateType,
      final long version,
      final Instant occurredAt,
      final DomainEvent payload) {
    final DomainEvent nonNullPayload = throwIllegalArgumentIfNull(payload, "Event payload");

    return new EventRecord(
        UUID.randomUUID(),
        aggregateId,
        aggregateType,
        nonNullPayload.eventType(),
        version,
        occurredAt,
        nonNullPayload.payloadVersion(),
        nonNullPayload,
        null,
        0L);
  }

  /**
   * @return {@code true} if the event store has assigned a global position to this record
   */
  public boolean isCommitted() {
    return globalPosition > 0;
  }

  /**
   * @return identifier of the command which produced this event, if known
   */
  public Optional<String> causation() {
    return Optional.ofNullable(causationId);
  }

  /**
   * @param newCausationId of the command which produced this event
   * @return a copy of this record with the given causation identifier
   */
  public EventRecord withCausationId(final String newCausationId) {
    return new EventRecord(
        eventId,
        aggregateId,
        aggregateType,
        eventType,
        version,
        occurredAt,
        payloadVersion,
        payload,
        throwIllegalArgumentIfBlank(newCausationId, "Causation ID"),
        globalPosition);
  }

  /**
   * Used by event stores only.
   *
   * @param position assigned by the event store
   * @return a copy of this record marked as committed at the given position
   */
  public EventRecord committedAt(final long position) {
    if (position < 1) {
      throw new IllegalArgumentException(
          "Global position must start from 1, got %d".formatted(position));
    }

    return new EventRecord(
        eventId,
        aggregateId,
        aggregateType,
        eventType,
        version,
        occurredAt,
        payloadVersion,
        payload,
        causationId,
        position);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    EventRecord that = (EventRecord) o;
    return version == that.version && aggregateId.equals(that.aggregateId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(aggregateId, version);
  }
}
