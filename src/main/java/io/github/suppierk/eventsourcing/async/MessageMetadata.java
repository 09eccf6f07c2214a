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

package io.github.suppierk.eventsourcing.async;

import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfBlank;
import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfNull;

import io.github.suppierk.eventsourcing.event.EventRecord;
import java.time.Instant;

/**
 * Broker-agnostic headers accompanying every delivered event.
 *
 * <p>Consumers deduplicate by {@link #aggregateId()} and {@link #version()}.
 *
 * @param type of the event
 * @param id unique identifier of the event
 * @param timestamp when the event occurred
 * @param aggregateId of the aggregate which produced the event
 * @param version of the aggregate produced by the event
 * @param payloadVersion schema version of the payload
 * @param globalPosition of the event in the commit order
 */
public record MessageMetadata(
    String type,
    String id,
    Instant timestamp,
    String aggregateId,
    long version,
    int payloadVersion,
    long globalPosition) {
  public MessageMetadata {
    throwIllegalArgumentIfBlank(type, "Message type");
    throwIllegalArgumentIfBlank(id, "Message ID");
    throwIllegalArgumentIfNull(timestamp, "Message timestamp");
    throwIllegalArgumentIfBlank(aggregateId, "Aggregate ID");
  }

  public static MessageMetadata of(final EventRecord event) {
    final EventRecord nonNullEvent = throwIllegalArgumentIfNull(event, "Event");

    return new MessageMetadata(
        nonNullEvent.eventType(),
        nonNullEvent.eventId().toString(),
        nonNullEvent.occurredAt(),
        nonNullEvent.aggregateId(),
        nonNullEvent.version(),
        nonNullEvent.payloadVersion(),
        nonNullEvent.globalPosition());
  }
}
