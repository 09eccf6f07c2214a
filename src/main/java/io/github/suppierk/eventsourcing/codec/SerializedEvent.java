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

import java.time.Instant;
import java.util.UUID;

/**
 * Stable, storage-friendly form of an {@link io.github.suppierk.eventsourcing.event.EventRecord}
 * where the payload is JSON text opaque to the store.
 *
 * @param eventId unique identifier of this occurrence
 * @param aggregateId of the aggregate this event belongs to
 * @param aggregateType of the aggregate this event belongs to
 * @param eventType tag used to resolve the payload type
 * @param version of the aggregate produced by this event
 * @param occurredAt time of the occurrence
 * @param payloadVersion schema version of the payload
 * @param payload JSON text of the payload
 * @param causationId identifier of the command which produced this event, can be {@code null}
 * @param globalPosition commit order position, {@code 0} when not committed yet
 */
public record SerializedEvent(
    UUID eventId,
    String aggregateId,
    String aggregateType,
    String eventType,
    long version,
    Instant occurredAt,
    int payloadVersion,
    String payload,
    String causationId,
    long globalPosition) {
  public SerializedEvent {
    throwIllegalArgumentIfNull(eventId, "Event ID");
    throwIllegalArgumentIfBlank(aggregateId, "Aggregate ID");
    throwIllegalArgumentIfBlank(aggregateType, "Aggregate type");
    throwIllegalArgumentIfBlank(eventType, "Event type");
    throwIllegalArgumentIfNull(occurredAt, "Occurrence time");
    throwIllegalArgumentIfBlank(payload, "Event payload");
  }
}
