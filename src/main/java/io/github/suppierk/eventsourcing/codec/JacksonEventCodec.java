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

import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfNull;
import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalStateIfNull;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.suppierk.eventsourcing.event.DomainEvent;
import io.github.suppierk.eventsourcing.event.EventRecord;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.UUID;

/**
 * {@link EventCodec} backed by Jackson.
 *
 * <p>Payload types are resolved through {@link EventTypeRegistry} only, stored payloads older than
 * the registered version are migrated with the registered {@link EventUpcaster}s before being
 * bound to the payload class.
 */
public final class JacksonEventCodec implements EventCodec {
  private static final String EVENT_ID = "eventId";
  private static final String AGGREGATE_ID = "aggregateId";
  private static final String AGGREGATE_TYPE = "aggregateType";
  private static final String EVENT_TYPE = "eventType";
  private static final String VERSION = "version";
  private static final String OCCURRED_AT = "occurredAt";
  private static final String PAYLOAD_VERSION = "payloadVersion";
  private static final String PAYLOAD = "payload";
  private static final String CAUSATION_ID = "causationId";
  private static final String GLOBAL_POSITION = "globalPosition";

  private final EventTypeRegistry registry;
  private final ObjectMapper objectMapper;

  public JacksonEventCodec(final EventTypeRegistry registry) {
    this(registry, defaultObjectMapper());
  }

  public JacksonEventCodec(final EventTypeRegistry registry, final ObjectMapper objectMapper) {
    this.registry = throwIllegalArgumentIfNull(registry, "Event type registry");
    this.objectMapper = throwIllegalArgumentIfNull(objectMapper, "Object mapper");
  }

  /**
   * Java time values are written as ISO-8601 text and unknown properties are ignored, so that
   * consumers tolerate fields added by newer producers.
   *
   * @return a new {@link ObjectMapper} configured for events and snapshots
   */
  public static ObjectMapper defaultObjectMapper() {
    return new ObjectMapper()
        .findAndRegisterModules()
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  /** {@inheritDoc} */
  @Override
  public SerializedEvent serialize(final EventRecord eventRecord) {
    final EventRecord nonNullRecord = throwIllegalArgumentIfNull(eventRecord, "Event record");
    final Class<? extends DomainEvent> registeredClass =
        registry.resolve(nonNullRecord.eventType());

    if (!registeredClass.equals(nonNullRecord.payload().getClass())) {
      throw new CodecException(
          "Event type '%s' is registered for '%s', but the payload is '%s'"
              .formatted(
                  nonNullRecord.eventType(),
                  registeredClass.getName(),
                  nonNullRecord.payload().getClass().getName()));
    }

    final String payload;
    try {
      payload = objectMapper.writeValueAsString(nonNullRecord.payload());
    } catch (JsonProcessingException e) {
      throw new CodecException(
          "Failed to serialize payload of event '%s'".formatted(nonNullRecord.eventId()), e);
    }

    return new SerializedEvent(
        nonNullRecord.eventId(),
        nonNullRecord.aggregateId(),
        nonNullRecord.aggregateType(),
        nonNullRecord.eventType(),
        nonNullRecord.version(),
        nonNullRecord.occurredAt(),
        nonNullRecord.payloadVersion(),
        payload,
        nonNullRecord.causationId(),
        nonNullRecord.globalPosition());
  }

  /** {@inheritDoc} */
  @Override
  public EventRecord deserialize(final SerializedEvent serializedEvent) {
    final SerializedEvent nonNullEvent =
        throwIllegalArgumentIfNull(serializedEvent, "Serialized event");
    final String eventType = nonNullEvent.eventType();
    final Class<? extends DomainEvent> eventClass = registry.resolve(eventType);
    final int currentPayloadVersion = registry.currentPayloadVersion(eventType);

    if (nonNullEvent.payloadVersion() > currentPayloadVersion) {
      throw new CodecException(
          "Event '%s' has payload version %d, but only %d is supported for '%s'"
              .formatted(
                  nonNullEvent.eventId(),
                  nonNullEvent.payloadVersion(),
                  currentPayloadVersion,
                  eventType));
    }

    ObjectNode payloadNode = readObject(nonNullEvent.payload());
    for (int version = nonNullEvent.payloadVersion();
        version < currentPayloadVersion;
        version++) {
      final int fromVersion = version;
      final EventUpcaster upcaster =
          registry
              .upcasterFor(eventType, fromVersion)
              .orElseThrow(
                  () ->
                      new CodecException(
                          "No upcaster registered for '%s' from payload version %d"
                              .formatted(eventType, fromVersion)));
      payloadNode = throwIllegalStateIfNull(upcaster.upcast(payloadNode), "Upcasted payload");
    }

    final DomainEvent payload;
    try {
      payload = objectMapper.treeToValue(payloadNode, eventClass);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new CodecException(
          "Failed to deserialize payload of event '%s' as '%s'"
              .formatted(nonNullEvent.eventId(), eventClass.getName()),
          e);
    }

    return new EventRecord(
        nonNullEvent.eventId(),
        nonNullEvent.aggregateId(),
        nonNullEvent.aggregateType(),
        eventType,
        nonNullEvent.version(),
        nonNullEvent.occurredAt(),
        currentPayloadVersion,
        throwIllegalStateIfNull(payload, "Deserialized payload"),
        nonNullEvent.causationId(),
        nonNullEvent.globalPosition());
  }

  /** {@inheritDoc} */
  @Override
  public String writeEnvelope(final SerializedEvent serializedEvent) {
    return write(toEnvelopeNode(throwIllegalArgumentIfNull(serializedEvent, "Serialized event")));
  }

  /** {@inheritDoc} */
  @Override
  public String writeEnvelopes(final List<SerializedEvent> serializedEvents) {
    final ArrayNode envelopes = objectMapper.createArrayNode();
    for (SerializedEvent serializedEvent :
        throwIllegalArgumentIfNull(serializedEvents, "Serialized events")) {
      envelopes.add(
          toEnvelopeNode(throwIllegalArgumentIfNull(serializedEvent, "Serialized event")));
    }

    return write(envelopes);
  }

  /** {@inheritDoc} */
  @Override
  public SerializedEvent readEnvelope(final String envelope) {
    final ObjectNode node = readObject(throwIllegalArgumentIfNull(envelope, "Envelope"));
    final JsonNode payload = requiredField(node, PAYLOAD);
    if (!payload.isObject()) {
      throw new CodecException("Envelope payload must be a JSON object");
    }

    try {
      return new SerializedEvent(
          UUID.fromString(requiredField(node, EVENT_ID).asText()),
          requiredField(node, AGGREGATE_ID).asText(),
          requiredField(node, AGGREGATE_TYPE).asText(),
          requiredField(node, EVENT_TYPE).asText(),
          requiredField(node, VERSION).asLong(),
          Instant.parse(requiredField(node, OCCURRED_AT).asText()),
          requiredField(node, PAYLOAD_VERSION).asInt(),
          payload.toString(),
          node.hasNonNull(CAUSATION_ID) ? node.get(CAUSATION_ID).asText() : null,
          node.path(GLOBAL_POSITION).asLong(0L));
    } catch (IllegalArgumentException | DateTimeParseException e) {
      throw new CodecException("Envelope contains invalid values", e);
    }
  }

  private ObjectNode toEnvelopeNode(final SerializedEvent serializedEvent) {
    final ObjectNode node = objectMapper.createObjectNode();
    node.put(EVENT_ID, serializedEvent.eventId().toString());
    node.put(AGGREGATE_ID, serializedEvent.aggregateId());
    node.put(AGGREGATE_TYPE, serializedEvent.aggregateType());
    node.put(EVENT_TYPE, serializedEvent.eventType());
    node.put(VERSION, serializedEvent.version());
    node.put(OCCURRED_AT, serializedEvent.occurredAt().toString());
    node.put(PAYLOAD_VERSION, serializedEvent.payloadVersion());
    node.set(PAYLOAD, readObject(serializedEvent.payload()));
    node.put(CAUSATION_ID, serializedEvent.causationId());
    node.put(GLOBAL_POSITION, serializedEvent.globalPosition());
    return node;
  }

  private ObjectNode readObject(final String json) {
    final JsonNode node;
    try {
      node = objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new CodecException("Malformed JSON", e);
    }

    if (node instanceof ObjectNode objectNode) {
      return objectNode;
    }

    throw new CodecException("Expected a JSON object, got '%s'".formatted(node.getNodeType()));
  }

  private String write(final JsonNode node) {
    try {
      return objectMapper.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new CodecException("Failed to write JSON", e);
    }
  }

  private static JsonNode requiredField(final ObjectNode node, final String fieldName) {
    final JsonNode field = node.get(fieldName);
    if (field == null || field.isNull()) {
      throw new CodecException("Envelope field '%s' is missing".formatted(fieldName));
    }

    return field;
  }
}
