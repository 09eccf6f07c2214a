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

import io.github.suppierk.eventsourcing.event.EventRecord;
import java.util.List;

/**
 * Converts {@link EventRecord}s to and from their durable and wire representations.
 *
 * <ul>
 *   <li>{@link SerializedEvent} is the durable form used by event stores.
 *   <li>Envelope JSON is the wire form used by channel adapters and the event feed: a JSON object
 *       with the fields of {@link SerializedEvent}, where the payload is embedded as a JSON
 *       object.
 * </ul>
 */
public interface EventCodec {
  /**
   * @param eventRecord to serialize
   * @return durable form of the record
   * @throws CodecException if the payload type is not registered or cannot be serialized
   */
  SerializedEvent serialize(EventRecord eventRecord);

  /**
   * Restores the record, upcasting the payload to its current version when necessary.
   *
   * @param serializedEvent to deserialize
   * @return the record with a payload of the current version
   * @throws CodecException if the event type is unknown or the payload cannot be upcasted
   */
  EventRecord deserialize(SerializedEvent serializedEvent);

  /**
   * @param serializedEvent to convert
   * @return envelope JSON text
   * @throws CodecException if the envelope cannot be written
   */
  String writeEnvelope(SerializedEvent serializedEvent);

  /**
   * @param serializedEvents to convert, in order
   * @return JSON array text of envelopes
   * @throws CodecException if the envelopes cannot be written
   */
  String writeEnvelopes(List<SerializedEvent> serializedEvents);

  /**
   * @param envelope JSON text produced by {@link #writeEnvelope(SerializedEvent)}
   * @return durable form of the event
   * @throws CodecException if the text is not a valid envelope
   */
  SerializedEvent readEnvelope(String envelope);
}
