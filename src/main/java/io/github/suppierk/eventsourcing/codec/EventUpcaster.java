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

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.function.UnaryOperator;

/**
 * Migrates a stored payload of one event type from one payload version to the next one.
 *
 * <p>Upcasters are chained: a payload stored with version {@code 1} of an event whose current
 * version is {@code 3} goes through the upcaster from {@code 1} and then the one from {@code 2}.
 * Stored events are never rewritten, the migration happens on every read.
 */
public interface EventUpcaster {
  /**
   * @param eventType this upcaster applies to
   * @param fromPayloadVersion this upcaster accepts
   * @param migration producing the payload of {@code fromPayloadVersion + 1}
   * @return a new instance of {@link EventUpcaster}
   */
  static EventUpcaster of(
      final String eventType,
      final int fromPayloadVersion,
      final UnaryOperator<ObjectNode> migration) {
    final String nonBlankEventType = throwIllegalArgumentIfBlank(eventType, "Event type");
    final UnaryOperator<ObjectNode> nonNullMigration =
        throwIllegalArgumentIfNull(migration, "Upcaster migration");

    if (fromPayloadVersion < 1) {
      throw new IllegalArgumentException(
          "Payload version must start from 1, got %d".formatted(fromPayloadVersion));
    }

    return new EventUpcaster() {
      @Override
      public String eventType() {
        return nonBlankEventType;
      }

      @Override
      public int fromPayloadVersion() {
        return fromPayloadVersion;
      }

      @Override
      public ObjectNode upcast(ObjectNode payload) {
        return nonNullMigration.apply(payload);
      }
    };
  }

  /**
   * @return the event type tag this upcaster applies to
   */
  String eventType();

  /**
   * @return the payload version this upcaster accepts, the output has this version plus one
   */
  int fromPayloadVersion();

  /**
   * @param payload of {@link #fromPayloadVersion()}, can be modified in place
   * @return the payload of the next version
   */
  ObjectNode upcast(ObjectNode payload);
}
