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

import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfNull;

import io.github.suppierk.eventsourcing.event.DomainEvent;
import io.github.suppierk.eventsourcing.event.EventRecord;
import java.util.function.BiConsumer;

/**
 * Updates a read model from one type of event.
 *
 * <p>Handlers must be idempotent: an upsert keyed by the aggregate identifier is the usual shape.
 */
@FunctionalInterface
public interface ProjectionHandler {
  /**
   * Adapts a handler of a specific payload type.
   *
   * @param eventClass of the payload
   * @param handler receiving the envelope together with the typed payload
   * @param <E> is the type of the payload
   * @return a new handler
   */
  static <E extends DomainEvent> ProjectionHandler of(
      final Class<E> eventClass, final BiConsumer<EventRecord, E> handler) {
    final Class<E> nonNullEventClass = throwIllegalArgumentIfNull(eventClass, "Event class");
    final BiConsumer<EventRecord, E> nonNullHandler =
        throwIllegalArgumentIfNull(handler, "Projection handler");

    return event -> nonNullHandler.accept(event, nonNullEventClass.cast(event.payload()));
  }

  void handle(final EventRecord event);
}
