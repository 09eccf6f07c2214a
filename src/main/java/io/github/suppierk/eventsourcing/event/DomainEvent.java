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

import java.io.Serializable;

/**
 * Represents an immutable fact about something that happened to an aggregate.
 *
 * <p>It is highly recommended to use this interface with Java {@link Record}s.
 *
 * <p>Events must be named in the past tense and must be task-oriented, not data-centric - e.g.
 * 'Wish Made' instead of 'Wish Status Set To CREATED'.
 *
 * <p>This interface describes only the payload. Metadata such as the aggregate identifier, the
 * version and the commit position is kept outside, in {@link EventRecord}, so that events stay
 * plain business data.
 *
 * <p>Events are asynchronous by nature, and it should be possible to place them in a message
 * queue - this is the reason this class implements {@link Serializable} interface.
 */
public interface DomainEvent extends Serializable {
  /**
   * Defined as {@code eventType()} rather than {@code getEventType()} so that JSON serializers do
   * not treat it as a payload property.
   *
   * @return the explicit tag of this event used for dispatching and deserialization, simple class
   *     name by default
   */
  default String eventType() {
    return getClass().getSimpleName();
  }

  /**
   * @return the schema version of this payload, which is independent of the aggregate version and
   *     lets consumers tell old and new shapes of the same event apart
   */
  default int payloadVersion() {
    return 1;
  }
}
