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

import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfNegative;
import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfNotPositive;
import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfNull;

import io.github.suppierk.eventsourcing.codec.EventCodec;
import io.github.suppierk.eventsourcing.codec.SerializedEvent;
import io.github.suppierk.eventsourcing.event.EventRecord;
import io.github.suppierk.eventsourcing.store.EventStore;
import java.util.List;
import java.util.stream.Stream;

/**
 * Pull alternative to {@link EventPublisher}: serves pages of the event log to consumers which
 * keep their own cursor, e.g. behind {@code GET /events?since=<cursor>}.
 *
 * <p>Consumers pass the {@code globalPosition} of the last event they have processed as the next
 * cursor. An empty page means that the consumer has caught up.
 */
public final class EventFeed {
  static final int DEFAULT_PAGE_SIZE = 100;

  private final EventStore eventStore;
  private final EventCodec codec;

  public EventFeed(final EventStore eventStore, final EventCodec codec) {
    this.eventStore = throwIllegalArgumentIfNull(eventStore, "Event store");
    this.codec = throwIllegalArgumentIfNull(codec, "Event codec");
  }

  public String eventsSince(final long since) {
    return eventsSince(since, DEFAULT_PAGE_SIZE);
  }

  /**
   * @param since global position of the last processed event, exclusive
   * @param limit maximum number of events in the page
   * @return JSON array of event envelopes in commit order
   * @throws IllegalArgumentException if {@code since} is negative or {@code limit} is not positive
   */
  public String eventsSince(final long since, final int limit) {
    throwIllegalArgumentIfNegative(since, "Cursor");
    throwIllegalArgumentIfNotPositive(limit, "Page size");

    final List<SerializedEvent> page;
    try (Stream<EventRecord> events = eventStore.readAll(since)) {
      page = events.limit(limit).map(codec::serialize).toList();
    }

    return codec.writeEnvelopes(page);
  }
}
