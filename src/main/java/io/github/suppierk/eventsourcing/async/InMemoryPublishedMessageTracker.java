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
import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfNegative;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/** {@link PublishedMessageTracker} kept in memory. */
public final class InMemoryPublishedMessageTracker implements PublishedMessageTracker {
  private final ConcurrentMap<String, Long> positions;

  public InMemoryPublishedMessageTracker() {
    this.positions = new ConcurrentHashMap<>();
  }

  /** {@inheritDoc} */
  @Override
  public long lastPublishedPosition(final String channelId) {
    return positions.getOrDefault(throwIllegalArgumentIfBlank(channelId, "Channel ID"), 0L);
  }

  /** {@inheritDoc} */
  @Override
  public void advance(final String channelId, final long position) {
    positions.merge(
        throwIllegalArgumentIfBlank(channelId, "Channel ID"),
        throwIllegalArgumentIfNegative(position, "Position"),
        Math::max);
  }
}
