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

/**
 * Remembers, per channel, the global position of the last event the channel has acknowledged.
 *
 * <p>Positions never move backwards. A channel which was never advanced starts at {@code 0}, the
 * beginning of the event log.
 */
public interface PublishedMessageTracker {
  /**
   * @param channelId to look up
   * @return global position of the last acknowledged event, {@code 0} if none
   */
  long lastPublishedPosition(final String channelId);

  /**
   * Positions which are not greater than the current one are ignored.
   *
   * @param channelId to advance
   * @param position of the last acknowledged event
   */
  void advance(final String channelId, final long position);
}
