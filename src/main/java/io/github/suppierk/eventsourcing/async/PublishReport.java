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

import java.util.Optional;

/**
 * Result of one publishing run of a channel.
 *
 * @param channelId of the published channel
 * @param fromPosition cursor of the channel before the run, exclusive
 * @param toPosition cursor of the channel after the run, inclusive
 * @param deliveredCount number of acknowledged events
 * @param deliveryFailure which stopped the run, {@code null} if all pending events were delivered
 */
public record PublishReport(
    String channelId,
    long fromPosition,
    long toPosition,
    int deliveredCount,
    DeliveryFailureException deliveryFailure) {
  /** Reported as positions of a run which failed before reading the cursor. */
  public static final long UNKNOWN_POSITION = -1L;

  static PublishReport aborted(final String channelId, final Throwable cause) {
    return new PublishReport(
        channelId,
        UNKNOWN_POSITION,
        UNKNOWN_POSITION,
        0,
        new DeliveryFailureException(
            channelId, UNKNOWN_POSITION, "Publishing to '%s' failed".formatted(channelId), cause));
  }

  public Optional<DeliveryFailureException> failure() {
    return Optional.ofNullable(deliveryFailure);
  }

  public boolean isComplete() {
    return deliveryFailure == null;
  }
}
