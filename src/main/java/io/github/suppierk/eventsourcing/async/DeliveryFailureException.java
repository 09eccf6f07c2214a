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

import java.io.Serial;

/** Describes why a channel did not accept an event. */
public class DeliveryFailureException extends RuntimeException {
  @Serial private static final long serialVersionUID = -6408954744406785427L;

  private final String channelId;
  private final long globalPosition;

  public DeliveryFailureException(
      final String channelId, final long globalPosition, final String message) {
    this(channelId, globalPosition, message, null);
  }

  public DeliveryFailureException(
      final String channelId,
      final long globalPosition,
      final String message,
      final Throwable cause) {
    super(message, cause);
    this.channelId = channelId;
    this.globalPosition = globalPosition;
  }

  public String getChannelId() {
    return channelId;
  }

  /**
   * @return position of the event which was not delivered, {@code -1} if publishing failed before
   *     any event was offered
   */
  public long getGlobalPosition() {
    return globalPosition;
  }
}
