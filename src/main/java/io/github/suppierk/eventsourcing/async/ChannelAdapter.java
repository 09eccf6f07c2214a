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
 * Hands events over to one downstream destination, such as a message broker or a read model.
 *
 * <p>Events are offered in commit order, and the same event can be offered more than once, so
 * destinations must be idempotent on the aggregate identifier and version.
 */
@FunctionalInterface
public interface ChannelAdapter {
  /**
   * @param envelope JSON envelope of the event
   * @param metadata headers of the event
   * @return {@link DeliveryStatus#ACKNOWLEDGED} once the destination has taken responsibility for
   *     the event
   * @throws Exception if the delivery failed, which is treated the same way as {@link
   *     DeliveryStatus#REJECTED}
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-112/">Suppressed Sonar rule to allow
   *     more flexibility</a>
   */
  @SuppressWarnings("squid:S112")
  DeliveryStatus send(final String envelope, final MessageMetadata metadata) throws Exception;
}
