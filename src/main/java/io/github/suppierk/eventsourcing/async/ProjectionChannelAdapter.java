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

import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfNull;

import io.github.suppierk.eventsourcing.codec.EventCodec;
import io.github.suppierk.eventsourcing.projection.ProjectionEngine;

/** Feeds delivered events into a {@link ProjectionEngine} within the same process. */
public final class ProjectionChannelAdapter implements ChannelAdapter {
  private final EventCodec codec;
  private final ProjectionEngine projectionEngine;

  public ProjectionChannelAdapter(final EventCodec codec, final ProjectionEngine projectionEngine) {
    this.codec = throwIllegalArgumentIfNull(codec, "Event codec");
    this.projectionEngine = throwIllegalArgumentIfNull(projectionEngine, "Projection engine");
  }

  /** {@inheritDoc} */
  @Override
  public DeliveryStatus send(final String envelope, final MessageMetadata metadata) {
    projectionEngine.apply(codec.deserialize(codec.readEnvelope(envelope)));
    return DeliveryStatus.ACKNOWLEDGED;
  }
}
