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

package io.github.suppierk.eventsourcing.snapshot;

import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfBlank;
import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfNull;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Serialized state of an aggregate as of {@link #version()}.
 *
 * <p>A snapshot is only meaningful together with the events of the aggregate after {@link
 * #version()}.
 *
 * @param aggregateId of the captured aggregate
 * @param aggregateType of the captured aggregate
 * @param version of the aggregate at capture time
 * @param state JSON text of the aggregate state
 * @param createdAt time of the capture, truncated to milliseconds
 */
public record Snapshot(
    String aggregateId, String aggregateType, long version, String state, Instant createdAt) {
  public Snapshot {
    throwIllegalArgumentIfBlank(aggregateId, "Aggregate ID");
    throwIllegalArgumentIfBlank(aggregateType, "Aggregate type");
    throwIllegalArgumentIfBlank(state, "Snapshot state");
    throwIllegalArgumentIfNull(createdAt, "Creation time");

    if (version < 1) {
      throw new IllegalArgumentException(
          "Snapshot version must start from 1, got %d".formatted(version));
    }

    createdAt = createdAt.truncatedTo(ChronoUnit.MILLIS);
  }

  /**
   * Creation time is not compared, so that retries of the same capture are recognized.
   *
   * @param other snapshot
   * @return {@code true} if both snapshots describe the same state of the same aggregate version
   */
  public boolean hasSameContentAs(final Snapshot other) {
    return other != null
        && aggregateId.equals(other.aggregateId)
        && aggregateType.equals(other.aggregateType)
        && version == other.version
        && state.equals(other.state);
  }
}
