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

package io.github.suppierk.eventsourcing.store;

import java.io.Serial;

/**
 * Thrown by {@link EventStore#append} when another writer has already appended to the same
 * aggregate stream since the caller has read it.
 */
public class ConcurrencyConflictException extends RuntimeException {
  @Serial private static final long serialVersionUID = -3180960419361525762L;

  private final String aggregateId;
  private final long expectedVersion;
  private final long actualVersion;

  public ConcurrencyConflictException(
      final String aggregateId, final long expectedVersion, final long actualVersion) {
    this(aggregateId, expectedVersion, actualVersion, null);
  }

  public ConcurrencyConflictException(
      final String aggregateId,
      final long expectedVersion,
      final long actualVersion,
      final Throwable cause) {
    super(
        "Aggregate '%s' was expected at version %d, but is at version %d"
            .formatted(aggregateId, expectedVersion, actualVersion),
        cause);
    this.aggregateId = aggregateId;
    this.expectedVersion = expectedVersion;
    this.actualVersion = actualVersion;
  }

  public String getAggregateId() {
    return aggregateId;
  }

  public long getExpectedVersion() {
    return expectedVersion;
  }

  /**
   * @return stored version at the moment of the conflict, {@code -1} if the store could not tell
   */
  public long getActualVersion() {
    return actualVersion;
  }
}
