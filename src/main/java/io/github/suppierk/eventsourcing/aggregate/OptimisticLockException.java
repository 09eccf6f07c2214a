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

package io.github.suppierk.eventsourcing.aggregate;

import java.io.Serial;

/**
 * Thrown by {@link EventSourcedRepository#save(AggregateRoot)} when the aggregate was changed by
 * someone else after it was loaded.
 *
 * <p>The aggregate instance which failed to save is stale and must be discarded. The whole
 * operation can be retried on a freshly loaded instance.
 */
public class OptimisticLockException extends RuntimeException {
  @Serial private static final long serialVersionUID = 5254126409127432275L;

  private final String aggregateId;
  private final long expectedVersion;

  public OptimisticLockException(
      final String aggregateId, final long expectedVersion, final Throwable cause) {
    super(
        "Aggregate '%s' was modified concurrently, expected version %d"
            .formatted(aggregateId, expectedVersion),
        cause);
    this.aggregateId = aggregateId;
    this.expectedVersion = expectedVersion;
  }

  public String getAggregateId() {
    return aggregateId;
  }

  public long getExpectedVersion() {
    return expectedVersion;
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/409">409 Conflict</a>
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-3400/">Suppressed Sonar rule about
   *     declaring a constant instead</a>
   */
  @SuppressWarnings("squid:S3400")
  public final int getStatusCode() {
    return 409;
  }
}
