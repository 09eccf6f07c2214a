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
import java.time.Duration;

/**
 * Thrown by {@link AggregateLocks} when the lock of an aggregate could not be acquired in time.
 * The operation can be retried later.
 */
public class LockTimeoutException extends RuntimeException {
  @Serial private static final long serialVersionUID = 8107425566395906627L;

  private final String aggregateId;

  public LockTimeoutException(final String aggregateId, final Duration timeout) {
    this(aggregateId, timeout, null);
  }

  public LockTimeoutException(
      final String aggregateId, final Duration timeout, final Throwable cause) {
    super(
        "Lock of aggregate '%s' was not acquired within %d ms"
            .formatted(aggregateId, timeout.toMillis()),
        cause);
    this.aggregateId = aggregateId;
  }

  public String getAggregateId() {
    return aggregateId;
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/503">503 Service
   *     Unavailable</a>
   */
  @SuppressWarnings("squid:S3400")
  public final int getStatusCode() {
    return 503;
  }
}
