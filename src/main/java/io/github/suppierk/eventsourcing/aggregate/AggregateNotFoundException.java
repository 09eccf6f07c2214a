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

/** Thrown when an aggregate is required to exist, but has no events. */
public class AggregateNotFoundException extends RuntimeException {
  @Serial private static final long serialVersionUID = -1617387338170291390L;

  private final String aggregateId;

  public AggregateNotFoundException(final String aggregateId) {
    super("Aggregate '%s' does not exist".formatted(aggregateId));
    this.aggregateId = aggregateId;
  }

  public String getAggregateId() {
    return aggregateId;
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/404">404 Not Found</a>
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-3400/">Suppressed Sonar rule about
   *     declaring a constant instead</a>
   */
  @SuppressWarnings("squid:S3400")
  public final int getStatusCode() {
    return 404;
  }
}
