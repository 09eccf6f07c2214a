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
 * Thrown by business methods of an {@link AggregateRoot} when the requested change would break a
 * business rule. Nothing is recorded when this exception is thrown.
 */
public class InvariantViolationException extends RuntimeException {
  @Serial private static final long serialVersionUID = -2447786105913391180L;

  public InvariantViolationException() {
    super();
  }

  public InvariantViolationException(String message) {
    super(message);
  }

  public InvariantViolationException(String message, Throwable cause) {
    super(message, cause);
  }

  public InvariantViolationException(Throwable cause) {
    super(cause);
  }
}
