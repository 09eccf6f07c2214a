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
 * Thrown when the storage behind an {@link EventStore} cannot serve the request.
 *
 * <p>When raised by {@link EventStore#append}, the outcome of the append is unknown: the events may
 * or may not have been stored.
 */
public class StoreUnavailableException extends RuntimeException {
  @Serial private static final long serialVersionUID = 2039488164307916548L;

  public StoreUnavailableException(String message) {
    super(message);
  }

  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }

  public StoreUnavailableException(Throwable cause) {
    super(cause);
  }
}
