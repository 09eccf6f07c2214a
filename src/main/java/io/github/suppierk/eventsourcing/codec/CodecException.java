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

package io.github.suppierk.eventsourcing.codec;

import java.io.Serial;

/**
 * A specific {@link Exception} to be thrown if an event, an envelope or a snapshot state cannot be
 * converted from or to its serialized form.
 *
 * <p>Typically signals either a programming error (unregistered event type) or a schema evolution
 * problem (a stored payload version without an upcaster).
 */
public class CodecException extends RuntimeException {
  @Serial private static final long serialVersionUID = -3127550316604932583L;

  /**
   * Constructs a new runtime exception with the specified detail message.
   *
   * @param message the detail message (which is saved for later retrieval by the {@link
   *     #getMessage()} method).
   */
  public CodecException(String message) {
    super(message);
  }

  /**
   * Constructs a new runtime exception with the specified detail message and cause.
   *
   * @param message the detail message (which is saved for later retrieval by the {@link
   *     #getMessage()} method).
   * @param cause the cause (which is saved for later retrieval by the {@link #getCause()} method).
   */
  public CodecException(String message, Throwable cause) {
    super(message, cause);
  }
}
