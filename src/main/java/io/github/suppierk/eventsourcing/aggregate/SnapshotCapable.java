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

/**
 * Implemented by {@link AggregateRoot}s whose state can be captured into a snapshot, so that
 * loading does not need to replay the whole history.
 *
 * <p>The state must be a plain serializable value, typically a {@link Record}, which does not
 * share mutable objects with the aggregate.
 *
 * @param <S> is the type of the captured state
 */
public interface SnapshotCapable<S> {
  Class<S> snapshotStateType();

  S captureSnapshotState();

  /**
   * Called on a freshly created aggregate before any event is applied.
   *
   * @param state previously returned by {@link #captureSnapshotState()}
   */
  void restoreSnapshotState(final S state);
}
