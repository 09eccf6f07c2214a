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

import io.github.suppierk.eventsourcing.event.EventRecord;
import java.util.List;

/**
 * Receives events right after {@link EventSourcedRepository} has committed them.
 *
 * <p>Listeners are notified after the commit, so a failing listener never reverts it. Anything
 * which must not be lost should be read back from the event store instead of relying on this
 * notification alone.
 */
@FunctionalInterface
public interface CommitListener {
  /**
   * @return an instance of listener which does not perform any operations
   */
  static CommitListener empty() {
    return NoOp.INSTANCE;
  }

  /**
   * @param aggregateId of the saved aggregate
   * @param committedEvents with assigned global positions, in commit order
   */
  void onCommitted(final String aggregateId, final List<EventRecord> committedEvents);

  /** Default implementation of the listener */
  final class NoOp implements CommitListener {
    private static final CommitListener INSTANCE = new NoOp();

    private NoOp() {
      // Cannot be instantiated from the outside
    }

    @Override
    public void onCommitted(final String aggregateId, final List<EventRecord> committedEvents) {
      // Do nothing
    }
  }
}
