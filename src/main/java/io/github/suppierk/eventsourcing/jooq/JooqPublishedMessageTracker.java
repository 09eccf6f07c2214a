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

package io.github.suppierk.eventsourcing.jooq;

import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfBlank;
import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfNegative;
import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfNull;

import io.github.suppierk.eventsourcing.async.PublishedMessageTracker;
import io.github.suppierk.eventsourcing.jooq.EventStoreSchema.Trackers;
import io.github.suppierk.eventsourcing.store.StoreUnavailableException;
import java.time.Clock;
import java.time.LocalDateTime;
import org.jooq.DSLContext;
import org.jooq.exception.DataAccessException;

/** {@link PublishedMessageTracker} persisted through jOOQ. */
public final class JooqPublishedMessageTracker implements PublishedMessageTracker {
  private final DSLContext dsl;
  private final Clock clock;

  public JooqPublishedMessageTracker(final DSLContext dsl) {
    this(dsl, Clock.systemUTC());
  }

  public JooqPublishedMessageTracker(final DSLContext dsl, final Clock clock) {
    this.dsl = throwIllegalArgumentIfNull(dsl, "DSLContext");
    this.clock = throwIllegalArgumentIfNull(clock, "Clock");
  }

  /** {@inheritDoc} */
  @Override
  public long lastPublishedPosition(final String channelId) {
    throwIllegalArgumentIfBlank(channelId, "Channel ID");

    try {
      return dsl.select(Trackers.LAST_PUBLISHED_POSITION)
          .from(Trackers.TABLE)
          .where(Trackers.CHANNEL_ID.eq(channelId))
          .fetchOptional(Trackers.LAST_PUBLISHED_POSITION)
          .orElse(0L);
    } catch (DataAccessException e) {
      throw new StoreUnavailableException(
          "Failed to read the cursor of '%s'".formatted(channelId), e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void advance(final String channelId, final long position) {
    throwIllegalArgumentIfBlank(channelId, "Channel ID");
    throwIllegalArgumentIfNegative(position, "Position");

    try {
      dsl.transaction(
          configuration -> {
            final DSLContext transactionalDsl = configuration.dsl();
            final LocalDateTime now = EventStoreSchema.toUtc(clock.instant());

            final Long current =
                transactionalDsl
                    .select(Trackers.LAST_PUBLISHED_POSITION)
                    .from(Trackers.TABLE)
                    .where(Trackers.CHANNEL_ID.eq(channelId))
                    .forUpdate()
                    .fetchOne(Trackers.LAST_PUBLISHED_POSITION);

            if (current == null) {
              transactionalDsl
                  .insertInto(Trackers.TABLE)
                  .set(Trackers.CHANNEL_ID, channelId)
                  .set(Trackers.LAST_PUBLISHED_POSITION, position)
                  .set(Trackers.UPDATED_AT, now)
                  .execute();
            } else if (position > current) {
              transactionalDsl
                  .update(Trackers.TABLE)
                  .set(Trackers.LAST_PUBLISHED_POSITION, position)
                  .set(Trackers.UPDATED_AT, now)
                  .where(Trackers.CHANNEL_ID.eq(channelId))
                  .execute();
            }
          });
    } catch (DataAccessException e) {
      throw new StoreUnavailableException(
          "Failed to advance the cursor of '%s' to %d".formatted(channelId, position), e);
    }
  }
}
