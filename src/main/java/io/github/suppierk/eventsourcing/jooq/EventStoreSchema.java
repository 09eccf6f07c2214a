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

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;

/**
 * Tables used by the jOOQ based stores.
 *
 * <p>The DDL is shipped as {@value #DDL_RESOURCE} next to this class and can be applied with
 * {@link #ddlStatements()} or by any migration tool.
 */
public final class EventStoreSchema {
  public static final String DDL_RESOURCE = "event_store.sql";

  private EventStoreSchema() {
    // No instance
  }

  /**
   * @return statements of the bundled DDL script, in execution order
   * @throws UncheckedIOException if the script cannot be read
   */
  public static List<String> ddlStatements() {
    try (InputStream inputStream = EventStoreSchema.class.getResourceAsStream(DDL_RESOURCE)) {
      if (inputStream == null) {
        throw new IllegalStateException("Missing resource '%s'".formatted(DDL_RESOURCE));
      }

      final String script = new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
      return Arrays.stream(script.split(";"))
          .map(String::strip)
          .filter(statement -> !statement.isEmpty())
          .toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read '%s'".formatted(DDL_RESOURCE), e);
    }
  }

  static LocalDateTime toUtc(final Instant instant) {
    return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
  }

  static Instant fromUtc(final LocalDateTime localDateTime) {
    return localDateTime.toInstant(ZoneOffset.UTC);
  }

  /** Current version of every aggregate, locked by appends to the same aggregate. */
  public static final class Streams {
    public static final Table<Record> TABLE = DSL.table(DSL.name("event_stream"));

    public static final Field<String> AGGREGATE_ID =
        DSL.field(DSL.name("aggregate_id"), SQLDataType.VARCHAR(255));
    public static final Field<Long> VERSION = DSL.field(DSL.name("version"), SQLDataType.BIGINT);

    private Streams() {
      // No instance
    }
  }

  /**
   * Append-only log of all events.
   *
   * <p>{@link #APPEND_ID} is assigned on insert, {@link #GLOBAL_POSITION} stays {@code null} until
   * the committed event is sequenced.
   */
  public static final class Events {
    public static final Table<Record> TABLE = DSL.table(DSL.name("event_store"));

    public static final Field<Long> APPEND_ID =
        DSL.field(DSL.name("append_id"), SQLDataType.BIGINT);
    public static final Field<Long> GLOBAL_POSITION =
        DSL.field(DSL.name("global_position"), SQLDataType.BIGINT);
    public static final Field<UUID> EVENT_ID = DSL.field(DSL.name("event_id"), SQLDataType.UUID);
    public static final Field<String> AGGREGATE_ID =
        DSL.field(DSL.name("aggregate_id"), SQLDataType.VARCHAR(255));
    public static final Field<String> AGGREGATE_TYPE =
        DSL.field(DSL.name("aggregate_type"), SQLDataType.VARCHAR(255));
    public static final Field<String> EVENT_TYPE =
        DSL.field(DSL.name("event_type"), SQLDataType.VARCHAR(255));
    public static final Field<Long> VERSION = DSL.field(DSL.name("version"), SQLDataType.BIGINT);
    public static final Field<LocalDateTime> OCCURRED_AT =
        DSL.field(DSL.name("occurred_at"), SQLDataType.LOCALDATETIME(3));
    public static final Field<Integer> PAYLOAD_VERSION =
        DSL.field(DSL.name("payload_version"), SQLDataType.INTEGER);
    public static final Field<String> PAYLOAD = DSL.field(DSL.name("payload"), SQLDataType.CLOB);
    public static final Field<String> CAUSATION_ID =
        DSL.field(DSL.name("causation_id"), SQLDataType.VARCHAR(255));

    static final List<Field<?>> INSERT_COLUMNS =
        List.of(
            EVENT_ID,
            AGGREGATE_ID,
            AGGREGATE_TYPE,
            EVENT_TYPE,
            VERSION,
            OCCURRED_AT,
            PAYLOAD_VERSION,
            PAYLOAD,
            CAUSATION_ID);

    static final List<Field<?>> COLUMNS =
        List.of(
            GLOBAL_POSITION,
            EVENT_ID,
            AGGREGATE_ID,
            AGGREGATE_TYPE,
            EVENT_TYPE,
            VERSION,
            OCCURRED_AT,
            PAYLOAD_VERSION,
            PAYLOAD,
            CAUSATION_ID);

    private Events() {
      // No instance
    }
  }

  /** Single row holding the last assigned global position, locked while events are sequenced. */
  public static final class Positions {
    public static final Table<Record> TABLE = DSL.table(DSL.name("event_store_position"));

    public static final Field<Integer> ID = DSL.field(DSL.name("id"), SQLDataType.INTEGER);
    public static final Field<Long> POSITION = DSL.field(DSL.name("position"), SQLDataType.BIGINT);

    static final int ROW_ID = 1;

    private Positions() {
      // No instance
    }
  }

  /** Captured aggregate states. */
  public static final class Snapshots {
    public static final Table<Record> TABLE = DSL.table(DSL.name("aggregate_snapshot"));

    public static final Field<String> AGGREGATE_ID =
        DSL.field(DSL.name("aggregate_id"), SQLDataType.VARCHAR(255));
    public static final Field<Long> VERSION = DSL.field(DSL.name("version"), SQLDataType.BIGINT);
    public static final Field<String> AGGREGATE_TYPE =
        DSL.field(DSL.name("aggregate_type"), SQLDataType.VARCHAR(255));
    public static final Field<String> STATE = DSL.field(DSL.name("state"), SQLDataType.CLOB);
    public static final Field<LocalDateTime> CREATED_AT =
        DSL.field(DSL.name("created_at"), SQLDataType.LOCALDATETIME(3));

    private Snapshots() {
      // No instance
    }
  }

  /** Delivery cursors of publishing channels. */
  public static final class Trackers {
    public static final Table<Record> TABLE = DSL.table(DSL.name("published_message_tracker"));

    public static final Field<String> CHANNEL_ID =
        DSL.field(DSL.name("channel_id"), SQLDataType.VARCHAR(255));
    public static final Field<Long> LAST_PUBLISHED_POSITION =
        DSL.field(DSL.name("last_published_position"), SQLDataType.BIGINT);
    public static final Field<LocalDateTime> UPDATED_AT =
        DSL.field(DSL.name("updated_at"), SQLDataType.LOCALDATETIME(3));

    private Trackers() {
      // No instance
    }
  }
}
