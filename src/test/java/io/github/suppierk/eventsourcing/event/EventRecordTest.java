package io.github.suppierk.eventsourcing.event;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.test.idea.IdeaRated;
import io.github.suppierk.test.reference.UserSignedUp;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EventRecordTest {
  static final Instant NOW = Instant.parse("2024-05-01T10:15:30.123456789Z");

  @Nested
  class Creation {
    @Test
    void uncommitted_record_must_take_type_and_payload_version_from_payload() {
      final var event = EventRecord.uncommitted("idea-1", "Idea", 1, NOW, new IdeaRated(5));

      assertEquals("IdeaRated", event.eventType());
      assertEquals(1, event.payloadVersion());
      assertEquals(0L, event.globalPosition());
      assertFalse(event.isCommitted());
      assertEquals(Optional.empty(), event.causation());
    }

    @Test
    void occurrence_time_must_be_truncated_to_milliseconds() {
      final var event = EventRecord.uncommitted("idea-1", "Idea", 1, NOW, new IdeaRated(5));

      assertEquals(Instant.parse("2024-05-01T10:15:30.123Z"), event.occurredAt());
    }

    @Test
    void when_version_is_not_positive_illegal_argument_must_be_thrown() {
      final var payload = new IdeaRated(5);

      assertThrows(
          IllegalArgumentException.class,
          () -> EventRecord.uncommitted("idea-1", "Idea", 0, NOW, payload));
    }

    @Test
    void when_mandatory_values_are_missing_illegal_argument_must_be_thrown() {
      final var payload = new IdeaRated(5);

      assertThrows(
          IllegalArgumentException.class,
          () -> EventRecord.uncommitted(null, "Idea", 1, NOW, payload));
      assertThrows(
          IllegalArgumentException.class,
          () -> EventRecord.uncommitted(" ", "Idea", 1, NOW, payload));
      assertThrows(
          IllegalArgumentException.class,
          () -> EventRecord.uncommitted("idea-1", "Idea", 1, null, payload));
      assertThrows(
          IllegalArgumentException.class,
          () -> EventRecord.uncommitted("idea-1", "Idea", 1, NOW, null));
      assertThrows(
          IllegalArgumentException.class,
          () ->
              new EventRecord(
                  UUID.randomUUID(), "idea-1", "Idea", "IdeaRated", 1, NOW, 0, payload, null, 0));
    }
  }

  @Nested
  class Transitions {
    @Test
    void committed_copy_must_keep_everything_but_position() {
      final var event =
          EventRecord.uncommitted("idea-1", "Idea", 1, NOW, new IdeaRated(5))
              .withCausationId("command-1");
      final var committed = event.committedAt(42);

      assertTrue(committed.isCommitted());
      assertEquals(42L, committed.globalPosition());
      assertEquals(event.eventId(), committed.eventId());
      assertEquals(Optional.of("command-1"), committed.causation());
      assertEquals(event.payload(), committed.payload());
    }

    @Test
    void when_committing_at_non_positive_position_illegal_argument_must_be_thrown() {
      final var event = EventRecord.uncommitted("idea-1", "Idea", 1, NOW, new IdeaRated(5));

      assertThrows(IllegalArgumentException.class, () -> event.committedAt(0));
    }

    @Test
    void when_causation_is_blank_illegal_argument_must_be_thrown() {
      final var event = EventRecord.uncommitted("idea-1", "Idea", 1, NOW, new IdeaRated(5));

      assertThrows(IllegalArgumentException.class, () -> event.withCausationId(""));
    }
  }

  @Nested
  class Equality {
    @Test
    void records_of_the_same_aggregate_version_must_be_equal() {
      final var first = EventRecord.uncommitted("user-1", "User", 1, NOW, new UserSignedUp("a@b"));
      final var redelivered =
          EventRecord.uncommitted("user-1", "User", 1, NOW.plusSeconds(5), new UserSignedUp("x@y"))
              .committedAt(7);

      assertEquals(first, redelivered);
      assertEquals(first.hashCode(), redelivered.hashCode());
    }

    @Test
    void records_of_different_versions_or_aggregates_must_differ() {
      final var payload = new UserSignedUp("a@b");
      final var first = EventRecord.uncommitted("user-1", "User", 1, NOW, payload);

      assertNotEquals(first, EventRecord.uncommitted("user-1", "User", 2, NOW, payload));
      assertNotEquals(first, EventRecord.uncommitted("user-2", "User", 1, NOW, payload));
    }
  }
}
