package io.github.suppierk.eventsourcing.async;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.suppierk.eventsourcing.aggregate.EventSourcedRepository;
import io.github.suppierk.eventsourcing.codec.JacksonEventCodec;
import io.github.suppierk.eventsourcing.store.InMemoryEventStore;
import io.github.suppierk.test.TestEventTypes;
import io.github.suppierk.test.idea.Idea;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EventFeedTest {
  final JacksonEventCodec codec = TestEventTypes.codec();

  EventFeed feed;

  @BeforeEach
  void setUp() {
    final var eventStore = new InMemoryEventStore();
    final var idea = Idea.propose("idea-1", "Pancakes");
    idea.addRating(5);
    idea.addRating(3);
    new EventSourcedRepository<>(Idea::new, eventStore).save(idea);

    feed = new EventFeed(eventStore, codec);
  }

  JsonNode read(String json) throws Exception {
    return JacksonEventCodec.defaultObjectMapper().readTree(json);
  }

  @Test
  void page_must_start_after_the_cursor() throws Exception {
    final var page = read(feed.eventsSince(1));

    assertEquals(2, page.size());
    assertEquals(2L, page.get(0).get("globalPosition").asLong());
    assertEquals(5, page.get(0).get("payload").get("rating").asInt());
    assertEquals(3L, page.get(1).get("globalPosition").asLong());
  }

  @Test
  void page_must_be_limited() throws Exception {
    final var page = read(feed.eventsSince(0, 2));

    assertEquals(2, page.size());
    assertEquals("IdeaProposed", page.get(0).get("eventType").asText());
  }

  @Test
  void page_after_the_end_must_be_empty() throws Exception {
    assertEquals(0, read(feed.eventsSince(3)).size());
  }

  @Test
  void entries_must_be_readable_envelopes() throws Exception {
    final var entry = read(feed.eventsSince(0, 1)).get(0);

    final var event = codec.deserialize(codec.readEnvelope(entry.toString()));

    assertEquals("idea-1", event.aggregateId());
    assertEquals(1L, event.globalPosition());
  }

  @Test
  void when_arguments_are_invalid_illegal_argument_must_be_thrown() {
    assertThrows(IllegalArgumentException.class, () -> feed.eventsSince(-1));
    assertThrows(IllegalArgumentException.class, () -> feed.eventsSince(0, 0));
  }
}
