package io.github.suppierk.eventsourcing.codec;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.test.TestEventTypes;
import io.github.suppierk.test.idea.IdeaProposed;
import io.github.suppierk.test.idea.IdeaRated;
import java.util.Set;
import java.util.function.UnaryOperator;
import org.junit.jupiter.api.Test;

class EventTypeRegistryTest {
  @Test
  void simple_class_name_must_be_used_as_default_tag() {
    final var registry = new EventTypeRegistry().register(IdeaRated.class);

    assertEquals(IdeaRated.class, registry.resolve("IdeaRated"));
    assertEquals(1, registry.currentPayloadVersion("IdeaRated"));
    assertEquals(Set.of("IdeaRated"), registry.registeredEventTypes());
  }

  @Test
  void repeated_identical_registration_must_be_accepted() {
    final var registry = new EventTypeRegistry().register(IdeaRated.class);

    assertDoesNotThrow(() -> registry.register(IdeaRated.class));
  }

  @Test
  void when_tag_is_taken_by_another_class_illegal_state_must_be_thrown() {
    final var registry = new EventTypeRegistry().register("Rated", IdeaRated.class, 1);

    assertThrows(
        IllegalStateException.class, () -> registry.register("Rated", IdeaProposed.class, 1));
    assertThrows(
        IllegalStateException.class, () -> registry.register("Rated", IdeaRated.class, 2));
  }

  @Test
  void when_payload_version_is_not_positive_illegal_argument_must_be_thrown() {
    final var registry = new EventTypeRegistry();

    assertThrows(
        IllegalArgumentException.class, () -> registry.register("Rated", IdeaRated.class, 0));
  }

  @Test
  void when_tag_is_unknown_codec_exception_must_be_thrown() {
    final var registry = TestEventTypes.registry();

    assertThrows(CodecException.class, () -> registry.resolve("Unknown"));
    assertThrows(CodecException.class, () -> registry.currentPayloadVersion("Unknown"));
  }

  @Test
  void upcasters_must_be_looked_up_by_tag_and_version() {
    final var upcaster = EventUpcaster.of("IdeaRated", 1, UnaryOperator.identity());
    final var registry = new EventTypeRegistry().registerUpcaster(upcaster);

    assertEquals(upcaster, registry.upcasterFor("IdeaRated", 1).orElseThrow());
    assertTrue(registry.upcasterFor("IdeaRated", 2).isEmpty());
  }

  @Test
  void when_upcaster_is_registered_twice_illegal_state_must_be_thrown() {
    final var registry =
        new EventTypeRegistry()
            .registerUpcaster(EventUpcaster.of("IdeaRated", 1, UnaryOperator.identity()));
    final var duplicate = EventUpcaster.of("IdeaRated", 1, UnaryOperator.identity());

    assertThrows(IllegalStateException.class, () -> registry.registerUpcaster(duplicate));
  }
}
