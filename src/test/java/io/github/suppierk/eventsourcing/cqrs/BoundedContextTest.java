package io.github.suppierk.eventsourcing.cqrs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.eventsourcing.aggregate.EventSourcedRepository;
import io.github.suppierk.eventsourcing.store.InMemoryEventStore;
import io.github.suppierk.test.idea.Idea;
import io.github.suppierk.test.idea.ProposeIdea;
import io.github.suppierk.test.idea.ProposeIdeaHandler;
import io.github.suppierk.test.idea.RateIdea;
import io.github.suppierk.test.idea.RateIdeaHandler;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class BoundedContextTest {
  EventSourcedRepository<Idea> repository;

  @BeforeEach
  void setUp() {
    repository = new EventSourcedRepository<>(Idea::new, new InMemoryEventStore());
  }

  @Nested
  class Construction {
    @Test
    void when_adding_null_command_handler_illegal_argument_must_be_thrown() {
      final var context = new BoundedContext();

      assertThrows(IllegalArgumentException.class, () -> context.addCommandHandler(null));
      assertTrue(context.getSupportedCommandClasses().isEmpty());
    }

    @Test
    void when_adding_existing_command_handler_illegal_state_must_be_thrown() {
      final var context = new BoundedContext();
      final var handler = new ProposeIdeaHandler(repository);
      context.addCommandHandler(handler);

      assertEquals(Set.of(ProposeIdea.class), context.getSupportedCommandClasses());
      assertFalse(context.isAnyWriteLockHeld());

      assertThrows(IllegalStateException.class, () -> context.addCommandHandler(handler));
      assertFalse(context.isAnyWriteLockHeld());
    }
  }

  @Nested
  class Invocation {
    BoundedContext context;

    @BeforeEach
    void setUp() {
      context = new BoundedContext();
      context.addCommandHandler(new ProposeIdeaHandler(repository));
      context.addCommandHandler(new RateIdeaHandler(repository));
    }

    @Test
    void commands_must_be_routed_to_their_handlers() {
      final Idea.View proposed = context.execute(new ProposeIdea("idea-1", "Pancakes"));
      final Idea.View rated = context.execute(new RateIdea("idea-1", 5));

      assertEquals(new Idea.View("idea-1", "Pancakes", 0, 0), proposed);
      assertEquals(new Idea.View("idea-1", "Pancakes", 1, 5), rated);
      assertFalse(context.isAnyReadLockHeld());
    }

    @Test
    void when_command_has_no_handler_unsupported_operation_must_be_thrown() {
      final var otherContext = new BoundedContext();
      final var command = new RateIdea("idea-1", 5);

      assertThrows(UnsupportedOperationException.class, () -> otherContext.execute(command));
      assertFalse(otherContext.isAnyReadLockHeld());
    }

    @Test
    void when_command_is_null_illegal_argument_must_be_thrown() {
      assertThrows(IllegalArgumentException.class, () -> context.execute(null));
    }

    @Test
    void handler_failures_must_reach_the_caller() {
      context.execute(new ProposeIdea("idea-1", "Pancakes"));
      final var command = new RateIdea("idea-1", 0);

      assertThrows(CommandRejectedException.class, () -> context.execute(command));
      assertFalse(context.isAnyReadLockHeld());
    }
  }
}
