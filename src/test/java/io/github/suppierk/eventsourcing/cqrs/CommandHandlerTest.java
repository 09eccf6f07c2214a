package io.github.suppierk.eventsourcing.cqrs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.eventsourcing.aggregate.AggregateLocks;
import io.github.suppierk.eventsourcing.aggregate.AggregateNotFoundException;
import io.github.suppierk.eventsourcing.aggregate.EventSourcedRepository;
import io.github.suppierk.eventsourcing.aggregate.OptimisticLockException;
import io.github.suppierk.eventsourcing.store.InMemoryEventStore;
import io.github.suppierk.eventsourcing.store.StoreUnavailableException;
import io.github.suppierk.test.RecordingEventStore;
import io.github.suppierk.test.idea.Idea;
import io.github.suppierk.test.idea.ProposeIdea;
import io.github.suppierk.test.idea.ProposeIdeaHandler;
import io.github.suppierk.test.idea.RateIdea;
import io.github.suppierk.test.idea.RateIdeaHandler;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CommandHandlerTest {
  RecordingEventStore eventStore;
  EventSourcedRepository<Idea> repository;

  @BeforeEach
  void setUp() {
    eventStore = new RecordingEventStore(new InMemoryEventStore());
    repository = new EventSourcedRepository<>(Idea::new, eventStore);
  }

  @Nested
  class Create {
    @Test
    void new_aggregate_must_be_saved_with_command_causation() {
      final var command = new ProposeIdea("idea-1", "Pancakes");

      final var view = new ProposeIdeaHandler(repository).handle(command);

      assertEquals(new Idea.View("idea-1", "Pancakes", 0, 0), view);
      assertTrue(repository.wasCommitted("idea-1", command.messageId().toString()));
    }

    @Test
    void when_aggregate_already_exists_optimistic_lock_exception_must_be_thrown() {
      final var handler = new ProposeIdeaHandler(repository);
      handler.handle(new ProposeIdea("idea-1", "Pancakes"));
      final var duplicate = new ProposeIdea("idea-1", "Waffles");

      assertThrows(OptimisticLockException.class, () -> handler.handle(duplicate));
      assertEquals("Pancakes", repository.load("idea-1").view().title());
    }

    @Test
    void when_command_is_null_illegal_argument_must_be_thrown() {
      final var handler = new ProposeIdeaHandler(repository);

      assertThrows(IllegalArgumentException.class, () -> handler.handle(null));
    }

    @Test
    void when_handler_arguments_are_null_illegal_argument_must_be_thrown() {
      assertThrows(IllegalArgumentException.class, () -> new ProposeIdeaHandler(null));
    }
  }

  @Nested
  class Update {
    @BeforeEach
    void setUp() {
      new ProposeIdeaHandler(repository).handle(new ProposeIdea("idea-1", "Pancakes"));
    }

    @Test
    void loaded_aggregate_must_be_updated_and_saved() {
      final var view = new RateIdeaHandler(repository).handle(new RateIdea("idea-1", 4));

      assertEquals(new Idea.View("idea-1", "Pancakes", 1, 4), view);
      assertEquals(2L, eventStore.currentVersion("idea-1"));
    }

    @Test
    void invariant_violation_must_be_reported_as_rejected_command() {
      final var handler = new RateIdeaHandler(repository);
      final var command = new RateIdea("idea-1", 9);

      final var exception =
          assertThrows(CommandRejectedException.class, () -> handler.handle(command));

      assertEquals(422, exception.getStatusCode());
      assertEquals(1L, eventStore.currentVersion("idea-1"));
    }

    @Test
    void when_aggregate_does_not_exist_not_found_must_be_thrown() {
      final var handler = new RateIdeaHandler(repository);
      final var command = new RateIdea("idea-2", 4);

      assertThrows(AggregateNotFoundException.class, () -> handler.handle(command));
    }

    @Test
    void concurrent_modification_must_be_retried_on_fresh_state() {
      final var interfered = new AtomicBoolean(false);
      final var handler =
          new RateIdeaHandler(repository) {
            @Override
            protected Idea.View update(RateIdea command, Idea aggregate) {
              interfereOnce(interfered);
              return super.update(command, aggregate);
            }
          };

      final var view = handler.handle(new RateIdea("idea-1", 4));

      assertEquals(new Idea.View("idea-1", "Pancakes", 2, 5), view);
      assertEquals(3L, eventStore.currentVersion("idea-1"));
    }

    @Test
    void when_attempts_are_exhausted_optimistic_lock_exception_must_be_thrown() {
      final var interfered = new AtomicBoolean(false);
      final var handler =
          new RateIdeaHandler(repository, 1) {
            @Override
            protected Idea.View update(RateIdea command, Idea aggregate) {
              interfereOnce(interfered);
              return super.update(command, aggregate);
            }
          };
      final var command = new RateIdea("idea-1", 4);

      assertThrows(OptimisticLockException.class, () -> handler.handle(command));
      assertEquals(2L, eventStore.currentVersion("idea-1"));
    }

    @Test
    void locked_updates_of_the_same_aggregate_must_all_succeed() throws Exception {
      final var handler =
          new RateIdeaHandler(repository, new AggregateLocks(Duration.ofSeconds(10)));
      final var executor = Executors.newFixedThreadPool(4);

      try {
        final List<Future<Idea.View>> futures = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
          futures.add(executor.submit(() -> handler.handle(new RateIdea("idea-1", 5))));
        }

        for (Future<Idea.View> future : futures) {
          future.get(10, TimeUnit.SECONDS);
        }
      } finally {
        executor.shutdownNow();
      }

      assertEquals(11L, eventStore.currentVersion("idea-1"));
      assertEquals(new Idea.View("idea-1", "Pancakes", 10, 50), repository.load("idea-1").view());
    }

    @Test
    void when_max_attempts_are_not_positive_illegal_argument_must_be_thrown() {
      assertThrows(IllegalArgumentException.class, () -> new RateIdeaHandler(repository, 0));
    }

    void interfereOnce(AtomicBoolean interfered) {
      if (interfered.compareAndSet(false, true)) {
        final var concurrent = repository.load("idea-1");
        concurrent.addRating(1);
        repository.save(concurrent);
      }
    }
  }

  @Nested
  class UnknownOutcome {
    @BeforeEach
    void setUp() {
      new ProposeIdeaHandler(repository).handle(new ProposeIdea("idea-1", "Pancakes"));
    }

    @Test
    void failure_after_commit_must_be_resolved_as_success() {
      eventStore.failNextAppendAfterCommit();
      final var command = new RateIdea("idea-1", 4);

      final var view = new RateIdeaHandler(repository).handle(command);

      assertEquals(new Idea.View("idea-1", "Pancakes", 1, 4), view);
      assertEquals(2L, eventStore.currentVersion("idea-1"));
      assertTrue(repository.wasCommitted("idea-1", command.messageId().toString()));
    }

    @Test
    void failure_before_commit_must_be_rethrown() {
      eventStore.failNextAppendBeforeCommit();
      final var handler = new RateIdeaHandler(repository);
      final var command = new RateIdea("idea-1", 4);

      assertThrows(StoreUnavailableException.class, () -> handler.handle(command));
      assertEquals(1L, eventStore.currentVersion("idea-1"));
    }

    @Test
    void failure_after_commit_must_not_duplicate_events() {
      eventStore.resetCounters();
      eventStore.failNextAppendAfterCommit();
      new RateIdeaHandler(repository).handle(new RateIdea("idea-1", 4));

      assertEquals(1, eventStore.appendCalls());
      assertEquals(1L, eventStore.readStream("idea-1", 1).count());
      assertEquals(new Idea.View("idea-1", "Pancakes", 1, 4), repository.load("idea-1").view());
    }
  }
}
