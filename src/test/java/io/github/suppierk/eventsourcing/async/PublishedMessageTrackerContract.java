package io.github.suppierk.eventsourcing.async;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Behavior every {@link PublishedMessageTracker} implementation must share. */
public abstract class PublishedMessageTrackerContract {
  protected PublishedMessageTracker tracker;

  protected abstract PublishedMessageTracker createTracker();

  @BeforeEach
  protected void setUp() {
    tracker = createTracker();
  }

  @Test
  void unknown_channel_must_start_from_zero() {
    assertEquals(0L, tracker.lastPublishedPosition("projection"));
  }

  @Test
  void cursor_must_move_forward_per_channel() {
    tracker.advance("projection", 10);
    tracker.advance("projection", 15);
    tracker.advance("audit", 3);

    assertEquals(15L, tracker.lastPublishedPosition("projection"));
    assertEquals(3L, tracker.lastPublishedPosition("audit"));
  }

  @Test
  void cursor_must_never_move_backwards() {
    tracker.advance("projection", 15);
    tracker.advance("projection", 10);

    assertEquals(15L, tracker.lastPublishedPosition("projection"));
  }

  @Test
  void when_arguments_are_invalid_illegal_argument_must_be_thrown() {
    assertThrows(IllegalArgumentException.class, () -> tracker.advance(" ", 1));
    assertThrows(IllegalArgumentException.class, () -> tracker.advance("projection", -1));
    assertThrows(IllegalArgumentException.class, () -> tracker.lastPublishedPosition(null));
  }
}
