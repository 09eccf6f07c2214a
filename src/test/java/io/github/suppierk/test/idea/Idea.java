package io.github.suppierk.test.idea;

import io.github.suppierk.eventsourcing.aggregate.AggregateRoot;
import io.github.suppierk.eventsourcing.aggregate.InvariantViolationException;
import java.time.Clock;

public final class Idea extends AggregateRoot {
  public static final String TYPE = "Idea";

  private String title;
  private int ratingCount;
  private int ratingTotal;

  public Idea(String id) {
    this(id, Clock.systemUTC());
  }

  public Idea(String id, Clock clock) {
    super(id, clock);
    on(IdeaProposed.class, event -> title = event.title());
    on(
        IdeaRated.class,
        event -> {
          ratingCount++;
          ratingTotal += event.rating();
        });
  }

  public static Idea propose(String id, String title) {
    final Idea idea = new Idea(id);
    idea.recordAndApply(new IdeaProposed(title));
    return idea;
  }

  public View addRating(int rating) {
    if (rating < 1 || rating > 5) {
      throw new InvariantViolationException("Rating must be between 1 and 5, got " + rating);
    }

    recordAndApply(new IdeaRated(rating));
    return view();
  }

  public View view() {
    return new View(aggregateId(), title, ratingCount, ratingTotal);
  }

  @Override
  public String aggregateType() {
    return TYPE;
  }

  public record View(String id, String title, int ratingCount, int ratingTotal) {}
}
