package io.github.suppierk.test.idea;

import io.github.suppierk.eventsourcing.aggregate.AggregateLocks;
import io.github.suppierk.eventsourcing.aggregate.EventSourcedRepository;
import io.github.suppierk.eventsourcing.cqrs.CommandHandler;

public class RateIdeaHandler extends CommandHandler.Update<RateIdea, Idea, Idea.View> {
  public RateIdeaHandler(EventSourcedRepository<Idea> repository) {
    super(RateIdea.class, repository);
  }

  public RateIdeaHandler(EventSourcedRepository<Idea> repository, int maxAttempts) {
    super(RateIdea.class, repository, maxAttempts);
  }

  public RateIdeaHandler(EventSourcedRepository<Idea> repository, AggregateLocks locks) {
    super(RateIdea.class, repository, locks);
  }

  @Override
  protected Idea.View update(RateIdea command, Idea aggregate) {
    return aggregate.addRating(command.rating());
  }
}
