package io.github.suppierk.test.idea;

import io.github.suppierk.eventsourcing.cqrs.DomainCommand;
import java.time.Instant;
import java.util.UUID;

public record RateIdea(UUID messageId, Instant createdAt, String aggregateId, int rating)
    implements DomainCommand.Update<UUID, Instant> {
  public RateIdea(String aggregateId, int rating) {
    this(UUID.randomUUID(), Instant.now(), aggregateId, rating);
  }
}
