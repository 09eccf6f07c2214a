package io.github.suppierk.test.idea;

import io.github.suppierk.eventsourcing.event.DomainEvent;

public record IdeaRated(int rating) implements DomainEvent {}
