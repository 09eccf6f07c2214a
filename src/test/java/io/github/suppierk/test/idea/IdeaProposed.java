package io.github.suppierk.test.idea;

import io.github.suppierk.eventsourcing.event.DomainEvent;

public record IdeaProposed(String title) implements DomainEvent {}
