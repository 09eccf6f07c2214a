package io.github.suppierk.test.cluster;

import io.github.suppierk.eventsourcing.event.DomainEvent;

public record EmailChanged(String email) implements DomainEvent {}
