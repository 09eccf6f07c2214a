package io.github.suppierk.test.cluster;

import io.github.suppierk.eventsourcing.event.DomainEvent;

public record UserRegistered(String email) implements DomainEvent {}
