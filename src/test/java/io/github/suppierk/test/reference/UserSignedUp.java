package io.github.suppierk.test.reference;

import io.github.suppierk.eventsourcing.event.DomainEvent;

public record UserSignedUp(String email) implements DomainEvent {}
