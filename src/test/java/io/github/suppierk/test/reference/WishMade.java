package io.github.suppierk.test.reference;

import io.github.suppierk.eventsourcing.event.DomainEvent;

public record WishMade(String userId, String address, String content) implements DomainEvent {}
