package io.github.suppierk.test.reference;

import io.github.suppierk.eventsourcing.aggregate.AggregateRoot;
import io.github.suppierk.eventsourcing.aggregate.InvariantViolationException;

public final class Wish extends AggregateRoot {
  public static final String TYPE = "Wish";

  private String userId;
  private String address;
  private String content;

  public Wish(String id) {
    super(id);
    on(
        WishMade.class,
        event -> {
          userId = event.userId();
          address = event.address();
          content = event.content();
        });
  }

  static Wish make(String id, String userId, String address, String content) {
    if (address == null || !address.contains("@")) {
      throw new InvariantViolationException("Invalid address '%s'".formatted(address));
    }

    if (content == null || content.isBlank()) {
      throw new InvariantViolationException("Wish cannot be empty");
    }

    final Wish wish = new Wish(id);
    wish.recordAndApply(new WishMade(userId, address, content));
    return wish;
  }

  public View view() {
    return new View(aggregateId(), userId, address, content);
  }

  @Override
  public String aggregateType() {
    return TYPE;
  }

  public record View(String id, String userId, String address, String content) {}
}
