package io.github.suppierk.test.cluster;

import io.github.suppierk.eventsourcing.aggregate.AggregateRoot;
import io.github.suppierk.eventsourcing.aggregate.InvariantViolationException;
import io.github.suppierk.eventsourcing.aggregate.SnapshotCapable;
import java.util.ArrayList;
import java.util.List;

/**
 * A user which owns its wishes: wishes live in a flat list inside the aggregate and are addressed
 * by their index.
 */
public final class User extends AggregateRoot implements SnapshotCapable<User.State> {
  public static final String TYPE = "ClusterUser";
  public static final int MAX_WISHES = 3;

  private final List<Wish> wishes;
  private String email;

  public User(String id) {
    super(id);
    this.wishes = new ArrayList<>();

    on(UserRegistered.class, event -> email = event.email());
    on(EmailChanged.class, event -> email = event.email());
    on(
        WishAdded.class,
        event -> wishes.add(new Wish(event.wishIndex(), event.address(), event.content())));
  }

  public static User register(String id, String email) {
    final User user = new User(id);
    user.recordAndApply(new UserRegistered(email));
    return user;
  }

  public View addWish(String address, String content) {
    if (wishes.size() >= MAX_WISHES) {
      throw new InvariantViolationException(
          "User '%s' cannot have more than %d wishes".formatted(aggregateId(), MAX_WISHES));
    }

    recordAndApply(new WishAdded(wishes.size(), address, content));
    return view();
  }

  public View changeEmail(String newEmail) {
    if (newEmail == null || !newEmail.contains("@")) {
      throw new InvariantViolationException("Invalid email '%s'".formatted(newEmail));
    }

    recordAndApply(new EmailChanged(newEmail));
    return view();
  }

  public View view() {
    return new View(aggregateId(), email, List.copyOf(wishes));
  }

  @Override
  public String aggregateType() {
    return TYPE;
  }

  @Override
  public Class<State> snapshotStateType() {
    return State.class;
  }

  @Override
  public State captureSnapshotState() {
    return new State(email, List.copyOf(wishes));
  }

  @Override
  public void restoreSnapshotState(State state) {
    email = state.email();
    wishes.clear();
    wishes.addAll(state.wishes());
  }

  public record Wish(int index, String address, String content) {}

  public record State(String email, List<Wish> wishes) {}

  public record View(String id, String email, List<Wish> wishes) {}
}
