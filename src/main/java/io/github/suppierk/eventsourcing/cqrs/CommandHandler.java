/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.suppierk.eventsourcing.cqrs;

import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfBlank;
import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfNotPositive;
import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfNull;
import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalStateIfNull;

import io.github.suppierk.eventsourcing.aggregate.AggregateLocks;
import io.github.suppierk.eventsourcing.aggregate.AggregateNotFoundException;
import io.github.suppierk.eventsourcing.aggregate.AggregateRoot;
import io.github.suppierk.eventsourcing.aggregate.EventSourcedRepository;
import io.github.suppierk.eventsourcing.aggregate.InvariantViolationException;
import io.github.suppierk.eventsourcing.aggregate.OptimisticLockException;
import io.github.suppierk.eventsourcing.store.StoreUnavailableException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Class to accept and process the work associated to a specific {@link DomainCommand}:
 *
 * <ul>
 *   <li>Load the aggregate, or create a new one.
 *   <li>Invoke the business method which records new events.
 *   <li>Save the aggregate, using {@link DomainMessage#messageId()} as the causation identifier.
 * </ul>
 *
 * <p>One handler covers one use case and changes exactly one aggregate. Other aggregates can be
 * read, but they are never saved by the same handler.
 *
 * <p>Because {@link DomainCommand} leverages new Java {@code sealed} feature, for more type safety
 * this class also makes use of the same feature.
 *
 * <p>Failures are reported as follows:
 *
 * <ul>
 *   <li>{@link InvariantViolationException} is translated to {@link CommandRejectedException}.
 *   <li>{@link StoreUnavailableException} during saving is rethrown only if the events of the
 *       command were not committed, otherwise the result is returned as usual.
 *   <li>{@link OptimisticLockException} of an update is retried on a freshly loaded aggregate up
 *       to the configured number of attempts.
 * </ul>
 *
 * @param <COMMAND> the type of the particular {@link DomainCommand}
 * @param <AGGREGATE> the type of the changed aggregate
 * @param <OUTPUT> the type of the result, an immutable view rather than the aggregate itself
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
// @formatter:off
public abstract sealed class CommandHandler<
  COMMAND extends DomainCommand<?, ?>,
  AGGREGATE extends AggregateRoot,
  OUTPUT
>
permits
  CommandHandler.Create,
  CommandHandler.Update
{
// @formatter:on
  private static final Logger LOG = LoggerFactory.getLogger(CommandHandler.class);

  private final Class<COMMAND> commandClass;
  private final EventSourcedRepository<AGGREGATE> repository;

  /**
   * @param commandClass the class of the {@link DomainCommand} to handle
   * @param repository of the changed aggregate
   * @throws IllegalArgumentException if any argument is null
   */
  protected CommandHandler(
      final Class<COMMAND> commandClass, final EventSourcedRepository<AGGREGATE> repository) {
    this.commandClass = throwIllegalArgumentIfNull(commandClass, "Command class");
    this.repository = throwIllegalArgumentIfNull(repository, "Repository");
  }

  public final Class<COMMAND> getCommandClass() {
    return commandClass;
  }

  protected final EventSourcedRepository<AGGREGATE> repository() {
    return repository;
  }

  /**
   * @param command to handle
   * @return the result of the command
   * @throws IllegalArgumentException if the command is null
   * @throws CommandRejectedException if the command breaks a business rule
   * @throws OptimisticLockException if the aggregate kept changing concurrently
   * @throws StoreUnavailableException if the events of the command were not committed
   */
  public final OUTPUT handle(final COMMAND command) {
    return runContract(throwIllegalArgumentIfNull(command, "Command"));
  }

  final OUTPUT handleMessage(final DomainCommand<?, ?> command) {
    return handle(commandClass.cast(throwIllegalArgumentIfNull(command, "Command")));
  }

  abstract OUTPUT runContract(final COMMAND command);

  /**
   * Saves the aggregate and resolves the unknown outcome of a storage failure.
   *
   * @return {@code true} if events were saved by this call, {@code false} if they had been saved
   *     before the storage failed
   */
  final boolean save(final AGGREGATE aggregate, final String causationId) {
    try {
      repository.save(aggregate, causationId);
      return true;
    } catch (StoreUnavailableException e) {
      final boolean committed;
      try {
        committed = repository.wasCommitted(aggregate.aggregateId(), causationId);
      } catch (StoreUnavailableException verificationFailure) {
        e.addSuppressed(verificationFailure);
        throw e;
      }

      if (!committed) {
        throw e;
      }

      LOG.info(
          "Events of '{}' for command '{}' were committed despite the storage failure",
          aggregate.aggregateId(),
          causationId);
      return false;
    }
  }

  static String causationIdOf(final DomainCommand<?, ?> command) {
    return String.valueOf(throwIllegalStateIfNull(command.messageId(), "Command's message ID"));
  }

  static <T> T rejectingInvariantViolations(final Supplier<T> businessOperation) {
    try {
      return businessOperation.get();
    } catch (InvariantViolationException e) {
      throw new CommandRejectedException(e.getMessage(), e);
    }
  }

  /**
   * A variant of the {@link CommandHandler} for {@link DomainCommand.Create}.
   *
   * <p>Creation is never retried: a conflict means that the aggregate already exists.
   *
   * @param <CREATE> the type of the particular {@link DomainCommand.Create}
   * @param <AGGREGATE> the type of the created aggregate
   * @param <OUTPUT> the type of the result
   */
  // @formatter:off
  public abstract static non-sealed class Create<
    CREATE extends DomainCommand.Create<?, ?>,
    AGGREGATE extends AggregateRoot,
    OUTPUT
  > extends CommandHandler<CREATE, AGGREGATE, OUTPUT> {
  // @formatter:on
    protected Create(
        final Class<CREATE> commandClass, final EventSourcedRepository<AGGREGATE> repository) {
      super(commandClass, repository);
    }

    /**
     * Business logic to bring a new aggregate to life.
     *
     * <p>Other aggregates can be loaded through their repositories to make the decision, but only
     * the returned aggregate is saved.
     *
     * @param command being executed
     * @return a new aggregate with uncommitted events
     * @throws InvariantViolationException if the command breaks a business rule
     */
    protected abstract AGGREGATE create(final CREATE command);

    /**
     * @param aggregate which was saved
     * @return an immutable view of the aggregate
     */
    protected abstract OUTPUT view(final AGGREGATE aggregate);

    /** {@inheritDoc} */
    @Override
    final OUTPUT runContract(final CREATE command) {
      final String causationId = causationIdOf(command);
      final AGGREGATE aggregate =
          throwIllegalStateIfNull(
              rejectingInvariantViolations(() -> create(command)), "Created aggregate");

      if (aggregate.uncommittedEvents().size() != aggregate.currentVersion()) {
        throw new IllegalStateException(
            "Aggregate '%s' is not new".formatted(aggregate.aggregateId()));
      }

      save(aggregate, causationId);
      return throwIllegalStateIfNull(view(aggregate), "Aggregate view");
    }
  }

  /**
   * A variant of the {@link CommandHandler} for {@link DomainCommand.Update}.
   *
   * @param <UPDATE> the type of the particular {@link DomainCommand.Update}
   * @param <AGGREGATE> the type of the changed aggregate
   * @param <OUTPUT> the type of the result
   */
  // @formatter:off
  public abstract static non-sealed class Update<
    UPDATE extends DomainCommand.Update<?, ?>,
    AGGREGATE extends AggregateRoot,
    OUTPUT
  > extends CommandHandler<UPDATE, AGGREGATE, OUTPUT> {
  // @formatter:on
    static final int DEFAULT_MAX_ATTEMPTS = 2;

    private final int maxAttempts;
    private final AggregateLocks aggregateLocks;

    protected Update(
        final Class<UPDATE> commandClass, final EventSourcedRepository<AGGREGATE> repository) {
      this(commandClass, repository, DEFAULT_MAX_ATTEMPTS);
    }

    /**
     * @param commandClass the class of the {@link DomainCommand.Update} to handle
     * @param repository of the changed aggregate
     * @param maxAttempts how many times the whole operation runs before a concurrent modification
     *     is reported, {@code 1} disables retries
     */
    protected Update(
        final Class<UPDATE> commandClass,
        final EventSourcedRepository<AGGREGATE> repository,
        final int maxAttempts) {
      super(commandClass, repository);
      this.maxAttempts = throwIllegalArgumentIfNotPositive(maxAttempts, "Max attempts");
      this.aggregateLocks = null;
    }

    /**
     * Runs every command of the same aggregate under its exclusive lock, so that commands in this
     * process never conflict with each other.
     *
     * @param commandClass the class of the {@link DomainCommand.Update} to handle
     * @param repository of the changed aggregate
     * @param aggregateLocks to acquire before loading the aggregate
     */
    protected Update(
        final Class<UPDATE> commandClass,
        final EventSourcedRepository<AGGREGATE> repository,
        final AggregateLocks aggregateLocks) {
      super(commandClass, repository);
      this.maxAttempts = DEFAULT_MAX_ATTEMPTS;
      this.aggregateLocks = throwIllegalArgumentIfNull(aggregateLocks, "Aggregate locks");
    }

    /**
     * Business logic to change the aggregate by calling its business methods.
     *
     * <p>May be invoked more than once for the same command when the aggregate is changed
     * concurrently, each time with a freshly loaded aggregate, so it must not have side effects
     * outside the aggregate.
     *
     * @param command being executed
     * @param aggregate loaded for this attempt
     * @return an immutable view of the result
     * @throws InvariantViolationException if the command breaks a business rule
     */
    protected abstract OUTPUT update(final UPDATE command, final AGGREGATE aggregate);

    /** {@inheritDoc} */
    @Override
    final OUTPUT runContract(final UPDATE command) {
      final String aggregateId =
          throwIllegalArgumentIfBlank(command.aggregateId(), "Command's aggregate ID");
      final String causationId = causationIdOf(command);

      if (aggregateLocks == null) {
        return runWithRetries(command, aggregateId, causationId);
      }

      return aggregateLocks.withLock(
          aggregateId, () -> runWithRetries(command, aggregateId, causationId));
    }

    private OUTPUT runWithRetries(
        final UPDATE command, final String aggregateId, final String causationId) {
      for (int attempt = 1; ; attempt++) {
        try {
          return runOnce(command, aggregateId, causationId);
        } catch (OptimisticLockException e) {
          if (attempt >= maxAttempts) {
            throw e;
          }

          LOG.info(
              "'{}' was modified concurrently, retrying '{}' ({} of {})",
              aggregateId,
              getCommandClass().getSimpleName(),
              attempt + 1,
              maxAttempts);
        }
      }
    }

    /**
     * @throws AggregateNotFoundException if the aggregate does not exist
     */
    private OUTPUT runOnce(
        final UPDATE command, final String aggregateId, final String causationId) {
      final AGGREGATE aggregate = repository().load(aggregateId);
      final OUTPUT output =
          throwIllegalStateIfNull(
              rejectingInvariantViolations(() -> update(command, aggregate)), "Command output");

      save(aggregate, causationId);
      return output;
    }
  }
}
