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

import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfNull;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Entry point of command intake: routes every {@link DomainCommand} to the one {@link
 * CommandHandler} registered for its class.
 *
 * <p>Handlers are usually registered once at startup, while commands are executed concurrently,
 * so registration takes the write lock and dispatching takes the read lock only.
 */
public class BoundedContext {
  private final ReentrantReadWriteLock lock;
  private final Map<Class<?>, CommandHandler<?, ?, ?>> commandHandlers;

  public BoundedContext() {
    this.lock = new ReentrantReadWriteLock();
    this.commandHandlers = new HashMap<>();
  }

  /**
   * @param commandHandler to register
   * @throws IllegalArgumentException if the handler is null
   * @throws IllegalStateException if a handler for the same command class is already registered
   */
  public final void addCommandHandler(final CommandHandler<?, ?, ?> commandHandler) {
    final CommandHandler<?, ?, ?> nonNullHandler =
        throwIllegalArgumentIfNull(commandHandler, "Command handler");

    lock.writeLock().lock();
    try {
      final Class<?> commandClass = nonNullHandler.getCommandClass();
      if (commandHandlers.containsKey(commandClass)) {
        throw new IllegalStateException(
            "Handler for '%s' is already registered".formatted(commandClass.getSimpleName()));
      }

      commandHandlers.put(commandClass, nonNullHandler);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * @return classes of commands this context can execute
   */
  public final Set<Class<?>> getSupportedCommandClasses() {
    lock.readLock().lock();
    try {
      return Set.copyOf(commandHandlers.keySet());
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * The output type is decided by the handler registered for the command class.
   *
   * @param command to execute
   * @param <OUTPUT> is the type of the handler result
   * @return the result of the handler
   * @throws IllegalArgumentException if the command is null
   * @throws UnsupportedOperationException if no handler is registered for the command class
   * @see CommandHandler#handle(DomainCommand)
   */
  @SuppressWarnings({"unchecked", "squid:S119"})
  public final <OUTPUT> OUTPUT execute(final DomainCommand<?, ?> command) {
    final DomainCommand<?, ?> nonNullCommand = throwIllegalArgumentIfNull(command, "Command");

    final CommandHandler<?, ?, ?> handler;
    lock.readLock().lock();
    try {
      handler = commandHandlers.get(nonNullCommand.getClass());
    } finally {
      lock.readLock().unlock();
    }

    if (handler == null) {
      throw new UnsupportedOperationException(
          "No handler is registered for '%s'".formatted(nonNullCommand.getClass().getSimpleName()));
    }

    return (OUTPUT) handler.handleMessage(nonNullCommand);
  }

  boolean isAnyWriteLockHeld() {
    return lock.isWriteLocked();
  }

  boolean isAnyReadLockHeld() {
    return lock.getReadLockCount() > 0;
  }
}
