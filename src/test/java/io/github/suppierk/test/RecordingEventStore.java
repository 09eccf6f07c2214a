package io.github.suppierk.test;

import io.github.suppierk.eventsourcing.event.EventRecord;
import io.github.suppierk.eventsourcing.store.EventStore;
import io.github.suppierk.eventsourcing.store.StoreUnavailableException;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Delegating {@link EventStore} which counts replayed events and simulates storage failures with
 * either outcome of an append.
 */
public final class RecordingEventStore implements EventStore {
  private final EventStore delegate;
  private final AtomicInteger streamedEvents;
  private final AtomicInteger appendCalls;
  private final AtomicBoolean failNextAppendBeforeCommit;
  private final AtomicBoolean failNextAppendAfterCommit;

  public RecordingEventStore(EventStore delegate) {
    this.delegate = delegate;
    this.streamedEvents = new AtomicInteger();
    this.appendCalls = new AtomicInteger();
    this.failNextAppendBeforeCommit = new AtomicBoolean(false);
    this.failNextAppendAfterCommit = new AtomicBoolean(false);
  }

  public void failNextAppendBeforeCommit() {
    failNextAppendBeforeCommit.set(true);
  }

  public void failNextAppendAfterCommit() {
    failNextAppendAfterCommit.set(true);
  }

  public int streamedEvents() {
    return streamedEvents.get();
  }

  public int appendCalls() {
    return appendCalls.get();
  }

  public void resetCounters() {
    streamedEvents.set(0);
    appendCalls.set(0);
  }

  @Override
  public List<EventRecord> append(
      String aggregateId, long expectedVersion, List<EventRecord> newEvents) {
    appendCalls.incrementAndGet();

    if (failNextAppendBeforeCommit.getAndSet(false)) {
      throw new StoreUnavailableException("Connection lost before commit");
    }

    final List<EventRecord> committed = delegate.append(aggregateId, expectedVersion, newEvents);

    if (failNextAppendAfterCommit.getAndSet(false)) {
      throw new StoreUnavailableException("Connection lost after commit");
    }

    return committed;
  }

  @Override
  public Stream<EventRecord> readStream(String aggregateId, long sinceVersion) {
    return delegate
        .readStream(aggregateId, sinceVersion)
        .peek(event -> streamedEvents.incrementAndGet());
  }

  @Override
  public Stream<EventRecord> readAll(long sinceGlobalPosition) {
    return delegate.readAll(sinceGlobalPosition);
  }

  @Override
  public long currentVersion(String aggregateId) {
    return delegate.currentVersion(aggregateId);
  }
}
