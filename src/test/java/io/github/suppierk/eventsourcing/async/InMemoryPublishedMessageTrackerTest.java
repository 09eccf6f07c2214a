package io.github.suppierk.eventsourcing.async;

class InMemoryPublishedMessageTrackerTest extends PublishedMessageTrackerContract {
  @Override
  protected PublishedMessageTracker createTracker() {
    return new InMemoryPublishedMessageTracker();
  }
}
