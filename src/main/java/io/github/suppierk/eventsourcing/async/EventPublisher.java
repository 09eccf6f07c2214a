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

package io.github.suppierk.eventsourcing.async;

import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfBlank;
import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfNotPositive;
import static io.github.suppierk.eventsourcing.Suspicious.throwIllegalArgumentIfNull;

import io.github.suppierk.eventsourcing.aggregate.CommitListener;
import io.github.suppierk.eventsourcing.codec.EventCodec;
import io.github.suppierk.eventsourcing.event.EventRecord;
import io.github.suppierk.eventsourcing.store.EventStore;
import io.github.suppierk.java.Try;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers committed events to registered channels at least once.
 *
 * <p>Each channel has its own cursor in a {@link PublishedMessageTracker}. A publishing run reads
 * the events after the cursor in batches and offers them to the channel in commit order:
 *
 * <ul>
 *   <li>the cursor moves only past events the channel has acknowledged;
 *   <li>the first failed event stops the run, so it is offered again, before anything after it,
 *       on the next run.
 * </ul>
 *
 * <p>Runs of the same channel never overlap, and channels never wait for each other: runs of
 * different channels are executed separately on the given {@link Executor}.
 *
 * <p>As a {@link CommitListener}, the publisher schedules a run of every channel on the given
 * {@link Executor} after each commit. Commits arriving while a run is already scheduled are picked
 * up by that run.
 */
public final class EventPublisher implements CommitListener {
  private static final Logger LOG = LoggerFactory.getLogger(EventPublisher.class);

  static final int DEFAULT_BATCH_SIZE = 100;

  private final EventStore eventStore;
  private final EventCodec codec;
  private final PublishedMessageTracker tracker;
  private final Executor executor;
  private final int batchSize;
  private final ConcurrentMap<String, Channel> channels;

  public EventPublisher(
      final EventStore eventStore,
      final EventCodec codec,
      final PublishedMessageTracker tracker,
      final Executor executor) {
    this(eventStore, codec, tracker, executor, DEFAULT_BATCH_SIZE);
  }

  public EventPublisher(
      final EventStore eventStore,
      final EventCodec codec,
      final PublishedMessageTracker tracker,
      final Executor executor,
      final int batchSize) {
    this.eventStore = throwIllegalArgumentIfNull(eventStore, "Event store");
    this.codec = throwIllegalArgumentIfNull(codec, "Event codec");
    this.tracker = throwIllegalArgumentIfNull(tracker, "Published message tracker");
    this.executor = throwIllegalArgumentIfNull(executor, "Executor");
    this.batchSize = throwIllegalArgumentIfNotPositive(batchSize, "Batch size");
    this.channels = new ConcurrentHashMap<>();
  }

  /**
   * @param channelId unique name of the destination, also used as the cursor key
   * @param adapter delivering events to the destination
   * @throws IllegalStateException if a channel with the same identifier is already registered
   */
  public void registerChannel(final String channelId, final ChannelAdapter adapter) {
    final Channel channel =
        new Channel(
            throwIllegalArgumentIfBlank(channelId, "Channel ID"),
            throwIllegalArgumentIfNull(adapter, "Channel adapter"));

    if (channels.putIfAbsent(channelId, channel) != null) {
      throw new IllegalStateException("Channel '%s' is already registered".formatted(channelId));
    }
  }

  public Set<String> channelIds() {
    return new TreeSet<>(channels.keySet());
  }

  /**
   * Delivers all events committed after the cursor of the channel.
   *
   * @param channelId to publish to
   * @return report of the run, containing the failure which stopped it, if any
   * @throws IllegalArgumentException if the channel is not registered
   * @throws io.github.suppierk.eventsourcing.store.StoreUnavailableException if events could not
   *     be read
   */
  public PublishReport publishPending(final String channelId) {
    final Channel channel = channels.get(throwIllegalArgumentIfBlank(channelId, "Channel ID"));
    if (channel == null) {
      throw new IllegalArgumentException("Channel '%s' is not registered".formatted(channelId));
    }

    return publish(channel);
  }

  /**
   * Publishes every registered channel, each in its own run on the executor, and waits for all
   * runs to finish. A failing or slow channel does not prevent others from being published.
   *
   * @return reports of all channels, ordered by channel identifier
   */
  public List<PublishReport> publishAllPending() {
    final Map<String, CompletableFuture<PublishReport>> runs = new LinkedHashMap<>();
    for (String channelId : channelIds()) {
      runs.put(channelId, submit(channelId));
    }

    final List<PublishReport> reports = new ArrayList<>(runs.size());
    runs.forEach(
        (channelId, run) ->
            reports.add(
                run.handle(
                        (report, reason) ->
                            reason == null ? report : aborted(channelId, unwrap(reason)))
                    .join()));

    return reports;
  }

  /**
   * @throws RejectedExecutionException if the executor does not accept a run
   */
  @Override
  public void onCommitted(final String aggregateId, final List<EventRecord> committedEvents) {
    for (Channel channel : channels.values()) {
      schedule(channel);
    }
  }

  private void schedule(final Channel channel) {
    if (!channel.scheduled.compareAndSet(false, true)) {
      return;
    }

    try {
      executor.execute(
          () -> {
            // Commits from now on need another run
            channel.scheduled.set(false);

            final Try<PublishReport> report = Try.of(() -> publish(channel));
            report.ifFailure(reason -> LOG.warn("Publishing to '{}' failed", channel.id, reason));
          });
    } catch (RejectedExecutionException e) {
      channel.scheduled.set(false);
      throw e;
    }
  }

  private CompletableFuture<PublishReport> submit(final String channelId) {
    try {
      return CompletableFuture.supplyAsync(() -> publishPending(channelId), executor);
    } catch (RejectedExecutionException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  private static PublishReport aborted(final String channelId, final Throwable reason) {
    LOG.warn("Publishing to '{}' failed", channelId, reason);
    return PublishReport.aborted(channelId, reason);
  }

  private static Throwable unwrap(final Throwable reason) {
    if (reason instanceof CompletionException && reason.getCause() != null) {
      return reason.getCause();
    }

    return reason;
  }

  private PublishReport publish(final Channel channel) {
    channel.lock.lock();
    try {
      final long fromPosition = tracker.lastPublishedPosition(channel.id);
      long lastAcknowledged = fromPosition;
      int deliveredCount = 0;

      while (true) {
        final List<EventRecord> batch;
        try (Stream<EventRecord> events = eventStore.readAll(lastAcknowledged)) {
          batch = events.limit(batchSize).toList();
        }

        final long batchStart = lastAcknowledged;
        for (EventRecord event : batch) {
          final Optional<DeliveryFailureException> failure = deliver(channel, event);

          if (failure.isPresent()) {
            if (lastAcknowledged > batchStart) {
              tracker.advance(channel.id, lastAcknowledged);
            }

            LOG.warn(
                "Delivery of event at position {} to '{}' failed, {} event(s) delivered",
                event.globalPosition(),
                channel.id,
                deliveredCount,
                failure.get());
            return new PublishReport(
                channel.id, fromPosition, lastAcknowledged, deliveredCount, failure.get());
          }

          lastAcknowledged = event.globalPosition();
          deliveredCount++;
        }

        if (lastAcknowledged > batchStart) {
          tracker.advance(channel.id, lastAcknowledged);
        }

        if (batch.size() < batchSize) {
          return new PublishReport(
              channel.id, fromPosition, lastAcknowledged, deliveredCount, null);
        }
      }
    } finally {
      channel.lock.unlock();
    }
  }

  private Optional<DeliveryFailureException> deliver(
      final Channel channel, final EventRecord event) {
    final Try<DeliveryStatus> status =
        Try.of(
            () ->
                channel.adapter.send(
                    codec.writeEnvelope(codec.serialize(event)), MessageMetadata.of(event)));

    final AtomicReference<DeliveryFailureException> failure = new AtomicReference<>();

    status.ifSuccess(
        deliveryStatus -> {
          if (deliveryStatus == DeliveryStatus.ACKNOWLEDGED) {
            LOG.debug(
                "Delivered '{}' of '{}' at position {} to '{}'",
                event.eventType(),
                event.aggregateId(),
                event.globalPosition(),
                channel.id);
          } else {
            failure.set(
                new DeliveryFailureException(
                    channel.id,
                    event.globalPosition(),
                    "Channel '%s' returned %s for event '%s'"
                        .formatted(channel.id, deliveryStatus, event.eventId())));
          }
        });

    status.ifFailure(
        reason ->
            failure.set(
                new DeliveryFailureException(
                    channel.id,
                    event.globalPosition(),
                    "Channel '%s' failed to accept event '%s'"
                        .formatted(channel.id, event.eventId()),
                    reason)));

    return Optional.ofNullable(failure.get());
  }

  private static final class Channel {
    private final String id;
    private final ChannelAdapter adapter;
    private final ReentrantLock lock;
    private final AtomicBoolean scheduled;

    private Channel(final String id, final ChannelAdapter adapter) {
      this.id = id;
      this.adapter = adapter;
      this.lock = new ReentrantLock();
      this.scheduled = new AtomicBoolean(false);
    }
  }
}
