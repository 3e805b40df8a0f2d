package com.verlumen.candlestream.hub;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.google.inject.assistedinject.Assisted;
import com.verlumen.candlestream.marketdata.FeedKey;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded queue between the hub and one subscriber.
 *
 * <p>{@link #offer} never blocks: when the queue is full the configured {@link OverflowPolicy}
 * decides which event is lost. {@link #next} blocks for at most the idle window and produces a
 * heartbeat when nothing arrived in time.
 */
public final class SubscriberChannel {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  // Identity sentinel that wakes a blocked reader on close.
  private static final StreamEvent END = StreamEvent.ofHeartbeat(Long.MIN_VALUE);

  private final FeedKey key;
  private final ChannelSettings settings;
  private final Clock clock;
  private final Instant createdAt;
  private final BlockingQueue<StreamEvent> queue;
  private final AtomicLong droppedEvents = new AtomicLong();
  private volatile boolean closed;

  @Inject
  SubscriberChannel(Clock clock, ChannelSettings settings, @Assisted FeedKey key) {
    this.clock = clock;
    this.settings = settings;
    this.key = key;
    this.createdAt = clock.instant();
    this.queue = new ArrayBlockingQueue<>(settings.capacity());
  }

  public FeedKey key() {
    return key;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public int capacity() {
    return settings.capacity();
  }

  /** Events queued and not yet read. */
  public int size() {
    return queue.size();
  }

  public long droppedEvents() {
    return droppedEvents.get();
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * Enqueues without blocking. Returns false when the event itself was not queued, either because
   * the channel is closed or because it was dropped under {@link OverflowPolicy#DROP_NEWEST}.
   */
  public boolean offer(StreamEvent event) {
    if (closed) {
      return false;
    }
    if (queue.offer(event)) {
      return true;
    }
    if (settings.overflowPolicy() == OverflowPolicy.DROP_NEWEST) {
      recordDrop();
      return false;
    }
    while (!queue.offer(event)) {
      if (closed) {
        return false;
      }
      if (queue.poll() != null) {
        recordDrop();
      }
    }
    return true;
  }

  /**
   * Waits up to the idle window for the next event.
   *
   * @return the next queued event, a heartbeat if the window elapsed with nothing queued, or empty
   *     once the channel is closed
   */
  public Optional<StreamEvent> next() throws InterruptedException {
    if (closed) {
      return Optional.empty();
    }
    StreamEvent event = queue.poll(settings.idleWindow().toMillis(), MILLISECONDS);
    if (event == END || closed) {
      return Optional.empty();
    }
    if (event == null) {
      return Optional.of(StreamEvent.ofHeartbeat(clock.millis()));
    }
    return Optional.of(event);
  }

  /** Discards queued events and releases any blocked reader. Idempotent. */
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    queue.clear();
    queue.offer(END);
  }

  private void recordDrop() {
    long dropped = droppedEvents.incrementAndGet();
    logger.atFine().atMostEvery(10, SECONDS).log(
        "Subscriber channel for %s is full, %d events dropped so far", key, dropped);
  }

  interface Factory {
    SubscriberChannel create(FeedKey key);
  }
}
