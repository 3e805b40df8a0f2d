package com.verlumen.candlestream.hub;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.candlestream.ingestion.BarSink;
import com.verlumen.candlestream.ingestion.UpstreamFeed;
import com.verlumen.candlestream.marketdata.Bar;
import com.verlumen.candlestream.marketdata.FeedKey;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * {@link FanOutHub} keeping one {@link KeyEntry} per active key.
 *
 * <p>Each entry serializes registration, removal and the latest-bar update on its own monitor, so
 * keys never contend with each other. Bars are offered to a snapshot of the subscriber set outside
 * the monitor. An entry that lost its last subscriber is retired and removed from the map; a
 * retired entry refuses new subscribers and ignores late bars from its stopped feed.
 */
final class FanOutHubImpl implements FanOutHub {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ConcurrentMap<FeedKey, KeyEntry> entries = new ConcurrentHashMap<>();
  private final UpstreamFeed.Factory feedFactory;
  private final SubscriberChannel.Factory channelFactory;
  private volatile boolean closed;

  @Inject
  FanOutHubImpl(UpstreamFeed.Factory feedFactory, SubscriberChannel.Factory channelFactory) {
    this.feedFactory = feedFactory;
    this.channelFactory = channelFactory;
  }

  @Override
  public Subscription subscribe(FeedKey key) {
    checkNotNull(key);
    while (true) {
      checkState(!closed, "Hub is closed");
      KeyEntry entry = entries.computeIfAbsent(key, KeyEntry::new);
      Optional<Subscription> subscription = entry.register();
      if (subscription.isPresent()) {
        return subscription.get();
      }
      // The entry was retired between lookup and registration; a fresh one replaces it.
    }
  }

  @Override
  public void unsubscribe(FeedKey key, SubscriberChannel channel) {
    checkNotNull(key);
    checkNotNull(channel);
    KeyEntry entry = entries.get(key);
    if (entry == null) {
      logger.atFine().log("Ignoring unsubscribe for inactive key %s", key);
      return;
    }
    entry.remove(channel);
  }

  @Override
  public HubStatus status() {
    ImmutableMap.Builder<FeedKey, KeyStatus> streams = ImmutableMap.builder();
    for (KeyEntry entry : entries.values()) {
      UpstreamFeed feed = entry.feed;
      ImmutableSet<SubscriberChannel> subscribers = entry.subscribers;
      if (feed == null || subscribers.isEmpty()) {
        continue;
      }
      long dropped = 0;
      for (SubscriberChannel channel : subscribers) {
        dropped += channel.droppedEvents();
      }
      streams.put(
          entry.key,
          KeyStatus.create(subscribers.size(), feed.state(), feed.reconnectAttempt(), dropped));
    }
    return HubStatus.create(streams.buildKeepingLast());
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    logger.atInfo().log("Closing hub with %d active streams", entries.size());
    for (KeyEntry entry : entries.values()) {
      entry.shutdown();
    }
  }

  private final class KeyEntry implements BarSink {
    private final FeedKey key;

    // Written under this entry's monitor, read without it by status().
    private volatile ImmutableSet<SubscriberChannel> subscribers = ImmutableSet.of();
    private volatile UpstreamFeed feed;

    // Guarded by this.
    private Bar latestBar;
    private boolean retired;

    KeyEntry(FeedKey key) {
      this.key = key;
    }

    synchronized Optional<Subscription> register() {
      if (retired) {
        return Optional.empty();
      }
      if (closed) {
        retire();
        throw new IllegalStateException("Hub is closed");
      }

      SubscriberChannel channel = channelFactory.create(key);
      subscribers = with(channel);
      if (feed == null) {
        logger.atInfo().log("First subscriber for %s, opening upstream feed", key);
        try {
          feed = feedFactory.create(key, this);
          feed.start();
        } catch (RuntimeException e) {
          logger.atSevere().withCause(e).log("Unable to open upstream feed for %s", key);
          subscribers = without(channel);
          channel.close();
          retire();
          throw e;
        }
      } else if (latestBar != null) {
        channel.offer(StreamEvent.ofBar(latestBar));
      }
      logger.atInfo().log("New subscriber for %s (total: %d)", key, subscribers.size());
      return Optional.of(new Subscription(key, channel, () -> unsubscribe(key, channel)));
    }

    synchronized void remove(SubscriberChannel channel) {
      if (!subscribers.contains(channel)) {
        logger.atFine().log("Ignoring unsubscribe of unknown channel for %s", key);
        return;
      }
      subscribers = without(channel);
      channel.close();
      logger.atInfo().log("Subscriber left %s (remaining: %d)", key, subscribers.size());
      if (subscribers.isEmpty()) {
        logger.atInfo().log("No subscribers left for %s, closing upstream feed", key);
        retire();
      }
    }

    synchronized void shutdown() {
      if (retired) {
        return;
      }
      for (SubscriberChannel channel : subscribers) {
        channel.close();
      }
      subscribers = ImmutableSet.of();
      retire();
    }

    @Override
    public void onBar(FeedKey barKey, Bar bar) {
      ImmutableSet<SubscriberChannel> snapshot;
      synchronized (this) {
        if (retired) {
          logger.atFine().log("Dropping bar for %s from a closed feed", key);
          return;
        }
        if (feed == null || !key.equals(barKey) || !key.equals(bar.key())) {
          logger.atSevere().log(
              "Refusing to broadcast %s on %s (bar key %s, feed open: %s)",
              barKey, key, bar.key(), feed != null);
          throw new IllegalStateException(
              String.format("Bar for %s delivered to the stream for %s", barKey, key));
        }
        latestBar = bar;
        snapshot = subscribers;
      }
      logger.atFinest().log("Broadcasting bar for %s to %d subscribers", key, snapshot.size());
      StreamEvent event = StreamEvent.ofBar(bar);
      for (SubscriberChannel channel : snapshot) {
        channel.offer(event);
      }
    }

    // Guarded by this.
    private void retire() {
      retired = true;
      if (feed != null) {
        feed.stop();
        feed = null;
      }
      latestBar = null;
      entries.remove(key, this);
    }

    private ImmutableSet<SubscriberChannel> with(SubscriberChannel channel) {
      return ImmutableSet.<SubscriberChannel>builder().addAll(subscribers).add(channel).build();
    }

    private ImmutableSet<SubscriberChannel> without(SubscriberChannel channel) {
      ImmutableSet.Builder<SubscriberChannel> remaining = ImmutableSet.builder();
      for (SubscriberChannel existing : subscribers) {
        if (existing != channel) {
          remaining.add(existing);
        }
      }
      return remaining.build();
    }
  }
}
