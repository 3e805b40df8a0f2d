package com.verlumen.candlestream.hub;

import com.verlumen.candlestream.marketdata.FeedKey;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/** Handle returned by {@link FanOutHub#subscribe}. Closing it unsubscribes. */
public final class Subscription implements AutoCloseable {
  private final FeedKey key;
  private final SubscriberChannel channel;
  private final Runnable onCancel;
  private final AtomicBoolean cancelled = new AtomicBoolean();

  Subscription(FeedKey key, SubscriberChannel channel, Runnable onCancel) {
    this.key = key;
    this.channel = channel;
    this.onCancel = onCancel;
  }

  public FeedKey key() {
    return key;
  }

  public SubscriberChannel channel() {
    return channel;
  }

  /** See {@link SubscriberChannel#next()}. */
  public Optional<StreamEvent> next() throws InterruptedException {
    return channel.next();
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  public void cancel() {
    if (cancelled.compareAndSet(false, true)) {
      onCancel.run();
    }
  }

  @Override
  public void close() {
    cancel();
  }
}
