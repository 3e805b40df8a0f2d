package com.verlumen.candlestream.hub;

import com.verlumen.candlestream.marketdata.FeedKey;

/**
 * Shares one upstream feed per {@link FeedKey} among any number of subscribers.
 *
 * <p>The first subscriber for a key opens its feed and the last one to leave closes it. A subscriber
 * joining a running key is first sent the most recent bar seen for it.
 */
public interface FanOutHub extends AutoCloseable {
  /**
   * Registers a new subscriber for {@code key}.
   *
   * @throws IllegalStateException if the hub has been closed
   */
  Subscription subscribe(FeedKey key);

  /** Removes {@code channel} from {@code key}. Unknown keys and channels are ignored. */
  void unsubscribe(FeedKey key, SubscriberChannel channel);

  HubStatus status();

  /** Closes every channel and stops every feed. Idempotent. */
  @Override
  void close();
}
