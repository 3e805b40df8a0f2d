package com.verlumen.candlestream.ingestion;

import com.verlumen.candlestream.marketdata.FeedKey;
import java.util.Optional;

/**
 * A self-healing connection to one upstream feed.
 *
 * <p>States move {@code IDLE -> CONNECTING -> LIVE <-> BACKOFF -> STOPPED}. Transport failures are
 * retried with backoff until {@link #stop()} is called; they are never reported to the sink.
 */
public interface UpstreamFeed {
  enum State {
    IDLE,
    CONNECTING,
    LIVE,
    BACKOFF,
    STOPPED
  }

  FeedKey key();

  /** Begins connecting. Returns without waiting for the connection. */
  void start();

  /** Stops the feed from any state. Idempotent. */
  void stop();

  State state();

  /** Failed attempts since the feed last stayed live long enough to reset the backoff. */
  int reconnectAttempt();

  Optional<Throwable> lastError();

  interface Factory {
    UpstreamFeed create(FeedKey key, BarSink sink);
  }
}
