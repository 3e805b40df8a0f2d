package com.verlumen.candlestream.ingestion;

import com.verlumen.candlestream.marketdata.FeedKey;
import java.util.concurrent.CompletableFuture;

/**
 * Opens connections to an upstream source of raw candle messages.
 *
 * <p>Implementations must tolerate being reopened for the same key after an arbitrary delay.
 * Overlapping or repeated bars after a reconnect are expected.
 */
public interface FeedTransport {
  /**
   * Starts connecting for {@code key}. The returned future completes once the connection is
   * established and subscribed, or completes exceptionally if it could not be.
   */
  CompletableFuture<FeedSession> open(FeedKey key, Listener listener);

  /** Callbacks for one connection. Calls for one connection never overlap. */
  interface Listener {
    void onMessage(String rawMessage);

    /** The connection is gone, either closed by the remote side or failed. */
    void onClosed(Throwable cause);
  }
}
