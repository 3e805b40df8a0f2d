package com.verlumen.candlestream.hub;

import com.google.auto.value.AutoValue;
import com.verlumen.candlestream.ingestion.UpstreamFeed;

/** Point-in-time view of one key's fan-out. */
@AutoValue
public abstract class KeyStatus {
  public static KeyStatus create(
      int subscriberCount,
      UpstreamFeed.State connectionState,
      int reconnectAttempt,
      long droppedEvents) {
    return new AutoValue_KeyStatus(
        subscriberCount, connectionState, reconnectAttempt, droppedEvents);
  }

  public abstract int subscriberCount();

  public abstract UpstreamFeed.State connectionState();

  public abstract int reconnectAttempt();

  /** Events dropped across the key's current subscriber channels. */
  public abstract long droppedEvents();

  public boolean connected() {
    return connectionState() == UpstreamFeed.State.LIVE;
  }
}
