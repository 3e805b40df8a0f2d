package com.verlumen.candlestream.hub;

/** What a full {@link SubscriberChannel} does with one more event. */
public enum OverflowPolicy {
  /** Reject the incoming event and keep what is queued. */
  DROP_NEWEST,
  /** Evict the oldest queued event to make room. */
  DROP_OLDEST
}
