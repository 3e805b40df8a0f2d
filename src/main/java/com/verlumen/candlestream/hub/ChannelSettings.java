package com.verlumen.candlestream.hub;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import java.time.Duration;

/** Capacity, idle window and overflow behaviour shared by every subscriber channel. */
@AutoValue
public abstract class ChannelSettings {
  public static final int DEFAULT_CAPACITY = 100;
  public static final Duration DEFAULT_IDLE_WINDOW = Duration.ofSeconds(30);

  public static ChannelSettings create(
      int capacity, Duration idleWindow, OverflowPolicy overflowPolicy) {
    checkArgument(capacity > 0, "Channel capacity must be positive: %s", capacity);
    checkArgument(
        !idleWindow.isNegative() && !idleWindow.isZero(),
        "Idle window must be positive: %s",
        idleWindow);
    return new AutoValue_ChannelSettings(capacity, idleWindow, overflowPolicy);
  }

  public static ChannelSettings defaults() {
    return create(DEFAULT_CAPACITY, DEFAULT_IDLE_WINDOW, OverflowPolicy.DROP_NEWEST);
  }

  public abstract int capacity();

  public abstract Duration idleWindow();

  public abstract OverflowPolicy overflowPolicy();
}
