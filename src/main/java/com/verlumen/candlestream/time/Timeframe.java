package com.verlumen.candlestream.time;

import java.time.Duration;
import java.util.Arrays;

/** Bar widths that live candle feeds can be subscribed to. */
public enum Timeframe {
  ONE_MIN("1m", Duration.ofMinutes(1)),
  FIVE_MIN("5m", Duration.ofMinutes(5)),
  FIFTEEN_MIN("15m", Duration.ofMinutes(15)),
  ONE_HOUR("1h", Duration.ofHours(1)),
  FOUR_HOUR("4h", Duration.ofHours(4)),
  ONE_DAY("1d", Duration.ofDays(1));

  private final String label;
  private final Duration duration;

  Timeframe(String label, Duration duration) {
    this.label = label;
    this.duration = duration;
  }

  public String getLabel() {
    return label;
  }

  public Duration getDuration() {
    return duration;
  }

  public static Timeframe fromLabel(String label) {
    return Arrays.stream(values())
        .filter(tf -> tf.label.equals(label))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported timeframe: " + label));
  }

  @Override
  public String toString() {
    return label;
  }
}
