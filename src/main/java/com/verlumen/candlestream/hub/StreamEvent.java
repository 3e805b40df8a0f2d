package com.verlumen.candlestream.hub;

import com.google.auto.value.AutoOneOf;
import com.google.auto.value.AutoValue;
import com.verlumen.candlestream.marketdata.Bar;

/** What a subscriber pulls from its channel: a bar, or a heartbeat standing in for silence. */
@AutoOneOf(StreamEvent.Kind.class)
public abstract class StreamEvent {
  public enum Kind {
    BAR,
    HEARTBEAT
  }

  public static StreamEvent ofBar(Bar bar) {
    return AutoOneOf_StreamEvent.bar(bar);
  }

  public static StreamEvent ofHeartbeat(long timestampMillis) {
    return AutoOneOf_StreamEvent.heartbeat(Heartbeat.create(timestampMillis));
  }

  public abstract Kind getKind();

  public abstract Bar bar();

  public abstract Heartbeat heartbeat();

  /** Keep-alive produced when no bar arrived within the idle window. */
  @AutoValue
  public abstract static class Heartbeat {
    static Heartbeat create(long timestampMillis) {
      return new AutoValue_StreamEvent_Heartbeat(timestampMillis);
    }

    public abstract long timestampMillis();
  }
}
