package com.verlumen.candlestream.hub;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import com.verlumen.candlestream.marketdata.FeedKey;

@AutoValue
public abstract class HubStatus {
  public static HubStatus create(ImmutableMap<FeedKey, KeyStatus> streams) {
    return new AutoValue_HubStatus(streams);
  }

  public abstract ImmutableMap<FeedKey, KeyStatus> streams();

  public int activeStreams() {
    return streams().size();
  }

  public int totalSubscribers() {
    return streams().values().stream().mapToInt(KeyStatus::subscriberCount).sum();
  }
}
