package com.verlumen.candlestream.sse;

import com.google.common.collect.ImmutableList;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.inject.Inject;
import com.verlumen.candlestream.hub.HubStatus;
import com.verlumen.candlestream.hub.KeyStatus;
import com.verlumen.candlestream.hub.StreamEvent;
import com.verlumen.candlestream.marketdata.Bar;
import com.verlumen.candlestream.marketdata.FeedKey;
import java.util.Comparator;
import java.util.Map;

/**
 * Renders hub output in the JSON shapes existing chart clients read.
 *
 * <p>Candles use the short keys {@code t o h l c v} with {@code t} in epoch milliseconds. Prices
 * and volumes are written as JSON numbers straight from their decimal values.
 */
public final class StreamEventEncoder {
  static final String SSE_DATA_PREFIX = "data: ";
  static final String SSE_FRAME_SUFFIX = "\n\n";

  private final Gson gson;

  @Inject
  StreamEventEncoder(Gson gson) {
    this.gson = gson;
  }

  public String toJson(StreamEvent event) {
    switch (event.getKind()) {
      case BAR:
        return gson.toJson(candle(event.bar()));
      case HEARTBEAT:
        return gson.toJson(heartbeat(event.heartbeat().timestampMillis()));
    }
    throw new AssertionError("Unhandled event kind: " + event.getKind());
  }

  /** One Server-Sent-Events frame carrying the event's JSON. */
  public String toSseFrame(StreamEvent event) {
    return SSE_DATA_PREFIX + toJson(event) + SSE_FRAME_SUFFIX;
  }

  public String statusJson(HubStatus status) {
    JsonObject root = new JsonObject();
    root.addProperty("active_streams", status.activeStreams());
    root.addProperty("total_subscribers", status.totalSubscribers());

    ImmutableList<Map.Entry<FeedKey, KeyStatus>> sorted =
        ImmutableList.sortedCopyOf(
            Comparator.comparing((Map.Entry<FeedKey, KeyStatus> entry) -> entry.getKey().toString()),
            status.streams().entrySet());
    JsonArray streams = new JsonArray();
    for (Map.Entry<FeedKey, KeyStatus> entry : sorted) {
      KeyStatus keyStatus = entry.getValue();
      JsonObject stream = new JsonObject();
      stream.addProperty("key", entry.getKey().toString());
      stream.addProperty("subscribers", keyStatus.subscriberCount());
      stream.addProperty("connected", keyStatus.connected());
      stream.addProperty("state", keyStatus.connectionState().name());
      stream.addProperty("reconnect_attempt", keyStatus.reconnectAttempt());
      stream.addProperty("dropped_events", keyStatus.droppedEvents());
      streams.add(stream);
    }
    root.add("streams", streams);
    return gson.toJson(root);
  }

  private static JsonObject candle(Bar bar) {
    JsonObject candle = new JsonObject();
    candle.addProperty("type", "candle");
    candle.addProperty("symbol", bar.symbol());
    candle.addProperty("timeframe", bar.timeframe().getLabel());
    candle.addProperty("t", bar.openTime().toEpochMilli());
    candle.addProperty("o", bar.open());
    candle.addProperty("h", bar.high());
    candle.addProperty("l", bar.low());
    candle.addProperty("c", bar.close());
    candle.addProperty("v", bar.volume());
    return candle;
  }

  private static JsonObject heartbeat(long timestampMillis) {
    JsonObject heartbeat = new JsonObject();
    heartbeat.addProperty("type", "heartbeat");
    heartbeat.addProperty("timestamp", timestampMillis);
    return heartbeat;
  }
}
