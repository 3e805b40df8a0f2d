package com.verlumen.candlestream.marketdata;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.inject.Inject;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * Parses Bitfinex WebSocket v2 candle channel messages.
 *
 * <p>Event objects ({@code info}, {@code subscribed}, {@code error}) and {@code [chanId, "hb"]}
 * keep-alives carry no bars. Data arrives as {@code [chanId, [MTS, OPEN, CLOSE, HIGH, LOW,
 * VOLUME]]} for an update, or as {@code [chanId, [[...], [...]]]} for the snapshot of recent
 * history sent right after subscribing. Only the newest candle of a snapshot is returned.
 */
public final class BitfinexBarParser implements BarParser {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public static final String EXCHANGE = "bitfinex";
  private static final String HEARTBEAT = "hb";
  private static final int CANDLE_FIELDS = 6;

  @Inject
  BitfinexBarParser() {}

  @Override
  public ImmutableList<Bar> parse(FeedKey key, String rawMessage) throws BarParseException {
    JsonElement message;
    try {
      message = JsonParser.parseString(rawMessage);
    } catch (JsonParseException e) {
      throw new BarParseException("Message is not valid JSON: " + rawMessage, e);
    }

    if (message.isJsonObject()) {
      handleEvent(key, message.getAsJsonObject());
      return ImmutableList.of();
    }

    if (!message.isJsonArray() || message.getAsJsonArray().size() < 2) {
      throw new BarParseException("Unexpected message shape: " + rawMessage);
    }

    JsonElement payload = message.getAsJsonArray().get(1);
    if (payload.isJsonPrimitive() && HEARTBEAT.equals(payload.getAsString())) {
      logger.atFiner().log("Heartbeat on %s", key);
      return ImmutableList.of();
    }

    if (!payload.isJsonArray()) {
      throw new BarParseException("Candle payload is not an array: " + rawMessage);
    }

    JsonArray candles = payload.getAsJsonArray();
    if (candles.isEmpty()) {
      return ImmutableList.of();
    }

    if (!candles.get(0).isJsonArray()) {
      return ImmutableList.of(toBar(key, candles));
    }

    Bar newest = null;
    for (JsonElement candle : candles) {
      if (!candle.isJsonArray()) {
        throw new BarParseException("Snapshot entry is not an array: " + candle);
      }
      Bar bar = toBar(key, candle.getAsJsonArray());
      if (newest == null || bar.openTime().isAfter(newest.openTime())) {
        newest = bar;
      }
    }
    logger.atFine().log(
        "Snapshot of %d bars for %s, keeping the bar opened at %s",
        candles.size(), key, newest.openTime());
    return ImmutableList.of(newest);
  }

  private static void handleEvent(FeedKey key, JsonObject event) throws BarParseException {
    String type = eventType(event);
    switch (type) {
      case "subscribed":
        logger.atInfo().log(
            "Subscribed to %s on channel %s", key, event.has("chanId") ? event.get("chanId") : "?");
        break;
      case "error":
        logger.atWarning().log("Bitfinex reported an error for %s: %s", key, event);
        break;
      default:
        logger.atFine().log("Ignoring event for %s: %s", key, event);
    }
  }

  private static String eventType(JsonObject event) throws BarParseException {
    JsonElement type = event.get("event");
    if (type == null) {
      return "";
    }
    if (!type.isJsonPrimitive() || !type.getAsJsonPrimitive().isString()) {
      throw new BarParseException("Event type is not a string: " + event);
    }
    return type.getAsString();
  }

  private static Bar toBar(FeedKey key, JsonArray candle) throws BarParseException {
    if (candle.size() < CANDLE_FIELDS) {
      throw new BarParseException("Candle has " + candle.size() + " fields: " + candle);
    }
    try {
      Instant openTime = Instant.ofEpochMilli(candle.get(0).getAsLong());
      return Bar.builder()
          .setSymbol(key.symbol())
          .setTimeframe(key.timeframe())
          .setExchange(EXCHANGE)
          .setOpenTime(openTime)
          .setCloseTime(openTime.plus(key.timeframe().getDuration()))
          .setOpen(decimal(candle.get(1)))
          .setClose(decimal(candle.get(2)))
          .setHigh(decimal(candle.get(3)))
          .setLow(decimal(candle.get(4)))
          .setVolume(decimal(candle.get(5)))
          .build();
    } catch (RuntimeException e) {
      throw new BarParseException("Malformed candle: " + candle, e);
    }
  }

  private static BigDecimal decimal(JsonElement element) {
    return element.getAsBigDecimal();
  }
}
