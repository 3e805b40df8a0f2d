package com.verlumen.candlestream.ingestion;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

import com.google.common.flogger.FluentLogger;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.inject.Inject;
import com.google.inject.assistedinject.Assisted;
import com.verlumen.candlestream.marketdata.FeedKey;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;

/**
 * Dry-run transport that emits random-walk candles in the Bitfinex candle channel format, so the
 * rest of the pipeline runs unchanged without network access.
 */
final class SimulatedCandleTransport implements FeedTransport {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final BigDecimal START_PRICE = new BigDecimal("100.00");
  private static final int PRICE_SCALE = 2;
  private static final int VOLUME_SCALE = 4;
  private static final double STEP_STDDEV = 0.001;
  private static final int CHANNEL_ID = 0;

  private final ScheduledExecutorService scheduler;
  private final Clock clock;
  private final Random random;
  private final Duration tickInterval;

  @Inject
  SimulatedCandleTransport(
      ScheduledExecutorService scheduler,
      Clock clock,
      Random random,
      @Assisted Duration tickInterval) {
    this.scheduler = scheduler;
    this.clock = clock;
    this.random = random;
    this.tickInterval = tickInterval;
  }

  @Override
  public CompletableFuture<FeedSession> open(FeedKey key, Listener listener) {
    logger.atInfo().log("Opening simulated candle feed for %s every %s", key, tickInterval);
    RandomWalk walk = new RandomWalk(key);
    listener.onMessage(subscribedEvent(key));
    ScheduledFuture<?> ticks =
        scheduler.scheduleAtFixedRate(
            () -> listener.onMessage(walk.next()), 0, tickInterval.toMillis(), MILLISECONDS);
    return CompletableFuture.completedFuture(
        () -> {
          logger.atInfo().log("Closing simulated candle feed for %s", key);
          ticks.cancel(false);
        });
  }

  private static String subscribedEvent(FeedKey key) {
    JsonObject event = new JsonObject();
    event.addProperty("event", "subscribed");
    event.addProperty("channel", "candles");
    event.addProperty("chanId", CHANNEL_ID);
    event.addProperty("key", BitfinexCandleTransport.channelKey(key));
    return event.toString();
  }

  /** Builds the in-progress candle of the current bucket. Only touched by one tick task. */
  private final class RandomWalk {
    private final long bucketMillis;
    private long openTime = -1;
    private BigDecimal open;
    private BigDecimal high;
    private BigDecimal low;
    private BigDecimal close = START_PRICE;
    private BigDecimal volume;

    RandomWalk(FeedKey key) {
      this.bucketMillis = key.timeframe().getDuration().toMillis();
    }

    String next() {
      long now = clock.millis();
      long bucket = now - Math.floorMod(now, bucketMillis);
      if (bucket != openTime) {
        openTime = bucket;
        open = close;
        high = close;
        low = close;
        volume = BigDecimal.ZERO.setScale(VOLUME_SCALE);
      }

      BigDecimal step =
          close.multiply(BigDecimal.valueOf(random.nextGaussian() * STEP_STDDEV));
      close = close.add(step).setScale(PRICE_SCALE, RoundingMode.HALF_EVEN);
      high = high.max(close);
      low = low.min(close);
      volume =
          volume.add(
              BigDecimal.valueOf(random.nextDouble()).setScale(VOLUME_SCALE, RoundingMode.HALF_EVEN));

      JsonArray candle = new JsonArray();
      candle.add(openTime);
      candle.add(open);
      candle.add(close);
      candle.add(high);
      candle.add(low);
      candle.add(volume);

      JsonArray message = new JsonArray();
      message.add(CHANNEL_ID);
      message.add(candle);
      return message.toString();
    }
  }

  interface Factory {
    SimulatedCandleTransport create(Duration tickInterval);
  }
}
