package com.verlumen.candlestream.ingestion;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.math.LongMath;
import java.time.Duration;

/**
 * Governs when an {@link UpstreamFeed} reconnects.
 *
 * <p>The n-th consecutive failure waits {@code min(ceiling, floor * 2^(n-1))}, spread by up to
 * {@code jitter} of that value in either direction and never beyond the ceiling. A feed that stayed
 * live for {@code resetAfter} starts again from the floor. A live feed that has received nothing for
 * {@code staleAfter} is treated as failed; a zero {@code staleAfter} turns that check off.
 */
@AutoValue
public abstract class ReconnectPolicy {
  private static final int MAX_SHIFT = 30;

  public static ReconnectPolicy create(
      Duration floor, Duration ceiling, double jitter, Duration resetAfter, Duration staleAfter) {
    checkArgument(!floor.isNegative() && !floor.isZero(), "Backoff floor must be positive: %s", floor);
    checkArgument(
        ceiling.compareTo(floor) >= 0, "Backoff ceiling %s is below floor %s", ceiling, floor);
    checkArgument(jitter >= 0 && jitter <= 1, "Jitter must be within [0, 1]: %s", jitter);
    checkArgument(!resetAfter.isNegative(), "Reset period must not be negative: %s", resetAfter);
    checkArgument(!staleAfter.isNegative(), "Stale period must not be negative: %s", staleAfter);
    return new AutoValue_ReconnectPolicy(floor, ceiling, jitter, resetAfter, staleAfter);
  }

  public static ReconnectPolicy defaults() {
    return create(
        Duration.ofSeconds(1),
        Duration.ofSeconds(30),
        0.2,
        Duration.ofSeconds(60),
        Duration.ofSeconds(60));
  }

  public abstract Duration floor();

  public abstract Duration ceiling();

  public abstract double jitter();

  public abstract Duration resetAfter();

  public abstract Duration staleAfter();

  /**
   * Returns the wait before reconnect attempt {@code attempt}.
   *
   * @param attempt 1 for the first retry after a failure
   * @param random a uniform sample from [0, 1)
   */
  public Duration delayFor(int attempt, double random) {
    checkArgument(attempt >= 1, "Attempt must be at least 1: %s", attempt);
    checkArgument(random >= 0 && random <= 1, "Random sample must be within [0, 1]: %s", random);
    long ceilingMillis = ceiling().toMillis();
    long base =
        Math.min(
            ceilingMillis,
            LongMath.saturatedMultiply(floor().toMillis(), 1L << Math.min(attempt - 1, MAX_SHIFT)));
    long jittered = Math.round(base * (1 + jitter() * (2 * random - 1)));
    return Duration.ofMillis(Math.max(0, Math.min(ceilingMillis, jittered)));
  }
}
