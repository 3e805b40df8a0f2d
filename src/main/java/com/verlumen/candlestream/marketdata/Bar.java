package com.verlumen.candlestream.marketdata;

import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import com.verlumen.candlestream.time.Timeframe;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * One OHLCV bucket for a symbol and timeframe.
 *
 * <p>A venue republishes the bar of the current bucket while it is still forming, so several bars
 * with the same {@link #openTime()} may arrive for one key. The latest arrival replaces the earlier
 * ones; bars are never ordered by value.
 *
 * <p>Prices and volume are exact decimals as quoted by the venue.
 */
@AutoValue
public abstract class Bar {
  public static Builder builder() {
    return new AutoValue_Bar.Builder();
  }

  public abstract String symbol();

  public abstract Timeframe timeframe();

  public abstract String exchange();

  public abstract Instant openTime();

  public abstract Instant closeTime();

  public abstract BigDecimal open();

  public abstract BigDecimal high();

  public abstract BigDecimal low();

  public abstract BigDecimal close();

  public abstract BigDecimal volume();

  public abstract Builder toBuilder();

  public FeedKey key() {
    return FeedKey.create(symbol(), timeframe());
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setSymbol(String symbol);

    public abstract Builder setTimeframe(Timeframe timeframe);

    public abstract Builder setExchange(String exchange);

    public abstract Builder setOpenTime(Instant openTime);

    public abstract Builder setCloseTime(Instant closeTime);

    public abstract Builder setOpen(BigDecimal open);

    public abstract Builder setHigh(BigDecimal high);

    public abstract Builder setLow(BigDecimal low);

    public abstract Builder setClose(BigDecimal close);

    public abstract Builder setVolume(BigDecimal volume);

    abstract Bar autoBuild();

    public Bar build() {
      Bar bar = autoBuild();
      checkState(
          !bar.closeTime().isBefore(bar.openTime()),
          "Bar for %s closes (%s) before it opens (%s)",
          bar.symbol(),
          bar.closeTime(),
          bar.openTime());
      return bar;
    }
  }
}
