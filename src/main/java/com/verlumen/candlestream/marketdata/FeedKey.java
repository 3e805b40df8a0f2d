package com.verlumen.candlestream.marketdata;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Strings.isNullOrEmpty;

import com.google.auto.value.AutoValue;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.verlumen.candlestream.time.Timeframe;
import java.util.Locale;

/**
 * Identifies one logical live feed: a symbol streamed at one timeframe.
 *
 * <p>The string form is {@code SYMBOL:timeframe}, e.g. {@code BTCUSD:1m}.
 */
@AutoValue
public abstract class FeedKey {
  private static final String DELIMITER = ":";

  public static FeedKey create(String symbol, Timeframe timeframe) {
    checkArgument(!isNullOrEmpty(symbol) && !symbol.isBlank(), "Symbol must not be blank");
    return new AutoValue_FeedKey(symbol.trim().toUpperCase(Locale.ROOT), timeframe);
  }

  /**
   * Parses a key of the form {@code SYMBOL:timeframe}.
   *
   * @throws IllegalArgumentException if the text is not two non-empty parts or the timeframe is
   *     unknown
   */
  public static FeedKey parse(String text) {
    ImmutableList<String> parts =
        ImmutableList.copyOf(Splitter.on(DELIMITER).trimResults().omitEmptyStrings().split(text));
    checkArgument(parts.size() == 2, "Feed key must look like SYMBOL:timeframe, got \"%s\"", text);
    return create(parts.get(0), Timeframe.fromLabel(parts.get(1)));
  }

  public abstract String symbol();

  public abstract Timeframe timeframe();

  @Override
  public final String toString() {
    return symbol() + DELIMITER + timeframe().getLabel();
  }
}
