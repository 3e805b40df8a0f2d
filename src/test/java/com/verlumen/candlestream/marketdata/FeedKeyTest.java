package com.verlumen.candlestream.marketdata;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.verlumen.candlestream.time.Timeframe;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class FeedKeyTest {
  @Test
  public void create_normalizesSymbol() {
    // Act
    FeedKey key = FeedKey.create("  btcusd ", Timeframe.ONE_MIN);

    // Assert
    assertThat(key.symbol()).isEqualTo("BTCUSD");
    assertThat(key.timeframe()).isEqualTo(Timeframe.ONE_MIN);
  }

  @Test
  public void create_blankSymbol_throws() {
    assertThrows(IllegalArgumentException.class, () -> FeedKey.create("  ", Timeframe.ONE_MIN));
  }

  @Test
  public void create_sameSymbolDifferentCase_isEqual() {
    assertThat(FeedKey.create("ethusd", Timeframe.ONE_HOUR))
        .isEqualTo(FeedKey.create("ETHUSD", Timeframe.ONE_HOUR));
  }

  @Test
  public void create_differentTimeframe_isNotEqual() {
    assertThat(FeedKey.create("BTCUSD", Timeframe.ONE_MIN))
        .isNotEqualTo(FeedKey.create("BTCUSD", Timeframe.FIVE_MIN));
  }

  @Test
  public void parse_validKey_returnsKey() {
    // Act
    FeedKey key = FeedKey.parse("BTCUSD:5m");

    // Assert
    assertThat(key).isEqualTo(FeedKey.create("BTCUSD", Timeframe.FIVE_MIN));
  }

  @Test
  public void parse_missingTimeframe_throws() {
    assertThrows(IllegalArgumentException.class, () -> FeedKey.parse("BTCUSD"));
  }

  @Test
  public void parse_unknownTimeframe_throws() {
    assertThrows(IllegalArgumentException.class, () -> FeedKey.parse("BTCUSD:7m"));
  }

  @Test
  public void toString_rendersParseableKey() {
    // Arrange
    FeedKey key = FeedKey.create("solusd", Timeframe.ONE_DAY);

    // Act & Assert
    assertThat(key.toString()).isEqualTo("SOLUSD:1d");
    assertThat(FeedKey.parse(key.toString())).isEqualTo(key);
  }
}
