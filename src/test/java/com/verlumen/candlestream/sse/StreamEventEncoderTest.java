package com.verlumen.candlestream.sse;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.verlumen.candlestream.hub.HubStatus;
import com.verlumen.candlestream.hub.KeyStatus;
import com.verlumen.candlestream.hub.StreamEvent;
import com.verlumen.candlestream.ingestion.UpstreamFeed;
import com.verlumen.candlestream.marketdata.Bar;
import com.verlumen.candlestream.marketdata.FeedKey;
import com.verlumen.candlestream.marketdata.TestBars;
import com.verlumen.candlestream.time.Timeframe;
import java.math.BigDecimal;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class StreamEventEncoderTest {
  private static final FeedKey BTC = FeedKey.create("BTCUSD", Timeframe.FIVE_MIN);
  private static final FeedKey ETH = FeedKey.create("ETHUSD", Timeframe.ONE_MIN);

  @Inject private StreamEventEncoder encoder;

  @Before
  public void setUp() {
    Guice.createInjector().injectMembers(this);
  }

  @Test
  public void toJson_bar_usesShortCandleKeys() {
    // Arrange
    Bar bar = TestBars.bar(BTC, 2);

    // Act
    JsonObject json = JsonParser.parseString(encoder.toJson(StreamEvent.ofBar(bar))).getAsJsonObject();

    // Assert
    assertThat(json.keySet())
        .containsExactly("type", "symbol", "timeframe", "t", "o", "h", "l", "c", "v");
    assertThat(json.get("type").getAsString()).isEqualTo("candle");
    assertThat(json.get("symbol").getAsString()).isEqualTo("BTCUSD");
    assertThat(json.get("timeframe").getAsString()).isEqualTo("5m");
    assertThat(json.get("t").getAsLong()).isEqualTo(bar.openTime().toEpochMilli());
    assertThat(json.get("o").getAsBigDecimal()).isEquivalentAccordingToCompareTo(bar.open());
    assertThat(json.get("h").getAsBigDecimal()).isEquivalentAccordingToCompareTo(bar.high());
    assertThat(json.get("l").getAsBigDecimal()).isEquivalentAccordingToCompareTo(bar.low());
    assertThat(json.get("c").getAsBigDecimal()).isEquivalentAccordingToCompareTo(bar.close());
    assertThat(json.get("v").getAsBigDecimal()).isEquivalentAccordingToCompareTo(new BigDecimal("1.5"));
  }

  @Test
  public void toJson_bar_writesPricesAsNumbers() {
    // Act
    String json = encoder.toJson(StreamEvent.ofBar(TestBars.bar(BTC, 0)));

    // Assert
    assertThat(json).contains("\"o\":100.00");
    assertThat(json).contains("\"v\":1.5");
  }

  @Test
  public void toJson_heartbeat() {
    assertThat(encoder.toJson(StreamEvent.ofHeartbeat(1_704_067_230_000L)))
        .isEqualTo("{\"type\":\"heartbeat\",\"timestamp\":1704067230000}");
  }

  @Test
  public void toSseFrame_wrapsJsonInDataFrame() {
    assertThat(encoder.toSseFrame(StreamEvent.ofHeartbeat(5L)))
        .isEqualTo("data: {\"type\":\"heartbeat\",\"timestamp\":5}\n\n");
  }

  @Test
  public void statusJson_listsStreamsSortedByKey() {
    // Arrange
    HubStatus status =
        HubStatus.create(
            ImmutableMap.of(
                ETH, KeyStatus.create(1, UpstreamFeed.State.BACKOFF, 2, 0),
                BTC, KeyStatus.create(3, UpstreamFeed.State.LIVE, 0, 7)));

    // Act
    JsonObject json = JsonParser.parseString(encoder.statusJson(status)).getAsJsonObject();

    // Assert
    assertThat(json.get("active_streams").getAsInt()).isEqualTo(2);
    assertThat(json.get("total_subscribers").getAsInt()).isEqualTo(4);
    JsonArray streams = json.getAsJsonArray("streams");
    assertThat(streams.size()).isEqualTo(2);

    JsonObject btc = streams.get(0).getAsJsonObject();
    assertThat(btc.get("key").getAsString()).isEqualTo("BTCUSD:5m");
    assertThat(btc.get("subscribers").getAsInt()).isEqualTo(3);
    assertThat(btc.get("connected").getAsBoolean()).isTrue();
    assertThat(btc.get("state").getAsString()).isEqualTo("LIVE");
    assertThat(btc.get("dropped_events").getAsLong()).isEqualTo(7);

    JsonObject eth = streams.get(1).getAsJsonObject();
    assertThat(eth.get("key").getAsString()).isEqualTo("ETHUSD:1m");
    assertThat(eth.get("connected").getAsBoolean()).isFalse();
    assertThat(eth.get("reconnect_attempt").getAsInt()).isEqualTo(2);
  }

  @Test
  public void statusJson_emptyHub() {
    assertThat(encoder.statusJson(HubStatus.create(ImmutableMap.of())))
        .isEqualTo("{\"active_streams\":0,\"total_subscribers\":0,\"streams\":[]}");
  }
}
