package com.verlumen.candlestream.relay;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.testing.fieldbinder.Bind;
import com.google.inject.testing.fieldbinder.BoundFieldModule;
import com.verlumen.candlestream.execution.RunMode;
import com.verlumen.candlestream.hub.FanOutHub;
import com.verlumen.candlestream.hub.HubStatus;
import com.verlumen.candlestream.hub.OverflowPolicy;
import com.verlumen.candlestream.hub.Subscription;
import com.verlumen.candlestream.marketdata.FeedKey;
import com.verlumen.candlestream.time.Timeframe;
import java.time.Duration;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

@RunWith(JUnit4.class)
public class AppTest {
  @Rule public MockitoRule mocks = MockitoJUnit.rule();

  private static final FeedKey BTC = FeedKey.create("BTCUSD", Timeframe.ONE_MIN);
  private static final FeedKey ETH = FeedKey.create("ETHUSD", Timeframe.ONE_MIN);

  @Mock @Bind private FanOutHub mockHub;
  @Mock @Bind private EventRelay.Factory mockRelayFactory;
  @Mock private EventRelay mockRelay;
  @Mock private Subscription mockSubscription;

  @Bind private RunMode runMode = RunMode.DRY;

  @Inject private App app;

  @Before
  public void setUp() {
    when(mockHub.subscribe(any(FeedKey.class))).thenReturn(mockSubscription);
    when(mockHub.status()).thenReturn(HubStatus.create(ImmutableMap.of()));
    when(mockRelayFactory.create(any(Subscription.class), anyString())).thenReturn(mockRelay);
    Guice.createInjector(BoundFieldModule.of(this)).injectMembers(this);
  }

  @Test
  public void run_subscribesEachKeyAndRelays() throws Exception {
    // Act
    app.run(ImmutableList.of(BTC, ETH), 2, Duration.ZERO);

    // Assert
    verify(mockHub, times(2)).subscribe(BTC);
    verify(mockHub, times(2)).subscribe(ETH);
    verify(mockRelayFactory).create(mockSubscription, "BTCUSD:1m#1");
    verify(mockRelayFactory).create(mockSubscription, "ETHUSD:1m#2");
    verify(mockRelay, times(4)).run();
  }

  @Test
  public void run_finishes_cancelsSubscriptionsAndClosesHub() throws Exception {
    // Act
    app.run(ImmutableList.of(BTC), 1, Duration.ofSeconds(1));

    // Assert
    verify(mockSubscription).cancel();
    verify(mockHub).close();
  }

  @Test
  public void parseConfig_defaults() throws Exception {
    // Act
    RelayConfig config = App.parseConfig(new String[] {"--symbols", "btcusd", "ETHUSD"});

    // Assert
    assertThat(config.keys()).containsExactly(BTC, ETH).inOrder();
    assertThat(config.subscribersPerKey()).isEqualTo(1);
    assertThat(config.runMode()).isEqualTo(RunMode.DRY);
    assertThat(config.channelSettings().capacity()).isEqualTo(100);
    assertThat(config.channelSettings().idleWindow()).isEqualTo(Duration.ofSeconds(30));
    assertThat(config.channelSettings().overflowPolicy()).isEqualTo(OverflowPolicy.DROP_NEWEST);
    assertThat(config.reconnectPolicy().floor()).isEqualTo(Duration.ofSeconds(1));
    assertThat(config.reconnectPolicy().ceiling()).isEqualTo(Duration.ofSeconds(30));
    assertThat(config.reconnectPolicy().jitter()).isEqualTo(0.2);
    assertThat(config.reconnectPolicy().resetAfter()).isEqualTo(Duration.ofSeconds(60));
    assertThat(config.reconnectPolicy().staleAfter()).isEqualTo(Duration.ofSeconds(60));
    assertThat(config.simulatedTickInterval()).isEqualTo(Duration.ofSeconds(1));
    assertThat(config.runDuration()).isEqualTo(Duration.ZERO);
  }

  @Test
  public void parseConfig_overrides() throws Exception {
    // Act
    RelayConfig config =
        App.parseConfig(
            new String[] {
              "--symbols", "SOLUSD",
              "--timeframe", "4h",
              "--subscribersPerKey", "3",
              "--runMode", "wet",
              "--channelCapacity", "8",
              "--heartbeatSeconds", "5",
              "--overflowPolicy", "drop_oldest",
              "--backoffFloorMillis", "250",
              "--backoffCeilingMillis", "4000",
              "--backoffJitter", "0",
              "--backoffResetSeconds", "10",
              "--staleSeconds", "0",
              "--simulatedTickMillis", "100",
              "--durationSeconds", "15"
            });

    // Assert
    assertThat(config.keys()).containsExactly(FeedKey.create("SOLUSD", Timeframe.FOUR_HOUR));
    assertThat(config.subscribersPerKey()).isEqualTo(3);
    assertThat(config.runMode()).isEqualTo(RunMode.WET);
    assertThat(config.channelSettings().capacity()).isEqualTo(8);
    assertThat(config.channelSettings().idleWindow()).isEqualTo(Duration.ofSeconds(5));
    assertThat(config.channelSettings().overflowPolicy()).isEqualTo(OverflowPolicy.DROP_OLDEST);
    assertThat(config.reconnectPolicy().floor()).isEqualTo(Duration.ofMillis(250));
    assertThat(config.reconnectPolicy().ceiling()).isEqualTo(Duration.ofMillis(4000));
    assertThat(config.reconnectPolicy().jitter()).isEqualTo(0.0);
    assertThat(config.reconnectPolicy().staleAfter()).isEqualTo(Duration.ZERO);
    assertThat(config.simulatedTickInterval()).isEqualTo(Duration.ofMillis(100));
    assertThat(config.runDuration()).isEqualTo(Duration.ofSeconds(15));
  }

  @Test
  public void parseConfig_missingSymbols_throws() {
    assertThrows(ArgumentParserException.class, () -> App.parseConfig(new String[] {}));
  }

  @Test
  public void parseConfig_unknownTimeframe_throws() {
    assertThrows(
        ArgumentParserException.class,
        () -> App.parseConfig(new String[] {"--symbols", "BTCUSD", "--timeframe", "2m"}));
  }

  @Test
  public void parseConfig_zeroCapacity_throws() {
    assertThrows(
        IllegalArgumentException.class,
        () -> App.parseConfig(new String[] {"--symbols", "BTCUSD", "--channelCapacity", "0"}));
  }
}
