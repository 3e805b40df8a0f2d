package com.verlumen.candlestream.relay;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.verlumen.candlestream.execution.RunMode;
import com.verlumen.candlestream.hub.ChannelSettings;
import com.verlumen.candlestream.hub.FanOutHub;
import com.verlumen.candlestream.hub.StreamEvent;
import com.verlumen.candlestream.hub.Subscription;
import com.verlumen.candlestream.ingestion.ReconnectPolicy;
import com.verlumen.candlestream.ingestion.UpstreamFeed;
import com.verlumen.candlestream.marketdata.FeedKey;
import com.verlumen.candlestream.time.Timeframe;
import java.time.Duration;
import java.util.Optional;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Wires the real dry-run stack and checks that simulated candles reach a subscriber. */
@RunWith(JUnit4.class)
public class RelayModuleTest {
  private static final FeedKey BTC = FeedKey.create("BTCUSD", Timeframe.ONE_MIN);

  private Injector injector;
  private FanOutHub hub;

  @Before
  public void setUp() {
    RelayConfig config =
        new RelayConfig(
            ImmutableList.of(BTC),
            1,
            RunMode.DRY,
            ChannelSettings.defaults(),
            ReconnectPolicy.defaults(),
            Duration.ofMillis(20),
            Duration.ZERO);
    injector = Guice.createInjector(RelayModule.create(config));
    hub = injector.getInstance(FanOutHub.class);
  }

  @After
  public void tearDown() {
    hub.close();
  }

  @Test
  public void bindsSingletonHub() {
    assertThat(injector.getInstance(FanOutHub.class)).isSameInstanceAs(hub);
    assertThat(injector.getInstance(App.class)).isNotNull();
  }

  @Test
  public void dryRun_deliversSimulatedBars() throws Exception {
    // Act
    try (Subscription subscription = hub.subscribe(BTC)) {
      Optional<StreamEvent> event = subscription.next();

      // Assert
      assertThat(event).isPresent();
      assertThat(event.get().getKind()).isEqualTo(StreamEvent.Kind.BAR);
      assertThat(event.get().bar().key()).isEqualTo(BTC);
      assertThat(hub.status().streams().get(BTC).connectionState())
          .isEqualTo(UpstreamFeed.State.LIVE);
    }
    assertThat(hub.status().streams()).isEmpty();
  }
}
