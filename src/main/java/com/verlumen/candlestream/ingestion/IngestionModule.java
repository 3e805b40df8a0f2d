package com.verlumen.candlestream.ingestion;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;
import com.google.inject.Provider;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.assistedinject.FactoryModuleBuilder;
import com.verlumen.candlestream.execution.RunMode;
import com.verlumen.candlestream.marketdata.BarParser;
import com.verlumen.candlestream.marketdata.BitfinexBarParser;
import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Binds upstream feeds and the transport behind them.
 *
 * <p>Expects a {@link java.util.concurrent.ScheduledExecutorService}, {@link
 * com.google.common.base.Ticker}, {@link java.time.Clock} and {@link java.util.Random} to be bound
 * elsewhere.
 */
@AutoValue
public abstract class IngestionModule extends AbstractModule {
  public static IngestionModule create(
      RunMode runMode, ReconnectPolicy reconnectPolicy, Duration simulatedTickInterval) {
    return new AutoValue_IngestionModule(runMode, reconnectPolicy, simulatedTickInterval);
  }

  abstract RunMode runMode();

  abstract ReconnectPolicy reconnectPolicy();

  abstract Duration simulatedTickInterval();

  @Override
  protected void configure() {
    bind(BarParser.class).to(BitfinexBarParser.class);
    bind(ReconnectPolicy.class).toInstance(reconnectPolicy());
    install(
        new FactoryModuleBuilder()
            .implement(UpstreamFeed.class, UpstreamFeedImpl.class)
            .build(UpstreamFeed.Factory.class));
    install(new FactoryModuleBuilder().build(SimulatedCandleTransport.Factory.class));
  }

  @Provides
  @Singleton
  HttpClient provideHttpClient() {
    return HttpClient.newHttpClient();
  }

  @Provides
  @Singleton
  FeedTransport provideFeedTransport(
      Provider<BitfinexCandleTransport> bitfinexCandleTransport,
      SimulatedCandleTransport.Factory simulatedCandleTransportFactory) {
    switch (runMode()) {
      case DRY:
        return simulatedCandleTransportFactory.create(simulatedTickInterval());
      case WET:
        return bitfinexCandleTransport.get();
      default:
        throw new UnsupportedOperationException("Unsupported RunMode: " + runMode());
    }
  }
}
