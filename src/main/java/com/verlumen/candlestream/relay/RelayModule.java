package com.verlumen.candlestream.relay;

import com.google.auto.value.AutoValue;
import com.google.common.base.Ticker;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.gson.Gson;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.assistedinject.FactoryModuleBuilder;
import com.verlumen.candlestream.execution.ExecutionModule;
import com.verlumen.candlestream.hub.HubModule;
import com.verlumen.candlestream.ingestion.IngestionModule;
import java.io.PrintStream;
import java.time.Clock;
import java.util.Random;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@AutoValue
abstract class RelayModule extends AbstractModule {
  private static final int SCHEDULER_THREADS = 2;

  static RelayModule create(RelayConfig config) {
    return new AutoValue_RelayModule(config);
  }

  abstract RelayConfig config();

  @Override
  protected void configure() {
    install(ExecutionModule.create(config().runMode()));
    install(
        IngestionModule.create(
            config().runMode(), config().reconnectPolicy(), config().simulatedTickInterval()));
    install(HubModule.create(config().channelSettings()));
    install(new FactoryModuleBuilder().build(EventRelay.Factory.class));

    bind(Clock.class).toInstance(Clock.systemUTC());
    bind(Ticker.class).toInstance(Ticker.systemTicker());
    bind(Random.class).toInstance(new Random());
  }

  @Provides
  @Singleton
  ScheduledExecutorService provideScheduledExecutorService() {
    return Executors.newScheduledThreadPool(
        SCHEDULER_THREADS,
        new ThreadFactoryBuilder().setNameFormat("candlestream-scheduler-%d").setDaemon(true).build());
  }

  @Provides
  @Singleton
  Gson provideGson() {
    return new Gson();
  }

  @Provides
  PrintStream provideOutput() {
    return System.out;
  }
}
