package com.verlumen.candlestream.relay;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.verlumen.candlestream.execution.RunMode;
import com.verlumen.candlestream.hub.ChannelSettings;
import com.verlumen.candlestream.hub.FanOutHub;
import com.verlumen.candlestream.hub.OverflowPolicy;
import com.verlumen.candlestream.hub.Subscription;
import com.verlumen.candlestream.ingestion.ReconnectPolicy;
import com.verlumen.candlestream.marketdata.FeedKey;
import com.verlumen.candlestream.sse.StreamEventEncoder;
import com.verlumen.candlestream.time.Timeframe;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;

/**
 * Subscribes to live candles for the requested symbols and writes them to standard output as
 * Server-Sent-Events frames. Each symbol can be subscribed several times to exercise the fan-out.
 */
final class App {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final long RELAY_SHUTDOWN_SECONDS = 5;

  private final FanOutHub hub;
  private final StreamEventEncoder encoder;
  private final EventRelay.Factory relayFactory;
  private final RunMode runMode;
  private final List<Subscription> subscriptions = new ArrayList<>();

  @Inject
  App(
      FanOutHub hub,
      StreamEventEncoder encoder,
      EventRelay.Factory relayFactory,
      RunMode runMode) {
    logger.atInfo().log("Creating App instance with runMode: %s", runMode);
    this.hub = hub;
    this.encoder = encoder;
    this.relayFactory = relayFactory;
    this.runMode = runMode;
  }

  void run(ImmutableList<FeedKey> keys, int subscribersPerKey, Duration runDuration)
      throws InterruptedException {
    logger.atInfo().log(
        "Relaying %d keys with %d subscribers each in %s mode", keys.size(), subscribersPerKey, runMode);
    ExecutorService relays =
        Executors.newCachedThreadPool(
            new ThreadFactoryBuilder().setNameFormat("candlestream-relay-%d").build());
    try {
      for (FeedKey key : keys) {
        for (int i = 1; i <= subscribersPerKey; i++) {
          Subscription subscription = hub.subscribe(key);
          synchronized (subscriptions) {
            subscriptions.add(subscription);
          }
          relays.execute(relayFactory.create(subscription, key + "#" + i));
        }
      }
      logger.atInfo().log("Hub status: %s", encoder.statusJson(hub.status()));

      relays.shutdown();
      if (runDuration.isZero()) {
        while (!relays.awaitTermination(1, TimeUnit.MINUTES)) {
          logger.atInfo().log("Hub status: %s", encoder.statusJson(hub.status()));
        }
      } else if (!relays.awaitTermination(runDuration.toMillis(), TimeUnit.MILLISECONDS)) {
        logger.atInfo().log("Run duration of %s elapsed", runDuration);
      }
    } finally {
      shutdown();
      relays.shutdownNow();
      relays.awaitTermination(RELAY_SHUTDOWN_SECONDS, TimeUnit.SECONDS);
    }
  }

  /** Cancels every subscription and closes the hub. Safe to call more than once. */
  void shutdown() {
    logger.atInfo().log("Final hub status: %s", encoder.statusJson(hub.status()));
    synchronized (subscriptions) {
      for (Subscription subscription : subscriptions) {
        subscription.cancel();
      }
      subscriptions.clear();
    }
    hub.close();
  }

  public static void main(String[] args) throws Exception {
    logger.atInfo().log("Candle relay starting up with %d arguments", args.length);
    try {
      RelayConfig config = parseConfig(args);
      App app = Guice.createInjector(RelayModule.create(config)).getInstance(App.class);
      Runtime.getRuntime()
          .addShutdownHook(
              new Thread(
                  () -> {
                    logger.atInfo().log("Shutdown hook triggered");
                    app.shutdown();
                  }));
      logger.atInfo().log("Guice initialization complete, running application");
      app.run(config.keys(), config.subscribersPerKey(), config.runDuration());
    } catch (Exception e) {
      logger.atSevere().withCause(e).log("Fatal error in candle relay");
      throw e;
    }
  }

  static RelayConfig parseConfig(String[] args) throws ArgumentParserException {
    Namespace namespace = createParser().parseArgs(args);
    Timeframe timeframe = Timeframe.fromLabel(namespace.getString("timeframe"));
    ImmutableList.Builder<FeedKey> keys = ImmutableList.builder();
    for (String symbol : namespace.<String>getList("symbols")) {
      keys.add(FeedKey.create(symbol, timeframe));
    }
    ChannelSettings channelSettings =
        ChannelSettings.create(
            namespace.getInt("channelCapacity"),
            Duration.ofSeconds(namespace.getLong("heartbeatSeconds")),
            OverflowPolicy.valueOf(
                namespace.getString("overflowPolicy").toUpperCase(Locale.ROOT)));
    ReconnectPolicy reconnectPolicy =
        ReconnectPolicy.create(
            Duration.ofMillis(namespace.getLong("backoffFloorMillis")),
            Duration.ofMillis(namespace.getLong("backoffCeilingMillis")),
            namespace.getDouble("backoffJitter"),
            Duration.ofSeconds(namespace.getLong("backoffResetSeconds")),
            Duration.ofSeconds(namespace.getLong("staleSeconds")));
    return new RelayConfig(
        keys.build(),
        namespace.getInt("subscribersPerKey"),
        RunMode.fromString(namespace.getString("runMode")),
        channelSettings,
        reconnectPolicy,
        Duration.ofMillis(namespace.getLong("simulatedTickMillis")),
        Duration.ofSeconds(namespace.getLong("durationSeconds")));
  }

  private static ArgumentParser createParser() {
    ArgumentParser parser =
        ArgumentParsers.newFor("CandleStreamRelay")
            .build()
            .defaultHelp(true)
            .description("Relays live candles from one shared upstream feed per symbol as SSE");

    // Feed selection
    parser.addArgument("--symbols")
        .nargs("+")
        .required(true)
        .help("Symbols to subscribe to, e.g. BTCUSD ETHUSD");

    parser.addArgument("--timeframe")
        .choices("1m", "5m", "15m", "1h", "4h", "1d")
        .setDefault("1m")
        .help("Candle timeframe");

    parser.addArgument("--subscribersPerKey")
        .type(Integer.class)
        .setDefault(1)
        .help("Number of independent subscribers per symbol");

    // Run mode configuration
    parser.addArgument("--runMode")
        .choices("wet", "dry")
        .setDefault("dry")
        .help("Run mode: wet connects to Bitfinex, dry simulates candles");

    // Subscriber channels
    parser.addArgument("--channelCapacity")
        .type(Integer.class)
        .setDefault(ChannelSettings.DEFAULT_CAPACITY)
        .help("Events buffered per subscriber");

    parser.addArgument("--heartbeatSeconds")
        .type(Long.class)
        .setDefault(ChannelSettings.DEFAULT_IDLE_WINDOW.getSeconds())
        .help("Idle seconds before a subscriber receives a heartbeat");

    parser.addArgument("--overflowPolicy")
        .choices("drop_newest", "drop_oldest")
        .setDefault("drop_newest")
        .help("What a full subscriber buffer drops");

    // Reconnection
    parser.addArgument("--backoffFloorMillis")
        .type(Long.class)
        .setDefault(1_000L)
        .help("First reconnect delay in milliseconds");

    parser.addArgument("--backoffCeilingMillis")
        .type(Long.class)
        .setDefault(30_000L)
        .help("Maximum reconnect delay in milliseconds");

    parser.addArgument("--backoffJitter")
        .type(Double.class)
        .setDefault(0.2)
        .help("Fraction of each reconnect delay to randomize");

    parser.addArgument("--backoffResetSeconds")
        .type(Long.class)
        .setDefault(60L)
        .help("Seconds a connection must stay live before the backoff resets");

    parser.addArgument("--staleSeconds")
        .type(Long.class)
        .setDefault(60L)
        .help("Seconds without upstream messages before reconnecting (0 disables)");

    // Dry run
    parser.addArgument("--simulatedTickMillis")
        .type(Long.class)
        .setDefault(1_000L)
        .help("Interval between simulated candle updates in dry mode");

    parser.addArgument("--durationSeconds")
        .type(Long.class)
        .setDefault(0L)
        .help("Seconds to run before exiting (0 runs until interrupted)");

    return parser;
  }
}
