package com.verlumen.candlestream.ingestion;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.google.inject.assistedinject.Assisted;
import com.verlumen.candlestream.marketdata.Bar;
import com.verlumen.candlestream.marketdata.BarParseException;
import com.verlumen.candlestream.marketdata.BarParser;
import com.verlumen.candlestream.marketdata.FeedKey;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;

/**
 * Keeps one {@link FeedTransport} connection open for a key, reconnecting with backoff.
 *
 * <p>Every connect attempt gets a new generation number. Callbacks carrying an older generation
 * belong to a connection that was already given up on and are ignored, so a late open or close from
 * an abandoned socket can never revive or kill the current one.
 *
 * <p>Thread-safety: state transitions are guarded by this object's monitor. Bars are handed to the
 * sink without holding it.
 */
final class UpstreamFeedImpl implements UpstreamFeed {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final FeedKey key;
  private final BarSink sink;
  private final FeedTransport transport;
  private final BarParser parser;
  private final ScheduledExecutorService scheduler;
  private final ReconnectPolicy reconnectPolicy;
  private final Ticker ticker;
  private final Random random;

  private volatile State state = State.IDLE;
  private volatile int reconnectAttempt;
  private volatile Throwable lastError;
  private volatile long generation;
  private volatile long lastMessageNanos;

  // Guarded by this.
  private long liveSinceNanos;
  private FeedSession session;
  private ScheduledFuture<?> pendingRetry;
  private ScheduledFuture<?> healthCheck;

  @Inject
  UpstreamFeedImpl(
      FeedTransport transport,
      BarParser parser,
      ScheduledExecutorService scheduler,
      ReconnectPolicy reconnectPolicy,
      Ticker ticker,
      Random random,
      @Assisted FeedKey key,
      @Assisted BarSink sink) {
    this.transport = transport;
    this.parser = parser;
    this.scheduler = scheduler;
    this.reconnectPolicy = reconnectPolicy;
    this.ticker = ticker;
    this.random = random;
    this.key = key;
    this.sink = sink;
  }

  @Override
  public FeedKey key() {
    return key;
  }

  @Override
  public State state() {
    return state;
  }

  @Override
  public int reconnectAttempt() {
    return reconnectAttempt;
  }

  @Override
  public Optional<Throwable> lastError() {
    return Optional.ofNullable(lastError);
  }

  @Override
  public synchronized void start() {
    if (state != State.IDLE) {
      logger.atWarning().log("Upstream feed for %s already started, state is %s", key, state);
      return;
    }
    logger.atInfo().log("Starting upstream feed for %s", key);
    connect();
  }

  @Override
  public synchronized void stop() {
    if (state == State.STOPPED) {
      return;
    }
    logger.atInfo().log("Stopping upstream feed for %s (was %s)", key, state);
    state = State.STOPPED;
    generation++;
    cancelTimers();
    closeSession();
  }

  // Guarded by this.
  private void connect() {
    long attempt = ++generation;
    state = State.CONNECTING;
    logger.atInfo().log("Connecting upstream feed for %s, attempt %d", key, reconnectAttempt + 1);

    CompletableFuture<FeedSession> open;
    try {
      open = transport.open(key, new SessionListener(attempt));
    } catch (RuntimeException e) {
      onFailure(attempt, e);
      return;
    }
    open.whenComplete(
        (openedSession, error) -> {
          if (error != null) {
            onFailure(attempt, error);
          } else {
            onOpened(attempt, openedSession);
          }
        });
  }

  private synchronized void onOpened(long attempt, FeedSession openedSession) {
    if (attempt != generation || state == State.STOPPED) {
      logger.atFine().log("Closing connection for %s that opened after it was abandoned", key);
      openedSession.close();
      return;
    }
    session = openedSession;
    state = State.LIVE;
    liveSinceNanos = ticker.read();
    lastMessageNanos = liveSinceNanos;
    scheduleHealthCheck(attempt);
    logger.atInfo().log("Upstream feed for %s is live", key);
  }

  private synchronized void onFailure(long attempt, Throwable error) {
    if (attempt != generation || state == State.STOPPED) {
      return;
    }
    Throwable cause = unwrap(error);
    lastError = cause;
    if (state == State.LIVE
        && ticker.read() - liveSinceNanos >= reconnectPolicy.resetAfter().toNanos()) {
      reconnectAttempt = 0;
    }
    cancelTimers();
    closeSession();

    reconnectAttempt++;
    Duration delay = reconnectPolicy.delayFor(reconnectAttempt, random.nextDouble());
    long retryGeneration = ++generation;
    state = State.BACKOFF;
    logger.atWarning().withCause(cause).log(
        "Upstream feed for %s failed, reconnecting in %d ms (attempt %d)",
        key, delay.toMillis(), reconnectAttempt);
    try {
      pendingRetry =
          scheduler.schedule(() -> retry(retryGeneration), delay.toMillis(), MILLISECONDS);
    } catch (RejectedExecutionException e) {
      logger.atSevere().withCause(e).log("Scheduler rejected reconnect for %s, stopping feed", key);
      state = State.STOPPED;
    }
  }

  private synchronized void retry(long retryGeneration) {
    if (retryGeneration != generation || state != State.BACKOFF) {
      return;
    }
    pendingRetry = null;
    connect();
  }

  // Guarded by this.
  private void scheduleHealthCheck(long attempt) {
    Duration staleAfter = reconnectPolicy.staleAfter();
    if (staleAfter.isZero()) {
      return;
    }
    long period = Math.max(1, staleAfter.toMillis() / 2);
    try {
      healthCheck =
          scheduler.scheduleAtFixedRate(() -> checkHealth(attempt), period, period, MILLISECONDS);
    } catch (RejectedExecutionException e) {
      logger.atWarning().withCause(e).log("Unable to schedule health check for %s", key);
    }
  }

  private synchronized void checkHealth(long attempt) {
    if (attempt != generation || state != State.LIVE) {
      return;
    }
    long silentNanos = ticker.read() - lastMessageNanos;
    if (silentNanos >= reconnectPolicy.staleAfter().toNanos()) {
      onFailure(
          attempt,
          new IOException(
              String.format(
                  "No upstream message for %s in %d ms", key, Duration.ofNanos(silentNanos).toMillis())));
    }
  }

  // Guarded by this.
  private void cancelTimers() {
    if (pendingRetry != null) {
      pendingRetry.cancel(false);
      pendingRetry = null;
    }
    if (healthCheck != null) {
      healthCheck.cancel(false);
      healthCheck = null;
    }
  }

  // Guarded by this.
  private void closeSession() {
    if (session == null) {
      return;
    }
    try {
      session.close();
    } catch (RuntimeException e) {
      logger.atWarning().withCause(e).log("Error closing upstream connection for %s", key);
    }
    session = null;
  }

  private void handleMessage(long attempt, String rawMessage) {
    if (attempt != generation) {
      return;
    }
    lastMessageNanos = ticker.read();

    ImmutableList<Bar> bars;
    try {
      bars = parser.parse(key, rawMessage);
    } catch (BarParseException e) {
      logger.atWarning().withCause(e).log("Dropping unparseable message for %s", key);
      return;
    }

    for (Bar bar : bars) {
      // The connection may have been abandoned while parsing or delivering.
      if (attempt != generation) {
        logger.atFine().log("Dropping bars for %s from an abandoned connection", key);
        return;
      }
      try {
        sink.onBar(key, bar);
      } catch (RuntimeException e) {
        logger.atSevere().withCause(e).log("Bar sink for %s rejected %s", key, bar);
      }
    }
  }

  private static Throwable unwrap(Throwable error) {
    if (error instanceof CompletionException && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }

  private final class SessionListener implements FeedTransport.Listener {
    private final long attempt;

    SessionListener(long attempt) {
      this.attempt = attempt;
    }

    @Override
    public void onMessage(String rawMessage) {
      handleMessage(attempt, rawMessage);
    }

    @Override
    public void onClosed(Throwable cause) {
      onFailure(attempt, cause);
    }
  }
}
