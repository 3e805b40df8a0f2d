package com.verlumen.candlestream.relay;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.google.inject.assistedinject.Assisted;
import com.verlumen.candlestream.hub.StreamEvent;
import com.verlumen.candlestream.hub.Subscription;
import com.verlumen.candlestream.sse.StreamEventEncoder;
import java.io.PrintStream;
import java.util.Optional;

/** Pulls one subscription's events and writes them out as SSE frames until it ends. */
final class EventRelay implements Runnable {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final StreamEventEncoder encoder;
  private final PrintStream out;
  private final Subscription subscription;
  private final String label;

  @Inject
  EventRelay(
      StreamEventEncoder encoder,
      PrintStream out,
      @Assisted Subscription subscription,
      @Assisted String label) {
    this.encoder = encoder;
    this.out = out;
    this.subscription = subscription;
    this.label = label;
  }

  @Override
  public void run() {
    logger.atInfo().log("Relaying %s as %s", subscription.key(), label);
    long relayed = 0;
    try {
      Optional<StreamEvent> event;
      while ((event = subscription.next()).isPresent()) {
        String frame = encoder.toSseFrame(event.get());
        synchronized (out) {
          // SSE comment line naming the source; clients skip it.
          out.print(": " + label + "\n" + frame);
          out.flush();
        }
        relayed++;
      }
    } catch (InterruptedException e) {
      logger.atFine().log("Relay %s interrupted", label);
      Thread.currentThread().interrupt();
    } finally {
      subscription.cancel();
    }
    logger.atInfo().log("Relay %s finished after %d events", label, relayed);
  }

  interface Factory {
    EventRelay create(Subscription subscription, String label);
  }
}
