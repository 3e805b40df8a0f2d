package com.verlumen.candlestream.ingestion;

import com.google.common.flogger.FluentLogger;
import com.google.gson.JsonObject;
import com.google.inject.Inject;
import com.verlumen.candlestream.marketdata.FeedKey;
import com.verlumen.candlestream.time.Timeframe;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/** Opens one Bitfinex public WebSocket per key and subscribes it to the candle channel. */
final class BitfinexCandleTransport implements FeedTransport {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  static final String WEBSOCKET_URL = "wss://api-pub.bitfinex.com/ws/2";

  private final HttpClient httpClient;

  @Inject
  BitfinexCandleTransport(HttpClient httpClient) {
    this.httpClient = httpClient;
  }

  @Override
  public CompletableFuture<FeedSession> open(FeedKey key, Listener listener) {
    logger.atInfo().log("Opening Bitfinex WebSocket for %s", key);
    return httpClient
        .newWebSocketBuilder()
        .buildAsync(URI.create(WEBSOCKET_URL), new WebSocketListener(key, listener))
        .thenApply(
            webSocket -> {
              String message = subscribeMessage(key);
              logger.atFine().log("Sending subscription message: %s", message);
              webSocket.sendText(message, true);
              return new WebSocketSession(key, webSocket);
            });
  }

  static String subscribeMessage(FeedKey key) {
    JsonObject subscribe = new JsonObject();
    subscribe.addProperty("event", "subscribe");
    subscribe.addProperty("channel", "candles");
    subscribe.addProperty("key", channelKey(key));
    return subscribe.toString();
  }

  static String channelKey(FeedKey key) {
    return "trade:" + apiTimeframe(key.timeframe()) + ":t" + key.symbol();
  }

  private static String apiTimeframe(Timeframe timeframe) {
    return timeframe == Timeframe.ONE_DAY ? "1D" : timeframe.getLabel();
  }

  private static final class WebSocketSession implements FeedSession {
    private final FeedKey key;
    private final WebSocket webSocket;

    WebSocketSession(FeedKey key, WebSocket webSocket) {
      this.key = key;
      this.webSocket = webSocket;
    }

    @Override
    public void close() {
      logger.atInfo().log("Closing Bitfinex WebSocket for %s", key);
      webSocket
          .sendClose(WebSocket.NORMAL_CLOSURE, "Unsubscribed")
          .exceptionally(
              e -> {
                logger.atFine().withCause(e).log("Close handshake failed for %s, aborting", key);
                webSocket.abort();
                return null;
              });
    }
  }

  private static final class WebSocketListener implements WebSocket.Listener {
    private final StringBuilder messageBuffer = new StringBuilder();
    private final FeedKey key;
    private final Listener listener;

    WebSocketListener(FeedKey key, Listener listener) {
      this.key = key;
      this.listener = listener;
    }

    @Override
    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
      messageBuffer.append(data);
      try {
        if (last) {
          String message = messageBuffer.toString();
          messageBuffer.setLength(0);
          logger.atFiner().log("Message for %s: %s", key, message);
          listener.onMessage(message);
        }
      } finally {
        webSocket.request(1);
      }
      return null;
    }

    @Override
    public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
      logger.atInfo().log("Bitfinex WebSocket for %s closed: %d %s", key, statusCode, reason);
      listener.onClosed(
          new IOException(String.format("WebSocket closed: %d %s", statusCode, reason)));
      return null;
    }

    @Override
    public void onError(WebSocket webSocket, Throwable error) {
      logger.atWarning().withCause(error).log("Bitfinex WebSocket error for %s", key);
      listener.onClosed(error);
    }
  }
}
