package com.verlumen.candlestream.marketdata;

/** Thrown when an upstream message is not a well-formed candle message. */
public final class BarParseException extends Exception {
  public BarParseException(String message) {
    super(message);
  }

  public BarParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
