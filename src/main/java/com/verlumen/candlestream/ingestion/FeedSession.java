package com.verlumen.candlestream.ingestion;

/** One open connection to an upstream venue. */
public interface FeedSession {
  /** Releases the connection. Does not wait for the remote side to acknowledge. */
  void close();
}
