package com.verlumen.candlestream.ingestion;

import com.verlumen.candlestream.marketdata.Bar;
import com.verlumen.candlestream.marketdata.FeedKey;

/** Receives the bars produced by one {@link UpstreamFeed}. */
public interface BarSink {
  void onBar(FeedKey key, Bar bar);
}
