package com.verlumen.candlestream.marketdata;

import com.google.common.collect.ImmutableList;

/**
 * Turns one raw upstream message into bars.
 *
 * <p>Control and keep-alive messages yield an empty list. A message that cannot be understood is
 * reported with {@link BarParseException}; callers drop it and keep the connection.
 */
public interface BarParser {
  ImmutableList<Bar> parse(FeedKey key, String rawMessage) throws BarParseException;
}
