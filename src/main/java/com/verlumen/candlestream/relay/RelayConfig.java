package com.verlumen.candlestream.relay;

import com.google.common.collect.ImmutableList;
import com.verlumen.candlestream.execution.RunMode;
import com.verlumen.candlestream.hub.ChannelSettings;
import com.verlumen.candlestream.ingestion.ReconnectPolicy;
import com.verlumen.candlestream.marketdata.FeedKey;
import java.time.Duration;

/** Everything {@link App} reads from its command line. A zero run duration means until stopped. */
record RelayConfig(
    ImmutableList<FeedKey> keys,
    int subscribersPerKey,
    RunMode runMode,
    ChannelSettings channelSettings,
    ReconnectPolicy reconnectPolicy,
    Duration simulatedTickInterval,
    Duration runDuration) {}
