package com.crosswatch.exchange;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Local clock corrected by the offset to Binance server time.
 * Signed requests are rejected (-1021) when the timestamp drifts out of recvWindow.
 */
public final class BinanceServerTime {

    private final LongSupplier localMillis;
    private final AtomicLong offsetMillis = new AtomicLong();

    public BinanceServerTime() {
        this(System::currentTimeMillis);
    }

    public BinanceServerTime(LongSupplier localMillis) {
        this.localMillis = localMillis;
    }

    /** Records the offset from a server time sample taken around {@code [sentAt, receivedAt]}. */
    public long update(long serverMillis, long sentAt, long receivedAt) {
        long midpoint = sentAt + (receivedAt - sentAt) / 2;
        long offset = serverMillis - midpoint;
        offsetMillis.set(offset);
        return offset;
    }

    public long now() {
        return localMillis.getAsLong() + offsetMillis.get();
    }

    public long localNow() {
        return localMillis.getAsLong();
    }

    public long offset() {
        return offsetMillis.get();
    }
}
