package com.crosswatch.exchange;

/** One Binance kline row; times are epoch millis. */
public record Kline(
        long openTime,
        double open,
        double high,
        double low,
        double close,
        double volume,
        long closeTime
) {
}
