package com.crosswatch.infrastructure.market;

import com.crosswatch.application.error.PriceStreamClosedException;
import com.crosswatch.application.ports.PriceSourcePort;
import com.crosswatch.application.ports.PriceSubscription;
import com.crosswatch.domain.market.PriceSample;
import com.crosswatch.domain.market.Symbol;
import com.crosswatch.exchange.BinanceFuturesClient;
import com.crosswatch.exchange.Kline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Price stream built from polled klines.
 *
 * Each closed kline becomes one sample: close price, timestamped with the kline close time.
 * The last row of every response is the kline still forming and is never emitted; a row counts
 * as closed only once a newer row follows it. This keeps partial closes out of the stream no
 * matter how far the local clock drifts from the venue's.
 * A kline is emitted once; an unchanged response between polls produces nothing.
 * Poll errors are logged and retried on the next tick; the stream only ends on close().
 */
public class BinanceKlinePriceSource implements PriceSourcePort {

    private static final Logger log = LoggerFactory.getLogger(BinanceKlinePriceSource.class);

    /** Binance maximum per klines request. */
    static final int MAX_LIMIT = 1500;
    static final int POLL_LIMIT = 100;

    /** One klines endpoint: futures or spot. */
    @FunctionalInterface
    public interface KlineFeed {
        List<Kline> klines(String symbol, String interval, int limit) throws IOException;
    }

    private final KlineFeed feed;
    private final String interval;
    private final Duration pollInterval;

    public BinanceKlinePriceSource(BinanceFuturesClient client, String interval, Duration pollInterval) {
        this(client::klines, interval, pollInterval);
    }

    public BinanceKlinePriceSource(KlineFeed feed, String interval, Duration pollInterval) {
        this.feed = feed;
        this.interval = interval;
        this.pollInterval = pollInterval;
    }

    /** Spot market klines through the same client; used for monitor-only symbols. */
    public static BinanceKlinePriceSource spot(BinanceFuturesClient client, String interval, Duration pollInterval) {
        return new BinanceKlinePriceSource(client::spotKlines, interval, pollInterval);
    }

    @Override
    public List<PriceSample> history(Symbol symbol, int limit) throws IOException {
        if (limit <= 0) return List.of();
        List<Kline> klines = feed.klines(symbol.value(), interval, Math.min(MAX_LIMIT, limit + 1));
        List<PriceSample> closed = closedSamples(symbol, klines, Long.MIN_VALUE);
        return closed.size() <= limit ? closed : new ArrayList<>(closed.subList(closed.size() - limit, closed.size()));
    }

    @Override
    public PriceSubscription subscribe(Symbol symbol, Instant after) {
        log.info("Subscribing to {} {} klines (after={}, poll={} ms)", symbol, interval, after, pollInterval.toMillis());
        return new KlineSubscription(symbol, after == null ? null : after.toEpochMilli());
    }

    // every row but the last, newer than afterCloseTime
    private static List<PriceSample> closedSamples(Symbol symbol, List<Kline> klines, long afterCloseTime) {
        List<PriceSample> out = new ArrayList<>();
        for (int i = 0; i < klines.size() - 1; i++) {
            Kline k = klines.get(i);
            if (k.closeTime() <= afterCloseTime) continue;
            out.add(new PriceSample(symbol, Instant.ofEpochMilli(k.closeTime()), k.close()));
        }
        return out;
    }

    final class KlineSubscription implements PriceSubscription {

        private final Symbol symbol;
        private final Deque<PriceSample> pending = new ArrayDeque<>();
        private final CountDownLatch closed = new CountDownLatch(1);

        /** Close time of the newest kline already emitted; null until the first poll. */
        private Long lastCloseTime;
        private boolean firstPoll = true;

        KlineSubscription(Symbol symbol, Long afterMillis) {
            this.symbol = symbol;
            this.lastCloseTime = afterMillis;
        }

        @Override
        public PriceSample next() throws InterruptedException, PriceStreamClosedException {
            while (true) {
                if (closed.getCount() == 0) throw new PriceStreamClosedException(symbol + " stream closed");
                PriceSample ready = pending.poll();
                if (ready != null) return ready;

                if (!firstPoll && closed.await(pollInterval.toMillis(), TimeUnit.MILLISECONDS)) {
                    throw new PriceStreamClosedException(symbol + " stream closed");
                }
                firstPoll = false;
                poll();
            }
        }

        private void poll() {
            List<Kline> klines;
            try {
                klines = feed.klines(symbol.value(), interval, POLL_LIMIT);
            } catch (IOException | RuntimeException e) {
                log.warn("Kline poll for {} failed: {}", symbol, e.getMessage());
                return;
            }

            if (lastCloseTime == null) {
                // live-only subscription: start after the newest kline already closed
                List<PriceSample> current = closedSamples(symbol, klines, Long.MIN_VALUE);
                lastCloseTime = current.isEmpty() ? Long.MIN_VALUE : current.get(current.size() - 1).timestamp().toEpochMilli();
                return;
            }

            List<PriceSample> fresh = closedSamples(symbol, klines, lastCloseTime);
            if (fresh.isEmpty()) return;
            pending.addAll(fresh);
            lastCloseTime = fresh.get(fresh.size() - 1).timestamp().toEpochMilli();
        }

        @Override
        public void close() {
            closed.countDown();
        }
    }
}
