package com.crosswatch.domain.signal;

import com.crosswatch.domain.market.PriceSample;
import com.crosswatch.domain.market.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Keeps a short and a long moving average per registered symbol.
 *
 * <p>Samples for one symbol must be fed from a single thread in arrival order.
 * Different symbols may be updated concurrently.
 *
 * <p>Rejected samples (out of order, non-positive or non-finite price, wrong symbol)
 * are discarded, reported to the data-quality listener and never touch the averages.
 */
public class MovingAverageTracker {

    private static final Logger log = LoggerFactory.getLogger(MovingAverageTracker.class);

    private final MovingAverageType type;
    private final Consumer<DataQualityIssue> dataQuality;
    private final Map<Symbol, Entry> entries = new ConcurrentHashMap<>();

    public MovingAverageTracker(MovingAverageType type) {
        this(type, issue -> log.warn("{}", issue));
    }

    public MovingAverageTracker(MovingAverageType type, Consumer<DataQualityIssue> dataQuality) {
        this.type = Objects.requireNonNull(type, "type");
        this.dataQuality = Objects.requireNonNull(dataQuality, "dataQuality");
    }

    public MovingAverageType type() {
        return type;
    }

    /** Creates (or recreates) the state for a symbol. */
    public void register(Symbol symbol, int shortWindow, int longWindow) {
        Objects.requireNonNull(symbol, "symbol");
        if (shortWindow <= 0) throw new IllegalArgumentException("shortWindow must be > 0");
        if (longWindow <= shortWindow) throw new IllegalArgumentException("longWindow must be > shortWindow");
        entries.put(symbol, new Entry(symbol, type.newAverage(shortWindow), type.newAverage(longWindow)));
    }

    public void remove(Symbol symbol) {
        entries.remove(symbol);
    }

    public Set<Symbol> symbols() {
        return Set.copyOf(entries.keySet());
    }

    public Optional<MAState> current(Symbol symbol) {
        Entry e = entries.get(symbol);
        return e == null ? Optional.empty() : Optional.ofNullable(e.last);
    }

    /**
     * Feeds one sample.
     *
     * @return the new state, or empty when the sample was rejected
     * @throws IllegalArgumentException if the symbol was never registered
     */
    public Optional<MAState> update(Symbol symbol, PriceSample sample) {
        Entry e = entries.get(symbol);
        if (e == null) throw new IllegalArgumentException("Symbol not registered: " + symbol);

        if (sample == null) {
            report(symbol, null, DataQualityIssue.Reason.MISSING, "null sample");
            return Optional.empty();
        }
        if (!symbol.equals(sample.symbol())) {
            report(symbol, sample, DataQualityIssue.Reason.SYMBOL_MISMATCH, "sample for " + sample.symbol());
            return Optional.empty();
        }
        double price = sample.price();
        if (!Double.isFinite(price) || price <= 0.0) {
            report(symbol, sample, DataQualityIssue.Reason.INVALID_PRICE, "price=" + price);
            return Optional.empty();
        }
        if (e.lastTimestamp != null && !sample.timestamp().isAfter(e.lastTimestamp)) {
            report(symbol, sample, DataQualityIssue.Reason.OUT_OF_ORDER,
                    "ts=" + sample.timestamp() + " last=" + e.lastTimestamp);
            return Optional.empty();
        }

        return Optional.of(e.accept(sample));
    }

    public Optional<MAState> update(PriceSample sample) {
        Objects.requireNonNull(sample, "sample");
        return update(sample.symbol(), sample);
    }

    private void report(Symbol symbol, PriceSample sample, DataQualityIssue.Reason reason, String detail) {
        try {
            dataQuality.accept(new DataQualityIssue(symbol, sample, reason, detail));
        } catch (RuntimeException ex) {
            log.warn("Data-quality listener failed for {}", symbol, ex);
        }
    }

    private static final class Entry {
        private final Symbol symbol;
        private final RollingAverage shortAvg;
        private final RollingAverage longAvg;

        private long samples;
        private Instant lastTimestamp;
        private MAState last;

        private Entry(Symbol symbol, RollingAverage shortAvg, RollingAverage longAvg) {
            this.symbol = symbol;
            this.shortAvg = shortAvg;
            this.longAvg = longAvg;
        }

        private MAState accept(PriceSample sample) {
            shortAvg.add(sample.price());
            longAvg.add(sample.price());
            samples++;
            lastTimestamp = sample.timestamp();
            last = new MAState(
                    symbol,
                    shortAvg.value(),
                    longAvg.value(),
                    samples,
                    shortAvg.isWarm(),
                    longAvg.isWarm(),
                    lastTimestamp
            );
            return last;
        }
    }
}
