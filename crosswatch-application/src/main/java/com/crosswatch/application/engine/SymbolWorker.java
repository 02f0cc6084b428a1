package com.crosswatch.application.engine;

import com.crosswatch.application.config.SymbolSettings;
import com.crosswatch.application.error.PriceStreamClosedException;
import com.crosswatch.application.execution.ExecutionCoordinator;
import com.crosswatch.application.execution.ExecutionOutcome;
import com.crosswatch.application.execution.Sleeper;
import com.crosswatch.application.ports.PriceSourcePort;
import com.crosswatch.application.ports.PriceSubscription;
import com.crosswatch.domain.ledger.PositionLedger;
import com.crosswatch.domain.ledger.SymbolPhase;
import com.crosswatch.domain.market.PriceSample;
import com.crosswatch.domain.market.Symbol;
import com.crosswatch.domain.signal.CrossoverDetector;
import com.crosswatch.domain.signal.CrossoverEvent;
import com.crosswatch.domain.signal.MAState;
import com.crosswatch.domain.signal.MovingAverageTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Monitors one symbol: price stream -> tracker -> detector -> coordinator.
 *
 * <p>Everything for the symbol runs on this worker's thread, so samples and events are
 * handled strictly in arrival order. A closed stream is resubscribed after a delay;
 * an exception while handling one sample is logged and the loop continues.
 */
public class SymbolWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SymbolWorker.class);

    private final SymbolSettings settings;
    private final MovingAverageTracker tracker;
    private final CrossoverDetector detector;
    private final PositionLedger ledger;
    private final PriceSourcePort priceSource;
    private final ExecutionCoordinator coordinator;
    private final Sleeper sleeper;
    private final Duration resubscribeDelay;
    private final int historyLimit;

    private final CountDownLatch finished = new CountDownLatch(1);
    private final AtomicLong acceptedSamples = new AtomicLong();
    private final AtomicLong detectedEvents = new AtomicLong();

    private volatile boolean stopping;
    private volatile PriceSubscription subscription;
    private volatile MAState lastState;
    private volatile ExecutionOutcome lastOutcome;

    public SymbolWorker(SymbolSettings settings,
                        MovingAverageTracker tracker,
                        PositionLedger ledger,
                        PriceSourcePort priceSource,
                        ExecutionCoordinator coordinator,
                        Sleeper sleeper,
                        Duration resubscribeDelay,
                        int historyLimit) {
        this.settings = settings;
        this.tracker = tracker;
        this.detector = new CrossoverDetector(settings.symbol());
        this.ledger = ledger;
        this.priceSource = priceSource;
        this.coordinator = coordinator;
        this.sleeper = sleeper;
        this.resubscribeDelay = resubscribeDelay;
        this.historyLimit = historyLimit;
    }

    public Symbol symbol() {
        return settings.symbol();
    }

    @Override
    public void run() {
        MDC.put("symbol", symbol().value());
        try {
            log.info("Worker started for {} (short={}, long={})",
                    symbol(), settings.shortWindow(), settings.longWindow());
            warmUp();
            while (!stopping) {
                if (!streamOnce()) break;
            }
        } finally {
            subscription = null;
            log.info("Worker stopped for {}", symbol());
            MDC.remove("symbol");
            finished.countDown();
        }
    }

    /** @return false when the worker should exit */
    private boolean streamOnce() {
        Instant after = lastState == null ? null : lastState.lastTimestamp();
        try (PriceSubscription sub = priceSource.subscribe(symbol(), after)) {
            subscription = sub;
            while (!stopping) {
                PriceSample sample = sub.next();
                if (stopping) break;
                process(sample);
            }
            return false;
        } catch (PriceStreamClosedException e) {
            if (stopping) return false;
            log.warn("Price stream for {} closed: {}. Resubscribing in {} ms",
                    symbol(), e.getMessage(), resubscribeDelay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            if (stopping) return false;
            log.error("Subscription for {} failed. Retrying in {} ms", symbol(), resubscribeDelay.toMillis(), e);
        } finally {
            subscription = null;
        }
        return pause(resubscribeDelay);
    }

    /** Loads recent history into the averages; crosses found there are never executed. */
    void warmUp() {
        if (historyLimit <= 0) return;
        List<PriceSample> history;
        try {
            history = priceSource.history(symbol(), historyLimit);
        } catch (Exception e) {
            log.warn("Warm-up history for {} unavailable, starting cold: {}", symbol(), e.getMessage());
            return;
        }
        int ignored = 0;
        for (PriceSample sample : history) {
            Optional<MAState> st = tracker.update(symbol(), sample);
            if (st.isEmpty()) continue;
            lastState = st.get();
            if (detector.onUpdate(st.get()).isPresent()) ignored++;
        }
        log.info("Warmed {} with {} samples (warm={}, historical crosses ignored={})",
                symbol(), history.size(), lastState != null && lastState.isWarm(), ignored);
    }

    void process(PriceSample sample) {
        try {
            Optional<MAState> st = tracker.update(symbol(), sample);
            if (st.isEmpty()) return;
            acceptedSamples.incrementAndGet();
            lastState = st.get();
            log.debug("{} {}", symbol(), lastState.describe(settings.priceScale()));

            Optional<CrossoverEvent> event = detector.onUpdate(lastState);
            if (event.isEmpty()) return;
            detectedEvents.incrementAndGet();
            if (stopping) {
                log.info("Shutdown in progress, not evaluating {} on {}", event.get().direction(), symbol());
                return;
            }
            lastOutcome = coordinator.handle(event.get());
        } catch (RuntimeException e) {
            log.error("Failed to process sample {} for {}", sample, symbol(), e);
        }
    }

    private boolean pause(Duration d) {
        try {
            sleeper.sleep(d);
            return !stopping;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /** Signals the worker to stop; does not interrupt an in-flight execution. */
    public void stop() {
        stopping = true;
        PriceSubscription s = subscription;
        if (s != null) {
            try {
                s.close();
            } catch (RuntimeException e) {
                log.warn("Closing price stream for {} failed", symbol(), e);
            }
        }
    }

    public boolean awaitFinished(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isStopping() {
        return stopping;
    }

    public SymbolPhase phase() {
        MAState s = lastState;
        return SymbolPhase.of(s != null && s.isWarm(), ledger.entry(symbol()));
    }

    public Optional<MAState> lastState() {
        return Optional.ofNullable(lastState);
    }

    public Optional<ExecutionOutcome> lastOutcome() {
        return Optional.ofNullable(lastOutcome);
    }

    public long acceptedSamples() {
        return acceptedSamples.get();
    }

    public long detectedEvents() {
        return detectedEvents.get();
    }

    public String statusLine() {
        MAState s = lastState;
        String values = s == null ? "no data" : s.describe(settings.priceScale()) + " samples=" + s.samples();
        ExecutionOutcome o = lastOutcome;
        String outcome = o == null ? "-" : o.status() + (o.orderId() == null ? "" : " " + o.orderId());
        return symbol() + " | " + phase() + " | " + values + " | last=" + outcome;
    }
}
