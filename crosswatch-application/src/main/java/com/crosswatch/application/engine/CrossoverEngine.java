package com.crosswatch.application.engine;

import com.crosswatch.application.config.EngineConfig;
import com.crosswatch.application.config.ExecutionSettings;
import com.crosswatch.application.config.SymbolSettings;
import com.crosswatch.application.execution.ExecutionCoordinator;
import com.crosswatch.application.execution.OrderRateLimiter;
import com.crosswatch.application.execution.Sleeper;
import com.crosswatch.application.ports.LedgerStorePort;
import com.crosswatch.application.ports.NotifierPort;
import com.crosswatch.application.ports.OrderExecutionPort;
import com.crosswatch.application.ports.PriceSourcePort;
import com.crosswatch.application.ports.TradeJournalPort;
import com.crosswatch.domain.ledger.LedgerEntry;
import com.crosswatch.domain.ledger.PositionLedger;
import com.crosswatch.domain.ledger.SymbolPhase;
import com.crosswatch.domain.market.Symbol;
import com.crosswatch.domain.signal.MovingAverageTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Owns the per-symbol workers for one configuration snapshot.
 *
 * <p>start(): restore the ledger from its store, register every symbol, start one worker thread per symbol.
 * <p>shutdown(): no new evaluations, streams closed, in-flight executions allowed to finish
 * until the timeout, then threads are interrupted.
 */
public class CrossoverEngine {

    private static final Logger log = LoggerFactory.getLogger(CrossoverEngine.class);

    private final EngineConfig config;
    private final PriceSourcePort priceSource;
    private final LedgerStorePort ledgerStore;
    private final NotifierPort notifier;
    private final Sleeper sleeper;

    private final PositionLedger ledger = new PositionLedger();
    private final MovingAverageTracker tracker;
    private final ExecutionCoordinator coordinator;
    private final Map<Symbol, SymbolWorker> workers = new LinkedHashMap<>();

    private ExecutorService executor;
    private volatile boolean running;

    public CrossoverEngine(EngineConfig config,
                           PriceSourcePort priceSource,
                           OrderExecutionPort venue,
                           NotifierPort notifier,
                           LedgerStorePort ledgerStore,
                           TradeJournalPort journal,
                           Clock clock,
                           Sleeper sleeper) {
        this.config = Objects.requireNonNull(config, "config");
        this.priceSource = Objects.requireNonNull(priceSource, "priceSource");
        this.ledgerStore = Objects.requireNonNull(ledgerStore, "ledgerStore");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");

        this.tracker = new MovingAverageTracker(config.averageType());

        ExecutionSettings ex = config.execution();
        OrderRateLimiter limiter = new OrderRateLimiter(ex.ordersPerSecond(), ex.orderBurst());
        this.coordinator = new ExecutionCoordinator(
                config, ledger, ledgerStore, venue, notifier, journal, limiter, sleeper, clock);
    }

    public synchronized void start() {
        if (running) throw new IllegalStateException("Engine already running");
        if (executor != null) throw new IllegalStateException("Engine cannot be restarted; build a new one");

        for (SymbolSettings s : config.symbols()) {
            tracker.register(s.symbol(), s.shortWindow(), s.longWindow());
            ledger.register(s.symbol(), s.minInterval());
        }
        restoreLedger();

        for (String rejected : config.rejected()) {
            log.error("Symbol not monitored, configuration error: {}", rejected);
            safeNotify("⚠ Not monitored (config error): " + rejected);
        }

        executor = Executors.newFixedThreadPool(Math.max(1, config.symbols().size()), workerThreads());
        for (SymbolSettings s : config.symbols()) {
            SymbolWorker w = new SymbolWorker(s, tracker, ledger, priceSource, coordinator, sleeper,
                    config.resubscribeDelay(), config.historyLimitFor(s));
            workers.put(s.symbol(), w);
            executor.submit(w);
        }
        running = true;

        log.info("Engine started: {} symbol(s), mode={}, averages={}, autoTrade={}",
                workers.size(), config.mode(), config.averageType(), config.autoTrade());
        safeNotify("▶ Monitoring " + workers.keySet() + " (" + config.mode() + ", " + config.averageType() + ")");
    }

    /**
     * Loads persisted entries. Entries for symbols that are no longer configured are deleted.
     * An unreadable store is fatal: starting with an empty ledger could duplicate orders.
     */
    private void restoreLedger() {
        Map<Symbol, LedgerEntry> persisted;
        try {
            persisted = ledgerStore.loadAll();
        } catch (Exception e) {
            throw new IllegalStateException("Cannot load position ledger", e);
        }
        for (LedgerEntry entry : persisted.values()) {
            if (ledger.restore(entry)) {
                log.info("Restored ledger for {}: last={} at {}", entry.symbol(), entry.lastDirection(), entry.executedAt());
            } else {
                try {
                    ledgerStore.delete(entry.symbol());
                    log.info("Removed ledger entry for unconfigured symbol {}", entry.symbol());
                } catch (Exception e) {
                    log.warn("Could not remove stale ledger entry for {}", entry.symbol(), e);
                }
            }
        }
    }

    public void shutdown() {
        shutdown(config.shutdownTimeout());
    }

    public synchronized void shutdown(Duration timeout) {
        if (!running) return;
        running = false;
        log.info("Engine shutting down ({} symbol(s))", workers.size());

        workers.values().forEach(SymbolWorker::stop);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Workers did not finish within {} ms, interrupting", timeout.toMillis());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        safeNotify("⛔ Monitoring stopped");
    }

    public boolean isRunning() {
        return running;
    }

    public EngineConfig config() {
        return config;
    }

    public PositionLedger ledger() {
        return ledger;
    }

    public SymbolPhase phase(Symbol symbol) {
        SymbolWorker w = workers.get(symbol);
        if (w == null) throw new IllegalArgumentException("Not monitored: " + symbol);
        return w.phase();
    }

    public Map<Symbol, SymbolWorker> workers() {
        return Map.copyOf(workers);
    }

    /** Human-readable status for notifier/CLI. */
    public String statusText() {
        if (workers.isEmpty()) return "No monitored symbols.";
        StringBuilder sb = new StringBuilder();
        sb.append(running ? "Running" : "Stopped").append(", symbols: ").append(workers.size()).append("\n");
        for (SymbolWorker w : workers.values()) {
            sb.append("- ").append(w.statusLine()).append("\n");
        }
        return sb.toString().trim();
    }

    private void safeNotify(String message) {
        try {
            notifier.send(message);
        } catch (Exception e) {
            log.warn("Notification failed: {}", e.getMessage());
        }
    }

    private static ThreadFactory workerThreads() {
        return new ThreadFactory() {
            private int n;

            @Override
            public synchronized Thread newThread(Runnable r) {
                Thread t = new Thread(r, "crosswatch-worker-" + (++n));
                t.setDaemon(false);
                return t;
            }
        };
    }
}
