package com.crosswatch.application.config;

import com.crosswatch.domain.market.Symbol;
import com.crosswatch.domain.signal.MovingAverageType;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Static configuration snapshot handed to the engine at construction.
 * Reconfiguration means building a new snapshot and a new engine.
 *
 * {@code rejected} lists per-symbol configuration errors; those symbols are not monitored.
 */
public record EngineConfig(
        List<SymbolSettings> symbols,
        MovingAverageType averageType,
        TradingMode mode,
        boolean autoTrade,
        boolean notifySuppressed,
        ExecutionSettings execution,
        Duration resubscribeDelay,
        Duration shutdownTimeout,
        int historyLimit,
        List<String> rejected
) {
    public EngineConfig {
        symbols = List.copyOf(symbols);
        rejected = rejected == null ? List.of() : List.copyOf(rejected);
        Objects.requireNonNull(averageType, "averageType");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(execution, "execution");
        resubscribeDelay = resubscribeDelay == null ? Duration.ofSeconds(5) : resubscribeDelay;
        shutdownTimeout = shutdownTimeout == null ? Duration.ofSeconds(30) : shutdownTimeout;
    }

    /** Snapshot with defaults for everything except the symbols. */
    public static EngineConfig of(List<SymbolSettings> symbols) {
        return new EngineConfig(symbols, MovingAverageType.EMA, TradingMode.PAPER, true, false,
                ExecutionSettings.defaults(), Duration.ofSeconds(5), Duration.ofSeconds(30), 0, List.of());
    }

    public Map<Symbol, SymbolSettings> bySymbol() {
        Map<Symbol, SymbolSettings> map = new LinkedHashMap<>();
        for (SymbolSettings s : symbols) map.put(s.symbol(), s);
        return map;
    }

    /** Samples to request for warm-up; 0 in config means three long windows. */
    public int historyLimitFor(SymbolSettings s) {
        return historyLimit > 0 ? historyLimit : s.longWindow() * 3;
    }
}
