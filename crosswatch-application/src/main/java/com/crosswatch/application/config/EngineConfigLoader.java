package com.crosswatch.application.config;

import com.crosswatch.application.error.ConfigurationException;
import com.crosswatch.application.ports.ConfigPort;
import com.crosswatch.domain.market.Symbol;
import com.crosswatch.domain.signal.MovingAverageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the {@link EngineConfig} snapshot from a {@link ConfigPort}.
 *
 * Engine-wide problems throw {@link ConfigurationException}; a broken symbol is only
 * excluded (listed in {@link EngineConfig#rejected()}) so the others keep running.
 */
public final class EngineConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(EngineConfigLoader.class);

    private final ConfigValidator validator = new ConfigValidator();

    public EngineConfig load(ConfigPort config) {
        ConfigValidationResult global = validator.validate(config);

        MovingAverageType type = MovingAverageType.EMA;
        try {
            type = MovingAverageType.parse(config.get(ConfigKey.MA_TYPE.key(), "EMA"));
        } catch (IllegalArgumentException e) {
            global.addError(e.getMessage());
        }

        if (!global.isValid()) {
            throw new ConfigurationException("Invalid configuration: " + String.join("; ", global.errors()), global.errors());
        }

        TradingMode mode = TradingMode.parse(config.get(ConfigKey.TRADING_MODE.key(), "PAPER"));

        List<SymbolSettings> symbols = new ArrayList<>();
        List<String> rejected = new ArrayList<>();
        Set<Symbol> seen = new LinkedHashSet<>();

        for (String raw : config.get(ConfigKey.SYMBOLS.key(), "").split(",")) {
            if (raw.isBlank()) continue;

            Symbol symbol;
            try {
                symbol = Symbol.of(raw);
            } catch (IllegalArgumentException e) {
                rejected.add(raw.trim() + ": " + e.getMessage());
                continue;
            }
            if (!seen.add(symbol)) {
                log.warn("Symbol {} listed twice; using the first entry", symbol);
                continue;
            }

            ConfigValidationResult res = new ConfigValidationResult();
            SymbolSettings settings = readSymbol(config, symbol, res);
            if (settings != null) res.addAll(validator.validateSymbol(settings));

            if (res.isValid()) {
                symbols.add(settings);
            } else {
                rejected.addAll(res.errors());
            }
        }

        if (symbols.isEmpty()) {
            List<String> errors = new ArrayList<>(rejected);
            errors.add(0, "No valid symbols configured (" + ConfigKey.SYMBOLS.key() + ")");
            throw new ConfigurationException(String.join("; ", errors), errors);
        }

        ExecutionSettings defaults = ExecutionSettings.defaults();
        ExecutionSettings execution = new ExecutionSettings(
                Math.max(1, config.getInt(ConfigKey.EXECUTION_MAX_ATTEMPTS.key(), defaults.maxAttempts())),
                Duration.ofMillis(Math.max(0, config.getLong(ConfigKey.EXECUTION_BACKOFF_BASE_MS.key(), defaults.backoffBase().toMillis()))),
                Duration.ofMillis(Math.max(0, config.getLong(ConfigKey.EXECUTION_BACKOFF_MAX_MS.key(), defaults.backoffMax().toMillis()))),
                config.getDouble(ConfigKey.EXECUTION_ORDERS_PER_SECOND.key(), defaults.ordersPerSecond()),
                Math.max(1, config.getInt(ConfigKey.EXECUTION_ORDER_BURST.key(), defaults.orderBurst()))
        );

        return new EngineConfig(
                symbols,
                type,
                mode,
                config.getBoolean(ConfigKey.TRADING_AUTO_TRADE.key(), true),
                config.getBoolean(ConfigKey.NOTIFY_SUPPRESSED.key(), false),
                execution,
                Duration.ofMillis(Math.max(0, config.getLong(ConfigKey.ENGINE_RESUBSCRIBE_DELAY_MS.key(), 5_000))),
                Duration.ofMillis(Math.max(0, config.getLong(ConfigKey.ENGINE_SHUTDOWN_TIMEOUT_MS.key(), 30_000))),
                Math.max(0, config.getInt(ConfigKey.ENGINE_HISTORY_LIMIT.key(), 0)),
                rejected
        );
    }

    private static SymbolSettings readSymbol(ConfigPort config, Symbol symbol, ConfigValidationResult res) {
        String s = symbol.value();
        Integer shortWindow = intValue(config, s, "shortWindow", ConfigKey.MA_SHORT_WINDOW, "9", res);
        Integer longWindow = intValue(config, s, "longWindow", ConfigKey.MA_LONG_WINDOW, "26", res);
        Integer scale = intValue(config, s, "priceScale", ConfigKey.PRICE_SCALE, "4", res);
        Integer minInterval = intValue(config, s, "minIntervalSeconds", ConfigKey.ORDER_MIN_INTERVAL_SECONDS, "0", res);
        Integer leverage = intValue(config, s, "leverage", ConfigKey.BINANCE_LEVERAGE, "0", res);

        String rawMarket = value(config, s, "market", ConfigKey.MARKET_TYPE, "FUTURES");
        MarketType market = null;
        try {
            market = MarketType.parse(rawMarket);
        } catch (IllegalArgumentException e) {
            res.addError(s + ": market must be FUTURES or SPOT, got: " + rawMarket);
        }

        String rawQty = value(config, s, "quantity", ConfigKey.ORDER_QUANTITY, null);
        Double quantity = null;
        if (rawQty == null || rawQty.isBlank()) {
            res.addError(s + ": missing " + ConfigKey.ORDER_QUANTITY.key());
        } else {
            try {
                quantity = Double.parseDouble(rawQty.trim());
            } catch (NumberFormatException e) {
                res.addError(s + ": quantity is not a number: " + rawQty);
            }
        }

        if (!res.isValid()) return null;
        return new SymbolSettings(symbol, shortWindow, longWindow, quantity, Duration.ofSeconds(minInterval), scale,
                leverage, market);
    }

    private static Integer intValue(ConfigPort config, String symbol, String suffix, ConfigKey global,
                                    String def, ConfigValidationResult res) {
        String raw = value(config, symbol, suffix, global, def);
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            res.addError(symbol + ": " + suffix + " is not an integer: " + raw);
            return null;
        }
    }

    private static String value(ConfigPort config, String symbol, String suffix, ConfigKey global, String def) {
        String v = config.get(ConfigKey.perSymbol(symbol, suffix), null);
        if (v == null || v.isBlank()) v = config.get(global.key(), null);
        return (v == null || v.isBlank()) ? def : v;
    }
}
