package com.crosswatch.application.config;

import com.crosswatch.application.execution.OrderRateLimiter;
import com.crosswatch.application.ports.ConfigPort;

public final class ConfigValidator {

    static final int MAX_LEVERAGE = 125;

    /** Engine-wide checks; no network calls. */
    public ConfigValidationResult validate(ConfigPort config) {
        ConfigValidationResult res = new ConfigValidationResult();

        for (ConfigKey k : ConfigKey.values()) {
            if (k.isOptional()) continue;

            String v = k.isSecret() ? config.getSecret(k.key()) : config.get(k.key());
            if (v == null || v.isBlank()) {
                res.addError("Missing required " + (k.isSecret() ? "secret" : "config") + ": " + k.key());
            }
        }

        String rawMode = config.get(ConfigKey.TRADING_MODE.key(), "PAPER");
        TradingMode mode = null;
        try {
            mode = TradingMode.parse(rawMode);
        } catch (IllegalArgumentException e) {
            res.addError("trading.mode must be PAPER or LIVE, got: " + rawMode);
        }

        if (mode == TradingMode.LIVE) {
            requireSecret(config, ConfigKey.BINANCE_API_KEY, res, "LIVE trading");
            requireSecret(config, ConfigKey.BINANCE_API_SECRET, res, "LIVE trading");
        }

        if (config.getBoolean(ConfigKey.TELEGRAM_ENABLED.key(), false)) {
            requireSecret(config, ConfigKey.TELEGRAM_BOT_TOKEN, res, "telegram.enabled=true");
            requireSecret(config, ConfigKey.TELEGRAM_CHAT_ID, res, "telegram.enabled=true");
        }

        requireHttpUrl(config, ConfigKey.BINANCE_BASE_URL, res);
        requireHttpUrl(config, ConfigKey.BINANCE_SPOT_BASE_URL, res);

        double rate = config.getDouble(ConfigKey.EXECUTION_ORDERS_PER_SECOND.key(), 0);
        if (Double.isNaN(rate) || Double.isInfinite(rate)
                || (rate > 0 && (rate < OrderRateLimiter.MIN_RATE || rate > OrderRateLimiter.MAX_RATE))) {
            res.addError(ConfigKey.EXECUTION_ORDERS_PER_SECOND.key() + " must be <= 0 (unlimited) or within "
                    + OrderRateLimiter.MIN_RATE + ".." + OrderRateLimiter.MAX_RATE + ", got " + rate);
        }

        return res;
    }

    public ConfigValidationResult validateSymbol(SymbolSettings s) {
        ConfigValidationResult res = new ConfigValidationResult();
        String p = s.symbol().value();
        if (s.shortWindow() < 1) {
            res.addError(p + ": shortWindow must be >= 1, got " + s.shortWindow());
        }
        if (s.longWindow() <= s.shortWindow()) {
            res.addError(p + ": longWindow must be > shortWindow, got " + s.longWindow() + " <= " + s.shortWindow());
        }
        if (!(s.quantity() > 0) || !Double.isFinite(s.quantity())) {
            res.addError(p + ": quantity must be > 0, got " + s.quantity());
        }
        if (s.minInterval().isNegative()) {
            res.addError(p + ": minIntervalSeconds must be >= 0");
        }
        if (s.priceScale() < 0 || s.priceScale() > 12) {
            res.addError(p + ": priceScale must be within 0..12, got " + s.priceScale());
        }
        if (s.leverage() < 0 || s.leverage() > MAX_LEVERAGE) {
            res.addError(p + ": leverage must be within 0.." + MAX_LEVERAGE + ", got " + s.leverage());
        }
        return res;
    }

    private static void requireHttpUrl(ConfigPort config, ConfigKey key, ConfigValidationResult res) {
        String url = config.get(key.key(), "");
        if (!url.isBlank() && !(url.startsWith("http://") || url.startsWith("https://"))) {
            res.addError(key.key() + " must start with http:// or https://");
        }
    }

    private static void requireSecret(ConfigPort config, ConfigKey key, ConfigValidationResult res, String because) {
        String v = config.getSecret(key.key());
        if (v == null || v.isBlank()) {
            res.addError("Missing required secret " + key.key() + " (" + because + ")");
        }
    }
}
