package com.crosswatch.application.config;

/**
 * Known configuration keys.
 * Secrets are read through {@link com.crosswatch.application.ports.ConfigPort#getSecret(String)}.
 */
public enum ConfigKey {
    SYMBOLS("symbols", false, false),
    MA_TYPE("ma.type", false, true),
    MA_SHORT_WINDOW("ma.shortWindow", false, true),
    MA_LONG_WINDOW("ma.longWindow", false, true),
    ORDER_QUANTITY("order.quantity", false, true),
    ORDER_MIN_INTERVAL_SECONDS("order.minIntervalSeconds", false, true),
    PRICE_SCALE("price.scale", false, true),

    TRADING_MODE("trading.mode", false, true),
    TRADING_AUTO_TRADE("trading.autoTrade", false, true),

    EXECUTION_MAX_ATTEMPTS("execution.maxAttempts", false, true),
    EXECUTION_BACKOFF_BASE_MS("execution.backoffBaseMs", false, true),
    EXECUTION_BACKOFF_MAX_MS("execution.backoffMaxMs", false, true),
    EXECUTION_ORDERS_PER_SECOND("execution.ordersPerSecond", false, true),
    EXECUTION_ORDER_BURST("execution.orderBurst", false, true),

    NOTIFY_SUPPRESSED("notify.suppressed", false, true),

    MARKET_INTERVAL("market.interval", false, true),
    MARKET_POLL_MS("market.pollMs", false, true),
    MARKET_TYPE("market.type", false, true),

    ENGINE_RESUBSCRIBE_DELAY_MS("engine.resubscribeDelayMs", false, true),
    ENGINE_SHUTDOWN_TIMEOUT_MS("engine.shutdownTimeoutMs", false, true),
    ENGINE_HISTORY_LIMIT("engine.historyLimit", false, true),

    BINANCE_BASE_URL("binance.baseUrl", false, true),
    BINANCE_SPOT_BASE_URL("binance.spotBaseUrl", false, true),
    BINANCE_LEVERAGE("binance.leverage", false, true),
    BINANCE_RECV_WINDOW("binance.recvWindow", false, true),
    BINANCE_QUANTITY_SCALE("binance.quantityScale", false, true),
    BINANCE_API_KEY("BINANCE_API_KEY", true, true),
    BINANCE_API_SECRET("BINANCE_API_SECRET", true, true),

    TELEGRAM_ENABLED("telegram.enabled", false, true),
    TELEGRAM_BOT_TOKEN("telegram.botToken", true, true),
    TELEGRAM_CHAT_ID("telegram.chatId", true, true),

    STORAGE_DB_PATH("storage.dbPath", false, true);

    private final String key;
    private final boolean secret;
    private final boolean optional;

    ConfigKey(String key, boolean secret, boolean optional) {
        this.key = key;
        this.secret = secret;
        this.optional = optional;
    }

    public String key() { return key; }
    public boolean isSecret() { return secret; }
    public boolean isOptional() { return optional; }

    /** Per-symbol override key, e.g. symbol.BTCUSDT.shortWindow. */
    public static String perSymbol(String symbol, String suffix) {
        return "symbol." + symbol + "." + suffix;
    }
}
