package com.crosswatch.worker.wiring;

import com.crosswatch.application.config.ConfigKey;
import com.crosswatch.application.config.EngineConfig;
import com.crosswatch.application.config.EngineConfigLoader;
import com.crosswatch.application.config.SymbolSettings;
import com.crosswatch.application.config.TradingMode;
import com.crosswatch.application.engine.CrossoverEngine;
import com.crosswatch.application.execution.Sleeper;
import com.crosswatch.application.ports.ConfigPort;
import com.crosswatch.application.ports.NotifierPort;
import com.crosswatch.application.ports.OrderExecutionPort;
import com.crosswatch.application.ports.PriceSourcePort;
import com.crosswatch.domain.market.Symbol;
import com.crosswatch.exchange.BinanceFuturesClient;
import com.crosswatch.infrastructure.db.Database;
import com.crosswatch.infrastructure.db.SqliteLedgerStore;
import com.crosswatch.infrastructure.execution.BinanceFuturesOrderExecution;
import com.crosswatch.infrastructure.execution.PaperOrderExecution;
import com.crosswatch.infrastructure.journal.SqliteTradeJournal;
import com.crosswatch.infrastructure.market.BinanceKlinePriceSource;
import com.crosswatch.infrastructure.market.MarketRoutingPriceSource;
import com.crosswatch.infrastructure.notification.ConsoleNotifier;
import com.crosswatch.infrastructure.notification.TelegramNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

public final class Bootstrap {

    private static final Logger log = LoggerFactory.getLogger(Bootstrap.class);

    private Bootstrap() {}

    /**
     * Wires a not-yet-started engine from the provided ConfigPort.
     * Throws {@link com.crosswatch.application.error.ConfigurationException} when the snapshot is unusable.
     */
    public static CrossoverEngine createEngine(ConfigPort config) {
        EngineConfig engineConfig = new EngineConfigLoader().load(config);

        // Market data (klines are public; the same client signs LIVE orders)
        BinanceFuturesClient client = new BinanceFuturesClient(config);
        PriceSourcePort prices = createPriceSource(engineConfig, config, client);

        OrderExecutionPort venue = createVenue(engineConfig, config, client);
        NotifierPort notifier = createNotifier(config);

        // Storage
        Database db = new Database(Path.of(config.get(ConfigKey.STORAGE_DB_PATH.key(), Database.DEFAULT_PATH)))
                .initSchema();

        log.info("Wiring engine: mode={} autoTrade={} symbols={} db={}",
                engineConfig.mode(), engineConfig.autoTrade(), engineConfig.symbols().size(), db.file());

        return new CrossoverEngine(
                engineConfig,
                prices,
                venue,
                notifier,
                new SqliteLedgerStore(db),
                new SqliteTradeJournal(db),
                Clock.systemUTC(),
                Sleeper.SYSTEM
        );
    }

    static PriceSourcePort createPriceSource(EngineConfig engineConfig, ConfigPort config, BinanceFuturesClient client) {
        String interval = config.get(ConfigKey.MARKET_INTERVAL.key(), "15m");
        Duration poll = Duration.ofMillis(config.getLong(ConfigKey.MARKET_POLL_MS.key(), 60_000));
        PriceSourcePort futures = new BinanceKlinePriceSource(client, interval, poll);

        Set<Symbol> spot = engineConfig.symbols().stream()
                .filter(SymbolSettings::monitorOnly)
                .map(SymbolSettings::symbol)
                .collect(Collectors.toSet());
        if (spot.isEmpty()) return futures;

        log.info("Monitor-only spot symbols: {}", spot);
        return new MarketRoutingPriceSource(futures, BinanceKlinePriceSource.spot(client, interval, poll), spot);
    }

    static OrderExecutionPort createVenue(EngineConfig engineConfig, ConfigPort config, BinanceFuturesClient client) {
        if (engineConfig.mode() != TradingMode.LIVE) {
            return new PaperOrderExecution();
        }
        try {
            client.syncTime();
        } catch (IOException e) {
            // signed calls resync on -1021, so a failed first sync only costs one retry
            log.warn("Initial server time sync failed: {}", e.getMessage());
        }
        Map<Symbol, Integer> leverage = new HashMap<>();
        for (SymbolSettings s : engineConfig.symbols()) {
            leverage.put(s.symbol(), s.leverage());
        }
        return new BinanceFuturesOrderExecution(
                client,
                leverage,
                config.getInt(ConfigKey.BINANCE_LEVERAGE.key(), 0),
                config.getInt(ConfigKey.BINANCE_QUANTITY_SCALE.key(), 3)
        );
    }

    /** Token and chat id are already required by the config validator when telegram is enabled. */
    static NotifierPort createNotifier(ConfigPort config) {
        if (config.getBoolean(ConfigKey.TELEGRAM_ENABLED.key(), false)) {
            return new TelegramNotifier(
                    config.getSecret(ConfigKey.TELEGRAM_BOT_TOKEN.key()),
                    config.getSecret(ConfigKey.TELEGRAM_CHAT_ID.key()));
        }
        return new ConsoleNotifier();
    }
}
