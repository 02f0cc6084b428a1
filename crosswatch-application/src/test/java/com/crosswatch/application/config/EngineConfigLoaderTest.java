package com.crosswatch.application.config;

import com.crosswatch.application.error.ConfigurationException;
import com.crosswatch.application.support.MapConfig;
import com.crosswatch.domain.market.Symbol;
import com.crosswatch.domain.signal.MovingAverageType;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineConfigLoaderTest {

    private final EngineConfigLoader loader = new EngineConfigLoader();

    @Test
    void appliesDefaultsAndPerSymbolOverrides() {
        MapConfig cfg = new MapConfig()
                .with("symbols", "btc/usdt, ETHUSDT")
                .with("order.quantity", "0.01")
                .with("symbol.ETHUSDT.shortWindow", "5")
                .with("symbol.ETHUSDT.longWindow", "20")
                .with("symbol.ETHUSDT.quantity", "0.5")
                .with("symbol.ETHUSDT.minIntervalSeconds", "900");

        EngineConfig c = loader.load(cfg);

        assertThat(c.averageType()).isEqualTo(MovingAverageType.EMA);
        assertThat(c.mode()).isEqualTo(TradingMode.PAPER);
        assertThat(c.autoTrade()).isTrue();
        assertThat(c.rejected()).isEmpty();
        assertThat(c.symbols()).extracting(SymbolSettings::symbol)
                .containsExactly(Symbol.of("BTCUSDT"), Symbol.of("ETHUSDT"));

        SymbolSettings btc = c.bySymbol().get(Symbol.of("BTCUSDT"));
        assertThat(btc.shortWindow()).isEqualTo(9);
        assertThat(btc.longWindow()).isEqualTo(26);
        assertThat(btc.quantity()).isEqualTo(0.01);
        assertThat(btc.minInterval()).isEqualTo(Duration.ZERO);
        assertThat(c.historyLimitFor(btc)).isEqualTo(78);

        SymbolSettings eth = c.bySymbol().get(Symbol.of("ETHUSDT"));
        assertThat(eth.shortWindow()).isEqualTo(5);
        assertThat(eth.longWindow()).isEqualTo(20);
        assertThat(eth.quantity()).isEqualTo(0.5);
        assertThat(eth.minInterval()).isEqualTo(Duration.ofMinutes(15));
    }

    @Test
    void brokenSymbolIsRejectedWithoutStoppingOthers() {
        MapConfig cfg = new MapConfig()
                .with("symbols", "BTCUSDT,ETHUSDT")
                .with("order.quantity", "0.01")
                .with("symbol.ETHUSDT.shortWindow", "30")
                .with("symbol.ETHUSDT.longWindow", "10");

        EngineConfig c = loader.load(cfg);

        assertThat(c.symbols()).extracting(SymbolSettings::symbol).containsExactly(Symbol.of("BTCUSDT"));
        assertThat(c.rejected()).singleElement().asString().contains("ETHUSDT").contains("longWindow");
    }

    @Test
    void missingQuantityRejectsSymbol() {
        MapConfig cfg = new MapConfig()
                .with("symbols", "BTCUSDT,ETHUSDT")
                .with("symbol.BTCUSDT.quantity", "0.002");

        EngineConfig c = loader.load(cfg);

        assertThat(c.symbols()).hasSize(1);
        assertThat(c.rejected()).singleElement().asString().contains("ETHUSDT: missing order.quantity");
    }

    @Test
    void duplicateSymbolsAreCollapsed() {
        EngineConfig c = loader.load(new MapConfig()
                .with("symbols", "BTCUSDT,BTC-USDT")
                .with("order.quantity", "1"));

        assertThat(c.symbols()).hasSize(1);
    }

    @Test
    void failsWhenNoSymbolSurvives() {
        MapConfig cfg = new MapConfig()
                .with("symbols", "BTCUSDT")
                .with("order.quantity", "-1");

        assertThatThrownBy(() -> loader.load(cfg))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("No valid symbols");
    }

    @Test
    void missingSymbolsIsAnEngineError() {
        assertThatThrownBy(() -> loader.load(new MapConfig().with("order.quantity", "1")))
                .isInstanceOfSatisfying(ConfigurationException.class,
                        e -> assertThat(e.errors()).anySatisfy(err -> assertThat(err).contains("symbols")));
    }

    @Test
    void liveModeRequiresCredentials() {
        MapConfig cfg = new MapConfig()
                .with("symbols", "BTCUSDT")
                .with("order.quantity", "0.01")
                .with("trading.mode", "LIVE");

        assertThatThrownBy(() -> loader.load(cfg))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("BINANCE_API_KEY");

        cfg.with("BINANCE_API_KEY", "k").with("BINANCE_API_SECRET", "s");
        assertThat(loader.load(cfg).mode()).isEqualTo(TradingMode.LIVE);
    }

    @Test
    void readsExecutionAndEngineSettings() {
        EngineConfig c = loader.load(new MapConfig()
                .with("symbols", "BTCUSDT")
                .with("order.quantity", "0.01")
                .with("ma.type", "sma")
                .with("trading.autoTrade", "false")
                .with("execution.maxAttempts", "5")
                .with("execution.backoffBaseMs", "250")
                .with("execution.ordersPerSecond", "0")
                .with("engine.shutdownTimeoutMs", "1000"));

        assertThat(c.averageType()).isEqualTo(MovingAverageType.SMA);
        assertThat(c.autoTrade()).isFalse();
        assertThat(c.execution().maxAttempts()).isEqualTo(5);
        assertThat(c.execution().retryPolicy().backoffAfter(1)).isEqualTo(Duration.ofMillis(250));
        assertThat(c.execution().ordersPerSecond()).isZero();
        assertThat(c.shutdownTimeout()).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void unknownAverageTypeIsRejected() {
        assertThatThrownBy(() -> loader.load(new MapConfig()
                .with("symbols", "BTCUSDT")
                .with("order.quantity", "0.01")
                .with("ma.type", "WMA")))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void leverageAndMarketFallBackToGlobalsAndCanBeOverriddenPerSymbol() {
        EngineConfig c = loader.load(new MapConfig()
                .with("symbols", "BTCUSDT,ETHUSDT,SOLUSDT")
                .with("order.quantity", "0.01")
                .with("binance.leverage", "5")
                .with("symbol.ETHUSDT.leverage", "20")
                .with("symbol.SOLUSDT.market", "spot"));

        SymbolSettings btc = c.bySymbol().get(Symbol.of("BTCUSDT"));
        assertThat(btc.leverage()).isEqualTo(5);
        assertThat(btc.market()).isEqualTo(MarketType.FUTURES);
        assertThat(btc.monitorOnly()).isFalse();

        assertThat(c.bySymbol().get(Symbol.of("ETHUSDT")).leverage()).isEqualTo(20);

        SymbolSettings sol = c.bySymbol().get(Symbol.of("SOLUSDT"));
        assertThat(sol.market()).isEqualTo(MarketType.SPOT);
        assertThat(sol.monitorOnly()).isTrue();
    }

    @Test
    void globalMarketTypeAcceptsContractAlias() {
        EngineConfig c = loader.load(new MapConfig()
                .with("symbols", "BTCUSDT")
                .with("order.quantity", "0.01")
                .with("market.type", "contract"));

        assertThat(c.symbols().get(0).market()).isEqualTo(MarketType.FUTURES);
    }

    @Test
    void outOfRangeLeverageOrUnknownMarketRejectsOnlyThatSymbol() {
        EngineConfig c = loader.load(new MapConfig()
                .with("symbols", "BTCUSDT,ETHUSDT,SOLUSDT")
                .with("order.quantity", "0.01")
                .with("symbol.ETHUSDT.leverage", "200")
                .with("symbol.SOLUSDT.market", "margin"));

        assertThat(c.symbols()).extracting(SymbolSettings::symbol).containsExactly(Symbol.of("BTCUSDT"));
        assertThat(c.rejected()).hasSize(2);
        assertThat(c.rejected().get(0)).contains("ETHUSDT", "leverage");
        assertThat(c.rejected().get(1)).contains("SOLUSDT", "market");
    }

    @Test
    void orderRateTooSmallForTheLimiterIsAConfigurationError() {
        for (String rate : new String[] {"1e-12", "0.0001", "NaN", "Infinity", "5000"}) {
            assertThatThrownBy(() -> loader.load(new MapConfig()
                    .with("symbols", "BTCUSDT")
                    .with("order.quantity", "0.01")
                    .with("execution.ordersPerSecond", rate)))
                    .as("rate %s", rate)
                    .isInstanceOfSatisfying(ConfigurationException.class,
                            e -> assertThat(e.getMessage()).contains("execution.ordersPerSecond"));
        }

        EngineConfig slowest = loader.load(new MapConfig()
                .with("symbols", "BTCUSDT")
                .with("order.quantity", "0.01")
                .with("execution.ordersPerSecond", "0.001"));
        assertThat(slowest.execution().ordersPerSecond()).isEqualTo(0.001);
    }
}
