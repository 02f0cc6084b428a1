package com.crosswatch.application.execution;

import com.crosswatch.application.config.EngineConfig;
import com.crosswatch.application.config.ExecutionSettings;
import com.crosswatch.application.config.MarketType;
import com.crosswatch.application.config.SymbolSettings;
import com.crosswatch.application.config.TradingMode;
import com.crosswatch.application.support.InMemoryLedgerStore;
import com.crosswatch.application.support.RecordingNotifier;
import com.crosswatch.application.support.ScriptedVenue;
import com.crosswatch.domain.ledger.PositionLedger;
import com.crosswatch.domain.market.Symbol;
import com.crosswatch.domain.order.OrderSide;
import com.crosswatch.domain.signal.CrossDirection;
import com.crosswatch.domain.signal.CrossoverEvent;
import com.crosswatch.domain.signal.MovingAverageType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.crosswatch.domain.signal.CrossDirection.DEATH;
import static com.crosswatch.domain.signal.CrossDirection.GOLDEN;
import static org.assertj.core.api.Assertions.assertThat;

class ExecutionCoordinatorTest {

    private static final Symbol BTC = Symbol.of("BTCUSDT");
    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private final PositionLedger ledger = new PositionLedger();
    private final InMemoryLedgerStore store = new InMemoryLedgerStore();
    private final ScriptedVenue venue = new ScriptedVenue();
    private final RecordingNotifier notifier = new RecordingNotifier();
    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();
    private final List<String> journal = new ArrayList<>();

    @BeforeEach
    void setUp() {
        ledger.register(BTC, Duration.ZERO);
    }

    private ExecutionCoordinator coordinator(boolean autoTrade, Duration minInterval) {
        return coordinator(autoTrade, new SymbolSettings(BTC, 3, 5, 0.01, minInterval, 2));
    }

    private ExecutionCoordinator coordinator(boolean autoTrade, SymbolSettings s) {
        ledger.register(BTC, s.minInterval());
        EngineConfig config = new EngineConfig(List.of(s), MovingAverageType.EMA, TradingMode.PAPER, autoTrade, true,
                ExecutionSettings.defaults(), null, null, 0, List.of());
        return new ExecutionCoordinator(config, ledger, store, venue, notifier,
                (mode, symbol, side, qty, orderId, comment) -> journal.add(side + " " + symbol + " " + orderId),
                OrderRateLimiter.unlimited(), sleeps::add, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private ExecutionCoordinator coordinator() {
        return coordinator(true, Duration.ZERO);
    }

    private static CrossoverEvent event(CrossDirection direction, int minute) {
        return new CrossoverEvent(BTC, direction, NOW.plusSeconds(60L * minute), 101.5, 100.25);
    }

    @Test
    void repeatedGoldenCrossExecutesOnlyOnce() {
        ExecutionCoordinator c = coordinator();

        ExecutionOutcome first = c.handle(event(GOLDEN, 1));
        ExecutionOutcome second = c.handle(event(GOLDEN, 2));

        assertThat(first.status()).isEqualTo(ExecutionOutcome.Status.EXECUTED);
        assertThat(second.status()).isEqualTo(ExecutionOutcome.Status.SUPPRESSED);
        assertThat(second.reason()).contains("duplicate GOLDEN");
        assertThat(venue.requests()).hasSize(1);
        assertThat(venue.requests().get(0).side()).isEqualTo(OrderSide.BUY);
        assertThat(notifier.countStartingWith("⏭")).isEqualTo(1);
    }

    @Test
    void transientFailureIsRetriedAndRecordedOnce() {
        venue.then(OrderResult.transientFailure("timeout"));
        ExecutionCoordinator c = coordinator();

        ExecutionOutcome out = c.handle(event(GOLDEN, 1));

        assertThat(out.isExecuted()).isTrue();
        assertThat(out.attempts()).isEqualTo(2);
        assertThat(out.orderId()).isEqualTo("ord-1");
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1));
        assertThat(ledger.entry(BTC).lastDirection()).isEqualTo(GOLDEN);
        assertThat(ledger.entry(BTC).executedAt()).isEqualTo(NOW);
        assertThat(store.rows()).containsKey(BTC);
        assertThat(notifier.countStartingWith("🟢")).isEqualTo(1);
        assertThat(journal).containsExactly("BUY BTCUSDT ord-1");
    }

    @Test
    void permanentFailureLeavesLedgerUntouched() {
        venue.then(OrderResult.permanentFailure("insufficient margin"));
        ExecutionCoordinator c = coordinator();

        ExecutionOutcome out = c.handle(event(GOLDEN, 1));

        assertThat(out.status()).isEqualTo(ExecutionOutcome.Status.FAILED_PERMANENT);
        assertThat(out.attempts()).isEqualTo(1);
        assertThat(out.reason()).isEqualTo("insufficient margin");
        assertThat(sleeps).isEmpty();
        assertThat(ledger.entry(BTC).isEmpty()).isTrue();
        assertThat(ledger.mayExecute(BTC, GOLDEN, NOW)).isTrue();
        assertThat(store.rows()).isEmpty();
        assertThat(notifier.countStartingWith("❌")).isEqualTo(1);
        assertThat(journal).isEmpty();
    }

    @Test
    void exhaustedRetriesKeepDirectionEligible() {
        venue.then(OrderResult.transientFailure("503"))
                .then(OrderResult.transientFailure("503"))
                .then(OrderResult.transientFailure("503"));
        ExecutionCoordinator c = coordinator();

        ExecutionOutcome out = c.handle(event(GOLDEN, 1));

        assertThat(out.status()).isEqualTo(ExecutionOutcome.Status.FAILED_TRANSIENT);
        assertThat(out.attempts()).isEqualTo(3);
        assertThat(out.reason()).contains("retries exhausted");
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
        assertThat(ledger.entry(BTC).isEmpty()).isTrue();

        ExecutionOutcome retry = c.handle(event(GOLDEN, 2));
        assertThat(retry.isExecuted()).isTrue();
        assertThat(venue.requests()).hasSize(4);
    }

    @Test
    void adapterExceptionIsTreatedAsTransient() {
        venue.thenThrow(new IllegalStateException("socket reset"));
        ExecutionCoordinator c = coordinator();

        ExecutionOutcome out = c.handle(event(DEATH, 1));

        assertThat(out.isExecuted()).isTrue();
        assertThat(out.attempts()).isEqualTo(2);
        assertThat(venue.requests()).extracting(ExecutionRequest::side).containsOnly(OrderSide.SELL);
        assertThat(notifier.countStartingWith("🔴")).isEqualTo(1);
    }

    @Test
    void alternatingCrossesAllExecute() {
        ExecutionCoordinator c = coordinator();

        c.handle(event(GOLDEN, 1));
        c.handle(event(DEATH, 2));
        c.handle(event(GOLDEN, 3));

        assertThat(venue.requests()).extracting(ExecutionRequest::side)
                .containsExactly(OrderSide.BUY, OrderSide.SELL, OrderSide.BUY);
        assertThat(venue.requests()).allSatisfy(r -> assertThat(r.quantity()).isEqualTo(0.01));
    }

    @Test
    void signalOnlyModeNeverSubmits() {
        ExecutionCoordinator c = coordinator(false, Duration.ZERO);

        ExecutionOutcome out = c.handle(event(GOLDEN, 1));

        assertThat(out.status()).isEqualTo(ExecutionOutcome.Status.SIGNAL_ONLY);
        assertThat(venue.requests()).isEmpty();
        assertThat(ledger.entry(BTC).isEmpty()).isTrue();
        assertThat(notifier.messages()).hasSize(1);
        assertThat(notifier.messages().get(0)).startsWith("📈").contains("short=101.50").contains("long=100.25");
    }

    @Test
    void spotSymbolIsMonitorOnlyEvenWithAutoTrade() {
        ExecutionCoordinator c = coordinator(true,
                new SymbolSettings(BTC, 3, 5, 0.01, Duration.ZERO, 2, 0, MarketType.SPOT));

        ExecutionOutcome golden = c.handle(event(GOLDEN, 1));
        ExecutionOutcome death = c.handle(event(DEATH, 2));

        assertThat(golden.status()).isEqualTo(ExecutionOutcome.Status.SIGNAL_ONLY);
        assertThat(golden.reason()).isEqualTo("monitor-only (SPOT)");
        assertThat(death.status()).isEqualTo(ExecutionOutcome.Status.SIGNAL_ONLY);
        assertThat(venue.requests()).isEmpty();
        assertThat(journal).isEmpty();
        assertThat(ledger.entry(BTC).isEmpty()).isTrue();
        assertThat(notifier.messages()).hasSize(2);
    }

    @Test
    void minIntervalSuppressesOppositeDirection() {
        ExecutionCoordinator c = coordinator(true, Duration.ofHours(1));

        assertThat(c.handle(event(GOLDEN, 1)).isExecuted()).isTrue();
        ExecutionOutcome out = c.handle(event(DEATH, 2));

        assertThat(out.status()).isEqualTo(ExecutionOutcome.Status.SUPPRESSED);
        assertThat(out.reason()).contains("min interval");
        assertThat(venue.requests()).hasSize(1);
    }

    @Test
    void ledgerPersistenceFailureDoesNotUndoExecution() {
        store.failSave(true);
        ExecutionCoordinator c = coordinator();

        ExecutionOutcome out = c.handle(event(GOLDEN, 1));

        assertThat(out.isExecuted()).isTrue();
        assertThat(ledger.entry(BTC).lastDirection()).isEqualTo(GOLDEN);
        assertThat(notifier.countStartingWith("⚠")).isEqualTo(1);
    }

    @Test
    void notifierOutageDoesNotAffectExecution() {
        notifier.failing(true);
        ExecutionCoordinator c = coordinator();

        ExecutionOutcome out = c.handle(event(GOLDEN, 1));

        assertThat(out.isExecuted()).isTrue();
        assertThat(ledger.entry(BTC).lastDirection()).isEqualTo(GOLDEN);
    }
}
