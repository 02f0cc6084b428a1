package com.crosswatch.domain.signal;

import com.crosswatch.domain.market.PriceSample;
import com.crosswatch.domain.market.Symbol;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class MovingAverageTrackerTest {

    private static final Symbol BTC = Symbol.of("BTCUSDT");

    private final List<DataQualityIssue> issues = new ArrayList<>();

    private MovingAverageTracker tracker(MovingAverageType type) {
        MovingAverageTracker t = new MovingAverageTracker(type, issues::add);
        t.register(BTC, 3, 5);
        return t;
    }

    private static PriceSample sample(long ts, double price) {
        return PriceSample.of("BTCUSDT", ts, price);
    }

    @Test
    void emaIsSeededWithSimpleAverageThenSmoothed() {
        MovingAverageTracker t = tracker(MovingAverageType.EMA);
        double[] prices = {10, 10, 10, 10, 10, 9};
        MAState last = null;
        for (int i = 0; i < prices.length; i++) {
            last = t.update(BTC, sample(i + 1, prices[i])).orElseThrow();
        }

        assertThat(last.samples()).isEqualTo(6);
        assertThat(last.shortValue()).isCloseTo(9.5, within(1e-9));
        assertThat(last.longValue()).isCloseTo(9.0 / 3 + 20.0 / 3, within(1e-9));
    }

    @Test
    void smaUsesRollingWindow() {
        MovingAverageTracker t = tracker(MovingAverageType.SMA);
        double[] prices = {10, 10, 10, 10, 10, 9, 8};
        MAState last = null;
        for (int i = 0; i < prices.length; i++) {
            last = t.update(BTC, sample(i + 1, prices[i])).orElseThrow();
        }

        assertThat(last.shortValue()).isCloseTo(9.0, within(1e-9));
        assertThat(last.longValue()).isCloseTo(9.4, within(1e-9));
    }

    @Test
    void longWindowBecomesWarmOnlyAfterEnoughSamples() {
        MovingAverageTracker t = tracker(MovingAverageType.EMA);

        MAState s3 = null;
        for (int i = 1; i <= 3; i++) s3 = t.update(BTC, sample(i, 100)).orElseThrow();
        assertThat(s3.shortWarm()).isTrue();
        assertThat(s3.isWarm()).isFalse();

        t.update(BTC, sample(4, 100));
        MAState s5 = t.update(BTC, sample(5, 100)).orElseThrow();
        assertThat(s5.isWarm()).isTrue();
    }

    @Test
    void outOfOrderSampleIsDiscardedWithWarning() {
        MovingAverageTracker t = tracker(MovingAverageType.EMA);
        t.update(BTC, sample(10, 100));
        MAState before = t.current(BTC).orElseThrow();

        Optional<MAState> stale = t.update(BTC, sample(9, 1));
        Optional<MAState> duplicate = t.update(BTC, sample(10, 1));

        assertThat(stale).isEmpty();
        assertThat(duplicate).isEmpty();
        assertThat(t.current(BTC)).contains(before);
        assertThat(issues).extracting(DataQualityIssue::reason)
                .containsExactly(DataQualityIssue.Reason.OUT_OF_ORDER, DataQualityIssue.Reason.OUT_OF_ORDER);
    }

    @Test
    void malformedPricesAreRejected() {
        MovingAverageTracker t = tracker(MovingAverageType.EMA);

        assertThat(t.update(BTC, sample(1, Double.NaN))).isEmpty();
        assertThat(t.update(BTC, sample(2, -3))).isEmpty();
        assertThat(t.update(BTC, sample(3, 0))).isEmpty();
        assertThat(t.update(BTC, PriceSample.of("ETHUSDT", 4, 10))).isEmpty();
        assertThat(t.current(BTC)).isEmpty();

        assertThat(issues).extracting(DataQualityIssue::reason).containsExactly(
                DataQualityIssue.Reason.INVALID_PRICE,
                DataQualityIssue.Reason.INVALID_PRICE,
                DataQualityIssue.Reason.INVALID_PRICE,
                DataQualityIssue.Reason.SYMBOL_MISMATCH);
    }

    @Test
    void unregisteredSymbolIsAProgrammingError() {
        MovingAverageTracker t = tracker(MovingAverageType.EMA);
        assertThatThrownBy(() -> t.update(PriceSample.of("ETHUSDT", 1, 10)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsInvalidWindows() {
        MovingAverageTracker t = new MovingAverageTracker(MovingAverageType.EMA);
        assertThatThrownBy(() -> t.register(BTC, 0, 5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> t.register(BTC, 5, 5)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void formatsAtDisplayScaleOnly() {
        assertThat(MAState.format(9.666666666, 4)).isEqualTo("9.6667");
        assertThat(MAState.format(10, 2)).isEqualTo("10.00");
    }
}
