package com.crosswatch.application.execution;

import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrderRateLimiterTest {

    @Test
    void burstPassesWithoutWaiting() throws InterruptedException {
        OrderRateLimiter l = new OrderRateLimiter(1, 3);

        long start = System.nanoTime();
        l.acquire();
        l.acquire();
        l.acquire();

        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(500);
        assertThat(l.availablePermits()).isLessThanOrEqualTo(0);
    }

    @Test
    void waitsForNextPeriodOnceBurstIsSpent() throws InterruptedException {
        // 2 permits per 200 ms
        OrderRateLimiter l = new OrderRateLimiter(10, 2);
        l.acquire();
        l.acquire();

        long start = System.nanoTime();
        l.acquire();
        long waitedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(waitedMs).isBetween(1L, 1_000L);
    }

    @Test
    void interruptedWaiterGivesUp() throws Exception {
        OrderRateLimiter l = new OrderRateLimiter(0.1, 1);
        l.acquire();

        Thread.currentThread().interrupt();
        try {
            l.acquire();
            assertThat(false).as("acquire should have been interrupted").isTrue();
        } catch (InterruptedException expected) {
            assertThat(Thread.currentThread().isInterrupted()).isFalse();
        }
    }

    @Test
    void nonPositiveRateMeansUnlimited() throws InterruptedException {
        OrderRateLimiter l = new OrderRateLimiter(0, 1);

        for (int i = 0; i < 100; i++) l.acquire();

        assertThat(l.isUnlimited()).isTrue();
        assertThat(l.availablePermits()).isEqualTo(-1);
        assertThat(OrderRateLimiter.unlimited().isUnlimited()).isTrue();
    }

    @Test
    void ratesOutsideTheSupportedRangeAreRejected() {
        assertThatThrownBy(() -> new OrderRateLimiter(1e-12, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new OrderRateLimiter(Double.NaN, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new OrderRateLimiter(Double.POSITIVE_INFINITY, 1))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(new OrderRateLimiter(OrderRateLimiter.MIN_RATE, 1).isUnlimited()).isFalse();
        assertThat(new OrderRateLimiter(OrderRateLimiter.MAX_RATE, 50).isUnlimited()).isFalse();
    }
}
