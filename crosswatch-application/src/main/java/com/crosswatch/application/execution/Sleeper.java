package com.crosswatch.application.execution;

import java.time.Duration;

/** Blocking wait, replaceable in tests. */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = d -> {
        if (!d.isNegative() && !d.isZero()) Thread.sleep(d.toMillis());
    };

    void sleep(Duration duration) throws InterruptedException;
}
