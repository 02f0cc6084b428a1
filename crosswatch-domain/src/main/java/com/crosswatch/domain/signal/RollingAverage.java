package com.crosswatch.domain.signal;

/** Incremental average over a fixed window. Not thread-safe. */
interface RollingAverage {

    void add(double price);

    /** True once the window has seen at least {@code period} samples. */
    boolean isWarm();

    double value();
}
