package com.crosswatch.domain.signal;

final class ExponentialAverage implements RollingAverage {

    private final int period;
    private final double k;

    private long count;
    private double seedSum;
    private double value;

    ExponentialAverage(int period) {
        if (period <= 0) throw new IllegalArgumentException("period must be > 0");
        this.period = period;
        this.k = 2.0 / (period + 1.0);
    }

    @Override
    public void add(double price) {
        count++;
        if (count <= period) {
            // seed phase: running simple mean until the window is full
            seedSum += price;
            value = seedSum / count;
            return;
        }
        value = price * k + value * (1 - k);
    }

    @Override
    public boolean isWarm() {
        return count >= period;
    }

    @Override
    public double value() {
        return value;
    }
}
