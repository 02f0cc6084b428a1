package com.crosswatch.domain.signal;

final class SimpleAverage implements RollingAverage {

    private final double[] window;
    private int next;
    private long count;
    private double sum;

    SimpleAverage(int period) {
        if (period <= 0) throw new IllegalArgumentException("period must be > 0");
        this.window = new double[period];
    }

    @Override
    public void add(double price) {
        if (count >= window.length) {
            sum -= window[next];
        }
        window[next] = price;
        sum += price;
        next = (next + 1) % window.length;
        count++;
    }

    @Override
    public boolean isWarm() {
        return count >= window.length;
    }

    @Override
    public double value() {
        long n = Math.min(count, window.length);
        return n == 0 ? 0.0 : sum / n;
    }
}
