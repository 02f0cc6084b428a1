package com.crosswatch.domain.signal;

import com.crosswatch.domain.order.OrderSide;

/**
 * GOLDEN: short average rises above the long average (bullish, BUY).
 * DEATH: short average falls below the long average (bearish, SELL).
 */
public enum CrossDirection {
    GOLDEN(OrderSide.BUY),
    DEATH(OrderSide.SELL);

    private final OrderSide side;

    CrossDirection(OrderSide side) {
        this.side = side;
    }

    public OrderSide side() {
        return side;
    }

    public CrossDirection opposite() {
        return this == GOLDEN ? DEATH : GOLDEN;
    }
}
