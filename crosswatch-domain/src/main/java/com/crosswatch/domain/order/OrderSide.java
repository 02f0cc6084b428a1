package com.crosswatch.domain.order;

public enum OrderSide {
    BUY,
    SELL
}
