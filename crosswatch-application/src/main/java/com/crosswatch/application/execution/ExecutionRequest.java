package com.crosswatch.application.execution;

import com.crosswatch.domain.market.Symbol;
import com.crosswatch.domain.order.OrderSide;

import java.util.Objects;

public record ExecutionRequest(Symbol symbol, OrderSide side, double quantity) {
    public ExecutionRequest {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(side, "side");
        if (!(quantity > 0)) throw new IllegalArgumentException("quantity must be > 0");
    }
}
