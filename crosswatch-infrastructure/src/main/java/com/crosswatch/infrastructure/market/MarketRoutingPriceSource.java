package com.crosswatch.infrastructure.market;

import com.crosswatch.application.ports.PriceSourcePort;
import com.crosswatch.application.ports.PriceSubscription;
import com.crosswatch.domain.market.PriceSample;
import com.crosswatch.domain.market.Symbol;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/** Sends spot symbols to the spot feed and everything else to the futures feed. */
public class MarketRoutingPriceSource implements PriceSourcePort {

    private final PriceSourcePort futures;
    private final PriceSourcePort spot;
    private final Set<Symbol> spotSymbols;

    public MarketRoutingPriceSource(PriceSourcePort futures, PriceSourcePort spot, Set<Symbol> spotSymbols) {
        this.futures = futures;
        this.spot = spot;
        this.spotSymbols = Set.copyOf(spotSymbols);
    }

    private PriceSourcePort route(Symbol symbol) {
        return spotSymbols.contains(symbol) ? spot : futures;
    }

    @Override
    public List<PriceSample> history(Symbol symbol, int limit) throws Exception {
        return route(symbol).history(symbol, limit);
    }

    @Override
    public PriceSubscription subscribe(Symbol symbol, Instant after) throws Exception {
        return route(symbol).subscribe(symbol, after);
    }
}
