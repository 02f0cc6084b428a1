package com.crosswatch.infrastructure.execution;

import com.crosswatch.application.execution.ExecutionRequest;
import com.crosswatch.application.execution.OrderResult;
import com.crosswatch.application.ports.OrderExecutionPort;
import com.crosswatch.domain.market.Symbol;
import com.crosswatch.exchange.BinanceApiException;
import com.crosswatch.exchange.BinanceFuturesClient;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * LIVE order execution on Binance USDT-M futures.
 *
 * Every failure is mapped to an {@link OrderResult}:
 *  - network errors, 5xx, 429/418 and the retryable Binance codes -> transient
 *  - anything else the venue rejects (keys, margin, filters)        -> permanent
 */
public class BinanceFuturesOrderExecution implements OrderExecutionPort {

    private static final Logger log = LoggerFactory.getLogger(BinanceFuturesOrderExecution.class);

    private final BinanceFuturesClient client;
    private final Map<Symbol, Integer> leverageBySymbol;
    private final int defaultLeverage;
    private final int quantityScale;
    private final Set<Symbol> leverageApplied = ConcurrentHashMap.newKeySet();

    /**
     * @param leverage      applied once per symbol before its first order; 0 keeps the account setting
     * @param quantityScale decimals the venue accepts for quantity (rounded down)
     */
    public BinanceFuturesOrderExecution(BinanceFuturesClient client, int leverage, int quantityScale) {
        this(client, Map.of(), leverage, quantityScale);
    }

    /**
     * @param leverageBySymbol per-symbol leverage; symbols not listed use {@code defaultLeverage}
     */
    public BinanceFuturesOrderExecution(BinanceFuturesClient client, Map<Symbol, Integer> leverageBySymbol,
                                        int defaultLeverage, int quantityScale) {
        this.client = client;
        this.leverageBySymbol = Map.copyOf(leverageBySymbol);
        this.defaultLeverage = defaultLeverage;
        this.quantityScale = quantityScale;
    }

    int leverageFor(Symbol symbol) {
        return leverageBySymbol.getOrDefault(symbol, defaultLeverage);
    }

    @Override
    public OrderResult submitOrder(ExecutionRequest request) {
        String qty = formatQuantity(request.quantity());
        if (qty == null) {
            return OrderResult.permanentFailure("quantity " + request.quantity() + " rounds to zero at scale " + quantityScale);
        }

        try {
            ensureLeverage(request.symbol());
            JsonNode resp = client.marketOrder(request.symbol().value(), request.side().name(), qty);
            JsonNode id = resp.get("orderId");
            if (id == null || id.isNull()) {
                // accepted without an id: do not resubmit, the order may exist
                log.warn("Order response without orderId for {} {}: {}", request.side(), request.symbol(), resp);
                return OrderResult.success("unknown");
            }
            log.info("LIVE {} {} qty={} orderId={} status={}", request.side(), request.symbol(), qty,
                    id.asText(), resp.path("status").asText(""));
            return OrderResult.success(id.asText());
        } catch (BinanceApiException e) {
            return classify(e);
        } catch (IOException e) {
            return OrderResult.transientFailure("network: " + e.getMessage());
        } catch (IllegalStateException e) {
            return OrderResult.permanentFailure(e.getMessage());
        }
    }

    static OrderResult classify(BinanceApiException e) {
        return e.isTransient()
                ? OrderResult.transientFailure(e.getMessage())
                : OrderResult.permanentFailure(e.getMessage());
    }

    private void ensureLeverage(Symbol symbol) throws IOException {
        int leverage = leverageFor(symbol);
        if (leverage <= 0 || leverageApplied.contains(symbol)) return;
        JsonNode resp = client.changeLeverage(symbol.value(), leverage);
        leverageApplied.add(symbol);
        log.info("Leverage for {} set to {}x ({})", symbol, leverage, resp.path("maxNotionalValue").asText("-"));
    }

    /** Rounded down to the venue scale; null when nothing is left. */
    String formatQuantity(double quantity) {
        BigDecimal q = BigDecimal.valueOf(quantity).setScale(quantityScale, RoundingMode.DOWN);
        if (q.signum() <= 0) return null;
        return q.stripTrailingZeros().toPlainString();
    }
}
