package com.crosswatch.application.execution;

import com.crosswatch.application.config.EngineConfig;
import com.crosswatch.application.config.SymbolSettings;
import com.crosswatch.application.config.TradingMode;
import com.crosswatch.application.ports.LedgerStorePort;
import com.crosswatch.application.ports.NotifierPort;
import com.crosswatch.application.ports.OrderExecutionPort;
import com.crosswatch.application.ports.TradeJournalPort;
import com.crosswatch.domain.ledger.LedgerEntry;
import com.crosswatch.domain.ledger.PositionLedger;
import com.crosswatch.domain.market.Symbol;
import com.crosswatch.domain.order.OrderSide;
import com.crosswatch.domain.signal.CrossDirection;
import com.crosswatch.domain.signal.CrossoverEvent;
import com.crosswatch.domain.signal.MAState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns crossover events into at most one venue order each.
 *
 * <p>Flow: notify signal -> ledger gate -> submit (rate limited, transient failures retried
 * with backoff) -> on success record in ledger + store + journal -> notify outcome.
 *
 * <p>The ledger is touched only after a confirmed order. A failed or exhausted execution
 * leaves it as it was, so the same direction stays eligible on the next event.
 *
 * <p>Events of one symbol must be handed in sequentially (one worker per symbol).
 */
public class ExecutionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ExecutionCoordinator.class);

    private final PositionLedger ledger;
    private final LedgerStorePort ledgerStore;
    private final OrderExecutionPort venue;
    private final NotifierPort notifier;
    private final TradeJournalPort journal;
    private final OrderRateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final Clock clock;

    private final Map<Symbol, SymbolSettings> settings;
    private final TradingMode mode;
    private final boolean autoTrade;
    private final boolean notifySuppressed;

    public ExecutionCoordinator(EngineConfig config,
                                PositionLedger ledger,
                                LedgerStorePort ledgerStore,
                                OrderExecutionPort venue,
                                NotifierPort notifier,
                                TradeJournalPort journal,
                                OrderRateLimiter rateLimiter,
                                Sleeper sleeper,
                                Clock clock) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.ledgerStore = Objects.requireNonNull(ledgerStore, "ledgerStore");
        this.venue = Objects.requireNonNull(venue, "venue");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.journal = Objects.requireNonNull(journal, "journal");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clock = Objects.requireNonNull(clock, "clock");

        this.retryPolicy = config.execution().retryPolicy();
        this.settings = config.bySymbol();
        this.mode = config.mode();
        this.autoTrade = config.autoTrade();
        this.notifySuppressed = config.notifySuppressed();
    }

    public ExecutionOutcome handle(CrossoverEvent event) {
        Objects.requireNonNull(event, "event");
        SymbolSettings s = settings.get(event.symbol());
        if (s == null) {
            throw new IllegalArgumentException("No settings for symbol " + event.symbol());
        }

        CrossDirection direction = event.direction();
        log.info("{} cross on {} at {} ({})", direction, event.symbol(), event.timestamp(),
                describe(event, s.priceScale()));
        safeNotify(signalMessage(event, s));

        if (s.monitorOnly()) {
            return ExecutionOutcome.signalOnly(event, "monitor-only (" + s.market() + ")");
        }
        if (!autoTrade) {
            return ExecutionOutcome.signalOnly(event);
        }

        Optional<String> suppressed = ledger.suppressionReason(event.symbol(), direction, clock.instant());
        if (suppressed.isPresent()) {
            log.info("Suppressed {} {}: {}", direction, event.symbol(), suppressed.get());
            if (notifySuppressed) {
                safeNotify("⏭ " + event.symbol() + " " + direction + " suppressed: " + suppressed.get());
            }
            return ExecutionOutcome.suppressed(event, suppressed.get());
        }

        ExecutionRequest request = new ExecutionRequest(event.symbol(), direction.side(), s.quantity());
        return submit(event, request);
    }

    private ExecutionOutcome submit(CrossoverEvent event, ExecutionRequest request) {
        int attempt = 0;
        while (true) {
            attempt++;
            OrderResult result;
            try {
                rateLimiter.acquire();
                result = submitOnce(request);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return fail(event, request, false, attempt, "interrupted before submission");
            }

            if (result instanceof OrderResult.Success ok) {
                return succeed(event, request, ok.orderId(), attempt);
            }
            if (result instanceof OrderResult.PermanentFailure pf) {
                return fail(event, request, true, attempt, pf.reason());
            }

            String reason = ((OrderResult.TransientFailure) result).reason();
            if (!retryPolicy.canRetryAfter(attempt)) {
                return fail(event, request, false, attempt, "retries exhausted: " + reason);
            }

            Duration wait = retryPolicy.backoffAfter(attempt);
            log.warn("Transient failure for {} {} (attempt {}/{}): {}. Retrying in {} ms",
                    request.side(), request.symbol(), attempt, retryPolicy.maxAttempts(), reason, wait.toMillis());
            try {
                sleeper.sleep(wait);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return fail(event, request, false, attempt, "interrupted during retry backoff: " + reason);
            }
        }
    }

    private OrderResult submitOnce(ExecutionRequest request) {
        try {
            OrderResult r = venue.submitOrder(request);
            return r == null ? OrderResult.transientFailure("venue returned no result") : r;
        } catch (RuntimeException e) {
            // unclassified adapter errors are treated as retryable
            log.warn("Order adapter threw for {} {}", request.side(), request.symbol(), e);
            return OrderResult.transientFailure(safeError(e));
        }
    }

    private ExecutionOutcome succeed(CrossoverEvent event, ExecutionRequest request, String orderId, int attempts) {
        Instant now = clock.instant();
        LedgerEntry entry = ledger.record(event.symbol(), event.direction(), now);
        try {
            ledgerStore.save(entry);
        } catch (Exception e) {
            log.error("Failed to persist ledger entry {}", entry, e);
            safeNotify("⚠ " + event.symbol() + " ledger not persisted: " + safeError(e));
        }

        try {
            journal.logTrade(mode.name(), request.symbol().value(), request.side().name(), request.quantity(), orderId,
                    event.direction() + " cross");
        } catch (Exception e) {
            log.warn("Trade journal write failed for order {}", orderId, e);
        }

        log.info("Executed {} {} qty={} orderId={} after {} attempt(s)",
                request.side(), request.symbol(), request.quantity(), orderId, attempts);
        String icon = request.side() == OrderSide.BUY ? "🟢" : "🔴";
        safeNotify(icon + " " + mode + " " + request.side() + " " + request.symbol()
                + " qty=" + request.quantity() + " orderId=" + orderId);
        return ExecutionOutcome.executed(event, orderId, attempts);
    }

    private ExecutionOutcome fail(CrossoverEvent event, ExecutionRequest request, boolean permanent,
                                  int attempts, String reason) {
        log.error("Order {} {} failed ({}, {} attempt(s)): {}",
                request.side(), request.symbol(), permanent ? "permanent" : "transient", attempts, reason);
        safeNotify("❌ " + mode + " " + request.side() + " " + request.symbol() + " failed after "
                + attempts + " attempt(s): " + reason);
        return ExecutionOutcome.failed(event, permanent, attempts, reason);
    }

    private static String signalMessage(CrossoverEvent event, SymbolSettings s) {
        String icon = event.direction() == CrossDirection.GOLDEN ? "📈" : "📉";
        return icon + " " + event.direction() + " cross " + event.symbol() + "\n" + describe(event, s.priceScale());
    }

    private static String describe(CrossoverEvent event, int scale) {
        return "short=" + MAState.format(event.shortValue(), scale) + " long=" + MAState.format(event.longValue(), scale);
    }

    private void safeNotify(String message) {
        try {
            notifier.send(message);
        } catch (Exception e) {
            log.warn("Notification failed: {}", e.getMessage());
        }
    }

    private static String safeError(Exception e) {
        String msg = e.getMessage();
        if (msg == null || msg.isBlank()) msg = e.getClass().getSimpleName();
        if (msg.length() > 500) msg = msg.substring(0, 500);
        return msg;
    }
}
