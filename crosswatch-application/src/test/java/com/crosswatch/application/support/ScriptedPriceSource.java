package com.crosswatch.application.support;

import com.crosswatch.application.error.PriceStreamClosedException;
import com.crosswatch.application.ports.PriceSourcePort;
import com.crosswatch.application.ports.PriceSubscription;
import com.crosswatch.domain.market.PriceSample;
import com.crosswatch.domain.market.Symbol;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Price source fake. Each subscribe() consumes the next scripted session for the symbol;
 * a session emits its samples and then either closes the stream or idles until closed.
 * With no sessions left the subscription idles.
 */
public class ScriptedPriceSource implements PriceSourcePort {

    private record Session(List<PriceSample> samples, boolean thenClose) {}

    private final Map<Symbol, List<PriceSample>> history = new ConcurrentHashMap<>();
    private final Map<Symbol, Deque<Session>> sessions = new ConcurrentHashMap<>();
    private final Map<Symbol, List<Optional<Instant>>> subscribedAfter = new ConcurrentHashMap<>();
    private final Map<Symbol, Boolean> brokenSymbols = new ConcurrentHashMap<>();

    public ScriptedPriceSource history(Symbol symbol, List<PriceSample> samples) {
        history.put(symbol, List.copyOf(samples));
        return this;
    }

    public ScriptedPriceSource session(Symbol symbol, List<PriceSample> samples, boolean thenClose) {
        sessions.computeIfAbsent(symbol, s -> new ConcurrentLinkedDeque<>()).add(new Session(samples, thenClose));
        return this;
    }

    /** Every subscribe() for the symbol fails with an I/O error. */
    public ScriptedPriceSource broken(Symbol symbol) {
        brokenSymbols.put(symbol, true);
        return this;
    }

    public List<Optional<Instant>> subscriptions(Symbol symbol) {
        return List.copyOf(subscribedAfter.getOrDefault(symbol, Collections.emptyList()));
    }

    @Override
    public PriceSubscription subscribe(Symbol symbol, Instant after) throws IOException {
        subscribedAfter.computeIfAbsent(symbol, s -> new CopyOnWriteArrayList<>()).add(Optional.ofNullable(after));
        if (brokenSymbols.containsKey(symbol)) throw new IOException("feed unavailable for " + symbol);

        Deque<Session> queue = sessions.get(symbol);
        Session next = queue == null ? null : queue.poll();
        QueueSubscription sub = new QueueSubscription();
        if (next != null) {
            next.samples().forEach(sub::push);
            if (next.thenClose()) sub.close();
        }
        return sub;
    }

    @Override
    public List<PriceSample> history(Symbol symbol, int limit) {
        List<PriceSample> all = history.getOrDefault(symbol, List.of());
        return new ArrayList<>(all.subList(Math.max(0, all.size() - limit), all.size()));
    }

    static final class QueueSubscription implements PriceSubscription {

        private static final Object CLOSED = new Object();

        private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();

        void push(PriceSample sample) {
            queue.add(sample);
        }

        @Override
        public PriceSample next() throws InterruptedException, PriceStreamClosedException {
            Object o = queue.take();
            if (o == CLOSED) {
                queue.add(CLOSED);
                throw new PriceStreamClosedException("stream closed");
            }
            return (PriceSample) o;
        }

        @Override
        public void close() {
            queue.add(CLOSED);
        }
    }
}
