package com.crosswatch.worker.metrics;

import com.crosswatch.application.engine.CrossoverEngine;
import com.crosswatch.application.engine.SymbolWorker;
import com.crosswatch.domain.market.Symbol;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Per-symbol worker gauges.
 *
 * Exposes:
 * - crosswatch.symbols.monitored
 * - crosswatch.symbol.samples.accepted{symbol}
 * - crosswatch.symbol.events.detected{symbol}
 * - crosswatch.symbol.phase{symbol} (ordinal of SymbolPhase)
 */
@Component
public class WorkerMetrics {

  private final MeterRegistry registry;

  public WorkerMetrics(MeterRegistry registry) {
    this.registry = registry;
  }

  /** Registers gauges for the engine's workers; call after start(). */
  public void bind(CrossoverEngine engine) {
    Map<Symbol, SymbolWorker> workers = engine.workers();

    Gauge.builder("crosswatch.symbols.monitored", workers, Map::size)
        .description("Symbols with a running worker")
        .register(registry);

    for (Map.Entry<Symbol, SymbolWorker> e : workers.entrySet()) {
      String symbol = e.getKey().value();
      SymbolWorker w = e.getValue();

      Gauge.builder("crosswatch.symbol.samples.accepted", w, x -> x.acceptedSamples())
          .tag("symbol", symbol)
          .register(registry);
      Gauge.builder("crosswatch.symbol.events.detected", w, x -> x.detectedEvents())
          .tag("symbol", symbol)
          .register(registry);
      Gauge.builder("crosswatch.symbol.phase", w, x -> x.phase().ordinal())
          .tag("symbol", symbol)
          .register(registry);
    }
  }
}
