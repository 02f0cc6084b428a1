package com.crosswatch.worker.engine;

import com.crosswatch.application.engine.CrossoverEngine;
import com.crosswatch.worker.metrics.WorkerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Starts monitoring once the context is up. A ledger that cannot be read aborts startup.
 */
@Component
public class EngineStartup implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(EngineStartup.class);

  private final CrossoverEngine engine;
  private final WorkerMetrics metrics;

  public EngineStartup(CrossoverEngine engine, WorkerMetrics metrics) {
    this.engine = engine;
    this.metrics = metrics;
  }

  @Override
  public void run(ApplicationArguments args) {
    engine.start();
    metrics.bind(engine);
    log.info("CrossWatch worker started\n{}", engine.statusText());
  }
}
