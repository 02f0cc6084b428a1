package com.crosswatch.worker.engine;

import com.crosswatch.application.engine.CrossoverEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;

/**
 * Graceful shutdown for production:
 * - stop evaluating new samples and close the price streams
 * - let in-flight orders finish (bounded by engine.shutdownTimeoutMs), then interrupt
 */
@Component
public class GracefulShutdownHook {

  private static final Logger log = LoggerFactory.getLogger(GracefulShutdownHook.class);

  private final CrossoverEngine engine;

  public GracefulShutdownHook(CrossoverEngine engine) {
    this.engine = engine;
  }

  @PreDestroy
  public void onShutdown() {
    try {
      engine.shutdown();
      log.info("Engine stopped\n{}", engine.statusText());
    } catch (Exception e) {
      log.warn("Graceful shutdown hook failed", e);
    }
  }
}
