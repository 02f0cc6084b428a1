package com.crosswatch.worker.engine;

import com.crosswatch.application.engine.CrossoverEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Logs per-symbol status lines while the engine runs.
 */
@Component
public class StatusHeartbeat {

  private static final Logger log = LoggerFactory.getLogger(StatusHeartbeat.class);

  private final CrossoverEngine engine;

  public StatusHeartbeat(CrossoverEngine engine) {
    this.engine = engine;
  }

  @Scheduled(initialDelayString = "${crosswatch.worker.statusMs:300000}",
      fixedDelayString = "${crosswatch.worker.statusMs:300000}")
  public void report() {
    if (engine.isRunning()) {
      log.info("Status\n{}", engine.statusText());
    }
  }
}
