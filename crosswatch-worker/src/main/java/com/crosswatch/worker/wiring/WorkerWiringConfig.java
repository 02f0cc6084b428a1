package com.crosswatch.worker.wiring;

import com.crosswatch.application.engine.CrossoverEngine;
import com.crosswatch.application.ports.ConfigPort;
import com.crosswatch.infrastructure.config.FileConfigService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

@Configuration
public class WorkerWiringConfig {

  @Bean
  public ConfigPort configPort() throws IOException {
    return FileConfigService.defaultFromWorkingDir();
  }

  // stopped by GracefulShutdownHook, not by an inferred destroy method
  @Bean(destroyMethod = "")
  public CrossoverEngine crossoverEngine(ConfigPort config) {
    return Bootstrap.createEngine(config);
  }
}
