package com.flamingo.ai.recall.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for application metrics. */
@Configuration
public class MetricsConfig {

  /**
   * Enables the @Timed annotation on search, indexing and embedding methods.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /** Tags every meter with the application and the active index backend. */
  @Bean
  public MeterRegistryCustomizer<MeterRegistry> recallCommonTags(
      @Value("${spring.application.name:recall}") String applicationName,
      RecallConfig recallConfig) {
    return registry ->
        registry
            .config()
            .commonTags(
                "application", applicationName,
                "index_backend", recallConfig.getIndex().getBackend());
  }
}
