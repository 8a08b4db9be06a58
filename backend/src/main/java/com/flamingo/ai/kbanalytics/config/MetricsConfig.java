package com.flamingo.ai.kbanalytics.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Metrics wiring for the analytics endpoints and background jobs. */
@Configuration
public class MetricsConfig {

  /** Makes {@code @Timed} on service methods record into the shared registry. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }
}
