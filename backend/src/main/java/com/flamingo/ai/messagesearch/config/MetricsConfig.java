package com.flamingo.ai.messagesearch.config;

import com.flamingo.ai.messagesearch.service.store.MessageStore;
import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Metrics wiring: {@code @Timed} support and index coverage gauges. */
@Configuration
public class MetricsConfig {

  /** Backs {@code corpus.rebuild} and {@code search.duration}. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /** Gauges are read on scrape, so each one costs a count query. */
  @Bean
  public MeterBinder indexCoverageMetrics(MessageStore messageStore) {
    return registry -> {
      Gauge.builder("messages.total", messageStore, MessageStore::countMessages)
          .description("Stored messages")
          .register(registry);
      Gauge.builder("messages.embedded", messageStore, MessageStore::countEmbedded)
          .description("Messages with an embedding")
          .register(registry);
    };
  }
}
