package com.flamingo.ai.messagesearch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** Async request handling for the progress stream. */
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

  /** Progress streams are closed by the server after this long; clients reconnect. */
  static final long PROGRESS_STREAM_TIMEOUT_MS = 30 * 60 * 1000L;

  @Override
  public void configureAsyncSupport(AsyncSupportConfigurer configurer) {
    configurer.setTaskExecutor(streamTaskExecutor());
    configurer.setDefaultTimeout(PROGRESS_STREAM_TIMEOUT_MS);
  }

  @Bean(name = "streamTaskExecutor")
  public AsyncTaskExecutor streamTaskExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(8);
    executor.setQueueCapacity(20);
    executor.setThreadNamePrefix("progress-stream-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }
}
