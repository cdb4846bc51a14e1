package com.scholary.mp3.converter.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async conversions.
 *
 * <p>Sets up a bounded thread pool for {@code convertAsync}. A conversion blocks its thread for
 * the whole job (admission wait included), so the pool size caps how many jobs can be waiting or
 * running at once; the queue absorbs bursts beyond that.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "conversionExecutor")
  public Executor conversionExecutor(ConversionProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.asyncExecutorThreads());
    executor.setMaxPoolSize(properties.asyncExecutorThreads());
    executor.setQueueCapacity(properties.asyncExecutorQueueSize());
    executor.setThreadNamePrefix("conversion-");
    executor.initialize();
    return executor;
  }
}
