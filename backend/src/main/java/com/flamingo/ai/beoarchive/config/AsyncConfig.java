package com.flamingo.ai.beoarchive.config;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for the bundle worker pool. */
@Configuration
public class AsyncConfig {

  @Bean(name = "bundleProcessingExecutor")
  public Executor bundleProcessingExecutor(BeoArchiveConfig config) {
    int workers = config.getPipeline().getWorkerThreads();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(workers);
    executor.setMaxPoolSize(workers);
    executor.setQueueCapacity(config.getPipeline().getQueueCapacity());
    executor.setThreadNamePrefix("beo-bundle-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }
}
