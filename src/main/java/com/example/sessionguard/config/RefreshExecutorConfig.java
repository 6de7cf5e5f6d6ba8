package com.example.sessionguard.config;

import com.example.sessionguard.properties.ApplicationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Threads and time for the refresh protocol.
 * <p>
 * Backend exchanges run on their own executor so that a request which stops waiting
 * (timeout, client disconnect) never aborts an exchange mid-flight.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
public class RefreshExecutorConfig {

  public static final String REFRESH_EXECUTOR = "refreshExecutor";

  @Bean(name = REFRESH_EXECUTOR)
  public ThreadPoolTaskExecutor refreshExecutor(ApplicationProperties properties) {
    ApplicationProperties.RefreshProperties.ExecutorProperties executorProps =
        properties.refresh().executor();

    log.info("Configuring refresh executor: core={}, max={}, queue={}",
             executorProps.corePoolSize(), executorProps.maxPoolSize(), executorProps.queueCapacity());

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(executorProps.corePoolSize());
    executor.setMaxPoolSize(executorProps.maxPoolSize());
    executor.setQueueCapacity(executorProps.queueCapacity());
    executor.setThreadNamePrefix("token-refresh-");
    // Let in-flight exchanges finish on shutdown
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(10);
    return executor;
  }

  /**
   * UTC clock; every expiry comparison goes through it.
   */
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
