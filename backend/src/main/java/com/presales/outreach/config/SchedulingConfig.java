package com.presales.outreach.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class SchedulingConfig {

  @Bean
  Clock clock(@Value("${app.timezone:Asia/Kolkata}") String timezone) {
    return Clock.system(ZoneId.of(timezone));
  }

  /**
   * Shared by the periodic sweeps and the one-shot callback triggers. Three threads let the
   * orchestrator, the reconciler and a due callback run side by side.
   */
  @Bean
  ThreadPoolTaskScheduler taskScheduler(@Value("${app.scheduler.pool-size:3}") int poolSize) {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(poolSize);
    scheduler.setThreadNamePrefix("outreach-sched-");
    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds(30);
    scheduler.setRemoveOnCancelPolicy(true);
    return scheduler;
  }
}
