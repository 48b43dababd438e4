package com.partnerbridge.bothub.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Single scheduling thread for tenant schedules, and a bounded pool for back-office fan-out
 * (balance queries).
 */
@Configuration
public class SchedulerConfig {

  public static final String SCHEDULE_RUNNER = "schedule-runner";
  public static final String FANOUT_EXECUTOR = "fanout-executor";

  @Bean(name = SCHEDULE_RUNNER)
  public ThreadPoolTaskScheduler scheduleRunner() {
    ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
    s.setPoolSize(1);
    s.setThreadNamePrefix("schedule-");
    s.setWaitForTasksToCompleteOnShutdown(false);
    s.initialize();
    return s;
  }

  @Bean(name = FANOUT_EXECUTOR)
  public ThreadPoolTaskExecutor fanoutExecutor() {
    ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
    e.setCorePoolSize(4);
    e.setMaxPoolSize(8);
    e.setQueueCapacity(500);
    e.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    e.setThreadNamePrefix("fanout-");
    e.initialize();
    return e;
  }
}
