package com.scholary.djset.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools for job processing.
 *
 * <p>{@code jobExecutor} runs one orchestration per job with a bounded queue. {@code splitExecutor}
 * runs the per-track units of every job; its queue is unbounded because each pipeline run bounds
 * its own concurrency, and its tasks inherit the submitting job's MDC. Job deadlines fire on a
 * single scheduler thread.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "jobExecutor")
  public Executor jobExecutor(SplitterProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.jobExecutorThreads());
    executor.setMaxPoolSize(properties.jobExecutorThreads());
    executor.setQueueCapacity(properties.jobExecutorQueueSize());
    executor.setThreadNamePrefix("job-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "splitExecutor")
  public Executor splitExecutor(SplitterProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.splitExecutorThreads());
    executor.setMaxPoolSize(properties.splitExecutorThreads());
    executor.setThreadNamePrefix("split-");
    executor.setTaskDecorator(new MdcTaskDecorator());
    executor.initialize();
    return executor;
  }

  @Bean(name = "jobDeadlineScheduler")
  public TaskScheduler jobDeadlineScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("job-deadline-");
    scheduler.initialize();
    return scheduler;
  }
}
