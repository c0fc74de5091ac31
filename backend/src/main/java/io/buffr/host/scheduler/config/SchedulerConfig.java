package io.buffr.host.scheduler.config;

import io.buffr.host.scheduler.schedule.CustomRecurrenceStrategy;
import io.buffr.host.scheduler.schedule.RecurrenceCalculator;
import java.time.Clock;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
@EnableConfigurationProperties(SchedulerProperties.class)
public class SchedulerConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /** Uses a {@link CustomRecurrenceStrategy} bean for CUSTOM schedules when one is defined. */
  @Bean
  public RecurrenceCalculator recurrenceCalculator(
      ObjectProvider<CustomRecurrenceStrategy> customStrategy) {
    return new RecurrenceCalculator(customStrategy.getIfAvailable(CustomRecurrenceStrategy::daily));
  }

  /** Single thread that fires dispatch ticks. Never runs handler work. */
  @Bean
  public ThreadPoolTaskScheduler scheduleDispatchTicker() {
    var scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("schedule-tick-");
    scheduler.setWaitForTasksToCompleteOnShutdown(false);
    return scheduler;
  }

  @Bean
  public ThreadPoolTaskExecutor scheduleDispatchExecutor(SchedulerProperties properties) {
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.dispatchPoolSize());
    executor.setMaxPoolSize(properties.dispatchPoolSize());
    executor.setQueueCapacity(properties.dispatchQueueCapacity());
    executor.setThreadNamePrefix("schedule-dispatch-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    return executor;
  }
}
