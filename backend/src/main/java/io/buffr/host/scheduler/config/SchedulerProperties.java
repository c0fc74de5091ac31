package io.buffr.host.scheduler.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration properties for the dispatch loop and executor.
 *
 * @param pollInterval time between dispatch ticks
 * @param handlerTimeout how long a single action handler may run before the attempt is TIMED_OUT
 * @param dispatchPoolSize worker threads that run action handlers
 * @param dispatchQueueCapacity dispatches that may wait for a free worker before ticks start
 *     rejecting them
 * @param autoStart whether the dispatch loop starts with the application context
 * @param defaultListLimit page size for list queries that do not name one
 */
@ConfigurationProperties(prefix = "scheduler")
public record SchedulerProperties(
    @DefaultValue("30s") Duration pollInterval,
    @DefaultValue("5m") Duration handlerTimeout,
    @DefaultValue("4") int dispatchPoolSize,
    @DefaultValue("100") int dispatchQueueCapacity,
    @DefaultValue("true") boolean autoStart,
    @DefaultValue("100") int defaultListLimit) {

  /** Length of the dispatch claim. Outlives one handler run plus the tick that follows it. */
  public Duration claimLease() {
    return handlerTimeout.plus(pollInterval);
  }
}
