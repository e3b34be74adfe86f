package com.github.spud.sample.chat.agent.application.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Worker pools for blocking infrastructure calls.
 * <p>
 * Callers already run on {@link Schedulers#boundedElastic()} and block on the result, so these
 * calls get pools of their own; sharing the caller pool would starve it under load.
 */
@Configuration
public class SchedulerConfig {

  public static final String DIRECTORY_SCHEDULER = "directoryScheduler";
  public static final String NOTIFY_SCHEDULER = "notifyScheduler";

  @Bean(name = DIRECTORY_SCHEDULER, destroyMethod = "dispose")
  public Scheduler directoryScheduler(AgentProperties properties) {
    return Schedulers.newBoundedElastic(properties.getDirectory().getLookupThreads(),
      Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE, "directory-lookup");
  }

  @Bean(name = NOTIFY_SCHEDULER, destroyMethod = "dispose")
  public Scheduler notifyScheduler(AgentProperties properties) {
    return Schedulers.newBoundedElastic(properties.getNotify().getThreads(),
      Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE, "notify");
  }
}
