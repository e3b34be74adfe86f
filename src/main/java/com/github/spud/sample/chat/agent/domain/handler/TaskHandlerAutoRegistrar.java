package com.github.spud.sample.chat.agent.domain.handler;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Registers every {@link TaskHandler} bean in the {@link TaskHandlerRegistry} at startup
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TaskHandlerAutoRegistrar {

  private final ObjectProvider<TaskHandler> taskHandlerProvider;
  private final TaskHandlerRegistry registry;

  @PostConstruct
  public void registerAllTaskHandlers() {
    log.info("Auto-registering TaskHandler beans from Spring container...");
    taskHandlerProvider.orderedStream().forEach(registry::register);
    log.info("Auto-registration complete: {} task handlers {}", registry.size(), registry.names());
  }
}
