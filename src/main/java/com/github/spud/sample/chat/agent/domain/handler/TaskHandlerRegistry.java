package com.github.spud.sample.chat.agent.domain.handler;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Capability name -> task handler. Filled once at startup by {@link TaskHandlerAutoRegistrar}.
 */
@Slf4j
@Component
public class TaskHandlerRegistry {

  private final Map<String, TaskHandler> handlers = Collections.synchronizedMap(new TreeMap<>());

  /**
   * @throws IllegalStateException if another handler already owns the name
   */
  public void register(TaskHandler handler) {
    String name = normalize(handler.name());
    if (name.isEmpty()) {
      throw new IllegalArgumentException("Task handler without a name: " + handler.getClass().getName());
    }
    TaskHandler existing = handlers.putIfAbsent(name, handler);
    if (existing != null) {
      throw new IllegalStateException("Duplicate task handler '" + name + "': "
        + existing.getClass().getSimpleName() + " and " + handler.getClass().getSimpleName());
    }
    log.info("Registered task handler: {}", name);
  }

  public Optional<TaskHandler> find(String capability) {
    return Optional.ofNullable(handlers.get(normalize(capability)));
  }

  public TaskHandler require(String capability) {
    return find(capability).orElseThrow(() -> new UnregisteredCapabilityException(capability));
  }

  /**
   * Registered names in alphabetical order
   */
  public Collection<String> names() {
    synchronized (handlers) {
      return List.copyOf(handlers.keySet());
    }
  }

  public Collection<TaskHandler> handlers() {
    synchronized (handlers) {
      return List.copyOf(handlers.values());
    }
  }

  public int size() {
    return handlers.size();
  }

  private static String normalize(String capability) {
    return capability == null ? "" : capability.trim().toLowerCase(Locale.ROOT);
  }
}
