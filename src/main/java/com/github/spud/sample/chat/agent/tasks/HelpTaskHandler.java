package com.github.spud.sample.chat.agent.tasks;

import com.github.spud.sample.chat.agent.application.config.AgentProperties;
import com.github.spud.sample.chat.agent.domain.handler.AgentResponse;
import com.github.spud.sample.chat.agent.domain.handler.TaskHandler;
import com.github.spud.sample.chat.agent.domain.handler.TaskHandlerRegistry;
import com.github.spud.sample.chat.agent.domain.session.Session;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Default handler: lists the available commands
 */
@Component
@RequiredArgsConstructor
public class HelpTaskHandler implements TaskHandler {

  private final TaskHandlerRegistry registry;
  private final AgentProperties properties;

  @Override
  public String name() {
    return "help";
  }

  @Override
  public String description() {
    return "show this list";
  }

  @Override
  public AgentResponse handle(String message, Session session) {
    String prefix = properties.getDispatch().getCommandPrefix();
    StringBuilder reply = new StringBuilder("👋 You are verified with ")
      .append(properties.getAppName()).append(". Here is what I can do:\n");
    for (TaskHandler handler : registry.handlers()) {
      reply.append("\n*").append(prefix).append(handler.name()).append("* - ")
        .append(handler.description());
    }
    reply.append("\n\nType *logout* at any time to end your session.");
    return AgentResponse.of(reply.toString());
  }
}
