package com.github.spud.sample.chat.agent.domain.handler;

/**
 * Handler for traffic from verified senders, registered under its {@link #name()}.
 * <p>
 * The session passed in is always verified and carries the resolved {@code userId}.
 */
public interface TaskHandler extends AgentHandler {

  /**
   * One line shown in the command list
   */
  String description();
}
