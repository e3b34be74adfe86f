package com.github.spud.sample.chat.agent.domain.handler;

import com.github.spud.sample.chat.agent.domain.session.Session;

/**
 * Uniform contract of everything that can answer a message
 */
public interface AgentHandler {

  /**
   * Name used in logs and routing
   */
  String name();

  /**
   * @param message raw text sent by the user
   * @param session the sender's session; handlers never modify it
   */
  AgentResponse handle(String message, Session session);
}
