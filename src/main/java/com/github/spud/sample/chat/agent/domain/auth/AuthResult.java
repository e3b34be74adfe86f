package com.github.spud.sample.chat.agent.domain.auth;

import com.github.spud.sample.chat.agent.domain.handler.AgentResponse;
import com.github.spud.sample.chat.agent.domain.session.Session;

/**
 * Reply plus the session the sender should have afterwards
 */
public record AuthResult(AgentResponse response, Session session) {
}
