package com.github.spud.sample.chat.agent.tasks;

import com.github.spud.sample.chat.agent.domain.auth.AgentReplies;
import com.github.spud.sample.chat.agent.domain.handler.AgentResponse;
import com.github.spud.sample.chat.agent.domain.handler.TaskHandler;
import com.github.spud.sample.chat.agent.domain.session.Session;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class LogoutTaskHandler implements TaskHandler {

  private final AgentReplies replies;

  @Override
  public String name() {
    return "logout";
  }

  @Override
  public String description() {
    return "end your session";
  }

  @Override
  public AgentResponse handle(String message, Session session) {
    return AgentResponse.builder()
      .replyText(replies.loggedOut())
      .endSession(true)
      .build();
  }
}
