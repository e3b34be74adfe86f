package com.github.spud.sample.chat.agent.tasks;

import com.github.spud.sample.chat.agent.domain.directory.DirectoryLookup;
import com.github.spud.sample.chat.agent.domain.handler.AgentResponse;
import com.github.spud.sample.chat.agent.domain.handler.TaskHandler;
import com.github.spud.sample.chat.agent.domain.session.Session;
import com.github.spud.sample.chat.agent.util.EmailMasker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Shows the directory record the sender was verified as
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProfileTaskHandler implements TaskHandler {

  private final DirectoryLookup directoryLookup;

  @Override
  public String name() {
    return "profile";
  }

  @Override
  public String description() {
    return "show the account you are verified as";
  }

  @Override
  public AgentResponse handle(String message, Session session) {
    return directoryLookup.findByUserId(session.getUserId())
      .map(user -> AgentResponse.of("👤 *" + user.getName() + "*\n"
        + "Company: " + user.getCompanyId() + "\n"
        + "Client code: " + user.getClientCode() + "\n"
        + "Email: " + EmailMasker.mask(user.getEmail())))
      .orElseGet(() -> {
        log.warn("Verified user {} is no longer in the directory", session.getUserId());
        return AgentResponse.of("I couldn't load your account details right now.");
      });
  }
}
