package com.github.spud.sample.chat.agent.infrastructure.notify;

import com.github.spud.sample.chat.agent.application.config.AgentProperties;
import com.github.spud.sample.chat.agent.domain.directory.DirectoryUser;
import com.github.spud.sample.chat.agent.domain.notify.ConfirmationEmail;
import com.github.spud.sample.chat.agent.domain.notify.Notifier;
import com.github.spud.sample.chat.agent.util.EmailMasker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Writes the confirmation to the log instead of mailing it. Default when no SMTP server is set up.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.notify.mode", havingValue = "log", matchIfMissing = true)
public class LoggingNotifier implements Notifier {

  private final AgentProperties properties;

  @Override
  public boolean sendConfirmation(DirectoryUser user) {
    ConfirmationEmail email = ConfirmationEmail.of(user, properties.getAppName());
    log.info("Confirmation for user {} (would be sent to {}): {}", user.getUserId(),
      EmailMasker.mask(email.to()), email.subject());
    return true;
  }
}
