package com.github.spud.sample.chat.agent.infrastructure.notify;

import com.github.spud.sample.chat.agent.application.config.AgentProperties;
import com.github.spud.sample.chat.agent.application.config.SchedulerConfig;
import com.github.spud.sample.chat.agent.domain.directory.DirectoryUser;
import com.github.spud.sample.chat.agent.domain.notify.ConfirmationEmail;
import com.github.spud.sample.chat.agent.domain.notify.Notifier;
import com.github.spud.sample.chat.agent.util.EmailMasker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Sends the confirmation through the configured SMTP server ({@code spring.mail.*})
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.notify.mode", havingValue = "email")
public class EmailNotifier implements Notifier {

  private final JavaMailSender mailSender;
  private final AgentProperties properties;
  private final Scheduler scheduler;

  public EmailNotifier(JavaMailSender mailSender, AgentProperties properties,
    @Qualifier(SchedulerConfig.NOTIFY_SCHEDULER) Scheduler scheduler) {
    this.mailSender = mailSender;
    this.properties = properties;
    this.scheduler = scheduler;
  }

  @Override
  public boolean sendConfirmation(DirectoryUser user) {
    ConfirmationEmail email = ConfirmationEmail.of(user, properties.getAppName());
    SimpleMailMessage message = new SimpleMailMessage();
    message.setFrom(properties.getNotify().getFrom());
    message.setTo(email.to());
    message.setSubject(email.subject());
    message.setText(email.body());

    String masked = EmailMasker.mask(email.to());
    log.info("Sending confirmation email to {}", masked);
    try {
      Mono.fromRunnable(() -> mailSender.send(message))
        .subscribeOn(scheduler)
        .timeout(properties.getNotify().getTimeout())
        .block();
      log.info("Confirmation email sent to {}", masked);
      return true;
    } catch (RuntimeException e) {
      log.warn("Failed to send confirmation email to {}: {}", masked, e.getMessage(), e);
      return false;
    }
  }
}
