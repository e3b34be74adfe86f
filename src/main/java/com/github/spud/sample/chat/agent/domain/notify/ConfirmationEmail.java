package com.github.spud.sample.chat.agent.domain.notify;

import com.github.spud.sample.chat.agent.domain.directory.DirectoryUser;

/**
 * Subject and body of the verification confirmation
 */
public record ConfirmationEmail(String to, String subject, String body) {

  public static ConfirmationEmail of(DirectoryUser user, String appName) {
    String subject = "WhatsApp verification confirmed - " + appName;
    String body = "Hello " + user.getName() + ",\n\n"
      + "Your identity has been verified on " + appName + " via WhatsApp.\n\n"
      + "If you did not start this verification, please contact support immediately.\n\n"
      + "Best regards,\n"
      + "The " + appName + " Team";
    return new ConfirmationEmail(user.getEmail(), subject, body);
  }
}
