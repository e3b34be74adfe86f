package com.github.spud.sample.chat.agent.domain.auth;

import com.github.spud.sample.chat.agent.application.config.AgentProperties;
import com.github.spud.sample.chat.agent.domain.directory.DirectoryUser;
import com.github.spud.sample.chat.agent.util.EmailMasker;
import java.util.Collection;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Every text the end user can receive from the gateway itself. Task handlers write their own.
 */
@Component
@RequiredArgsConstructor
public class AgentReplies {

  private final AgentProperties properties;

  public String verifiedByPhone(DirectoryUser user) {
    String help = command(properties.getDispatch().getDefaultHandler());
    return "✅ Welcome back, *" + user.getName() + "*! You have been verified.\n\n"
      + "How can I help you today? Send *" + help + "* to see what I can do.";
  }

  public String askClientCode() {
    return "🔍 I couldn't find an account linked to this phone number.\n\n"
      + "Please reply with your *Client Code* so I can look you up.";
  }

  public String askClientCodeAgain() {
    return "Please reply with your *Client Code* (for example ACME-1001).";
  }

  public String verifiedByClientCode(DirectoryUser user, boolean notificationSent) {
    StringBuilder reply = new StringBuilder()
      .append("✅ Verified! Welcome, *").append(user.getName()).append("*.");
    if (notificationSent) {
      reply.append("\n\nA confirmation email has been sent to *")
        .append(EmailMasker.mask(user.getEmail())).append("*.");
    }
    return reply.toString();
  }

  public String rejected() {
    return "❌ Sorry, I couldn't verify your identity.\n\n"
      + "Please contact our support team at " + properties.getSupportContact()
      + " for help. Send *logout* to start over.";
  }

  public String alreadyVerified() {
    return "You are already verified. How can I help you today?";
  }

  public String temporarilyUnavailable() {
    return "⚠️ Something went wrong on our side. Please try again in a moment.";
  }

  public String unknownCommand(String capability, Collection<String> available) {
    return "🤔 I don't know the command *" + command(capability) + "*.\n\n"
      + "Available commands: " + formatCommands(available);
  }

  public String loggedOut() {
    return "👋 You have been logged out. Send any message to start again.";
  }

  public String formatCommands(Collection<String> commands) {
    if (commands.isEmpty()) {
      return "none yet";
    }
    return String.join(", ", commands.stream().map(this::command).toList());
  }

  private String command(String name) {
    return properties.getDispatch().getCommandPrefix() + name;
  }
}
