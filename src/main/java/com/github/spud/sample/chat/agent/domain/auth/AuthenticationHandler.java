package com.github.spud.sample.chat.agent.domain.auth;

import com.github.spud.sample.chat.agent.domain.directory.DirectoryLookup;
import com.github.spud.sample.chat.agent.domain.directory.DirectoryUnavailableException;
import com.github.spud.sample.chat.agent.domain.directory.DirectoryUser;
import com.github.spud.sample.chat.agent.domain.handler.AgentHandler;
import com.github.spud.sample.chat.agent.domain.handler.AgentResponse;
import com.github.spud.sample.chat.agent.domain.notify.Notifier;
import com.github.spud.sample.chat.agent.domain.session.Session;
import com.github.spud.sample.chat.agent.domain.state.AuthEvent;
import com.github.spud.sample.chat.agent.domain.state.AuthState;
import com.github.spud.sample.chat.agent.domain.state.AuthStateMachineDriver;
import com.github.spud.sample.chat.agent.util.EmailMasker;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Authenticates a sender: phone lookup first, client code as fallback.
 * <ol>
 *   <li>First contact: the sender address is looked up as a phone. A match verifies silently.</li>
 *   <li>No match: the user is asked for their client code.</li>
 *   <li>The next message is looked up as a client code (trimmed, case-sensitive). A match
 *   verifies and triggers a confirmation notification; a miss rejects.</li>
 *   <li>Rejected senders stay rejected until they log out.</li>
 * </ol>
 * Lookups are pure queries, so redelivering a message against the same state repeats the same
 * transition. {@link DirectoryUnavailableException} propagates untouched: an outage is never a
 * rejection.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuthenticationHandler implements AgentHandler {

  private final DirectoryLookup directoryLookup;
  private final Notifier notifier;
  private final AuthStateMachineDriver stateMachineDriver;
  private final AgentReplies replies;

  @Override
  public String name() {
    return "auth";
  }

  @Override
  public AgentResponse handle(String message, Session session) {
    return authenticate(message, session).response();
  }

  public AuthResult authenticate(String message, Session session) {
    return switch (session.getAuthState()) {
      case UNVERIFIED -> checkPhone(session);
      case AWAITING_CLIENT_CODE -> checkClientCode(message, session);
      case REJECTED -> new AuthResult(AgentResponse.of(replies.rejected()), session);
      case VERIFIED -> new AuthResult(AgentResponse.of(replies.alreadyVerified()), session);
    };
  }

  private AuthResult checkPhone(Session session) {
    String phone = session.getSenderAddress();
    Optional<DirectoryUser> match = directoryLookup.findByPhone(phone);

    if (match.isPresent()) {
      DirectoryUser user = match.get();
      Session next = transition(session, AuthEvent.PHONE_MATCHED, user.getUserId());
      log.info("Phone {} matched user {}", phone, user.getUserId());
      return new AuthResult(AgentResponse.of(replies.verifiedByPhone(user)), next);
    }

    Session next = transition(session, AuthEvent.PHONE_NOT_FOUND, null);
    log.info("Phone {} not found in directory, requesting client code", phone);
    return new AuthResult(AgentResponse.of(replies.askClientCode()), next);
  }

  private AuthResult checkClientCode(String message, Session session) {
    String clientCode = message == null ? "" : message.trim();
    if (clientCode.isEmpty()) {
      // blank input is no attempt, so it cannot reject
      return new AuthResult(AgentResponse.of(replies.askClientCodeAgain()), session);
    }

    Optional<DirectoryUser> match = directoryLookup.findByClientCode(clientCode);
    if (match.isEmpty()) {
      Session next = transition(session, AuthEvent.CLIENT_CODE_NOT_FOUND, null);
      log.info("Client code {} not found for {}, sender rejected", clientCode,
        session.getSenderAddress());
      return new AuthResult(AgentResponse.of(replies.rejected()), next);
    }

    DirectoryUser user = match.get();
    Session next = transition(session, AuthEvent.CLIENT_CODE_MATCHED, user.getUserId());
    log.info("Client code {} matched user {} for {}", clientCode, user.getUserId(),
      session.getSenderAddress());

    boolean sent = sendConfirmation(user);
    AgentResponse response = AgentResponse.builder()
      .replyText(replies.verifiedByClientCode(user, sent))
      .notificationSent(sent)
      .build();
    return new AuthResult(response, next);
  }

  private Session transition(Session session, AuthEvent event, String userId) {
    AuthState target = stateMachineDriver.fire(session.getSenderAddress(), session.getAuthState(),
      event);
    log.info("Session {} state change: {} -> {}", session.getSenderAddress(),
      session.getAuthState(), target);
    return session.transitionTo(target, userId);
  }

  // verification already stands; a failed notification only changes the reply
  private boolean sendConfirmation(DirectoryUser user) {
    try {
      boolean sent = notifier.sendConfirmation(user);
      if (!sent) {
        log.warn("Confirmation for user {} was not delivered to {}", user.getUserId(),
          EmailMasker.mask(user.getEmail()));
      }
      return sent;
    } catch (RuntimeException e) {
      log.error("Notifier failed for user {}", user.getUserId(), e);
      return false;
    }
  }
}
