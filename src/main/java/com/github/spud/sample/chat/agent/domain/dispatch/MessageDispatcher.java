package com.github.spud.sample.chat.agent.domain.dispatch;

import com.github.spud.sample.chat.agent.application.config.AgentProperties;
import com.github.spud.sample.chat.agent.domain.auth.AgentReplies;
import com.github.spud.sample.chat.agent.domain.auth.AuthResult;
import com.github.spud.sample.chat.agent.domain.auth.AuthenticationHandler;
import com.github.spud.sample.chat.agent.domain.directory.DirectoryUnavailableException;
import com.github.spud.sample.chat.agent.domain.handler.AgentResponse;
import com.github.spud.sample.chat.agent.domain.handler.TaskHandler;
import com.github.spud.sample.chat.agent.domain.handler.TaskHandlerRegistry;
import com.github.spud.sample.chat.agent.domain.handler.UnregisteredCapabilityException;
import com.github.spud.sample.chat.agent.domain.session.SenderLockRegistry;
import com.github.spud.sample.chat.agent.domain.session.Session;
import com.github.spud.sample.chat.agent.domain.session.SessionStore;
import com.github.spud.sample.chat.agent.domain.session.SessionStoreException;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Front door for inbound messages.
 * <p>
 * Unverified senders go to the {@link AuthenticationHandler}, whose resulting session is stored
 * before replying. Verified senders go to a task handler: {@code /name ...} selects one by name,
 * anything else goes to the default handler. Each sender's get-handle-put runs under its own lock,
 * so concurrent messages from one sender are processed one at a time.
 * <p>
 * Routing misses and directory outages become replies. Only {@link SessionStoreException} escapes,
 * so the transport can redeliver.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MessageDispatcher {

  private final SessionStore sessionStore;
  private final SenderLockRegistry senderLocks;
  private final AuthenticationHandler authenticationHandler;
  private final TaskHandlerRegistry taskHandlers;
  private final AgentReplies replies;
  private final AgentProperties properties;
  private final Clock clock;

  public String route(String senderAddress, String messageText) {
    return dispatch(senderAddress, messageText).getReplyText();
  }

  public AgentResponse dispatch(String senderAddress, String messageText) {
    return senderLocks.withLock(senderAddress, () -> doDispatch(senderAddress, messageText));
  }

  /**
   * Logout: the sender's next message starts from the phone lookup again
   */
  public void logout(String senderAddress) {
    senderLocks.withLock(senderAddress, () -> sessionStore.clear(senderAddress));
    log.info("Sender {} logged out", senderAddress);
  }

  private AgentResponse doDispatch(String senderAddress, String messageText) {
    Session session = loadSession(senderAddress);
    try {
      if (!session.isVerified()) {
        return authenticate(senderAddress, messageText, session);
      }
      if (properties.getSession().getTtl() != null) {
        // TTL counts idle time, so activity keeps a verified session alive
        sessionStore.touch(senderAddress);
      }
      return runTask(senderAddress, messageText, session);
    } catch (SessionStoreException e) {
      throw e;
    } catch (DirectoryUnavailableException e) {
      log.warn("Directory unavailable while handling message from {}: {}", senderAddress,
        e.getMessage());
      return AgentResponse.of(replies.temporarilyUnavailable());
    } catch (RuntimeException e) {
      log.error("Unexpected error handling message from {}", senderAddress, e);
      return AgentResponse.of(replies.temporarilyUnavailable());
    }
  }

  private Session loadSession(String senderAddress) {
    Session session = sessionStore.get(senderAddress);

    if (!session.isConsistent()) {
      log.warn("Corrupt session for {} (state={}, userId={}), resetting", senderAddress,
        session.getAuthState(), session.getUserId());
      sessionStore.clear(senderAddress);
      return Session.initial(senderAddress);
    }

    Duration ttl = properties.getSession().getTtl();
    if (ttl != null && session.getLastUpdated() != null
      && session.getLastUpdated().isBefore(clock.instant().minus(ttl))) {
      log.info("Session for {} expired (last updated {}), starting over", senderAddress,
        session.getLastUpdated());
      sessionStore.clear(senderAddress);
      return Session.initial(senderAddress);
    }

    return session;
  }

  private AgentResponse authenticate(String senderAddress, String messageText, Session session) {
    log.info("Routing {} -> {}", senderAddress, authenticationHandler.name());
    AuthResult result = authenticationHandler.authenticate(messageText, session);
    sessionStore.put(senderAddress, result.session());
    return result.response();
  }

  private AgentResponse runTask(String senderAddress, String messageText, Session session) {
    String capability = resolveCapability(messageText);
    TaskHandler handler;
    try {
      handler = taskHandlers.require(capability);
    } catch (UnregisteredCapabilityException e) {
      log.info("No task handler '{}' for {}", e.getCapability(), senderAddress);
      return AgentResponse.of(replies.unknownCommand(e.getCapability(), taskHandlers.names()));
    }

    log.info("Routing {} (user {}) -> {}", senderAddress, session.getUserId(), handler.name());
    AgentResponse response = handler.handle(messageText, session);
    if (response.isEndSession()) {
      sessionStore.clear(senderAddress);
      log.info("Task handler {} ended the session of {}", handler.name(), senderAddress);
    }
    return response;
  }

  String resolveCapability(String messageText) {
    String prefix = properties.getDispatch().getCommandPrefix();
    String text = messageText == null ? "" : messageText.trim();
    if (text.length() > prefix.length() && text.startsWith(prefix)) {
      String command = text.substring(prefix.length()).split("\\s+", 2)[0];
      if (!command.isEmpty()) {
        return command.toLowerCase(Locale.ROOT);
      }
    }
    return properties.getDispatch().getDefaultHandler();
  }
}
