package com.github.spud.sample.chat.agent.infrastructure.session;

import com.github.spud.sample.chat.agent.domain.session.Session;
import com.github.spud.sample.chat.agent.domain.session.SessionStore;
import com.github.spud.sample.chat.agent.domain.session.SessionStoreException;
import com.github.spud.sample.chat.agent.infrastructure.persistence.entity.ChatSessionEntity;
import com.github.spud.sample.chat.agent.infrastructure.persistence.repository.ChatSessionRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Sessions in the {@code chat_session} table, so they survive restarts.
 * <p>
 * Per-sender locking stays in-process; running several instances needs sticky routing by sender.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.session.store", havingValue = "jpa")
public class JpaSessionStore implements SessionStore {

  private final ChatSessionRepository repository;
  private final Clock clock;

  @Override
  public Session get(String senderAddress) {
    try {
      return repository.findById(senderAddress)
        .map(ChatSessionEntity::toDomain)
        .orElseGet(() -> Session.initial(senderAddress));
    } catch (DataAccessException e) {
      throw new SessionStoreException("Failed to load session for " + senderAddress, e);
    }
  }

  @Override
  public void put(String senderAddress, Session session) {
    try {
      repository.save(ChatSessionEntity.fromDomain(session.touchedAt(clock.instant())));
    } catch (DataAccessException e) {
      throw new SessionStoreException("Failed to store session for " + senderAddress, e);
    }
  }

  @Override
  @Transactional
  public void touch(String senderAddress) {
    try {
      repository.touch(senderAddress, clock.instant());
    } catch (DataAccessException e) {
      throw new SessionStoreException("Failed to touch session for " + senderAddress, e);
    }
  }

  @Override
  public void clear(String senderAddress) {
    try {
      repository.deleteById(senderAddress);
      log.info("Session cleared for {}", senderAddress);
    } catch (DataAccessException e) {
      throw new SessionStoreException("Failed to clear session for " + senderAddress, e);
    }
  }

  @Override
  public long count() {
    try {
      return repository.count();
    } catch (DataAccessException e) {
      throw new SessionStoreException("Failed to count sessions", e);
    }
  }

  @Override
  @Transactional
  public int evictOlderThan(Instant cutoff) {
    try {
      return repository.deleteIdleSince(cutoff);
    } catch (DataAccessException e) {
      throw new SessionStoreException("Failed to evict sessions idle since " + cutoff, e);
    }
  }
}
