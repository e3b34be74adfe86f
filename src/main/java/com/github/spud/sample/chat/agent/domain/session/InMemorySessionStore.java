package com.github.spud.sample.chat.agent.domain.session;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Process-local session store, the default
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.session.store", havingValue = "memory", matchIfMissing = true)
public class InMemorySessionStore implements SessionStore {

  private final ConcurrentHashMap<String, Session> sessions = new ConcurrentHashMap<>();

  private final Clock clock;

  @Override
  public Session get(String senderAddress) {
    Session session = sessions.get(senderAddress);
    return session != null ? session : Session.initial(senderAddress);
  }

  @Override
  public void put(String senderAddress, Session session) {
    Session previous = sessions.put(senderAddress, session.touchedAt(clock.instant()));
    if (previous == null) {
      log.info("Created session for {}", senderAddress);
    }
  }

  @Override
  public void touch(String senderAddress) {
    sessions.computeIfPresent(senderAddress, (key, session) -> session.touchedAt(clock.instant()));
  }

  @Override
  public void clear(String senderAddress) {
    sessions.remove(senderAddress);
    log.info("Session cleared for {}", senderAddress);
  }

  @Override
  public long count() {
    return sessions.size();
  }

  @Override
  public int evictOlderThan(Instant cutoff) {
    int evicted = 0;
    for (Map.Entry<String, Session> entry : sessions.entrySet()) {
      Instant lastUpdated = entry.getValue().getLastUpdated();
      if (lastUpdated != null && lastUpdated.isBefore(cutoff)
        && sessions.remove(entry.getKey(), entry.getValue())) {
        evicted++;
      }
    }
    return evicted;
  }
}
