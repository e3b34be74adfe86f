package com.github.spud.sample.chat.agent.domain.session;

import com.github.spud.sample.chat.agent.application.config.AgentProperties;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Evicts idle sessions. Only active when {@code app.session.ttl} is set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.session.ttl")
public class SessionExpirySweeper {

  private final SessionStore sessionStore;
  private final AgentProperties properties;
  private final Clock clock;

  @Scheduled(fixedDelayString = "${app.session.sweep-interval:PT5M}")
  public void sweep() {
    Instant cutoff = clock.instant().minus(properties.getSession().getTtl());
    int evicted = sessionStore.evictOlderThan(cutoff);
    if (evicted > 0) {
      log.info("Evicted {} idle sessions (last updated before {})", evicted, cutoff);
    }
  }
}
