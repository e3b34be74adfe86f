package com.github.spud.sample.chat.agent.domain.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import com.github.spud.sample.chat.agent.domain.dispatch.MessageDispatcher;
import com.github.spud.sample.chat.agent.domain.state.AuthState;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

/**
 * The scheduled sweeper runs when a TTL is configured
 */
@SpringBootTest(properties = {
  "app.session.ttl=PT1S",
  "app.session.sweep-interval=PT0.2S"
})
@ActiveProfiles("test")
class SessionExpirySchedulingTest {

  @Autowired
  private MessageDispatcher dispatcher;

  @Autowired
  private SessionStore sessionStore;

  @Autowired
  private SessionExpirySweeper sweeper;

  @Test
  void idleSessionIsSweptAway() {
    assertThat(sweeper).isNotNull();

    dispatcher.route("+15559876543", "Hi");
    assertThat(sessionStore.get("+15559876543").getAuthState()).isEqualTo(AuthState.VERIFIED);

    await().atMost(Duration.ofSeconds(5))
      .pollInterval(Duration.ofMillis(100))
      .untilAsserted(() -> assertThat(sessionStore.get("+15559876543").getAuthState())
        .isEqualTo(AuthState.UNVERIFIED));
  }
}
