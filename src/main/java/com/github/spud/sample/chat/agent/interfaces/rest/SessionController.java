package com.github.spud.sample.chat.agent.interfaces.rest;

import com.github.spud.sample.chat.agent.domain.dispatch.MessageDispatcher;
import com.github.spud.sample.chat.agent.domain.session.Session;
import com.github.spud.sample.chat.agent.domain.session.SessionStore;
import com.github.spud.sample.chat.agent.domain.state.AuthState;
import java.time.Instant;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Session inspection and the out-of-band logout command
 */
@RestController
@RequestMapping("/sessions")
@RequiredArgsConstructor
public class SessionController {

  private final SessionStore sessionStore;
  private final MessageDispatcher dispatcher;

  @GetMapping
  public Mono<Map<String, Long>> stats() {
    return Mono.fromCallable(() -> Map.of("active", sessionStore.count()))
      .subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping("/{senderAddress}")
  public Mono<SessionView> get(@PathVariable String senderAddress) {
    return Mono.fromCallable(() -> SessionView.of(sessionStore.get(senderAddress)))
      .subscribeOn(Schedulers.boundedElastic());
  }

  @DeleteMapping("/{senderAddress}")
  public Mono<ResponseEntity<Void>> logout(@PathVariable String senderAddress) {
    return Mono.fromRunnable(() -> dispatcher.logout(senderAddress))
      .subscribeOn(Schedulers.boundedElastic())
      .then(Mono.just(ResponseEntity.noContent().<Void>build()));
  }

  public record SessionView(String senderAddress, AuthState authState, String userId,
                            Instant lastUpdated) {

    static SessionView of(Session session) {
      return new SessionView(session.getSenderAddress(), session.getAuthState(),
        session.getUserId(), session.getLastUpdated());
    }
  }
}
