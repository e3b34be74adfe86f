package com.github.spud.sample.chat.agent.domain.state;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.StateMachineEventResult;
import org.springframework.statemachine.support.DefaultStateMachineContext;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Applies one event to a sender's authentication state.
 * <p>
 * Sessions carry the state, so every call restores a fresh machine to that state, sends the event
 * and reads the target back. Machines are never shared between calls.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuthStateMachineDriver {

  private final AuthStateMachineFactory stateMachineFactory;

  /**
   * @return the state reached from {@code from} on {@code event}
   * @throws IllegalStateException if the transition table has no such transition
   */
  public AuthState fire(String senderAddress, AuthState from, AuthEvent event) {
    if (AuthState.isFinal(from)) {
      log.warn("Event {} sent to final state {} for {}", event, from, senderAddress);
      throw new IllegalStateException(from + " is final, " + event + " does not apply");
    }

    StateMachine<AuthState, AuthEvent> sm = stateMachineFactory.create(senderAddress);
    sm.getStateMachineAccessor().doWithAllRegions(access -> access
      .resetStateMachineReactively(new DefaultStateMachineContext<>(from, null, null, null))
      .block());
    sm.startReactively().block();

    try {
      StateMachineEventResult<AuthState, AuthEvent> result = sm
        .sendEvent(Mono.just(MessageBuilder.withPayload(event).build()))
        .blockFirst();

      boolean accepted = result != null
        && result.getResultType() == StateMachineEventResult.ResultType.ACCEPTED;
      if (!accepted) {
        log.warn("Event {} rejected in state {} for {}", event, from, senderAddress);
        throw new IllegalStateException("No transition from " + from + " on " + event);
      }

      AuthState next = sm.getState().getId();
      log.debug("Sender {} auth transition: {} --({})--> {}", senderAddress, from, event, next);
      return next;
    } finally {
      sm.stopReactively().block();
    }
  }
}
