package com.github.spud.sample.chat.agent.domain.state;

import java.util.EnumSet;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.config.StateMachineBuilder;
import org.springframework.stereotype.Component;

/**
 * Builds authentication state machines from a single transition table
 * <pre>
 *   UNVERIFIED --(PHONE_MATCHED)--> VERIFIED
 *   UNVERIFIED --(PHONE_NOT_FOUND)--> AWAITING_CLIENT_CODE
 *   AWAITING_CLIENT_CODE --(CLIENT_CODE_MATCHED)--> VERIFIED
 *   AWAITING_CLIENT_CODE --(CLIENT_CODE_NOT_FOUND)--> REJECTED
 * </pre>
 * Machines are not started; the caller positions them on the sender's current state first.
 */
@Component
public class AuthStateMachineFactory {

  public StateMachine<AuthState, AuthEvent> create(String machineId) {
    try {
      StateMachineBuilder.Builder<AuthState, AuthEvent> builder = StateMachineBuilder.builder();

      builder.configureConfiguration()
        .withConfiguration()
        .machineId(machineId)
        .autoStartup(false);

      builder.configureStates()
        .withStates()
        .initial(AuthState.UNVERIFIED)
        .states(EnumSet.allOf(AuthState.class))
        .end(AuthState.VERIFIED)
        .end(AuthState.REJECTED);

      builder.configureTransitions()
        .withExternal()
        .source(AuthState.UNVERIFIED).target(AuthState.VERIFIED)
        .event(AuthEvent.PHONE_MATCHED)
        .and()
        .withExternal()
        .source(AuthState.UNVERIFIED).target(AuthState.AWAITING_CLIENT_CODE)
        .event(AuthEvent.PHONE_NOT_FOUND)
        .and()
        .withExternal()
        .source(AuthState.AWAITING_CLIENT_CODE).target(AuthState.VERIFIED)
        .event(AuthEvent.CLIENT_CODE_MATCHED)
        .and()
        .withExternal()
        .source(AuthState.AWAITING_CLIENT_CODE).target(AuthState.REJECTED)
        .event(AuthEvent.CLIENT_CODE_NOT_FOUND);

      return builder.build();
    } catch (Exception e) {
      throw new IllegalStateException("Failed to build authentication state machine", e);
    }
  }
}
