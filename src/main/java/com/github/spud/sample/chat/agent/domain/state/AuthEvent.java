package com.github.spud.sample.chat.agent.domain.state;

/**
 * Directory lookup outcomes that drive {@link AuthState} transitions
 */
public enum AuthEvent {
  PHONE_MATCHED,
  PHONE_NOT_FOUND,
  CLIENT_CODE_MATCHED,
  CLIENT_CODE_NOT_FOUND
}
