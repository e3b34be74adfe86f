package com.github.spud.sample.chat.agent.domain.state;

/**
 * Authentication progress of a sender
 * <pre>
 * UNVERIFIED → VERIFIED
 *            → AWAITING_CLIENT_CODE → VERIFIED
 *                                   → REJECTED
 * </pre>
 */
public enum AuthState {
  /**
   * Nothing known yet; also the state of a sender without a session
   */
  UNVERIFIED,

  /**
   * Phone not in the directory, waiting for the client code
   */
  AWAITING_CLIENT_CODE,

  /**
   * Identity resolved to a user (terminal)
   */
  VERIFIED,

  /**
   * Client code did not match; stays here until logout (terminal)
   */
  REJECTED;

  public static boolean isFinal(AuthState state) {
    return state == VERIFIED || state == REJECTED;
  }
}
