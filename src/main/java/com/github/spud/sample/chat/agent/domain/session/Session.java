package com.github.spud.sample.chat.agent.domain.session;

import com.github.spud.sample.chat.agent.domain.state.AuthState;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Per-sender conversation state. Immutable; a transition yields a new instance.
 * <p>
 * Invariant: {@code userId} is present if and only if {@code authState == VERIFIED}.
 */
@Value
@Builder(toBuilder = true)
public class Session {

  /**
   * Store key, stable for the lifetime of the session
   */
  private String senderAddress;

  @Builder.Default
  private AuthState authState = AuthState.UNVERIFIED;

  private String userId;

  /**
   * Set by the store on write; {@code null} for a session that was never stored
   */
  private Instant lastUpdated;

  /**
   * The implicit session of a sender the store knows nothing about
   */
  public static Session initial(String senderAddress) {
    return Session.builder().senderAddress(senderAddress).build();
  }

  public Session transitionTo(AuthState next, String verifiedUserId) {
    if (next == AuthState.VERIFIED && verifiedUserId == null) {
      throw new IllegalArgumentException("A verified session needs a userId");
    }
    return toBuilder()
      .authState(next)
      .userId(next == AuthState.VERIFIED ? verifiedUserId : null)
      .build();
  }

  public Session touchedAt(Instant instant) {
    return toBuilder().lastUpdated(instant).build();
  }

  public boolean isVerified() {
    return authState == AuthState.VERIFIED;
  }

  public boolean isConsistent() {
    return authState != null && isVerified() == (userId != null);
  }
}
