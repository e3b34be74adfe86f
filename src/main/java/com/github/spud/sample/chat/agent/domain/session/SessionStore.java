package com.github.spud.sample.chat.agent.domain.session;

import java.time.Instant;

/**
 * Owner of all {@link Session} records, keyed by sender address.
 * <p>
 * Backing-store failures are reported as {@link SessionStoreException}. Callers serialize access
 * per sender; implementations only need to be safe across different senders.
 */
public interface SessionStore {

  /**
   * Never fails on a miss: an unknown sender gets {@link Session#initial(String)}.
   */
  Session get(String senderAddress);

  /**
   * Stores the session, stamping {@code lastUpdated}.
   */
  void put(String senderAddress, Session session);

  /**
   * Moves {@code lastUpdated} to now without changing the session. No-op for unknown senders.
   */
  void touch(String senderAddress);

  /**
   * Logout. The sender is back to the implicit initial state.
   */
  void clear(String senderAddress);

  long count();

  /**
   * Drops sessions not written since {@code cutoff}.
   *
   * @return number of sessions removed
   */
  int evictOlderThan(Instant cutoff);
}
