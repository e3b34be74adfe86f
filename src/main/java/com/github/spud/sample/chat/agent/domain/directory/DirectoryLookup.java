package com.github.spud.sample.chat.agent.domain.directory;

import java.util.Optional;

/**
 * Read-only queries against the customer directory.
 * <p>
 * A miss is {@link Optional#empty()}. Implementations throw {@link DirectoryUnavailableException}
 * when the directory cannot be reached in time, so callers never mistake an outage for a miss.
 */
public interface DirectoryLookup {

  /**
   * Exact match on the stored canonical phone. No normalization is applied.
   */
  Optional<DirectoryUser> findByPhone(String phone);

  /**
   * Exact, case-sensitive match on the client code.
   */
  Optional<DirectoryUser> findByClientCode(String clientCode);

  Optional<DirectoryUser> findByUserId(String userId);
}
