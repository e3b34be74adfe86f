package com.github.spud.sample.chat.agent.domain.session;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * One mutual-exclusion scope per sender address.
 * <p>
 * Locks are reference counted and dropped once no thread holds or waits for them, so the map only
 * grows with the number of senders currently being processed.
 */
@Component
public class SenderLockRegistry {

  private final ConcurrentHashMap<String, LockEntry> locks = new ConcurrentHashMap<>();

  public <T> T withLock(String senderAddress, Supplier<T> action) {
    LockEntry entry = locks.compute(senderAddress, (key, existing) -> {
      LockEntry e = existing != null ? existing : new LockEntry();
      e.holders++;
      return e;
    });

    entry.lock.lock();
    try {
      return action.get();
    } finally {
      entry.lock.unlock();
      locks.computeIfPresent(senderAddress, (key, e) -> --e.holders == 0 ? null : e);
    }
  }

  public void withLock(String senderAddress, Runnable action) {
    withLock(senderAddress, () -> {
      action.run();
      return null;
    });
  }

  /**
   * Senders with a lock currently held or awaited
   */
  public int activeSenders() {
    return locks.size();
  }

  private static final class LockEntry {

    private final ReentrantLock lock = new ReentrantLock();

    // guarded by the map's per-key compute
    private int holders;
  }
}
