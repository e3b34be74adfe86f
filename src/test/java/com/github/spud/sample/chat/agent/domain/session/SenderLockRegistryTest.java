package com.github.spud.sample.chat.agent.domain.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SenderLockRegistryTest {

  private SenderLockRegistry registry;
  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    registry = new SenderLockRegistry();
    executor = Executors.newFixedThreadPool(8);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void sameSenderNeverRunsConcurrently() throws Exception {
    AtomicInteger inside = new AtomicInteger();
    AtomicInteger maxInside = new AtomicInteger();
    CountDownLatch start = new CountDownLatch(1);

    List<Future<?>> futures = new ArrayList<>();
    for (int i = 0; i < 32; i++) {
      futures.add(executor.submit(() -> {
        start.await();
        registry.withLock("+15551234567", () -> {
          int now = inside.incrementAndGet();
          maxInside.accumulateAndGet(now, Math::max);
          sleep(2);
          inside.decrementAndGet();
        });
        return null;
      }));
    }
    start.countDown();
    for (Future<?> future : futures) {
      future.get(10, TimeUnit.SECONDS);
    }

    assertThat(maxInside.get()).isEqualTo(1);
    assertThat(registry.activeSenders()).isZero();
  }

  @Test
  void differentSendersDoNotBlockEachOther() throws Exception {
    CountDownLatch bothInside = new CountDownLatch(2);

    Future<Boolean> a = executor.submit(() -> registry.withLock("a",
      () -> awaitQuietly(bothInside)));
    Future<Boolean> b = executor.submit(() -> registry.withLock("b",
      () -> awaitQuietly(bothInside)));

    assertThat(a.get(5, TimeUnit.SECONDS)).isTrue();
    assertThat(b.get(5, TimeUnit.SECONDS)).isTrue();
  }

  @Test
  void lockIsReleasedWhenActionThrows() {
    assertThatThrownBy(() -> registry.withLock("a", (Runnable) () -> {
      throw new IllegalStateException("boom");
    })).isInstanceOf(IllegalStateException.class);

    assertThat(registry.activeSenders()).isZero();
    assertThat(registry.withLock("a", () -> "again")).isEqualTo("again");
  }

  @Test
  void reentrantForSameThread() {
    String result = registry.withLock("a", () -> registry.withLock("a", () -> "nested"));

    assertThat(result).isEqualTo("nested");
    assertThat(registry.activeSenders()).isZero();
  }

  private static boolean awaitQuietly(CountDownLatch latch) {
    latch.countDown();
    try {
      return latch.await(3, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
