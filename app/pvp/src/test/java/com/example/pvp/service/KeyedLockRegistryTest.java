package com.example.pvp.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class KeyedLockRegistryTest {

  private final KeyedLockRegistry registry = new KeyedLockRegistry();

  @Test
  void serializesActionsOnSameKey() throws Exception {
    final int threads = 8;
    final int[] counter = {0};
    final CountDownLatch start = new CountDownLatch(1);
    final ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      final List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  for (int j = 0; j < 1000; j++) {
                    registry.withLock("ranking:s1:p1", () -> counter[0]++);
                  }
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    assertThat(counter[0]).isEqualTo(threads * 1000);
    assertThat(registry.trackedKeyCount()).isZero();
  }

  @Test
  void opposingKeyOrderDoesNotDeadlock() throws Exception {
    final ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      final Future<?> first =
          executor.submit(
              () -> {
                for (int i = 0; i < 2000; i++) {
                  registry.withLocks(List.of("a", "b"), () -> null);
                }
              });
      final Future<?> second =
          executor.submit(
              () -> {
                for (int i = 0; i < 2000; i++) {
                  registry.withLocks(List.of("b", "a"), () -> null);
                }
              });
      first.get(10, TimeUnit.SECONDS);
      second.get(10, TimeUnit.SECONDS);
    } finally {
      executor.shutdownNow();
    }
    assertThat(registry.trackedKeyCount()).isZero();
  }

  @Test
  void releasesLocksWhenActionThrows() {
    assertThatThrownBy(
            () ->
                registry.withLocks(
                    List.of("x", "y"),
                    () -> {
                      throw new IllegalStateException("boom");
                    }))
        .isInstanceOf(IllegalStateException.class);

    assertThat(registry.trackedKeyCount()).isZero();
    assertThat(registry.withLock("x", () -> "ok")).isEqualTo("ok");
  }
}
