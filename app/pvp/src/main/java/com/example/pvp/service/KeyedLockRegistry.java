/*
 * どこで: PVP サービス層
 * 何を: 文字列キー単位の排他ロックを提供する
 * なぜ: 同一プレイヤーのランキング更新や同一試合の観戦操作を直列化するため
 */
package com.example.pvp.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

@Component
public class KeyedLockRegistry {

  private final ConcurrentMap<String, SharedLock> locks = new ConcurrentHashMap<>();

  public <T> T withLock(String key, Supplier<T> action) {
    return withLocks(List.of(key), action);
  }

  /**
   * 役割: 複数キーのロックを取ってから action を実行する。
   * 動作: キーは重複除去・昇順で取得し、逆順で解放する。誰も保持しなくなったキーは破棄する。
   */
  public <T> T withLocks(Collection<String> keys, Supplier<T> action) {
    final List<String> ordered = keys.stream().distinct().sorted().toList();
    final List<String> acquired = new ArrayList<>(ordered.size());
    try {
      for (String key : ordered) {
        acquire(key);
        acquired.add(key);
      }
      return action.get();
    } finally {
      for (int i = acquired.size() - 1; i >= 0; i--) {
        release(acquired.get(i));
      }
    }
  }

  int trackedKeyCount() {
    return locks.size();
  }

  private void acquire(String key) {
    final SharedLock entry =
        locks.compute(
            key,
            (k, existing) -> {
              final SharedLock lock = existing == null ? new SharedLock() : existing;
              lock.holders++;
              return lock;
            });
    entry.lock.lock();
  }

  private void release(String key) {
    final SharedLock entry = locks.get(key);
    entry.lock.unlock();
    // holders は compute 内でのみ変更する
    locks.computeIfPresent(key, (k, lock) -> --lock.holders == 0 ? null : lock);
  }

  private static final class SharedLock {
    private final ReentrantLock lock = new ReentrantLock();
    private int holders;
  }
}
