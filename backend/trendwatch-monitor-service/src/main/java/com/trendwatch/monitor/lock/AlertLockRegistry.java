package com.trendwatch.monitor.lock;

import java.util.Optional;

public interface AlertLockRegistry {

  /**
   * Tries to take the lock for {@code alertId} without waiting. An empty result means another worker or instance
   * currently holds it.
   */
  Optional<AlertLock> tryAcquire(String alertId);
}
