package com.trendwatch.monitor.lock;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-process locks, one per alert id. Covers worker threads of a single instance only. An entry exists only while
 * its alert is held.
 */
public class LocalAlertLockRegistry implements AlertLockRegistry {

  private final ConcurrentMap<String, Held> held = new ConcurrentHashMap<>();

  @Override
  public Optional<AlertLock> tryAcquire(String alertId) {
    Held mine = new Held(alertId);
    // a thread re-entering its own hold is still a second holder here
    if (held.putIfAbsent(alertId, mine) != null) return Optional.empty();
    return Optional.of(mine);
  }

  int heldCount() {
    return held.size();
  }

  private final class Held implements AlertLock {
    private final String alertId;

    private Held(String alertId) {
      this.alertId = alertId;
    }

    @Override
    public String alertId() { return alertId; }

    @Override
    public boolean renew() {
      return held.get(alertId) == this;
    }

    @Override
    public void close() {
      held.remove(alertId, this);
    }
  }
}
