package com.trendwatch.monitor.analysis;

import com.trendwatch.monitor.model.DispatchHistoryRecord;
import com.trendwatch.monitor.store.DispatchHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Suppresses an alert that already fired within the cooldown window. The window is the same for every channel.
 */
public class CooldownGuard {

  private static final Logger log = LoggerFactory.getLogger(CooldownGuard.class);

  private final DispatchHistory history;
  private final Duration cooldown;

  public CooldownGuard(DispatchHistory history, Duration cooldown) {
    this.history = Objects.requireNonNull(history, "history");
    if (cooldown == null || cooldown.isNegative() || cooldown.isZero()) {
      throw new IllegalArgumentException("cooldown must be positive, got " + cooldown);
    }
    this.cooldown = cooldown;
  }

  public Duration cooldown() { return cooldown; }

  public boolean shouldSuppress(String alertId, Instant now) {
    Optional<DispatchHistoryRecord> recent = history.findRecentDispatch(alertId, now.minus(cooldown));
    recent.ifPresent(r -> log.debug("Alert {} last fired at {}, within {} of {}", alertId, r.createdAt(), cooldown, now));
    return recent.isPresent();
  }
}
