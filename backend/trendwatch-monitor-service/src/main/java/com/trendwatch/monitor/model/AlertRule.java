package com.trendwatch.monitor.model;

import java.time.Instant;
import java.util.Set;

/**
 * A user's alert on one keyword. Either threshold may be null, meaning "not configured".
 */
public record AlertRule(
    String id,
    String entityId,
    String ownerId,
    AlertFrequency frequency,
    Double thresholdPct,
    Double thresholdAbs,
    Set<String> channels,
    AlertPriority priority,
    Instant createdAt
) {
  public AlertRule {
    channels = channels == null ? Set.of() : Set.copyOf(channels);
    if (priority == null) priority = AlertPriority.MEDIUM;
    if (frequency == null) frequency = AlertFrequency.REALTIME;
  }
}
