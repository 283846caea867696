package com.trendwatch.monitor.model;

/**
 * Counts for one scheduler cycle. {@code alertsTriggered} counts alerts that passed the cooldown and were handed
 * to the dispatcher, whether or not every channel accepted them.
 */
public record CycleSummary(
    int entitiesScanned,
    int entitiesSkipped,
    int entitiesFailed,
    int anomaliesDetected,
    int alertsMatched,
    int alertsTriggered,
    int alertsSuppressed,
    int alertsFailed,
    int deliveryFailures
) {
  public static CycleSummary empty() {
    return new CycleSummary(0, 0, 0, 0, 0, 0, 0, 0, 0);
  }
}
