package com.trendwatch.monitor.store;

import com.trendwatch.monitor.model.AlertRule;
import com.trendwatch.monitor.model.Measurement;
import com.trendwatch.monitor.model.MonitoredEntity;

import java.util.List;

/**
 * Read-only view of keywords, their trend points and their alerts. Nothing is cached; every call reads current
 * state. Failures surface as {@link com.trendwatch.monitor.error.CollaboratorUnavailableException}.
 */
public interface MonitorStore {

  List<MonitoredEntity> listActiveEntities();

  /** Up to {@code limit} of the newest measurements, ordered oldest to newest. */
  List<Measurement> recentMeasurements(String entityId, int limit);

  List<AlertRule> alertsFor(String entityId);
}
