package com.trendwatch.monitor.store;

import com.trendwatch.monitor.model.DispatchHistoryRecord;

import java.time.Instant;
import java.util.Optional;

/**
 * Record of alerts that have fired. Failures surface as
 * {@link com.trendwatch.monitor.error.CollaboratorUnavailableException}.
 */
public interface DispatchHistory {

  /** Most recent record for {@code alertId} created at or after {@code since}. */
  Optional<DispatchHistoryRecord> findRecentDispatch(String alertId, Instant since);

  DispatchHistoryRecord recordDispatch(String alertId, String ownerId, Instant timestamp);

  /** Deletes records created before {@code cutoff}, returning how many were removed. */
  long purgeOlderThan(Instant cutoff);
}
