package com.trendwatch.monitor.store;

import com.trendwatch.monitor.entity.DbNotification;
import com.trendwatch.monitor.error.CollaboratorUnavailableException;
import com.trendwatch.monitor.model.DispatchHistoryRecord;
import com.trendwatch.monitor.repo.DbNotificationRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.time.Instant;
import java.util.Optional;

@Component
public class JpaDispatchHistory implements DispatchHistory {

  private final DbNotificationRepository repo;

  public JpaDispatchHistory(DbNotificationRepository repo) {
    this.repo = repo;
  }

  @Override
  public Optional<DispatchHistoryRecord> findRecentDispatch(String alertId, Instant since) {
    try {
      return repo.findFirstByAlertIdAndCreatedAtGreaterThanEqualOrderByCreatedAtDesc(alertId, since)
          .map(JpaDispatchHistory::toRecord);
    } catch (DataAccessException | TransactionException e) {
      throw new CollaboratorUnavailableException("Failed to read dispatch history for alert " + alertId, e);
    }
  }

  @Override
  public DispatchHistoryRecord recordDispatch(String alertId, String ownerId, Instant timestamp) {
    DbNotification row = new DbNotification();
    row.setAlertId(alertId);
    row.setUserId(ownerId);
    row.setCreatedAt(timestamp);
    try {
      return toRecord(repo.save(row));
    } catch (DataAccessException | TransactionException e) {
      throw new CollaboratorUnavailableException("Failed to record dispatch for alert " + alertId, e);
    }
  }

  @Override
  public long purgeOlderThan(Instant cutoff) {
    try {
      return repo.deleteCreatedBefore(cutoff);
    } catch (DataAccessException | TransactionException e) {
      throw new CollaboratorUnavailableException("Failed to purge dispatch history before " + cutoff, e);
    }
  }

  private static DispatchHistoryRecord toRecord(DbNotification row) {
    return new DispatchHistoryRecord(row.getId(), row.getAlertId(), row.getUserId(), row.getCreatedAt());
  }
}
