package com.trendwatch.monitor.store;

import com.trendwatch.monitor.entity.DbAlert;
import com.trendwatch.monitor.entity.DbKeyword;
import com.trendwatch.monitor.entity.DbTrendPoint;
import com.trendwatch.monitor.error.CollaboratorUnavailableException;
import com.trendwatch.monitor.model.AlertRule;
import com.trendwatch.monitor.model.Measurement;
import com.trendwatch.monitor.model.MonitoredEntity;
import com.trendwatch.monitor.repo.DbAlertRepository;
import com.trendwatch.monitor.repo.DbKeywordRepository;
import com.trendwatch.monitor.repo.DbTrendPointRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Component
public class JpaMonitorStore implements MonitorStore {

  private final DbKeywordRepository keywords;
  private final DbTrendPointRepository points;
  private final DbAlertRepository alerts;

  public JpaMonitorStore(DbKeywordRepository keywords, DbTrendPointRepository points, DbAlertRepository alerts) {
    this.keywords = keywords;
    this.points = points;
    this.alerts = alerts;
  }

  @Override
  public List<MonitoredEntity> listActiveEntities() {
    try {
      return keywords.findByActiveTrueOrderByIdAsc().stream().map(JpaMonitorStore::toEntity).toList();
    } catch (DataAccessException | TransactionException e) {
      throw new CollaboratorUnavailableException("Failed to list active keywords", e);
    }
  }

  @Override
  public List<Measurement> recentMeasurements(String entityId, int limit) {
    if (limit <= 0) return List.of();
    try {
      // newest first from the index, flipped to oldest-first for analysis
      List<DbTrendPoint> rows = points.findByKeywordIdOrderByTimestampDesc(entityId, PageRequest.of(0, limit));
      List<Measurement> out = new ArrayList<>(rows.size());
      for (DbTrendPoint row : rows) {
        out.add(new Measurement(row.getKeywordId(), row.getTimestamp(), row.getValue(), row.getRelated()));
      }
      Collections.reverse(out);
      return out;
    } catch (DataAccessException | TransactionException e) {
      throw new CollaboratorUnavailableException("Failed to load trend points for keyword " + entityId, e);
    }
  }

  @Override
  public List<AlertRule> alertsFor(String entityId) {
    try {
      return alerts.findByKeywordIdOrderByCreatedAtAsc(entityId).stream().map(JpaMonitorStore::toRule).toList();
    } catch (DataAccessException | TransactionException e) {
      throw new CollaboratorUnavailableException("Failed to load alerts for keyword " + entityId, e);
    }
  }

  private static MonitoredEntity toEntity(DbKeyword row) {
    return new MonitoredEntity(row.getId(), row.getTerm(), row.isActive(), row.getUserId());
  }

  private static AlertRule toRule(DbAlert row) {
    return new AlertRule(
        row.getId(),
        row.getKeywordId(),
        row.getUserId(),
        row.getFrequency(),
        row.getThresholdPct(),
        row.getThresholdAbs(),
        row.getChannels(),
        row.getPriority(),
        row.getCreatedAt());
  }
}
