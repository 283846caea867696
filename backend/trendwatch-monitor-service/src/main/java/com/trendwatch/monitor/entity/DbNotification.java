package com.trendwatch.monitor.entity;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(
  name = "notifications",
  indexes = {
    @Index(name = "idx_notifications_alert_created", columnList = "alert_id,created_at DESC"),
    @Index(name = "idx_notifications_created", columnList = "created_at")
  }
)
public class DbNotification {
  @Id @GeneratedValue(strategy = GenerationType.UUID)
  private String id;

  @Column(name = "alert_id", nullable = false) private String alertId;
  @Column(name = "user_id") private String userId;
  @Column(name = "created_at", nullable = false) private Instant createdAt;

  public String getId() { return id; }
  public String getAlertId() { return alertId; }
  public void setAlertId(String alertId) { this.alertId = alertId; }
  public String getUserId() { return userId; }
  public void setUserId(String userId) { this.userId = userId; }
  public Instant getCreatedAt() { return createdAt; }
  public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
