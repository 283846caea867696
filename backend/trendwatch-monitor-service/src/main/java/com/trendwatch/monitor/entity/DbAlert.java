package com.trendwatch.monitor.entity;

import com.trendwatch.monitor.model.AlertFrequency;
import com.trendwatch.monitor.model.AlertPriority;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

@Entity
@Table(
  name = "alerts",
  indexes = {
    @Index(name = "idx_alerts_keyword", columnList = "keyword_id")
  }
)
public class DbAlert {
  @Id
  private String id;

  @Column(name = "keyword_id", nullable = false) private String keywordId;
  @Column(name = "user_id", nullable = false) private String userId;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private AlertFrequency frequency = AlertFrequency.REALTIME;

  @Column(name = "threshold_pct") private Double thresholdPct;
  @Column(name = "threshold_abs") private Double thresholdAbs;

  @Enumerated(EnumType.STRING)
  private AlertPriority priority;

  @ElementCollection(fetch = FetchType.EAGER)
  @CollectionTable(name = "alert_channels", joinColumns = @JoinColumn(name = "alert_id"))
  @Column(name = "channel")
  private Set<String> channels = new HashSet<>();

  @Column(name = "created_at", nullable = false) private Instant createdAt;

  public String getId() { return id; }
  public void setId(String id) { this.id = id; }
  public String getKeywordId() { return keywordId; }
  public void setKeywordId(String keywordId) { this.keywordId = keywordId; }
  public String getUserId() { return userId; }
  public void setUserId(String userId) { this.userId = userId; }
  public AlertFrequency getFrequency() { return frequency; }
  public void setFrequency(AlertFrequency frequency) { this.frequency = frequency; }
  public Double getThresholdPct() { return thresholdPct; }
  public void setThresholdPct(Double thresholdPct) { this.thresholdPct = thresholdPct; }
  public Double getThresholdAbs() { return thresholdAbs; }
  public void setThresholdAbs(Double thresholdAbs) { this.thresholdAbs = thresholdAbs; }
  public AlertPriority getPriority() { return priority; }
  public void setPriority(AlertPriority priority) { this.priority = priority; }
  public Set<String> getChannels() { return channels; }
  public void setChannels(Set<String> channels) { this.channels = channels; }
  public Instant getCreatedAt() { return createdAt; }
  public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
