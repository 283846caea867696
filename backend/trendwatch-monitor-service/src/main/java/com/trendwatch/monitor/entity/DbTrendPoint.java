package com.trendwatch.monitor.entity;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

@Entity
@Table(
  name = "trend_data",
  indexes = {
    @Index(name = "idx_trend_data_keyword_ts", columnList = "keyword_id,recorded_at DESC")
  },
  uniqueConstraints = {
    @UniqueConstraint(name = "uq_trend_data_keyword_ts", columnNames = {"keyword_id", "recorded_at"})
  }
)
public class DbTrendPoint {
  @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "keyword_id", nullable = false) private String keywordId;
  @Column(name = "recorded_at", nullable = false) private Instant timestamp;
  @Column(name = "point_value", nullable = false) private double value;

  @ElementCollection(fetch = FetchType.EAGER)
  @CollectionTable(name = "trend_data_related", joinColumns = @JoinColumn(name = "trend_data_id"))
  @Column(name = "term")
  private Set<String> related = new HashSet<>();

  public Long getId() { return id; }
  public String getKeywordId() { return keywordId; }
  public void setKeywordId(String keywordId) { this.keywordId = keywordId; }
  public Instant getTimestamp() { return timestamp; }
  public void setTimestamp(Instant timestamp) { this.timestamp = timestamp; }
  public double getValue() { return value; }
  public void setValue(double value) { this.value = value; }
  public Set<String> getRelated() { return related; }
  public void setRelated(Set<String> related) { this.related = related; }
}
