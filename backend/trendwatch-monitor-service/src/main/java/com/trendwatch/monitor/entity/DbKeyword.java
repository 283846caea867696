package com.trendwatch.monitor.entity;

import jakarta.persistence.*;

@Entity
@Table(
  name = "keywords",
  indexes = {
    @Index(name = "idx_keywords_active", columnList = "active")
  }
)
public class DbKeyword {
  @Id
  private String id;

  @Column(nullable = false) private String term;
  @Column(nullable = false) private boolean active;
  @Column(name = "user_id", nullable = false) private String userId;

  public String getId() { return id; }
  public void setId(String id) { this.id = id; }
  public String getTerm() { return term; }
  public void setTerm(String term) { this.term = term; }
  public boolean isActive() { return active; }
  public void setActive(boolean active) { this.active = active; }
  public String getUserId() { return userId; }
  public void setUserId(String userId) { this.userId = userId; }
}
