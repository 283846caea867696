package com.trendwatch.monitor.repo;

import com.trendwatch.monitor.entity.DbNotification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

public interface DbNotificationRepository extends JpaRepository<DbNotification, String> {
  Optional<DbNotification> findFirstByAlertIdAndCreatedAtGreaterThanEqualOrderByCreatedAtDesc(
      String alertId, Instant since);

  @Transactional
  @Modifying
  @Query("DELETE FROM DbNotification n WHERE n.createdAt < :cutoff")
  int deleteCreatedBefore(@Param("cutoff") Instant cutoff);
}
