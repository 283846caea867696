package com.trendwatch.monitor.repo;

import com.trendwatch.monitor.entity.DbAlert;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface DbAlertRepository extends JpaRepository<DbAlert, String> {
  List<DbAlert> findByKeywordIdOrderByCreatedAtAsc(String keywordId);
}
