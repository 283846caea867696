package com.trendwatch.monitor.repo;

import com.trendwatch.monitor.entity.DbTrendPoint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface DbTrendPointRepository extends JpaRepository<DbTrendPoint, Long> {
  List<DbTrendPoint> findByKeywordIdOrderByTimestampDesc(String keywordId, Pageable pageable);
}
