package com.trendwatch.monitor.repo;

import com.trendwatch.monitor.entity.DbKeyword;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface DbKeywordRepository extends JpaRepository<DbKeyword, String> {
  List<DbKeyword> findByActiveTrueOrderByIdAsc();
}
