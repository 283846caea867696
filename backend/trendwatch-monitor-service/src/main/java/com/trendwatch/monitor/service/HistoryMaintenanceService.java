package com.trendwatch.monitor.service;

import com.trendwatch.monitor.analysis.CooldownGuard;
import com.trendwatch.monitor.store.DispatchHistory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@Service
public class HistoryMaintenanceService {

  private static final Logger log = LoggerFactory.getLogger(HistoryMaintenanceService.class);

  private final DispatchHistory history;
  private final Clock clock;
  private final Duration retention;
  private final Counter purged;

  public HistoryMaintenanceService(DispatchHistory history,
                                   CooldownGuard cooldown,
                                   Clock clock,
                                   MeterRegistry metrics,
                                   @Value("${trendwatch.maintenance.history-retention-days:7}") long retentionDays) {
    this.history = history;
    this.clock = clock;
    this.retention = Duration.ofDays(retentionDays);
    // pruning inside the window would re-open suppressed alerts
    if (retention.compareTo(cooldown.cooldown()) < 0) {
      throw new IllegalStateException("trendwatch.maintenance.history-retention-days (" + retentionDays
          + ") must cover the cooldown window " + cooldown.cooldown());
    }
    this.purged = metrics.counter("trendwatch_history_purged_total");
  }

  // Periodic pruning of dispatch history so the notifications table doesn't grow unbounded
  @Scheduled(fixedDelayString = "${trendwatch.maintenance.interval-ms:3600000}",
             initialDelayString = "${trendwatch.maintenance.initial-delay-ms:60000}")
  public void purgeHistory() {
    Instant cutoff = clock.instant().minus(retention);
    try {
      long removed = history.purgeOlderThan(cutoff);
      if (removed > 0) {
        purged.increment(removed);
        log.info("[purgeHistory] Removed {} dispatch record(s) older than {}", removed, cutoff);
      } else {
        log.debug("[purgeHistory] Nothing older than {}", cutoff);
      }
    } catch (RuntimeException e) {
      log.warn("[purgeHistory] History purge failed: {}", e.getMessage());
    }
  }
}
