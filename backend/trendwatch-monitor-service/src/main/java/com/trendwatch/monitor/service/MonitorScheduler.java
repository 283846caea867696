package com.trendwatch.monitor.service;

import com.trendwatch.monitor.analysis.CooldownGuard;
import com.trendwatch.monitor.analysis.SeriesAnalyzer;
import com.trendwatch.monitor.analysis.ThresholdMatcher;
import com.trendwatch.monitor.dispatch.DeliveryException;
import com.trendwatch.monitor.dispatch.NotificationDispatcher;
import com.trendwatch.monitor.error.CollaboratorUnavailableException;
import com.trendwatch.monitor.error.ComputationException;
import com.trendwatch.monitor.error.InsufficientDataException;
import com.trendwatch.monitor.lock.AlertLock;
import com.trendwatch.monitor.lock.AlertLockRegistry;
import com.trendwatch.monitor.model.AlertRule;
import com.trendwatch.monitor.model.AnomalyResult;
import com.trendwatch.monitor.model.ContextStats;
import com.trendwatch.monitor.model.CycleSummary;
import com.trendwatch.monitor.model.Measurement;
import com.trendwatch.monitor.model.MonitoredEntity;
import com.trendwatch.monitor.model.TriggerEvent;
import com.trendwatch.monitor.store.DispatchHistory;
import com.trendwatch.monitor.store.MonitorStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Polls every active keyword on a fixed cadence, detects the latest spike, and fires the keyword's alerts that
 * clear their thresholds and cooldown.
 *
 * <p>Failures are contained per keyword and per alert: one bad keyword, alert or channel never stops its
 * siblings, and nothing thrown inside a cycle ends the loop. Keywords, points and alerts are re-read every cycle.
 */
@Service
public class MonitorScheduler {

  private static final Logger log = LoggerFactory.getLogger(MonitorScheduler.class);

  private final MonitorStore store;
  private final DispatchHistory history;
  private final NotificationDispatcher dispatcher;
  private final SeriesAnalyzer analyzer;
  private final ThresholdMatcher matcher;
  private final CooldownGuard cooldown;
  private final AlertLockRegistry locks;
  private final Executor entityExecutor;
  private final Clock clock;
  private final int measurementLookback;
  private final Duration pollInterval;
  private final HistoryWritePolicy writePolicy;

  private final MeterRegistry metrics;
  private final Counter cyclesRun;
  private final Timer cycleDuration;
  private final Counter anomaliesDetected;
  private final Counter alertsTriggered;
  private final Counter alertsSuppressedCooldown;
  private final Counter alertsSuppressedLocked;
  private final Counter alertsFailed;
  private final Counter deliveries;
  private final Counter deliveryFailures;
  private final Counter entitiesSkippedInsufficient;
  private final Counter entitiesFailed;

  public MonitorScheduler(MonitorStore store,
                          DispatchHistory history,
                          NotificationDispatcher dispatcher,
                          SeriesAnalyzer analyzer,
                          ThresholdMatcher matcher,
                          CooldownGuard cooldown,
                          AlertLockRegistry locks,
                          @Qualifier("monitorEntityExecutor") Executor entityExecutor,
                          Clock clock,
                          MeterRegistry metrics,
                          @Value("${trendwatch.monitor.measurement-lookback:30}") int measurementLookback,
                          @Value("${trendwatch.monitor.poll-interval-seconds:30}") long pollIntervalSeconds,
                          @Value("${trendwatch.monitor.history-write-policy:WRITE_BEFORE_SEND}") HistoryWritePolicy writePolicy) {
    if (pollIntervalSeconds <= 0) {
      throw new IllegalStateException("trendwatch.monitor.poll-interval-seconds must be > 0, got " + pollIntervalSeconds);
    }
    this.store = store;
    this.history = history;
    this.dispatcher = dispatcher;
    this.analyzer = analyzer;
    this.matcher = matcher;
    this.cooldown = cooldown;
    this.locks = locks;
    this.entityExecutor = entityExecutor;
    this.clock = clock;
    this.pollInterval = Duration.ofSeconds(pollIntervalSeconds);
    this.writePolicy = writePolicy;
    if (measurementLookback < analyzer.minimumPoints()) {
      log.warn("measurement-lookback={} cannot cover window-size={}; using {}",
          measurementLookback, analyzer.windowSize(), analyzer.minimumPoints());
      measurementLookback = analyzer.minimumPoints();
    }
    this.measurementLookback = measurementLookback;

    this.metrics = metrics;
    this.cyclesRun = metrics.counter("trendwatch_monitor_cycles_total");
    this.cycleDuration = metrics.timer("trendwatch_monitor_cycle_duration_seconds");
    this.anomaliesDetected = metrics.counter("trendwatch_anomalies_detected_total");
    this.alertsTriggered = metrics.counter("trendwatch_alerts_triggered_total");
    this.alertsSuppressedCooldown = metrics.counter("trendwatch_alerts_suppressed_total", "reason", "cooldown");
    this.alertsSuppressedLocked = metrics.counter("trendwatch_alerts_suppressed_total", "reason", "locked");
    this.alertsFailed = metrics.counter("trendwatch_alert_failures_total");
    this.deliveries = metrics.counter("trendwatch_deliveries_total");
    this.deliveryFailures = metrics.counter("trendwatch_dispatch_failures_total");
    this.entitiesSkippedInsufficient = metrics.counter("trendwatch_entities_skipped_total", "reason", "insufficient_data");
    this.entitiesFailed = metrics.counter("trendwatch_entities_failed_total");
  }

  public Duration pollInterval() { return pollInterval; }
  public int measurementLookback() { return measurementLookback; }
  public HistoryWritePolicy writePolicy() { return writePolicy; }

  /**
   * Reads the active keyword list once. The loop must not start if this fails.
   *
   * @return number of active keywords
   * @throws CollaboratorUnavailableException if the keyword store cannot be reached
   */
  public int verifyCollaborators() {
    try {
      return store.listActiveEntities().size();
    } catch (CollaboratorUnavailableException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new CollaboratorUnavailableException("Keyword store unreachable: " + e.getMessage(), e);
    }
  }

  /**
   * Runs cycles until {@code signal} is requested. The signal is only checked between cycles, so a cycle in
   * progress always completes. Cycle time is not subtracted from the sleep.
   */
  public void run(ShutdownSignal signal, Sleeper sleeper) {
    log.info("[run] Monitor loop started: window={} z={} pct={} cooldown={} interval={} lookback={} policy={}",
        analyzer.windowSize(), analyzer.zThreshold(), analyzer.pctChangeThreshold(), cooldown.cooldown(),
        pollInterval, measurementLookback, writePolicy);
    long cycles = 0;
    while (!signal.isRequested()) {
      try {
        runCycle();
      } catch (Exception e) {
        log.error("[run] Cycle failed, continuing with the next one: {}", e.getMessage(), e);
      }
      cycles++;
      if (signal.isRequested()) break;
      try {
        log.debug("[run] Sleeping {}", pollInterval);
        sleeper.sleep(pollInterval);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.info("[run] Interrupted while sleeping, stopping");
        break;
      }
    }
    log.info("[run] Monitor loop stopped after {} cycle(s)", cycles);
  }

  public CycleSummary runCycle() {
    Instant start = clock.instant();
    Tally tally = new Tally();
    log.info("[runCycle] Cycle started at {}", start);
    cyclesRun.increment();
    Timer.Sample sample = Timer.start(metrics);
    try {
      List<MonitoredEntity> entities;
      try {
        entities = store.listActiveEntities();
      } catch (RuntimeException e) {
        log.error("[runCycle] Could not list active keywords, skipping cycle: {}", e.getMessage(), e);
        return CycleSummary.empty();
      }
      log.info("[runCycle] Found {} active keyword(s) to check", entities.size());

      List<CompletableFuture<Void>> tasks = new ArrayList<>(entities.size());
      for (MonitoredEntity entity : entities) {
        if (!entity.active()) continue;
        tasks.add(CompletableFuture.runAsync(() -> processEntitySafely(entity, tally), entityExecutor));
      }
      CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).join();
    } catch (RuntimeException e) {
      log.error("[runCycle] Cycle aborted: {}", e.getMessage(), e);
    } finally {
      sample.stop(cycleDuration);
      long ms = Duration.between(start, clock.instant()).toMillis();
      log.info("[runCycle] Cycle finished in {} ms", ms);
    }

    CycleSummary summary = tally.summary();
    log.info("[runCycle] scanned={} skipped={} failed={} anomalies={} matched={} triggered={} suppressed={} alertErrors={} deliveryErrors={}",
        summary.entitiesScanned(), summary.entitiesSkipped(), summary.entitiesFailed(), summary.anomaliesDetected(),
        summary.alertsMatched(), summary.alertsTriggered(), summary.alertsSuppressed(), summary.alertsFailed(),
        summary.deliveryFailures());
    return summary;
  }

  private void processEntitySafely(MonitoredEntity entity, Tally tally) {
    tally.scanned.incrementAndGet();
    try {
      processEntity(entity, tally);
    } catch (InsufficientDataException e) {
      tally.skipped.incrementAndGet();
      entitiesSkippedInsufficient.increment();
      log.info("Skipping '{}' ({}): {}", entity.displayTerm(), entity.id(), e.getMessage());
    } catch (ComputationException e) {
      tally.failed.incrementAndGet();
      entitiesFailed.increment();
      log.warn("Skipping '{}' ({}): bad measurements: {}", entity.displayTerm(), entity.id(), e.getMessage());
    } catch (RuntimeException e) {
      tally.failed.incrementAndGet();
      entitiesFailed.increment();
      log.error("Error processing keyword '{}' ({}): {}", entity.displayTerm(), entity.id(), e.getMessage(), e);
    }
  }

  private void processEntity(MonitoredEntity entity, Tally tally) {
    List<Measurement> points = store.recentMeasurements(entity.id(), measurementLookback);
    if (points.size() < analyzer.minimumPoints()) {
      throw new InsufficientDataException(points.size(), analyzer.minimumPoints());
    }

    Optional<AnomalyResult> latest = analyzer.detectLatest(points);
    if (latest.isEmpty()) {
      log.debug("No spike for '{}' ({} points)", entity.displayTerm(), points.size());
      return;
    }
    AnomalyResult anomaly = latest.get();
    tally.anomalies.incrementAndGet();
    anomaliesDetected.increment();
    log.info("Spike detected: kw='{}' value={} z={} pct={} severity={} reason={}",
        entity.displayTerm(), anomaly.value(), fmt(anomaly.zScore()), fmt(anomaly.pctChange()),
        anomaly.severity(), anomaly.reason());

    ContextStats ctx = analyzer.contextStats(points, anomaly);
    List<AlertRule> alerts = store.alertsFor(entity.id());
    if (alerts.isEmpty()) {
      log.info("No alerts configured for '{}'", entity.displayTerm());
      return;
    }

    for (AlertRule alert : alerts) {
      try {
        evaluateAlert(entity, alert, anomaly, ctx, tally);
      } catch (RuntimeException e) {
        tally.alertsFailed.incrementAndGet();
        alertsFailed.increment();
        log.error("Error handling alert {} for '{}' (z={}, pct={}): {}",
            alert.id(), entity.displayTerm(), fmt(anomaly.zScore()), fmt(anomaly.pctChange()), e.getMessage(), e);
      }
    }
  }

  private void evaluateAlert(MonitoredEntity entity, AlertRule alert, AnomalyResult anomaly, ContextStats ctx,
                             Tally tally) {
    if (!matcher.matches(alert, anomaly)) {
      log.debug("Alert {} thresholds not met: pct={} (min {}), value={} (min {})",
          alert.id(), fmt(anomaly.pctChange()), alert.thresholdPct(), anomaly.value(), alert.thresholdAbs());
      return;
    }
    tally.matched.incrementAndGet();

    Optional<AlertLock> held = locks.tryAcquire(alert.id());
    if (held.isEmpty()) {
      tally.suppressed.incrementAndGet();
      alertsSuppressedLocked.increment();
      log.info("Alert {} is being handled by another worker, skipping", alert.id());
      return;
    }

    try (AlertLock lock = held.get()) {
      Instant now = clock.instant();
      if (cooldown.shouldSuppress(lock.alertId(), now)) {
        tally.suppressed.incrementAndGet();
        alertsSuppressedCooldown.increment();
        log.info("Skipping duplicate alert {} for '{}': already fired within {}",
            alert.id(), entity.displayTerm(), cooldown.cooldown());
        return;
      }

      TriggerEvent event = new TriggerEvent(alert, entity, anomaly, ctx, now);
      switch (writePolicy) {
        case WRITE_BEFORE_SEND -> {
          history.recordDispatch(alert.id(), alert.ownerId(), now);
          deliver(event, lock, tally);
        }
        case WRITE_AFTER_CONFIRMED_SEND -> {
          if (deliver(event, lock, tally) > 0) {
            history.recordDispatch(alert.id(), alert.ownerId(), now);
          } else {
            log.warn("No channel accepted alert {}; not recording, it stays eligible next cycle", alert.id());
          }
        }
      }
      tally.triggered.incrementAndGet();
      alertsTriggered.increment();
    }
  }

  // returns the number of channels that accepted the trigger
  private int deliver(TriggerEvent event, AlertLock lock, Tally tally) {
    AlertRule alert = event.alert();
    AnomalyResult anomaly = event.anomaly();
    if (alert.channels().isEmpty()) {
      log.warn("Alert {} has no channels configured", alert.id());
      return 0;
    }

    int delivered = 0;
    for (String channel : new TreeSet<>(alert.channels())) {
      if (!lock.renew()) {
        log.warn("Lost the lock on alert {} before sending via {}; another worker may repeat it", alert.id(), channel);
      }
      try {
        dispatcher.dispatch(channel, alert.ownerId(), event);
        delivered++;
        deliveries.increment();
        log.info("Alert {} for '{}' sent via {}", alert.id(), event.entity().displayTerm(), channel);
      } catch (DeliveryException | RuntimeException e) {
        tally.deliveryFailures.incrementAndGet();
        deliveryFailures.increment();
        log.warn("Delivery failed: alert={} channel={} z={} pct={}: {}",
            alert.id(), channel, fmt(anomaly.zScore()), fmt(anomaly.pctChange()), e.getMessage());
      }
    }
    return delivered;
  }

  private static String fmt(double v) {
    return String.format("%.2f", v);
  }

  private static final class Tally {
    final AtomicInteger scanned = new AtomicInteger();
    final AtomicInteger skipped = new AtomicInteger();
    final AtomicInteger failed = new AtomicInteger();
    final AtomicInteger anomalies = new AtomicInteger();
    final AtomicInteger matched = new AtomicInteger();
    final AtomicInteger triggered = new AtomicInteger();
    final AtomicInteger suppressed = new AtomicInteger();
    final AtomicInteger alertsFailed = new AtomicInteger();
    final AtomicInteger deliveryFailures = new AtomicInteger();

    CycleSummary summary() {
      return new CycleSummary(scanned.get(), skipped.get(), failed.get(), anomalies.get(), matched.get(),
          triggered.get(), suppressed.get(), alertsFailed.get(), deliveryFailures.get());
    }
  }
}
