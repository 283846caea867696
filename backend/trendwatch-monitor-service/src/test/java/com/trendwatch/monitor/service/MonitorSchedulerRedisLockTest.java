package com.trendwatch.monitor.service;

import com.trendwatch.monitor.analysis.CooldownGuard;
import com.trendwatch.monitor.analysis.SeriesAnalyzer;
import com.trendwatch.monitor.analysis.ThresholdMatcher;
import com.trendwatch.monitor.dispatch.DeliveryException;
import com.trendwatch.monitor.dispatch.NotificationDispatcher;
import com.trendwatch.monitor.lock.ExpiringRedis;
import com.trendwatch.monitor.lock.RedisAlertLockRegistry;
import com.trendwatch.monitor.model.CycleSummary;
import com.trendwatch.monitor.model.DispatchHistoryRecord;
import com.trendwatch.monitor.model.MonitoredEntity;
import com.trendwatch.monitor.store.DispatchHistory;
import com.trendwatch.monitor.store.MonitorStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static com.trendwatch.monitor.TrendFixtures.alert;
import static com.trendwatch.monitor.TrendFixtures.concat;
import static com.trendwatch.monitor.TrendFixtures.keyword;
import static com.trendwatch.monitor.TrendFixtures.repeat;
import static com.trendwatch.monitor.TrendFixtures.series;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Two instances sharing one Redis: a slow multi-channel delivery outlasting the lock TTL must not let the second
 * instance fire the same alert.
 */
class MonitorSchedulerRedisLockTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final Duration LOCK_TTL = Duration.ofMillis(600);
  private static final long SEND_MILLIS = 400;

  private final ExpiringRedis redis = new ExpiringRedis();
  private final MemoryHistory history = new MemoryHistory();
  private final MonitorStore store = mock(MonitorStore.class);

  private MonitorScheduler instance(NotificationDispatcher dispatcher) {
    return new MonitorScheduler(store, history, dispatcher, new SeriesAnalyzer(14, 2.5, 50), new ThresholdMatcher(),
        new CooldownGuard(history, Duration.ofMinutes(60)),
        new RedisAlertLockRegistry(redis.template(), "tw:lock:", LOCK_TTL), Runnable::run,
        Clock.fixed(NOW, ZoneOffset.UTC), new SimpleMeterRegistry(), 30, 30,
        HistoryWritePolicy.WRITE_AFTER_CONFIRMED_SEND);
  }

  @Test
  void slowDeliveryKeepsTheAlertLockedAgainstAnotherInstance() {
    MonitoredEntity kw = keyword("k1", "bitcoin");
    when(store.listActiveEntities()).thenReturn(List.of(kw));
    when(store.recentMeasurements(eq("k1"), anyInt())).thenReturn(series("k1", concat(repeat(10, 14), 100)));
    when(store.alertsFor("k1")).thenReturn(List.of(alert("a1", "k1", null, null, "email", "push", "sms", "webhook")));

    List<String> sends = new CopyOnWriteArrayList<>();
    MonitorScheduler second = instance((channel, recipient, event) -> sends.add("second:" + channel));
    AtomicReference<CycleSummary> secondSummary = new AtomicReference<>();
    AtomicInteger firstSends = new AtomicInteger();

    // by the third channel the first instance has held the alert longer than one TTL
    MonitorScheduler first = instance((channel, recipient, event) -> {
      if (firstSends.incrementAndGet() == 3) secondSummary.set(second.runCycle());
      sends.add("first:" + channel);
      try {
        Thread.sleep(SEND_MILLIS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new DeliveryException(channel, "interrupted", e);
      }
    });

    CycleSummary firstSummary = first.runCycle();

    assertThat(sends).containsExactly("first:email", "first:push", "first:sms", "first:webhook");
    assertThat(history.records).hasSize(1);
    assertThat(firstSummary.alertsTriggered()).isEqualTo(1);
    assertThat(secondSummary.get().alertsTriggered()).isZero();
    assertThat(secondSummary.get().alertsSuppressed()).isEqualTo(1);
  }

  private static final class MemoryHistory implements DispatchHistory {
    final List<DispatchHistoryRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public Optional<DispatchHistoryRecord> findRecentDispatch(String alertId, Instant since) {
      return records.stream()
          .filter(r -> r.alertId().equals(alertId) && !r.createdAt().isBefore(since))
          .reduce((a, b) -> b);
    }

    @Override
    public DispatchHistoryRecord recordDispatch(String alertId, String ownerId, Instant timestamp) {
      DispatchHistoryRecord r = new DispatchHistoryRecord("n-" + records.size(), alertId, ownerId, timestamp);
      records.add(r);
      return r;
    }

    @Override
    public long purgeOlderThan(Instant cutoff) {
      return 0;
    }
  }
}
