package com.trendwatch.monitor.config;

import com.trendwatch.monitor.analysis.CooldownGuard;
import com.trendwatch.monitor.analysis.SeriesAnalyzer;
import com.trendwatch.monitor.analysis.ThresholdMatcher;
import com.trendwatch.monitor.lock.AlertLockRegistry;
import com.trendwatch.monitor.lock.LocalAlertLockRegistry;
import com.trendwatch.monitor.lock.RedisAlertLockRegistry;
import com.trendwatch.monitor.store.DispatchHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class MonitorConfig {

  private static final Logger log = LoggerFactory.getLogger(MonitorConfig.class);

  @Bean
  public Clock monitorClock() {
    return Clock.systemUTC();
  }

  @Bean
  public SeriesAnalyzer seriesAnalyzer(@Value("${trendwatch.monitor.window-size:14}") int windowSize,
                                       @Value("${trendwatch.monitor.z-score-threshold:2.5}") double zThreshold,
                                       @Value("${trendwatch.monitor.pct-change-threshold:50}") double pctChangeThreshold) {
    try {
      return new SeriesAnalyzer(windowSize, zThreshold, pctChangeThreshold);
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException("Invalid trendwatch.monitor analyzer settings: " + e.getMessage(), e);
    }
  }

  @Bean
  public ThresholdMatcher thresholdMatcher() {
    return new ThresholdMatcher();
  }

  @Bean
  public CooldownGuard cooldownGuard(DispatchHistory history,
                                     @Value("${trendwatch.monitor.cooldown-minutes:60}") long cooldownMinutes) {
    if (cooldownMinutes <= 0) {
      throw new IllegalStateException("trendwatch.monitor.cooldown-minutes must be > 0, got " + cooldownMinutes);
    }
    return new CooldownGuard(history, Duration.ofMinutes(cooldownMinutes));
  }

  /**
   * Runs keyword evaluations. With one worker they run inline on the loop thread, one after another.
   */
  @Bean
  public Executor monitorEntityExecutor(@Value("${trendwatch.monitor.worker-threads:1}") int workerThreads) {
    if (workerThreads <= 1) return Runnable::run;
    log.info("Evaluating keywords on {} worker threads", workerThreads);
    AtomicInteger seq = new AtomicInteger();
    return Executors.newFixedThreadPool(workerThreads, r -> {
      Thread t = new Thread(r, "trend-monitor-worker-" + seq.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
  }

  @Bean
  @ConditionalOnProperty(name = "trendwatch.monitor.lock-mode", havingValue = "redis")
  public AlertLockRegistry redisAlertLockRegistry(StringRedisTemplate redis,
                                                  @Value("${trendwatch.monitor.lock-key-prefix:trendwatch:lock:alert:}") String keyPrefix,
                                                  @Value("${trendwatch.monitor.lock-ttl-ms:30000}") long lockTtlMs,
                                                  @Value("${trendwatch.dispatch.send-timeout-ms:10000}") long sendTimeoutMs) {
    // the lock is renewed before every channel, so one send plus the history write must fit in a TTL
    if (lockTtlMs < 2 * sendTimeoutMs) {
      throw new IllegalStateException("trendwatch.monitor.lock-ttl-ms (" + lockTtlMs
          + ") must be at least twice trendwatch.dispatch.send-timeout-ms (" + sendTimeoutMs + ")");
    }
    return new RedisAlertLockRegistry(redis, keyPrefix, Duration.ofMillis(lockTtlMs));
  }

  @Bean
  @ConditionalOnProperty(name = "trendwatch.monitor.lock-mode", havingValue = "local", matchIfMissing = true)
  public AlertLockRegistry localAlertLockRegistry() {
    return new LocalAlertLockRegistry();
  }
}
