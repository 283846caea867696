package com.trendwatch.monitor.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Runs the {@link MonitorScheduler} loop on its own thread for the lifetime of the application context.
 *
 * <p>Startup fails if the keyword store is unreachable. Stopping asks the loop to finish its current cycle and
 * waits a bounded time for it.
 */
@Component
@ConditionalOnProperty(name = "trendwatch.monitor.enabled", havingValue = "true", matchIfMissing = true)
public class MonitorWorker implements SmartLifecycle {

  private static final Logger log = LoggerFactory.getLogger(MonitorWorker.class);

  private final MonitorScheduler scheduler;
  private final long stopTimeoutMs;

  private volatile ShutdownSignal signal;
  private volatile Thread thread;

  public MonitorWorker(MonitorScheduler scheduler,
                       @Value("${trendwatch.monitor.stop-timeout-ms:60000}") long stopTimeoutMs) {
    this.scheduler = scheduler;
    this.stopTimeoutMs = stopTimeoutMs;
  }

  @Override
  public synchronized void start() {
    Thread previous = thread;
    if (previous != null) {
      if (previous.isAlive()) {
        log.warn("Previous monitor loop has not exited yet, not starting another");
        return;
      }
      thread = null;
      signal = null;
    }
    int active = scheduler.verifyCollaborators();
    log.info("Trend monitor starting: {} active keyword(s), checking every {}", active, scheduler.pollInterval());

    ShutdownSignal s = new ShutdownSignal();
    Thread t = new Thread(() -> scheduler.run(s, s::await), "trend-monitor");
    t.setUncaughtExceptionHandler((th, e) -> log.error("Monitor loop terminated unexpectedly", e));
    signal = s;
    thread = t;
    t.start();
  }

  @Override
  public synchronized void stop() {
    ShutdownSignal s = signal;
    Thread t = thread;
    if (s == null || t == null) return;
    log.info("Trend monitor shutting down, waiting for the current cycle");
    s.request();
    try {
      t.join(stopTimeoutMs);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    if (t.isAlive()) {
      // keep the references so start() cannot run a second loop beside this one
      log.warn("Monitor loop still running after {} ms, leaving it to finish", stopTimeoutMs);
      return;
    }
    signal = null;
    thread = null;
  }

  @Override
  public boolean isRunning() {
    Thread t = thread;
    return t != null && t.isAlive();
  }
}
