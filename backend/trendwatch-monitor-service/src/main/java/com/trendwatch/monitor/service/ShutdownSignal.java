package com.trendwatch.monitor.service;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot stop request for the monitor loop. The loop checks it only between cycles.
 */
public final class ShutdownSignal {

  private final CountDownLatch latch = new CountDownLatch(1);

  public void request() {
    latch.countDown();
  }

  public boolean isRequested() {
    return latch.getCount() == 0;
  }

  /** Waits up to {@code timeout}, returning early with {@code true} once a stop is requested. */
  public boolean await(Duration timeout) throws InterruptedException {
    return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }
}
