package com.trendwatch.monitor.lock;

/** Exclusive hold on one alert's cooldown check-then-write sequence. */
public interface AlertLock extends AutoCloseable {

  String alertId();

  /**
   * Extends the hold before another slow step. Returns {@code false} if the hold has already been lost, in which
   * case another worker may be handling the same alert.
   */
  boolean renew();

  @Override
  void close();
}
