package com.trendwatch.monitor.service;

/**
 * When the dispatch-history record that drives the cooldown is written, relative to delivery.
 */
public enum HistoryWritePolicy {
  /**
   * Record first, then attempt every channel. A failed delivery still starts the cooldown, so the next attempt
   * waits out the full window.
   */
  WRITE_BEFORE_SEND,
  /**
   * Attempt every channel, then record only if at least one accepted the trigger. If nothing was delivered the
   * alert stays eligible on the next cycle.
   */
  WRITE_AFTER_CONFIRMED_SEND
}
