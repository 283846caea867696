package com.trendwatch.monitor.model;

/** Severity tiers, declared in ascending order. */
public enum Severity {
  LOW, MEDIUM, HIGH, CRITICAL
}
