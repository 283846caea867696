package com.trendwatch.monitor.model;

public enum AlertPriority {
  LOW, MEDIUM, HIGH, CRITICAL
}
