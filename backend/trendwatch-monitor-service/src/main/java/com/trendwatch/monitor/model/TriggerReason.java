package com.trendwatch.monitor.model;

public enum TriggerReason {
  ZSCORE, PCT_CHANGE
}
