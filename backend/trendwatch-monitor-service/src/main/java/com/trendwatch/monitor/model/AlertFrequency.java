package com.trendwatch.monitor.model;

public enum AlertFrequency {
  REALTIME, HOURLY, DAILY
}
