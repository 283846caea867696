package com.trendwatch.monitor.error;

public class ComputationException extends MonitorException {
  public ComputationException(String message) {
    super(message);
  }
}
