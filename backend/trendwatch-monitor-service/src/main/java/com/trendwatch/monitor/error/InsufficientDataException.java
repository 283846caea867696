package com.trendwatch.monitor.error;

public class InsufficientDataException extends MonitorException {
  private final int available;
  private final int required;

  public InsufficientDataException(int available, int required) {
    super("Need at least " + required + " measurements, got " + available);
    this.available = available;
    this.required = required;
  }

  public int getAvailable() { return available; }
  public int getRequired() { return required; }
}
