package com.trendwatch.monitor.error;

/**
 * Base type for failures raised while evaluating one keyword or one alert.
 */
public class MonitorException extends RuntimeException {
  public MonitorException(String message) {
    super(message);
  }

  public MonitorException(String message, Throwable cause) {
    super(message, cause);
  }
}
