package com.trendwatch.monitor.error;

public class CollaboratorUnavailableException extends MonitorException {
  public CollaboratorUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
