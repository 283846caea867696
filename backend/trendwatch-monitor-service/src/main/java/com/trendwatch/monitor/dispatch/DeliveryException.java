package com.trendwatch.monitor.dispatch;

/**
 * Raised by a {@link NotificationDispatcher} when a channel could not accept a trigger.
 */
public class DeliveryException extends Exception {
  private final String channel;

  public DeliveryException(String channel, String message) {
    super(message);
    this.channel = channel;
  }

  public DeliveryException(String channel, String message, Throwable cause) {
    super(message, cause);
    this.channel = channel;
  }

  public String getChannel() { return channel; }
}
