package com.trendwatch.monitor.dispatch;

import com.trendwatch.monitor.model.TriggerEvent;

public interface NotificationDispatcher {

  /**
   * Hands one trigger to the transport behind {@code channel}. Implementations bound their own wait time.
   */
  void dispatch(String channel, String recipientRef, TriggerEvent event) throws DeliveryException;
}
