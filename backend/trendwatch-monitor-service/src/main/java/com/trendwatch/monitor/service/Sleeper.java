package com.trendwatch.monitor.service;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {
  void sleep(Duration duration) throws InterruptedException;
}
