package com.trendwatch.monitor.model;

/**
 * Statistics of the window preceding the anomalous point, attached to every trigger. When the latest anomaly sits
 * on an older point, the window and previous value are those of that point, not of the newest one.
 */
public record ContextStats(int windowSize, double windowMean, double windowStdDev, double previousValue) {}
