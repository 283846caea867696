package com.trendwatch.monitor.model;

import java.time.Instant;

public record AnomalyResult(
    String entityId,
    Instant timestamp,
    double value,
    double zScore,
    double pctChange,
    Severity severity,
    TriggerReason reason
) {}
