package com.trendwatch.monitor.model;

import java.time.Instant;

public record TriggerEvent(
    AlertRule alert,
    MonitoredEntity entity,
    AnomalyResult anomaly,
    ContextStats contextStats,
    Instant triggeredAt
) {}
