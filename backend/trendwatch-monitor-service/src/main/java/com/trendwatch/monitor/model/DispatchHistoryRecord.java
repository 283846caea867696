package com.trendwatch.monitor.model;

import java.time.Instant;

public record DispatchHistoryRecord(String id, String alertId, String ownerId, Instant createdAt) {}
