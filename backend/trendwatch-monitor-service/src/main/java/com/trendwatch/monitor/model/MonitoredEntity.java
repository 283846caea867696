package com.trendwatch.monitor.model;

public record MonitoredEntity(String id, String displayTerm, boolean active, String ownerId) {}
