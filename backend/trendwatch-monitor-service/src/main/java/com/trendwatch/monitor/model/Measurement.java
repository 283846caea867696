package com.trendwatch.monitor.model;

import java.time.Instant;
import java.util.Set;

public record Measurement(
    String entityId,
    Instant timestamp,
    double value,
    Set<String> relatedTerms
) {
  public Measurement {
    relatedTerms = relatedTerms == null ? Set.of() : Set.copyOf(relatedTerms);
  }
}
