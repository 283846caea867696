package com.trendwatch.monitor.analysis;

import com.trendwatch.monitor.model.AlertRule;
import com.trendwatch.monitor.model.AnomalyResult;

/**
 * Checks an alert's optional thresholds against a detected anomaly. The percentage threshold applies to the
 * magnitude of the change; the absolute threshold applies to the raw current value.
 */
public class ThresholdMatcher {

  public boolean matches(AlertRule alert, AnomalyResult anomaly) {
    boolean pctOk = alert.thresholdPct() == null || Math.abs(anomaly.pctChange()) >= alert.thresholdPct();
    boolean absOk = alert.thresholdAbs() == null || anomaly.value() >= alert.thresholdAbs();
    return pctOk && absOk;
  }
}
