package com.trendwatch.monitor.analysis;

import com.trendwatch.monitor.error.ComputationException;
import com.trendwatch.monitor.error.InsufficientDataException;
import com.trendwatch.monitor.model.AnomalyResult;
import com.trendwatch.monitor.model.ContextStats;
import com.trendwatch.monitor.model.Measurement;
import com.trendwatch.monitor.model.Severity;
import com.trendwatch.monitor.model.TriggerReason;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rolling-window spike detection over one keyword's measurements.
 *
 * <p>Each point from index {@code windowSize} onward is compared against the {@code windowSize} points strictly
 * before it. A point is flagged when its z-score against that window, or its percent change from the previous
 * point, reaches the configured threshold. Instances are immutable and safe to share between threads.
 */
public class SeriesAnalyzer {

  static final double STD_FLOOR = 1e-8;

  private final int windowSize;
  private final double zThreshold;
  private final double pctChangeThreshold;

  public SeriesAnalyzer(int windowSize, double zThreshold, double pctChangeThreshold) {
    if (windowSize < 1) throw new IllegalArgumentException("windowSize must be >= 1, got " + windowSize);
    if (zThreshold <= 0) throw new IllegalArgumentException("zThreshold must be > 0, got " + zThreshold);
    if (pctChangeThreshold <= 0) {
      throw new IllegalArgumentException("pctChangeThreshold must be > 0, got " + pctChangeThreshold);
    }
    this.windowSize = windowSize;
    this.zThreshold = zThreshold;
    this.pctChangeThreshold = pctChangeThreshold;
  }

  public int windowSize() { return windowSize; }
  public double zThreshold() { return zThreshold; }
  public double pctChangeThreshold() { return pctChangeThreshold; }

  /** Smallest series length for which an anomaly can be computed. */
  public int minimumPoints() {
    return windowSize + 1;
  }

  public List<AnomalyResult> detectAll(List<Measurement> points) {
    List<AnomalyResult> results = new ArrayList<>();
    if (points == null || points.size() <= windowSize) return results;
    requireFinite(points);

    for (int i = windowSize; i < points.size(); i++) {
      AnomalyResult r = evaluateAt(points, i);
      if (r != null) results.add(r);
    }
    return results;
  }

  /**
   * The most recent anomaly in the series, if any. This is the last element of {@link #detectAll}; it may belong
   * to a point older than the newest one when the newest point is unremarkable.
   */
  public Optional<AnomalyResult> detectLatest(List<Measurement> points) {
    if (points == null || points.size() < minimumPoints()) return Optional.empty();
    List<AnomalyResult> all = detectAll(points);
    return all.isEmpty() ? Optional.empty() : Optional.of(all.get(all.size() - 1));
  }

  /** Statistics of the window preceding the newest point. */
  public ContextStats contextStats(List<Measurement> points) {
    int n = points == null ? 0 : points.size();
    if (n < minimumPoints()) throw new InsufficientDataException(n, minimumPoints());
    return contextStatsAt(points, n - 1);
  }

  /**
   * Statistics of the window preceding the point {@code anomaly} was raised on, which is not necessarily the newest
   * point of the series.
   *
   * @throws IllegalArgumentException if no point in {@code points} carries the anomaly's timestamp, or it has no
   *     full window before it
   */
  public ContextStats contextStats(List<Measurement> points, AnomalyResult anomaly) {
    int n = points == null ? 0 : points.size();
    if (n < minimumPoints()) throw new InsufficientDataException(n, minimumPoints());
    for (int i = n - 1; i >= windowSize; i--) {
      if (points.get(i).timestamp().equals(anomaly.timestamp())) return contextStatsAt(points, i);
    }
    throw new IllegalArgumentException(
        "No point at " + anomaly.timestamp() + " with a full window for keyword " + anomaly.entityId());
  }

  private ContextStats contextStatsAt(List<Measurement> points, int i) {
    Stats stats = computeStats(points, i - windowSize, i);
    return new ContextStats(windowSize, stats.mean(), stats.stddev(), points.get(i - 1).value());
  }

  public static Severity severityFromZ(double z) {
    double az = Math.abs(z);
    if (az >= 4) return Severity.CRITICAL;
    if (az >= 3) return Severity.HIGH;
    if (az >= 2.5) return Severity.MEDIUM;
    return Severity.LOW;
  }

  private AnomalyResult evaluateAt(List<Measurement> points, int i) {
    Stats stats = computeStats(points, i - windowSize, i);
    double std = Math.max(stats.stddev(), STD_FLOOR);

    Measurement point = points.get(i);
    double current = point.value();
    double prev = points.get(i - 1).value();

    double z = (current - stats.mean()) / std;
    double pctChange = prev == 0 ? 100.0 : ((current - prev) / Math.abs(prev)) * 100.0;

    boolean zHit = Math.abs(z) >= zThreshold;
    if (!zHit && Math.abs(pctChange) < pctChangeThreshold) return null;

    return new AnomalyResult(
        point.entityId(),
        point.timestamp(),
        current,
        z,
        pctChange,
        severityFromZ(z),
        zHit ? TriggerReason.ZSCORE : TriggerReason.PCT_CHANGE);
  }

  // population statistics over points[from, to)
  private static Stats computeStats(List<Measurement> points, int from, int to) {
    int n = to - from;
    double sum = 0.0;
    for (int i = from; i < to; i++) sum += points.get(i).value();
    double mean = sum / n;
    double var = 0.0;
    for (int i = from; i < to; i++) {
      double d = points.get(i).value() - mean;
      var += d * d;
    }
    return new Stats(mean, Math.sqrt(var / n));
  }

  private static void requireFinite(List<Measurement> points) {
    for (Measurement m : points) {
      if (!Double.isFinite(m.value())) {
        throw new ComputationException(
            "Non-finite value " + m.value() + " for keyword " + m.entityId() + " at " + m.timestamp());
      }
    }
  }

  private record Stats(double mean, double stddev) {}
}
