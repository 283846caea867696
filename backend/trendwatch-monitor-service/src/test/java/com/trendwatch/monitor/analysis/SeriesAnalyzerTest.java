package com.trendwatch.monitor.analysis;

import com.trendwatch.monitor.error.ComputationException;
import com.trendwatch.monitor.error.InsufficientDataException;
import com.trendwatch.monitor.model.AnomalyResult;
import com.trendwatch.monitor.model.ContextStats;
import com.trendwatch.monitor.model.Measurement;
import com.trendwatch.monitor.model.Severity;
import com.trendwatch.monitor.model.TriggerReason;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static com.trendwatch.monitor.TrendFixtures.T0;
import static com.trendwatch.monitor.TrendFixtures.concat;
import static com.trendwatch.monitor.TrendFixtures.repeat;
import static com.trendwatch.monitor.TrendFixtures.series;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SeriesAnalyzerTest {

  private final SeriesAnalyzer analyzer = new SeriesAnalyzer(14, 2.5, 50);

  @Test
  void noResultsUntilWindowIsFull() {
    for (int n = 0; n <= 14; n++) {
      List<Measurement> points = series("kw", concat(repeat(1, Math.max(0, n - 1)), n == 0 ? new double[0] : new double[] {1000}));
      assertThat(analyzer.detectAll(points)).as("n=%d", n).isEmpty();
      assertThat(analyzer.detectLatest(points)).as("n=%d", n).isEmpty();
    }
    assertThat(analyzer.detectAll(null)).isEmpty();
  }

  @Test
  void flatSeriesEndingOnTheSameValueIsQuiet() {
    List<Measurement> points = series("kw", repeat(10, 15));

    assertThat(analyzer.detectAll(points)).isEmpty();
    assertThat(analyzer.detectLatest(points)).isEmpty();

    ContextStats ctx = analyzer.contextStats(points);
    assertThat(ctx.windowMean()).isEqualTo(10.0);
    assertThat(ctx.windowStdDev()).isZero();
  }

  @Test
  void deviationFromFlatBaselineIsCriticalZScore() {
    List<Measurement> points = series("kw", concat(repeat(10, 14), 100));

    Optional<AnomalyResult> latest = analyzer.detectLatest(points);

    assertThat(latest).isPresent();
    AnomalyResult r = latest.get();
    assertThat(r.entityId()).isEqualTo("kw");
    assertThat(r.timestamp()).isEqualTo(T0.plus(Duration.ofMinutes(14)));
    assertThat(r.value()).isEqualTo(100.0);
    assertThat(r.reason()).isEqualTo(TriggerReason.ZSCORE);
    assertThat(r.severity()).isEqualTo(Severity.CRITICAL);
    assertThat(r.pctChange()).isCloseTo(900.0, within(1e-9));
    assertThat(r.zScore()).isGreaterThan(1e9);
  }

  @Test
  void changeFromZeroIsOneHundredPercent() {
    // alternating 10/0 window: mean 5, std 5, so a 5 after a 0 has z = 0
    double[] window = new double[14];
    for (int i = 0; i < window.length; i++) window[i] = i % 2 == 0 ? 10 : 0;
    List<Measurement> points = series("kw", concat(window, 5));

    AnomalyResult r = analyzer.detectLatest(points).orElseThrow();

    assertThat(r.pctChange()).isEqualTo(100.0);
    assertThat(r.zScore()).isCloseTo(0.0, within(1e-12));
    assertThat(r.reason()).isEqualTo(TriggerReason.PCT_CHANGE);
    assertThat(r.severity()).isEqualTo(Severity.LOW);
  }

  @Test
  void zScoreWinsWhenBothConditionsHold() {
    // flat 10s then 30: z is huge and pct is +200%
    AnomalyResult r = analyzer.detectLatest(series("kw", concat(repeat(10, 14), 30))).orElseThrow();
    assertThat(r.reason()).isEqualTo(TriggerReason.ZSCORE);
  }

  @Test
  void dropsAreFlaggedByMagnitude() {
    AnomalyResult r = analyzer.detectLatest(series("kw", concat(repeat(100, 14), 10))).orElseThrow();
    assertThat(r.zScore()).isNegative();
    assertThat(r.pctChange()).isCloseTo(-90.0, within(1e-9));
    assertThat(r.severity()).isEqualTo(Severity.CRITICAL);
  }

  @Test
  void exactlyOneWindowPlusOneYieldsAtMostOneResult() {
    assertThat(analyzer.detectAll(series("kw", concat(repeat(10, 14), 100)))).hasSize(1);
  }

  @Test
  void detectLatestReturnsTheLastOfDetectAll() {
    // 14 x 10, then 100 twice: both trailing points are anomalous
    List<Measurement> points = series("kw", concat(repeat(10, 14), 100, 100));

    List<AnomalyResult> all = analyzer.detectAll(points);
    AnomalyResult latest = analyzer.detectLatest(points).orElseThrow();

    assertThat(all).hasSize(2);
    assertThat(latest).isEqualTo(all.get(1));
    assertThat(latest.timestamp()).isEqualTo(T0.plus(Duration.ofMinutes(15)));
    // window is 13 x 10 and one 100: mean 16.43, population std 23.18
    assertThat(latest.zScore()).isCloseTo(3.606, within(1e-3));
    assertThat(latest.severity()).isEqualTo(Severity.HIGH);
    assertThat(latest.pctChange()).isZero();
  }

  @Test
  void smallMovesInNoisySeriesAreIgnored() {
    List<Measurement> points = series("kw", 50, 52, 48, 51, 49, 50, 53, 47, 50, 52, 48, 51, 49, 50, 51);
    assertThat(analyzer.detectAll(points)).isEmpty();
  }

  @Test
  void severityTiers() {
    assertThat(SeriesAnalyzer.severityFromZ(0)).isEqualTo(Severity.LOW);
    assertThat(SeriesAnalyzer.severityFromZ(2.49)).isEqualTo(Severity.LOW);
    assertThat(SeriesAnalyzer.severityFromZ(2.5)).isEqualTo(Severity.MEDIUM);
    assertThat(SeriesAnalyzer.severityFromZ(-3)).isEqualTo(Severity.HIGH);
    assertThat(SeriesAnalyzer.severityFromZ(4)).isEqualTo(Severity.CRITICAL);
    assertThat(SeriesAnalyzer.severityFromZ(-1e12)).isEqualTo(Severity.CRITICAL);
  }

  @Test
  void severityIsMonotonicInMagnitude() {
    Severity prev = Severity.LOW;
    for (int i = 0; i <= 1000; i++) {
      double z = i / 100.0;
      Severity pos = SeriesAnalyzer.severityFromZ(z);
      Severity neg = SeriesAnalyzer.severityFromZ(-z);
      assertThat(pos).isEqualTo(neg);
      assertThat(pos.compareTo(prev)).as("z=%s", z).isGreaterThanOrEqualTo(0);
      prev = pos;
    }
  }

  @Test
  void customPercentThresholdIsHonoured() {
    SeriesAnalyzer strict = new SeriesAnalyzer(3, 100, 10);
    // 100 -> 112 is +12%, well inside z = 100
    AnomalyResult r = strict.detectLatest(series("kw", 100, 110, 100, 112)).orElseThrow();
    assertThat(r.reason()).isEqualTo(TriggerReason.PCT_CHANGE);
    assertThat(analyzer.detectAll(series("kw", 100, 110, 100, 112))).isEmpty();
  }

  @Test
  void contextStatsDescribeThePrecedingWindow() {
    SeriesAnalyzer small = new SeriesAnalyzer(4, 2.5, 50);
    ContextStats ctx = small.contextStats(series("kw", 999, 2, 4, 4, 6, 50));

    assertThat(ctx.windowSize()).isEqualTo(4);
    assertThat(ctx.windowMean()).isEqualTo(4.0);
    assertThat(ctx.windowStdDev()).isCloseTo(Math.sqrt(2.0), within(1e-12));
    assertThat(ctx.previousValue()).isEqualTo(6.0);
  }

  @Test
  void contextStatsFollowAnOlderAnomaly() {
    // 10/20 baseline, a spike to 31, then a quiet 20 as the newest point
    double[] baseline = new double[14];
    for (int i = 0; i < 14; i++) baseline[i] = i % 2 == 0 ? 10 : 20;
    List<Measurement> points = series("kw", concat(baseline, 31, 20));

    AnomalyResult latest = analyzer.detectLatest(points).orElseThrow();
    assertThat(latest.value()).isEqualTo(31.0);
    assertThat(latest.timestamp()).isEqualTo(T0.plus(Duration.ofMinutes(14)));

    ContextStats ctx = analyzer.contextStats(points, latest);
    assertThat(ctx.windowMean()).isEqualTo(15.0);
    assertThat(ctx.windowStdDev()).isCloseTo(5.0, within(1e-12));
    assertThat(ctx.previousValue()).isEqualTo(20.0);

    // the newest-point window would have included the spike
    assertThat(analyzer.contextStats(points).previousValue()).isEqualTo(31.0);
  }

  @Test
  void contextStatsRejectAnAnomalyFromAnotherSeries() {
    List<Measurement> points = series("kw", concat(repeat(10, 14), 100));
    AnomalyResult foreign = new AnomalyResult("kw", T0.minus(Duration.ofDays(1)), 100, 9, 900, Severity.CRITICAL,
        TriggerReason.ZSCORE);

    assertThatThrownBy(() -> analyzer.contextStats(points, foreign)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void contextStatsNeedAFullWindow() {
    assertThatThrownBy(() -> analyzer.contextStats(series("kw", repeat(1, 14))))
        .isInstanceOf(InsufficientDataException.class)
        .hasMessageContaining("15");
  }

  @Test
  void nonFiniteValuesAreRejected() {
    List<Measurement> points = series("kw", concat(repeat(10, 7), Double.NaN, 10, 10, 10, 10, 10, 10, 10));
    assertThatThrownBy(() -> analyzer.detectLatest(points))
        .isInstanceOf(ComputationException.class)
        .hasMessageContaining("kw");
    assertThatThrownBy(() -> analyzer.detectAll(series("kw", concat(repeat(1, 14), Double.POSITIVE_INFINITY))))
        .isInstanceOf(ComputationException.class);
  }

  @Test
  void rejectsInvalidSettings() {
    assertThatThrownBy(() -> new SeriesAnalyzer(0, 2.5, 50)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new SeriesAnalyzer(14, 0, 50)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new SeriesAnalyzer(14, 2.5, -1)).isInstanceOf(IllegalArgumentException.class);
    assertThat(analyzer.minimumPoints()).isEqualTo(15);
  }
}
