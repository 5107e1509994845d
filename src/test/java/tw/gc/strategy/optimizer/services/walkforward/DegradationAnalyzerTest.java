package tw.gc.strategy.optimizer.services.walkforward;

import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import tw.gc.strategy.optimizer.model.MetricsRecord;
import tw.gc.strategy.optimizer.model.Period;
import tw.gc.strategy.optimizer.model.WalkForwardPeriodResult;
import tw.gc.strategy.optimizer.model.WalkForwardSummary;

import static org.assertj.core.api.Assertions.*;
import static tw.gc.strategy.optimizer.OptimizerFixtures.combination;
import static tw.gc.strategy.optimizer.OptimizerFixtures.metrics;

/**
 * Unit tests for {@link DegradationAnalyzer}.
 */
class DegradationAnalyzerTest {

    private final DegradationAnalyzer analyzer = new DegradationAnalyzer();

    private static Period period(int index) {
        LocalDate start = LocalDate.of(2024, 1, 1).plusDays(20L * index);
        return new Period(index, start, start.plusDays(59), start.plusDays(60), start.plusDays(79));
    }

    private static WalkForwardPeriodResult completed(int index, double inSharpe, double outSharpe) {
        MetricsRecord in = metrics(inSharpe);
        MetricsRecord out = metrics(outSharpe);
        return WalkForwardPeriodResult.completed(period(index), combination("p", index), in, out,
            DegradationAnalyzer.degradation(inSharpe, outSharpe), List.of(), null);
    }

    private static WalkForwardPeriodResult failed(int index) {
        return WalkForwardPeriodResult.failed(period(index), "No viable in-sample trial", null, null, List.of(), null);
    }

    @Nested
    @DisplayName("Degradation")
    class DegradationTests {

        @Test
        @DisplayName("should be the relative Sharpe drop")
        void shouldComputeRelativeDrop() {
            assertThat(DegradationAnalyzer.degradation(2.0, 1.5)).isCloseTo(0.25, within(1e-9));
            assertThat(DegradationAnalyzer.degradation(1.0, 1.2)).isCloseTo(-0.2, within(1e-9));
            assertThat(DegradationAnalyzer.degradation(-1.0, -2.0)).isCloseTo(1.0, within(1e-9));
        }

        @Test
        @DisplayName("should not divide by a near-zero in-sample Sharpe")
        void shouldClampDenominator() {
            assertThat(DegradationAnalyzer.degradation(0.0, -0.02)).isCloseTo(2.0, within(1e-9));
            assertThat(Double.isFinite(DegradationAnalyzer.degradation(0.0, 0.5))).isTrue();
        }
    }

    @Nested
    @DisplayName("Summary")
    class SummaryTests {

        @Test
        @DisplayName("should aggregate completed periods and count failures")
        void shouldAggregate() {
            WalkForwardSummary summary = analyzer.summarize(List.of(
                completed(0, 2.0, 1.0),
                completed(1, 1.0, 1.0),
                failed(2),
                completed(3, 2.0, 0.5)));

            assertThat(summary.totalPeriods()).isEqualTo(4);
            assertThat(summary.completedPeriods()).isEqualTo(3);
            assertThat(summary.failedPeriods()).isEqualTo(1);
            assertThat(summary.meanDegradation()).isCloseTo((0.5 + 0.0 + 0.75) / 3, within(1e-9));
            assertThat(summary.medianDegradation()).isCloseTo(0.5, within(1e-9));
            assertThat(summary.meanOutOfSampleSharpe()).isCloseTo(2.5 / 3, within(1e-9));
            assertThat(summary.positiveOutOfSampleFraction()).isEqualTo(1.0);
            assertThat(summary.robust()).isTrue();
            assertThat(summary.warnings()).anyMatch(w -> w.contains("failed"));
        }

        @Test
        @DisplayName("should flag a run without positive out-of-sample periods")
        void shouldFlagNonRobust() {
            WalkForwardSummary summary = analyzer.summarize(List.of(completed(0, 1.0, -0.5), completed(1, 0.8, 0.0)));

            assertThat(summary.robust()).isFalse();
            assertThat(summary.positiveOutOfSampleFraction()).isZero();
            assertThat(summary.warnings()).anyMatch(w -> w.contains("positive out-of-sample"));
        }

        @Test
        @DisplayName("should handle a run where every period failed")
        void shouldHandleAllFailed() {
            WalkForwardSummary summary = analyzer.summarize(List.of(failed(0), failed(1)));

            assertThat(summary.completedPeriods()).isZero();
            assertThat(summary.failedPeriods()).isEqualTo(2);
            assertThat(summary.robust()).isFalse();
        }
    }

    @Nested
    @DisplayName("Selection")
    class SelectionTests {

        @Test
        @DisplayName("should pick the least degraded period with positive out-of-sample Sharpe")
        void shouldPickLeastDegraded() {
            List<WalkForwardPeriodResult> results = List.of(
                completed(0, 2.0, 1.0),
                completed(1, 1.0, 0.9),
                completed(2, 3.0, -0.1),
                failed(3));

            assertThat(analyzer.selectRobust(results)).get()
                .extracting(r -> r.period().index()).isEqualTo(1);
        }

        @Test
        @DisplayName("should break degradation ties by the higher out-of-sample Sharpe")
        void shouldBreakTiesByOutOfSampleSharpe() {
            List<WalkForwardPeriodResult> results = List.of(completed(0, 1.0, 0.5), completed(1, 2.0, 1.0));

            assertThat(analyzer.selectRobust(results)).get()
                .extracting(r -> r.period().index()).isEqualTo(1);
        }

        @Test
        @DisplayName("fallback should pick the best out-of-sample period when none is positive")
        void fallbackShouldPickBestOutOfSample() {
            List<WalkForwardPeriodResult> results = List.of(completed(0, 1.0, -0.5), completed(1, 1.0, -0.1), failed(2));

            assertThat(analyzer.selectRobust(results)).isEmpty();
            assertThat(analyzer.selectFallback(results)).get()
                .extracting(r -> r.period().index()).isEqualTo(1);
        }
    }
}
