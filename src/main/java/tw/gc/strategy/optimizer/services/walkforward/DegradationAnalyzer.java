package tw.gc.strategy.optimizer.services.walkforward;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;
import tw.gc.strategy.optimizer.model.WalkForwardPeriodResult;
import tw.gc.strategy.optimizer.model.WalkForwardSummary;

/**
 * Measures how much in-sample performance survives out of sample.
 *
 * <p>Degradation for a period is {@code (sharpeIn - sharpeOut) / max(|sharpeIn|, ε)}: 0 means the
 * out-of-sample Sharpe matched the in-sample one, 1 means it fell to zero, negative values mean the
 * parameters did better on unseen data. The ε floor keeps near-zero in-sample Sharpe ratios from
 * blowing the ratio up.
 */
@Component
@Slf4j
public class DegradationAnalyzer {

    /** Floor for the degradation denominator */
    public static final double DEGRADATION_EPSILON = 0.01;

    /** Mean degradation above which a warning is attached */
    public static final double HIGH_DEGRADATION_THRESHOLD = 0.5;

    /** Fewer completed periods than this make the statistics unreliable */
    public static final int MIN_PERIODS_FOR_ANALYSIS = 3;

    public static double degradation(double inSampleSharpe, double outOfSampleSharpe) {
        return (inSampleSharpe - outOfSampleSharpe) / Math.max(Math.abs(inSampleSharpe), DEGRADATION_EPSILON);
    }

    /**
     * Aggregates the completed periods. Failed periods only count towards {@code failedPeriods}.
     */
    public WalkForwardSummary summarize(List<WalkForwardPeriodResult> results) {
        List<WalkForwardPeriodResult> completed = results.stream()
            .filter(WalkForwardPeriodResult::completedPeriod)
            .toList();
        int failed = results.size() - completed.size();
        List<String> warnings = new ArrayList<>();

        if (completed.isEmpty()) {
            warnings.add("No period completed");
            return new WalkForwardSummary(results.size(), 0, failed, 0, 0, 0, 0, 0, false, warnings);
        }

        double[] degradations = completed.stream()
            .mapToDouble(WalkForwardPeriodResult::degradation)
            .sorted()
            .toArray();
        double meanDegradation = mean(degradations);
        double medianDegradation = median(degradations);
        double meanIn = completed.stream()
            .mapToDouble(r -> r.inSampleMetrics().getSharpeRatio())
            .average().orElse(0);
        double meanOut = completed.stream()
            .mapToDouble(r -> r.outOfSampleMetrics().getSharpeRatio())
            .average().orElse(0);
        long positive = completed.stream().filter(WalkForwardPeriodResult::positiveOutOfSample).count();
        double positiveFraction = (double) positive / completed.size();
        boolean robust = positive > 0;

        if (!robust) {
            warnings.add("No period kept a positive out-of-sample Sharpe");
        }
        if (meanDegradation > HIGH_DEGRADATION_THRESHOLD) {
            warnings.add("Mean degradation %.1f%% exceeds %.0f%%"
                .formatted(meanDegradation * 100, HIGH_DEGRADATION_THRESHOLD * 100));
        }
        if (completed.size() < MIN_PERIODS_FOR_ANALYSIS) {
            warnings.add("Only %d completed period(s), at least %d needed for reliable statistics"
                .formatted(completed.size(), MIN_PERIODS_FOR_ANALYSIS));
        }
        if (failed > 0) {
            warnings.add("%d period(s) failed".formatted(failed));
        }

        log.debug("Walk-forward summary: mean degradation {}, positive OOS {}/{}",
            meanDegradation, positive, completed.size());

        return new WalkForwardSummary(results.size(), completed.size(), failed, meanDegradation,
            medianDegradation, meanIn, meanOut, positiveFraction, robust, warnings);
    }

    /**
     * Picks the period whose winner generalized best: lowest degradation among periods with a positive
     * out-of-sample Sharpe, ties broken by the higher out-of-sample Sharpe.
     *
     * @return the chosen period, empty if no period has a positive out-of-sample Sharpe
     */
    public Optional<WalkForwardPeriodResult> selectRobust(List<WalkForwardPeriodResult> results) {
        return results.stream()
            .filter(WalkForwardPeriodResult::positiveOutOfSample)
            .min(Comparator.comparingDouble(WalkForwardPeriodResult::degradation)
                .thenComparing(r -> r.outOfSampleMetrics().getSharpeRatio(), Comparator.reverseOrder()));
    }

    /**
     * Fallback pick for non-robust runs: the completed period with the highest out-of-sample Sharpe.
     */
    public Optional<WalkForwardPeriodResult> selectFallback(List<WalkForwardPeriodResult> results) {
        return results.stream()
            .filter(WalkForwardPeriodResult::completedPeriod)
            .max(Comparator.comparingDouble((WalkForwardPeriodResult r) -> r.outOfSampleMetrics().getSharpeRatio())
                .thenComparing(WalkForwardPeriodResult::degradation, Comparator.reverseOrder()));
    }

    private static double mean(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    private static double median(double[] sorted) {
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return sorted[mid];
        }
        return (sorted[mid - 1] + sorted[mid]) / 2.0;
    }
}
