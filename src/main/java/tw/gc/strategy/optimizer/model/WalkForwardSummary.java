package tw.gc.strategy.optimizer.model;

import java.util.List;

/**
 * Aggregate degradation statistics over the completed periods of a walk-forward run.
 *
 * @param totalPeriods Number of generated periods that were processed
 * @param completedPeriods Periods with both an in-sample winner and an out-of-sample result
 * @param failedPeriods Periods marked failed
 * @param meanDegradation Mean relative Sharpe degradation
 * @param medianDegradation Median relative Sharpe degradation
 * @param meanInSampleSharpe Mean in-sample Sharpe of the period winners
 * @param meanOutOfSampleSharpe Mean out-of-sample Sharpe of the period winners
 * @param positiveOutOfSampleFraction Share of completed periods with a positive out-of-sample Sharpe
 * @param robust Whether at least one period kept a positive out-of-sample Sharpe
 * @param warnings Human-readable diagnostics
 */
public record WalkForwardSummary(
    int totalPeriods,
    int completedPeriods,
    int failedPeriods,
    double meanDegradation,
    double medianDegradation,
    double meanInSampleSharpe,
    double meanOutOfSampleSharpe,
    double positiveOutOfSampleFraction,
    boolean robust,
    List<String> warnings
) {
    public WalkForwardSummary {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
