package tw.gc.strategy.optimizer.model;

import java.util.List;

import tw.gc.strategy.optimizer.enums.PeriodStatus;

/**
 * Outcome of one walk-forward period: the in-sample grid search and the out-of-sample check
 * of its winner. Failed periods keep whatever was gathered before the failure.
 *
 * @param period The period
 * @param status Completed or failed
 * @param failureMessage Why the period failed, null when completed
 * @param bestParameters Winner of the in-sample search, null if the search found nothing viable
 * @param inSampleMetrics Winner's in-sample metrics
 * @param outOfSampleMetrics Winner's out-of-sample metrics, null if the check failed or never ran
 * @param degradation Relative Sharpe drop from in-sample to out-of-sample, null unless completed
 * @param inSampleTrials Every in-sample trial outcome, in completion order
 * @param outOfSampleTrial The out-of-sample trial outcome, null if it never ran
 */
public record WalkForwardPeriodResult(
    Period period,
    PeriodStatus status,
    String failureMessage,
    ParameterCombination bestParameters,
    MetricsRecord inSampleMetrics,
    MetricsRecord outOfSampleMetrics,
    Double degradation,
    List<TrialOutcome> inSampleTrials,
    TrialOutcome outOfSampleTrial
) {
    public WalkForwardPeriodResult {
        if (period == null || status == null) {
            throw new IllegalArgumentException("period and status cannot be null");
        }
        inSampleTrials = inSampleTrials == null ? List.of() : List.copyOf(inSampleTrials);
    }

    public static WalkForwardPeriodResult completed(
            Period period,
            ParameterCombination bestParameters,
            MetricsRecord inSampleMetrics,
            MetricsRecord outOfSampleMetrics,
            double degradation,
            List<TrialOutcome> inSampleTrials,
            TrialOutcome outOfSampleTrial) {
        return new WalkForwardPeriodResult(period, PeriodStatus.COMPLETED, null, bestParameters,
            inSampleMetrics, outOfSampleMetrics, degradation, inSampleTrials, outOfSampleTrial);
    }

    public static WalkForwardPeriodResult failed(
            Period period,
            String failureMessage,
            ParameterCombination bestParameters,
            MetricsRecord inSampleMetrics,
            List<TrialOutcome> inSampleTrials,
            TrialOutcome outOfSampleTrial) {
        return new WalkForwardPeriodResult(period, PeriodStatus.FAILED, failureMessage, bestParameters,
            inSampleMetrics, null, null, inSampleTrials, outOfSampleTrial);
    }

    public boolean completedPeriod() {
        return status == PeriodStatus.COMPLETED;
    }

    /**
     * @return true if the period completed and its out-of-sample Sharpe is strictly positive
     */
    public boolean positiveOutOfSample() {
        return completedPeriod() && outOfSampleMetrics.getSharpeRatio() > 0;
    }
}
