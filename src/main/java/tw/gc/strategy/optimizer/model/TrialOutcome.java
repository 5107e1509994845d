package tw.gc.strategy.optimizer.model;

import java.time.LocalDate;

/**
 * Immutable result of one trial: either {@code metrics} or {@code failure} is set, never both.
 *
 * @param trialIndex Submission index of the trial
 * @param combination Evaluated parameters
 * @param startDate Evaluation window start
 * @param endDate Evaluation window end
 * @param metrics Metrics on success, null on failure
 * @param failure Failure on error, null on success
 * @param durationMs Wall-clock time spent on the trial
 */
public record TrialOutcome(
    int trialIndex,
    ParameterCombination combination,
    LocalDate startDate,
    LocalDate endDate,
    MetricsRecord metrics,
    TrialFailure failure,
    long durationMs
) {
    public TrialOutcome {
        if ((metrics == null) == (failure == null)) {
            throw new IllegalArgumentException("Exactly one of metrics or failure must be set");
        }
    }

    public static TrialOutcome success(Trial trial, MetricsRecord metrics, long durationMs) {
        return new TrialOutcome(trial.index(), trial.combination(), trial.startDate(), trial.endDate(),
            metrics, null, durationMs);
    }

    public static TrialOutcome failure(Trial trial, TrialFailure failure, long durationMs) {
        return new TrialOutcome(trial.index(), trial.combination(), trial.startDate(), trial.endDate(),
            null, failure, durationMs);
    }

    public boolean succeeded() {
        return metrics != null;
    }
}
