package tw.gc.strategy.optimizer.model;

import java.time.Instant;
import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import tw.gc.strategy.optimizer.enums.SearchKind;

/**
 * Full result of one optimization run. Written once and never modified; only deleted as a whole.
 *
 * <p>Grid and adaptive runs fill {@code trials}; walk-forward runs fill {@code periods} and
 * {@code walkForwardSummary} instead.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RunRecord {

    String runId;

    Instant createdAt;

    String strategyId;

    SearchKind searchKind;

    /** Request exactly as the run executed it, after presets and property defaults */
    OptimizationRequest config;

    ParameterCombination bestCombination;

    MetricsRecord bestMetrics;

    /** Trial outcomes in completion order */
    @Singular
    List<TrialOutcome> trials;

    @Singular
    List<WalkForwardPeriodResult> periods;

    WalkForwardSummary walkForwardSummary;

    RunStatistics statistics;

    /** True if the run was cancelled and the record holds partial results */
    boolean cancelled;

    long durationMs;

    public RunIndexEntry toIndexEntry() {
        return new RunIndexEntry(
            runId,
            createdAt,
            strategyId,
            searchKind,
            bestMetrics.getSharpeRatio(),
            bestMetrics.getTotalReturnPct(),
            config.getSymbols(),
            config.getStartDate(),
            config.getEndDate(),
            statistics == null ? trials.size() : statistics.totalTrials(),
            cancelled,
            walkForwardSummary == null ? null : walkForwardSummary.robust()
        );
    }
}
