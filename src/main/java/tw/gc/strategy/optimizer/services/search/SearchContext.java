package tw.gc.strategy.optimizer.services.search;

import lombok.Builder;
import lombok.Value;
import tw.gc.strategy.optimizer.enums.RankingMetric;
import tw.gc.strategy.optimizer.services.execution.CancellationToken;
import tw.gc.strategy.optimizer.services.execution.ProgressListener;
import tw.gc.strategy.optimizer.services.execution.ScheduleOptions;
import tw.gc.strategy.optimizer.services.execution.TrialEvaluator;

/**
 * Per-run execution settings handed to a {@link SearchStrategy}.
 */
@Value
@Builder(toBuilder = true)
public class SearchContext {

    TrialEvaluator evaluator;

    @Builder.Default
    int concurrency = 1;

    @Builder.Default
    RankingMetric rankingMetric = RankingMetric.SHARPE;

    @Builder.Default
    ProgressListener progress = ProgressListener.none();

    @Builder.Default
    CancellationToken cancellationToken = CancellationToken.none();

    public SearchContext withProgress(ProgressListener progress) {
        return toBuilder().progress(progress).build();
    }

    /**
     * Scheduler options carrying this context's concurrency, progress and cancellation.
     */
    public ScheduleOptions.ScheduleOptionsBuilder scheduleOptions(String label) {
        return ScheduleOptions.builder()
            .concurrency(concurrency)
            .progress(progress)
            .cancellationToken(cancellationToken)
            .label(label);
    }
}
