package tw.gc.strategy.optimizer.services.execution;

import java.util.function.Consumer;

import lombok.Builder;
import lombok.Value;
import tw.gc.strategy.optimizer.model.TrialOutcome;

/**
 * Knobs for one {@link TrialScheduler#run} call.
 */
@Value
@Builder
public class ScheduleOptions {

    /** Worker count, at least 1 */
    @Builder.Default
    int concurrency = 1;

    /** Expected trial count for progress reporting, null when unknown */
    Integer total;

    @Builder.Default
    ProgressListener progress = ProgressListener.none();

    @Builder.Default
    CancellationToken cancellationToken = CancellationToken.none();

    /** Called with each outcome, in completion order, before the next trial is pulled */
    @Builder.Default
    Consumer<TrialOutcome> outcomeListener = outcome -> { };

    /** Prefix for worker thread names */
    @Builder.Default
    String label = "trial";
}
