package tw.gc.strategy.optimizer.services.execution;

import java.util.List;

import tw.gc.strategy.optimizer.model.TrialOutcome;

/**
 * Outcomes gathered by one scheduler run, in completion order.
 *
 * @param outcomes One outcome per started trial
 * @param cancelled True if the run stopped early because cancellation was requested
 */
public record ScheduleResult(List<TrialOutcome> outcomes, boolean cancelled) {

    public ScheduleResult {
        outcomes = List.copyOf(outcomes);
    }

    public long successCount() {
        return outcomes.stream().filter(TrialOutcome::succeeded).count();
    }
}
