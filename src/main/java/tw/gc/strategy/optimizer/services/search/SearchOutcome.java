package tw.gc.strategy.optimizer.services.search;

import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import tw.gc.strategy.optimizer.model.MetricsRecord;
import tw.gc.strategy.optimizer.model.ParameterCombination;
import tw.gc.strategy.optimizer.model.TrialOutcome;
import tw.gc.strategy.optimizer.model.WalkForwardPeriodResult;
import tw.gc.strategy.optimizer.model.WalkForwardSummary;

/**
 * What a search produced, before it is stamped with a run id and persisted.
 */
@Value
@Builder
public class SearchOutcome {

    ParameterCombination bestCombination;

    MetricsRecord bestMetrics;

    @Singular
    List<TrialOutcome> trials;

    @Singular
    List<WalkForwardPeriodResult> periods;

    WalkForwardSummary walkForwardSummary;

    boolean cancelled;

    /**
     * @return every trial outcome of the run, walk-forward periods flattened in period order
     */
    public List<TrialOutcome> allTrials() {
        if (periods.isEmpty()) {
            return trials;
        }
        return periods.stream()
            .flatMap(p -> {
                List<TrialOutcome> outcomes = new ArrayList<>(p.inSampleTrials());
                if (p.outOfSampleTrial() != null) {
                    outcomes.add(p.outOfSampleTrial());
                }
                return outcomes.stream();
            })
            .toList();
    }
}
