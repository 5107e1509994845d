package tw.gc.strategy.optimizer.services.search;

import tw.gc.strategy.optimizer.enums.SearchKind;
import tw.gc.strategy.optimizer.model.OptimizationRequest;
import tw.gc.strategy.optimizer.services.space.ParamSpace;

/**
 * One way of exploring a parameter space. Implementations produce trials, hand them to the
 * {@link tw.gc.strategy.optimizer.services.execution.TrialScheduler} and decide the run's best result
 * from the outcomes. A strategy instance may serve several runs, but each run is driven by a single thread.
 */
public interface SearchStrategy {

    SearchKind kind();

    /**
     * Runs the search.
     *
     * @param request Validated request
     * @param space Validated parameter space built from the request
     * @param context Evaluator, concurrency, ranking, progress and cancellation for this run
     * @return best result plus every outcome gathered
     * @throws tw.gc.strategy.optimizer.exceptions.NoViableResultException if nothing usable was produced
     */
    SearchOutcome search(OptimizationRequest request, ParamSpace space, SearchContext context);
}
