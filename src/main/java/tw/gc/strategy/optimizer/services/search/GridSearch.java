package tw.gc.strategy.optimizer.services.search;

import java.time.LocalDate;
import java.util.Iterator;
import java.util.List;
import java.util.stream.LongStream;

import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tw.gc.strategy.optimizer.enums.SearchKind;
import tw.gc.strategy.optimizer.exceptions.NoViableResultException;
import tw.gc.strategy.optimizer.model.OptimizationRequest;
import tw.gc.strategy.optimizer.model.Trial;
import tw.gc.strategy.optimizer.model.TrialOutcome;
import tw.gc.strategy.optimizer.services.execution.ScheduleResult;
import tw.gc.strategy.optimizer.services.execution.TrialScheduler;
import tw.gc.strategy.optimizer.services.space.ParamSpace;

/**
 * Exhaustive search: every combination of the space is evaluated once.
 *
 * <p>Combinations are submitted in enumeration order and pulled lazily by the scheduler.
 * Outcomes arrive in completion order; the best one is picked with {@link TrialRanking},
 * whose index tie-break makes the winner independent of scheduling.
 *
 * <p>A cancelled search still yields a result if at least one trial succeeded.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GridSearch implements SearchStrategy {

    private final TrialScheduler trialScheduler;

    @Override
    public SearchKind kind() {
        return SearchKind.GRID;
    }

    @Override
    public SearchOutcome search(OptimizationRequest request, ParamSpace space, SearchContext context) {
        WindowResult result = searchWindow(request, space, request.getStartDate(), request.getEndDate(), context);

        if (result.best() == null) {
            throw new NoViableResultException(
                "Grid search produced no successful trial out of %d".formatted(result.outcomes().size()),
                result.outcomes().size());
        }

        return SearchOutcome.builder()
            .bestCombination(result.best().combination())
            .bestMetrics(result.best().metrics())
            .trials(result.outcomes())
            .cancelled(result.cancelled())
            .build();
    }

    /**
     * Grid search restricted to one date window. Never throws for lack of viable trials:
     * walk-forward search uses this and records such windows as failed periods.
     */
    public WindowResult searchWindow(
            OptimizationRequest request,
            ParamSpace space,
            LocalDate start,
            LocalDate end,
            SearchContext context) {

        long size = space.size();
        log.info("🚀 Starting grid search for {} over {} parameters ({} combinations) [{} → {}]",
            request.getStrategyId(), space.specs().size(), size, start, end);

        long startTime = System.currentTimeMillis();

        Iterator<Trial> trials = LongStream.range(0, size)
            .mapToObj(i -> new Trial(
                (int) i,
                request.getStrategyId(),
                space.combinationAt(i),
                request.getSymbols(),
                start,
                end,
                request.getCapital()))
            .iterator();

        ScheduleResult scheduled = trialScheduler.run(trials, context.getEvaluator(),
            context.scheduleOptions("grid")
                .total((int) Math.min(size, Integer.MAX_VALUE))
                .build());

        TrialOutcome best = TrialRanking.best(scheduled.outcomes(), context.getRankingMetric()).orElse(null);
        long durationMs = System.currentTimeMillis() - startTime;

        if (best == null) {
            log.warn("⚠️ Grid search [{} → {}] finished in {}ms without a successful trial ({} attempted)",
                start, end, durationMs, scheduled.outcomes().size());
        } else {
            log.info("✅ Grid search [{} → {}] completed in {}ms: {}/{} trials succeeded, best {} (Sharpe {})",
                start, end, durationMs, scheduled.successCount(), scheduled.outcomes().size(),
                best.combination(), best.metrics().getSharpeRatio());
        }

        return new WindowResult(scheduled.outcomes(), best, scheduled.cancelled());
    }

    /**
     * @param outcomes Every outcome, in completion order
     * @param best Top-ranked successful outcome, null if none succeeded
     * @param cancelled Whether the search stopped early
     */
    public record WindowResult(List<TrialOutcome> outcomes, TrialOutcome best, boolean cancelled) {
    }
}
