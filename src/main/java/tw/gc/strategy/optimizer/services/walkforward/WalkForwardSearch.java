package tw.gc.strategy.optimizer.services.walkforward;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tw.gc.strategy.optimizer.enums.SearchKind;
import tw.gc.strategy.optimizer.exceptions.NoViableResultException;
import tw.gc.strategy.optimizer.model.OptimizationRequest;
import tw.gc.strategy.optimizer.model.Period;
import tw.gc.strategy.optimizer.model.Trial;
import tw.gc.strategy.optimizer.model.TrialOutcome;
import tw.gc.strategy.optimizer.model.WalkForwardPeriodResult;
import tw.gc.strategy.optimizer.model.WalkForwardSettings;
import tw.gc.strategy.optimizer.model.WalkForwardSummary;
import tw.gc.strategy.optimizer.services.execution.ScheduleResult;
import tw.gc.strategy.optimizer.services.execution.TrialScheduler;
import tw.gc.strategy.optimizer.services.search.GridSearch;
import tw.gc.strategy.optimizer.services.search.SearchContext;
import tw.gc.strategy.optimizer.services.search.SearchOutcome;
import tw.gc.strategy.optimizer.services.search.SearchStrategy;
import tw.gc.strategy.optimizer.services.space.ParamSpace;

/**
 * Walk-forward search: optimize on a window, validate on the next one, roll forward.
 *
 * <p>For each {@link Period}:
 * <ol>
 *   <li>grid search on the in-sample window</li>
 *   <li>a single out-of-sample trial with the in-sample winner</li>
 *   <li>degradation of the Sharpe ratio between the two</li>
 * </ol>
 *
 * <p>A period whose in-sample search finds nothing viable, or whose out-of-sample trial fails, is kept
 * and marked failed. The run's best combination comes from the period with the lowest degradation
 * among those with a positive out-of-sample Sharpe. When no period qualifies the run still completes,
 * flagged not robust, with the best out-of-sample period as its result. Only a run where every period
 * failed is rejected.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WalkForwardSearch implements SearchStrategy {

    private final GridSearch gridSearch;
    private final TrialScheduler trialScheduler;
    private final PeriodGenerator periodGenerator;
    private final DegradationAnalyzer degradationAnalyzer;

    @Override
    public SearchKind kind() {
        return SearchKind.WALK_FORWARD;
    }

    @Override
    public SearchOutcome search(OptimizationRequest request, ParamSpace space, SearchContext context) {
        WalkForwardSettings settings = request.getWalkForward();
        List<Period> periods = periodGenerator.generate(request.getStartDate(), request.getEndDate(), settings);

        log.info("🚶 Walk-Forward Analysis for {}: {} periods", request.getStrategyId(), periods.size());
        log.info("   Data range: {} to {}", request.getStartDate(), request.getEndDate());
        log.info("   In-sample: {} days | Out-of-sample: {} days | Step: {} days{}",
            settings.inSampleDays(), settings.outSampleDays(), settings.stepDays(),
            settings.anchored() ? " (anchored)" : "");

        if (periods.isEmpty()) {
            throw new IllegalArgumentException(
                "Date range %s → %s is too short for one walk-forward period (%d + %d days)".formatted(
                    request.getStartDate(), request.getEndDate(), settings.inSampleDays(), settings.outSampleDays()));
        }

        long trialsPerPeriod = space.size() + 1;
        Integer overallTotal = (int) Math.min(trialsPerPeriod * periods.size(), Integer.MAX_VALUE);
        List<WalkForwardPeriodResult> results = new ArrayList<>();
        int completedTrials = 0;
        boolean cancelled = false;

        for (Period period : periods) {
            if (context.getCancellationToken().isCancellationRequested()) {
                cancelled = true;
                break;
            }

            log.info("📊 Processing {}", period.describe());
            SearchContext periodContext = context.withProgress(
                context.getProgress().offset(completedTrials, overallTotal));

            GridSearch.WindowResult inSample = gridSearch.searchWindow(
                request, space, period.inSampleStart(), period.inSampleEnd(), periodContext);
            completedTrials += inSample.outcomes().size();

            if (inSample.best() == null) {
                log.warn("   ❌ No viable in-sample trial for period {}", period.index());
                results.add(WalkForwardPeriodResult.failed(period, "No viable in-sample trial",
                    null, null, inSample.outcomes(), null));
                if (inSample.cancelled()) {
                    cancelled = true;
                    break;
                }
                continue;
            }

            if (inSample.cancelled()) {
                log.warn("   ⏹️ Period {} cancelled before out-of-sample validation", period.index());
                results.add(WalkForwardPeriodResult.failed(period, "Cancelled before out-of-sample validation",
                    inSample.best().combination(), inSample.best().metrics(), inSample.outcomes(), null));
                cancelled = true;
                break;
            }

            Trial outOfSampleTrial = new Trial(
                inSample.outcomes().size(),
                request.getStrategyId(),
                inSample.best().combination(),
                request.getSymbols(),
                period.outSampleStart(),
                period.outSampleEnd(),
                request.getCapital());

            ScheduleResult outOfSample = trialScheduler.run(List.of(outOfSampleTrial).iterator(),
                context.getEvaluator(),
                periodContext.withProgress(context.getProgress().offset(completedTrials, overallTotal))
                    .scheduleOptions("walk-forward-oos")
                    .concurrency(1)
                    .total(1)
                    .build());
            completedTrials += outOfSample.outcomes().size();

            if (outOfSample.outcomes().isEmpty()) {
                results.add(WalkForwardPeriodResult.failed(period, "Cancelled before out-of-sample validation",
                    inSample.best().combination(), inSample.best().metrics(), inSample.outcomes(), null));
                cancelled = true;
                break;
            }

            TrialOutcome outcome = outOfSample.outcomes().get(0);
            if (!outcome.succeeded()) {
                log.warn("   ❌ Out-of-sample trial failed for period {}: {}", period.index(), outcome.failure());
                results.add(WalkForwardPeriodResult.failed(period,
                    "Out-of-sample evaluation failed: %s (%s)".formatted(
                        outcome.failure().reason(), outcome.failure().message()),
                    inSample.best().combination(), inSample.best().metrics(), inSample.outcomes(), outcome));
                continue;
            }

            double sharpeIn = inSample.best().metrics().getSharpeRatio();
            double sharpeOut = outcome.metrics().getSharpeRatio();
            double degradation = DegradationAnalyzer.degradation(sharpeIn, sharpeOut);
            results.add(WalkForwardPeriodResult.completed(period, inSample.best().combination(),
                inSample.best().metrics(), outcome.metrics(), degradation, inSample.outcomes(), outcome));

            log.info("   IS Sharpe: {} | OOS Sharpe: {} | Degradation: {}%",
                String.format("%.3f", sharpeIn), String.format("%.3f", sharpeOut),
                String.format("%.1f", degradation * 100));
        }

        WalkForwardSummary summary = degradationAnalyzer.summarize(results);
        WalkForwardPeriodResult chosen = degradationAnalyzer.selectRobust(results)
            .or(() -> degradationAnalyzer.selectFallback(results))
            .orElseThrow(() -> new NoViableResultException(
                "No walk-forward period produced a viable result (%d periods)".formatted(results.size()),
                completedTrialsOf(results)));

        log.info("✅ Walk-Forward Analysis Complete");
        log.info("   Periods: {} completed / {} failed", summary.completedPeriods(), summary.failedPeriods());
        log.info("   Mean degradation: {}% | Median: {}%",
            String.format("%.1f", summary.meanDegradation() * 100),
            String.format("%.1f", summary.medianDegradation() * 100));
        log.info("   Mean IS Sharpe: {} | Mean OOS Sharpe: {}",
            String.format("%.3f", summary.meanInSampleSharpe()),
            String.format("%.3f", summary.meanOutOfSampleSharpe()));
        if (!summary.robust()) {
            log.warn("   ⚠️ Not robust: no period kept a positive out-of-sample Sharpe");
        }

        return SearchOutcome.builder()
            .bestCombination(chosen.bestParameters())
            .bestMetrics(chosen.outOfSampleMetrics())
            .periods(results)
            .walkForwardSummary(summary)
            .cancelled(cancelled)
            .build();
    }

    private static int completedTrialsOf(List<WalkForwardPeriodResult> results) {
        return results.stream()
            .mapToInt(r -> r.inSampleTrials().size() + (r.outOfSampleTrial() == null ? 0 : 1))
            .sum();
    }
}
