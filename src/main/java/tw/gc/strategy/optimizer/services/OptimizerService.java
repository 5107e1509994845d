package tw.gc.strategy.optimizer.services;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import lombok.extern.slf4j.Slf4j;
import tw.gc.strategy.optimizer.config.OptimizerProperties;
import tw.gc.strategy.optimizer.enums.SearchKind;
import tw.gc.strategy.optimizer.model.AdaptiveSettings;
import tw.gc.strategy.optimizer.model.OptimizationRequest;
import tw.gc.strategy.optimizer.model.RunRecord;
import tw.gc.strategy.optimizer.model.RunStatistics;
import tw.gc.strategy.optimizer.model.WalkForwardSettings;
import tw.gc.strategy.optimizer.services.execution.BacktestEvaluator;
import tw.gc.strategy.optimizer.services.execution.CancellationToken;
import tw.gc.strategy.optimizer.services.execution.ProgressListener;
import tw.gc.strategy.optimizer.services.execution.TrialEvaluator;
import tw.gc.strategy.optimizer.services.search.SearchContext;
import tw.gc.strategy.optimizer.services.search.SearchOutcome;
import tw.gc.strategy.optimizer.services.search.SearchStrategy;
import tw.gc.strategy.optimizer.services.space.ParamSpace;
import tw.gc.strategy.optimizer.services.storage.ResultsStore;

/**
 * Entry point for optimization runs.
 *
 * <p>A run goes through these steps:
 * <ol>
 *   <li>validate the request and fill unset knobs from {@code optimizer.*} properties</li>
 *   <li>build the parameter space (grid and walk-forward runs are held to {@code maxCombinations})</li>
 *   <li>reserve a run id and hand the space to the {@link SearchStrategy} for the request's kind</li>
 *   <li>persist the result as a {@link RunRecord}</li>
 * </ol>
 * A run that fails as a whole (bad request, nothing viable) persists nothing and propagates its
 * exception. A cancelled run with usable partial results is persisted with {@code cancelled = true}.
 */
@Service
@Slf4j
public class OptimizerService {

    private final Map<SearchKind, SearchStrategy> strategies = new EnumMap<>(SearchKind.class);
    private final BacktestEvaluator backtestEvaluator;
    private final ResultsStore resultsStore;
    private final OptimizerProperties properties;

    public OptimizerService(List<SearchStrategy> strategies, BacktestEvaluator backtestEvaluator,
                            ResultsStore resultsStore, OptimizerProperties properties) {
        strategies.forEach(strategy -> this.strategies.put(strategy.kind(), strategy));
        this.backtestEvaluator = backtestEvaluator;
        this.resultsStore = resultsStore;
        this.properties = properties;
    }

    public RunRecord optimize(OptimizationRequest request) {
        return optimize(request, ProgressListener.none(), CancellationToken.none());
    }

    public RunRecord optimize(OptimizationRequest request, ProgressListener progress) {
        return optimize(request, progress, CancellationToken.none());
    }

    public RunRecord optimize(OptimizationRequest request, ProgressListener progress, CancellationToken cancellationToken) {
        if (request == null) {
            throw new IllegalArgumentException("Optimization request cannot be null");
        }
        request.validate();
        OptimizationRequest resolved = withDefaults(request);

        SearchStrategy strategy = strategies.get(resolved.getSearchKind());
        if (strategy == null) {
            throw new IllegalArgumentException("No search strategy registered for " + resolved.getSearchKind());
        }

        ParamSpace space = resolved.getSearchKind() == SearchKind.ADAPTIVE
            ? ParamSpace.of(resolved.getParameters())
            : ParamSpace.of(resolved.getParameters(), properties.getMaxCombinations());

        Instant createdAt = Instant.now();
        String runId = resultsStore.allocateRunId(resolved.getStrategyId(), resolved.getSearchKind(), createdAt);

        log.info("🔧 Optimization run {} | {} | {} | {} → {} | {} | concurrency {}",
            runId, resolved.getSearchKind().getCode(), resolved.getSymbols(),
            resolved.getStartDate(), resolved.getEndDate(), space, resolved.getConcurrency());

        long startTime = System.currentTimeMillis();
        SearchOutcome outcome;
        try (TrialEvaluator evaluator = new TrialEvaluator(
                backtestEvaluator, resolved.getTrialTimeoutMs(), resolved.getMinTrades())) {
            SearchContext context = SearchContext.builder()
                .evaluator(evaluator)
                .concurrency(resolved.getConcurrency())
                .rankingMetric(resolved.getRankingMetric())
                .progress(progress == null ? ProgressListener.none() : progress)
                .cancellationToken(cancellationToken == null ? CancellationToken.none() : cancellationToken)
                .build();
            outcome = strategy.search(resolved, space, context);
        } catch (RuntimeException e) {
            resultsStore.releaseRunId(runId);
            log.error("❌ Optimization run {} failed: {}", runId, e.getMessage());
            throw e;
        }
        long durationMs = System.currentTimeMillis() - startTime;

        RunRecord record = RunRecord.builder()
            .runId(runId)
            .createdAt(createdAt)
            .strategyId(resolved.getStrategyId())
            .searchKind(resolved.getSearchKind())
            .config(resolved)
            .bestCombination(outcome.getBestCombination())
            .bestMetrics(outcome.getBestMetrics())
            .trials(outcome.getTrials())
            .periods(outcome.getPeriods())
            .walkForwardSummary(outcome.getWalkForwardSummary())
            .statistics(RunStatistics.of(outcome.allTrials()))
            .cancelled(outcome.isCancelled())
            .durationMs(durationMs)
            .build();

        resultsStore.save(record);

        log.info("🏁 Run {} finished in {}ms{}: best {} | Sharpe {} | Return {}%",
            runId, durationMs, record.isCancelled() ? " (cancelled)" : "",
            record.getBestCombination(),
            String.format("%.3f", record.getBestMetrics().getSharpeRatio()),
            String.format("%.2f", record.getBestMetrics().getTotalReturnPct()));
        return record;
    }

    /**
     * Applies the named preset from {@code optimizer.presets} over the request, then runs it.
     *
     * @throws IllegalArgumentException if no preset has that name
     */
    public RunRecord optimizePreset(String presetName, OptimizationRequest request) {
        OptimizerProperties.Preset preset = properties.getPresets().get(presetName);
        if (preset == null) {
            throw new IllegalArgumentException("Unknown preset '%s', available: %s"
                .formatted(presetName, properties.getPresets().keySet()));
        }
        log.info("📋 Applying preset '{}'", presetName);
        return optimize(applyPreset(presetName, preset, request));
    }

    OptimizationRequest withDefaults(OptimizationRequest request) {
        return request.toBuilder()
            .concurrency(request.getConcurrency() != null ? request.getConcurrency() : Math.max(1, properties.getConcurrency()))
            .trialTimeoutMs(request.getTrialTimeoutMs() != null ? request.getTrialTimeoutMs() : properties.getTrialTimeoutMs())
            .rankingMetric(request.getRankingMetric() != null ? request.getRankingMetric() : properties.getRankingMetric())
            .minTrades(request.getMinTrades() != null ? request.getMinTrades() : properties.getMinTrades())
            .build();
    }

    /**
     * Preset fields that are set replace the request's values; walk-forward and adaptive settings are
     * only touched when the preset names one of their fields.
     */
    static OptimizationRequest applyPreset(String presetName, OptimizerProperties.Preset preset, OptimizationRequest request) {
        OptimizationRequest.OptimizationRequestBuilder builder = request.toBuilder().preset(presetName);

        if (preset.getConcurrency() != null) {
            builder.concurrency(preset.getConcurrency());
        }
        if (preset.getRankingMetric() != null) {
            builder.rankingMetric(preset.getRankingMetric());
        }

        if (preset.getInSampleDays() != null || preset.getOutSampleDays() != null
                || preset.getStepDays() != null || preset.getAnchored() != null) {
            WalkForwardSettings base = request.getWalkForward() != null
                ? request.getWalkForward()
                : WalkForwardSettings.defaults();
            builder.walkForward(new WalkForwardSettings(
                preset.getInSampleDays() != null ? preset.getInSampleDays() : base.inSampleDays(),
                preset.getOutSampleDays() != null ? preset.getOutSampleDays() : base.outSampleDays(),
                preset.getStepDays() != null ? preset.getStepDays() : base.stepDays(),
                preset.getAnchored() != null ? preset.getAnchored() : base.anchored()));
        }

        if (preset.getTrialBudget() != null || preset.getTimeBudgetMs() != null || preset.getSampler() != null) {
            AdaptiveSettings base = request.getAdaptive();
            Integer trialBudget = preset.getTrialBudget() != null ? preset.getTrialBudget()
                : base != null ? base.trialBudget() : null;
            Long timeBudgetMs = preset.getTimeBudgetMs() != null ? preset.getTimeBudgetMs()
                : base != null ? base.timeBudgetMs() : null;
            String sampler = preset.getSampler() != null ? preset.getSampler()
                : base != null ? base.sampler() : null;
            if (trialBudget != null || timeBudgetMs != null) {
                builder.adaptive(new AdaptiveSettings(trialBudget, timeBudgetMs, sampler,
                    base != null ? base.seed() : null));
            }
        }

        return builder.build();
    }
}
