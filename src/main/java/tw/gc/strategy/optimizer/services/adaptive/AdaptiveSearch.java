package tw.gc.strategy.optimizer.services.adaptive;

import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import lombok.extern.slf4j.Slf4j;
import tw.gc.strategy.optimizer.config.OptimizerProperties;
import tw.gc.strategy.optimizer.enums.RankingMetric;
import tw.gc.strategy.optimizer.enums.SearchKind;
import tw.gc.strategy.optimizer.exceptions.NoViableResultException;
import tw.gc.strategy.optimizer.model.AdaptiveSettings;
import tw.gc.strategy.optimizer.model.OptimizationRequest;
import tw.gc.strategy.optimizer.model.ParameterCombination;
import tw.gc.strategy.optimizer.model.Trial;
import tw.gc.strategy.optimizer.model.TrialOutcome;
import tw.gc.strategy.optimizer.services.execution.ScheduleResult;
import tw.gc.strategy.optimizer.services.execution.TrialScheduler;
import tw.gc.strategy.optimizer.services.search.SearchContext;
import tw.gc.strategy.optimizer.services.search.SearchOutcome;
import tw.gc.strategy.optimizer.services.search.SearchStrategy;
import tw.gc.strategy.optimizer.services.search.TrialRanking;
import tw.gc.strategy.optimizer.services.space.ParamSpace;

/**
 * Suggestion-driven search over a pluggable {@link SearchBackend}.
 *
 * <p>The loop is: ask the backend for a combination, run it as a trial, report its score back.
 * Suggestions are pulled lazily by the scheduler, so with {@code concurrency > 1} the backend may be
 * asked for up to {@code concurrency} suggestions before the first report arrives.
 *
 * <p>The run stops when the trial budget is used up or the time budget has elapsed, whichever comes
 * first. The time budget is checked before each new trial; trials already running are allowed to finish.
 */
@Service
@Slf4j
public class AdaptiveSearch implements SearchStrategy {

    /** Score reported for failed trials */
    public static final double FAILURE_SCORE = -1e9;

    private final Map<String, SearchBackendProvider> providers;
    private final TrialScheduler trialScheduler;
    private final OptimizerProperties properties;

    public AdaptiveSearch(List<SearchBackendProvider> providers, TrialScheduler trialScheduler,
                          OptimizerProperties properties) {
        this.providers = providers.stream()
            .collect(Collectors.toMap(p -> p.name().toLowerCase(Locale.ROOT), Function.identity()));
        this.trialScheduler = trialScheduler;
        this.properties = properties;
    }

    @Override
    public SearchKind kind() {
        return SearchKind.ADAPTIVE;
    }

    @Override
    public SearchOutcome search(OptimizationRequest request, ParamSpace space, SearchContext context) {
        AdaptiveSettings settings = request.getAdaptive();
        String sampler = settings.sampler() == null ? properties.getDefaultSampler() : settings.sampler();
        SearchBackendProvider provider = providers.get(sampler.toLowerCase(Locale.ROOT));
        if (provider == null) {
            throw new IllegalArgumentException("Unknown sampler '%s', available: %s"
                .formatted(sampler, providers.keySet()));
        }

        SearchBackend backend = provider.create(space, settings);
        RankingMetric metric = context.getRankingMetric();

        log.info("🎯 Starting adaptive search for {} with sampler '{}' (trial budget: {}, time budget: {})",
            request.getStrategyId(), provider.name(),
            settings.trialBudget() == null ? "-" : settings.trialBudget(),
            settings.timeBudgetMs() == null ? "-" : settings.timeBudgetMs() + "ms");

        long startTime = System.currentTimeMillis();
        ScheduleResult scheduled = trialScheduler.run(
            new SuggestionIterator(request, space, backend, settings, startTime),
            context.getEvaluator(),
            context.scheduleOptions("adaptive")
                .total(settings.trialBudget())
                .outcomeListener(outcome -> backend.report(outcome.combination(), score(outcome, metric)))
                .build());

        TrialOutcome best = TrialRanking.best(scheduled.outcomes(), metric)
            .orElseThrow(() -> new NoViableResultException(
                "Adaptive search produced no successful trial out of %d".formatted(scheduled.outcomes().size()),
                scheduled.outcomes().size()));

        log.info("✅ Adaptive search completed in {}ms: {}/{} trials succeeded, best {} ({} {})",
            System.currentTimeMillis() - startTime, scheduled.successCount(), scheduled.outcomes().size(),
            best.combination(), metric, String.format("%.4f", metric.extract(best.metrics())));

        return SearchOutcome.builder()
            .bestCombination(best.combination())
            .bestMetrics(best.metrics())
            .trials(scheduled.outcomes())
            .cancelled(scheduled.cancelled())
            .build();
    }

    static double score(TrialOutcome outcome, RankingMetric metric) {
        if (!outcome.succeeded()) {
            return FAILURE_SCORE;
        }
        double value = metric.extract(outcome.metrics());
        return Double.isFinite(value) ? value : FAILURE_SCORE;
    }

    /**
     * Turns backend suggestions into trials until a budget runs out.
     */
    private static final class SuggestionIterator implements Iterator<Trial> {

        private final OptimizationRequest request;
        private final ParamSpace space;
        private final SearchBackend backend;
        private final Integer trialBudget;
        private final Long timeBudgetMs;
        private final long startTime;
        private int issued;

        SuggestionIterator(OptimizationRequest request, ParamSpace space, SearchBackend backend,
                           AdaptiveSettings settings, long startTime) {
            this.request = request;
            this.space = space;
            this.backend = backend;
            this.trialBudget = settings.trialBudget();
            this.timeBudgetMs = settings.timeBudgetMs();
            this.startTime = startTime;
        }

        @Override
        public boolean hasNext() {
            if (trialBudget != null && issued >= trialBudget) {
                return false;
            }
            if (timeBudgetMs != null && System.currentTimeMillis() - startTime >= timeBudgetMs) {
                log.debug("Time budget of {}ms reached after {} trials", timeBudgetMs, issued);
                return false;
            }
            return true;
        }

        @Override
        public Trial next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            ParameterCombination suggestion = backend.suggest();
            if (suggestion == null || !space.contains(suggestion)) {
                throw new IllegalStateException("Search backend suggested a combination outside the space: "
                    + suggestion);
            }
            return new Trial(issued++, request.getStrategyId(), suggestion, request.getSymbols(),
                request.getStartDate(), request.getEndDate(), request.getCapital());
        }
    }
}
