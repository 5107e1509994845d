package tw.gc.strategy.optimizer.services.search;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import tw.gc.strategy.optimizer.enums.RankingMetric;
import tw.gc.strategy.optimizer.model.TrialOutcome;

/**
 * Total order over successful trial outcomes, best first:
 * <ol>
 *   <li>primary metric, descending</li>
 *   <li>total return, descending</li>
 *   <li>absolute max drawdown, ascending</li>
 *   <li>trial index, ascending (first enumerated or first suggested wins)</li>
 * </ol>
 * Shared by every search strategy so that runs of different kinds rank the same way.
 */
public final class TrialRanking {

    private TrialRanking() {
        // Utility class
    }

    public static Comparator<TrialOutcome> bestFirst(RankingMetric metric) {
        Comparator<TrialOutcome> byPrimary = Comparator.comparingDouble(o -> metric.extract(o.metrics()));
        Comparator<TrialOutcome> byReturn = Comparator.comparingDouble(o -> o.metrics().getTotalReturnPct());
        return byPrimary.reversed()
            .thenComparing(byReturn.reversed())
            .thenComparingDouble(o -> Math.abs(o.metrics().getMaxDrawdownPct()))
            .thenComparingInt(TrialOutcome::trialIndex);
    }

    /**
     * Successful outcomes sorted best first. Failed outcomes are left out.
     */
    public static List<TrialOutcome> rank(List<TrialOutcome> outcomes, RankingMetric metric) {
        return outcomes.stream()
            .filter(TrialOutcome::succeeded)
            .sorted(bestFirst(metric))
            .toList();
    }

    public static Optional<TrialOutcome> best(List<TrialOutcome> outcomes, RankingMetric metric) {
        return outcomes.stream()
            .filter(TrialOutcome::succeeded)
            .min(bestFirst(metric));
    }
}
