package tw.gc.strategy.optimizer.model;

import java.util.List;

/**
 * Distribution of results over all trials of a run.
 * Sharpe and return figures cover successful trials only; standard deviations are sample deviations.
 */
public record RunStatistics(
    int totalTrials,
    int successfulTrials,
    double meanSharpe,
    double stdSharpe,
    double bestSharpe,
    double worstSharpe,
    double meanReturn,
    double stdReturn
) {
    public static RunStatistics of(List<TrialOutcome> outcomes) {
        double[] sharpes = outcomes.stream()
            .filter(TrialOutcome::succeeded)
            .mapToDouble(o -> o.metrics().getSharpeRatio())
            .toArray();
        double[] returns = outcomes.stream()
            .filter(TrialOutcome::succeeded)
            .mapToDouble(o -> o.metrics().getTotalReturnPct())
            .toArray();

        if (sharpes.length == 0) {
            return new RunStatistics(outcomes.size(), 0, 0, 0, 0, 0, 0, 0);
        }

        double best = Double.NEGATIVE_INFINITY;
        double worst = Double.POSITIVE_INFINITY;
        for (double s : sharpes) {
            best = Math.max(best, s);
            worst = Math.min(worst, s);
        }
        return new RunStatistics(outcomes.size(), sharpes.length, mean(sharpes), std(sharpes), best, worst,
            mean(returns), std(returns));
    }

    private static double mean(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    private static double std(double[] values) {
        if (values.length < 2) {
            return 0;
        }
        double mean = mean(values);
        double squares = 0;
        for (double v : values) {
            squares += (v - mean) * (v - mean);
        }
        return Math.sqrt(squares / (values.length - 1));
    }
}
