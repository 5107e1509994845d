package tw.gc.strategy.optimizer.model;

/**
 * Budgets and backend selection for adaptive search.
 *
 * @param trialBudget Maximum number of trials, null for a purely time-budgeted run
 * @param timeBudgetMs Maximum wall-clock time in milliseconds, null for a purely count-budgeted run
 * @param sampler Name of the search backend, null for the configured default
 * @param seed Seed handed to the backend, null for a random seed
 */
public record AdaptiveSettings(
    Integer trialBudget,
    Long timeBudgetMs,
    String sampler,
    Long seed
) {
    public AdaptiveSettings {
        if (trialBudget == null && timeBudgetMs == null) {
            throw new IllegalArgumentException("Adaptive search needs a trialBudget or a timeBudgetMs");
        }
        if (trialBudget != null && trialBudget < 1) {
            throw new IllegalArgumentException("trialBudget must be >= 1, got: " + trialBudget);
        }
        if (timeBudgetMs != null && timeBudgetMs < 1) {
            throw new IllegalArgumentException("timeBudgetMs must be >= 1, got: " + timeBudgetMs);
        }
    }

    public static AdaptiveSettings trials(int trialBudget) {
        return new AdaptiveSettings(trialBudget, null, null, null);
    }

    public static AdaptiveSettings timeBudget(long timeBudgetMs) {
        return new AdaptiveSettings(null, timeBudgetMs, null, null);
    }

    public AdaptiveSettings withSampler(String sampler, Long seed) {
        return new AdaptiveSettings(trialBudget, timeBudgetMs, sampler, seed);
    }
}
