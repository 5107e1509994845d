package tw.gc.strategy.optimizer.services.adaptive;

import tw.gc.strategy.optimizer.model.ParameterCombination;

/**
 * Suggestion-based search backend driven by {@link AdaptiveSearch}.
 *
 * <p>Calls always come from the thread driving the search, never concurrently. A backend may suggest
 * the same combination more than once; each suggestion is evaluated again.
 */
public interface SearchBackend {

    /**
     * @return next combination to try, drawn from the space the backend was created for
     */
    ParameterCombination suggest();

    /**
     * Feeds back the score of an evaluated suggestion. Higher is better; failed trials are reported
     * with {@link AdaptiveSearch#FAILURE_SCORE}.
     */
    void report(ParameterCombination combination, double score);
}
