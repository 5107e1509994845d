package tw.gc.strategy.optimizer.model;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import tw.gc.strategy.optimizer.enums.RankingMetric;
import tw.gc.strategy.optimizer.enums.SearchKind;

/**
 * Everything needed to run one optimization. Stored unchanged as the run's configuration snapshot.
 *
 * <p>Nullable knobs ({@code concurrency}, {@code trialTimeoutMs}, {@code rankingMetric},
 * {@code minTrades}) fall back to {@code optimizer.*} properties.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class OptimizationRequest {

    public static final double DEFAULT_CAPITAL = 100_000.0;

    String strategyId;

    @Singular
    List<String> symbols;

    LocalDate startDate;

    LocalDate endDate;

    @Builder.Default
    double capital = DEFAULT_CAPITAL;

    @Singular
    List<ParameterSpec> parameters;

    SearchKind searchKind;

    Integer concurrency;

    Long trialTimeoutMs;

    RankingMetric rankingMetric;

    Integer minTrades;

    /** Required for {@link SearchKind#WALK_FORWARD} */
    WalkForwardSettings walkForward;

    /** Required for {@link SearchKind#ADAPTIVE} */
    AdaptiveSettings adaptive;

    /** Name of the preset applied to this request, if any */
    String preset;

    /**
     * Checks the request is complete and consistent for its search kind.
     * Parameter declarations themselves are checked when the space is built.
     *
     * @throws IllegalArgumentException on the first problem found
     */
    public void validate() {
        if (strategyId == null || strategyId.isBlank()) {
            throw new IllegalArgumentException("strategyId cannot be null or blank");
        }
        if (symbols.isEmpty()) {
            throw new IllegalArgumentException("At least one symbol is required");
        }
        if (startDate == null || endDate == null) {
            throw new IllegalArgumentException("startDate and endDate are required");
        }
        if (startDate.isAfter(endDate)) {
            throw new IllegalArgumentException("startDate (%s) cannot be after endDate (%s)"
                .formatted(startDate, endDate));
        }
        if (!(capital > 0)) {
            throw new IllegalArgumentException("capital must be positive, got: " + capital);
        }
        if (parameters.isEmpty()) {
            throw new IllegalArgumentException("At least one parameter is required for optimization");
        }
        if (searchKind == null) {
            throw new IllegalArgumentException("searchKind is required");
        }
        if (concurrency != null && concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1, got: " + concurrency);
        }
        if (trialTimeoutMs != null && trialTimeoutMs < 0) {
            throw new IllegalArgumentException("trialTimeoutMs cannot be negative, got: " + trialTimeoutMs);
        }
        if (minTrades != null && minTrades < 0) {
            throw new IllegalArgumentException("minTrades cannot be negative, got: " + minTrades);
        }
        if (searchKind == SearchKind.WALK_FORWARD && walkForward == null) {
            throw new IllegalArgumentException("walk_forward search requires walkForward settings");
        }
        if (searchKind == SearchKind.ADAPTIVE && adaptive == null) {
            throw new IllegalArgumentException("adaptive search requires adaptive settings");
        }
        Set<String> seen = new HashSet<>();
        for (String symbol : symbols) {
            if (symbol == null || symbol.isBlank() || !seen.add(symbol)) {
                throw new IllegalArgumentException("Symbols must be non-blank and unique: " + symbols);
            }
        }
    }
}
