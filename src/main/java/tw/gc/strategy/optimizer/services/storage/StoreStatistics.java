package tw.gc.strategy.optimizer.services.storage;

import java.util.List;

import tw.gc.strategy.optimizer.enums.SearchKind;

/**
 * Aggregates over the run index. Numeric fields are 0 for an empty store.
 */
public record StoreStatistics(
    int totalRuns,
    int totalStrategies,
    double bestSharpe,
    double bestReturn,
    double avgSharpe,
    double avgReturn,
    List<String> strategies,
    List<SearchKind> searchKinds
) {
    public static StoreStatistics empty() {
        return new StoreStatistics(0, 0, 0.0, 0.0, 0.0, 0.0, List.of(), List.of());
    }
}
