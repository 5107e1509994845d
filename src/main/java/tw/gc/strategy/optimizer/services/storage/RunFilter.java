package tw.gc.strategy.optimizer.services.storage;

import java.time.Instant;
import java.util.Set;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import tw.gc.strategy.optimizer.enums.SearchKind;
import tw.gc.strategy.optimizer.model.RunIndexEntry;

/**
 * Predicates over the run index. Unset fields match everything; set fields are combined with AND.
 */
@Value
@Builder
public class RunFilter {

    /** Strategy ids, any match */
    @Singular
    Set<String> strategies;

    SearchKind searchKind;

    Double minSharpe;

    Double maxSharpe;

    /** Inclusive lower bound on creation time */
    Instant createdFrom;

    /** Inclusive upper bound on creation time */
    Instant createdTo;

    /** Symbols, a run matches if it traded any of them */
    @Singular
    Set<String> symbols;

    public static RunFilter all() {
        return RunFilter.builder().build();
    }

    public boolean matches(RunIndexEntry entry) {
        if (!strategies.isEmpty() && !strategies.contains(entry.strategyId())) {
            return false;
        }
        if (searchKind != null && searchKind != entry.searchKind()) {
            return false;
        }
        if (minSharpe != null && entry.bestSharpe() < minSharpe) {
            return false;
        }
        if (maxSharpe != null && entry.bestSharpe() > maxSharpe) {
            return false;
        }
        if (createdFrom != null && entry.createdAt().isBefore(createdFrom)) {
            return false;
        }
        if (createdTo != null && entry.createdAt().isAfter(createdTo)) {
            return false;
        }
        return symbols.isEmpty() || entry.symbols().stream().anyMatch(symbols::contains);
    }
}
