package tw.gc.strategy.optimizer.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import tw.gc.strategy.optimizer.enums.SearchKind;

/**
 * Compact projection of a {@link RunRecord}, one line of the run index.
 *
 * @param robust Walk-forward robustness flag, null for other search kinds
 */
public record RunIndexEntry(
    String runId,
    Instant createdAt,
    String strategyId,
    SearchKind searchKind,
    double bestSharpe,
    double bestReturn,
    List<String> symbols,
    LocalDate startDate,
    LocalDate endDate,
    int totalTrials,
    boolean cancelled,
    Boolean robust
) {
    public RunIndexEntry {
        symbols = symbols == null ? List.of() : List.copyOf(symbols);
    }
}
