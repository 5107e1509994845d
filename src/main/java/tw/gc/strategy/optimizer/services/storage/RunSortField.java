package tw.gc.strategy.optimizer.services.storage;

import java.util.Comparator;

import tw.gc.strategy.optimizer.model.RunIndexEntry;

/**
 * Index fields a run listing can be ordered by. Each comparator is ascending.
 */
public enum RunSortField {
    CREATED_AT(Comparator.comparing(RunIndexEntry::createdAt)),
    RUN_ID(Comparator.comparing(RunIndexEntry::runId)),
    STRATEGY(Comparator.comparing(RunIndexEntry::strategyId)),
    SEARCH_KIND(Comparator.comparing(RunIndexEntry::searchKind)),
    BEST_SHARPE(Comparator.comparingDouble(RunIndexEntry::bestSharpe)),
    BEST_RETURN(Comparator.comparingDouble(RunIndexEntry::bestReturn)),
    TOTAL_TRIALS(Comparator.comparingInt(RunIndexEntry::totalTrials)),
    START_DATE(Comparator.comparing(RunIndexEntry::startDate)),
    END_DATE(Comparator.comparing(RunIndexEntry::endDate));

    private final Comparator<RunIndexEntry> ascending;

    RunSortField(Comparator<RunIndexEntry> ascending) {
        this.ascending = ascending;
    }

    public Comparator<RunIndexEntry> ascending() {
        return ascending;
    }
}
