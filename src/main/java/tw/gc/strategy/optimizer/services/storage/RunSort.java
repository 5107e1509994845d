package tw.gc.strategy.optimizer.services.storage;

import java.util.Comparator;

import tw.gc.strategy.optimizer.model.RunIndexEntry;

/**
 * Ordering of a run listing. Ties on the chosen field fall back to run id so the order is stable.
 */
public record RunSort(RunSortField field, boolean descending) {

    public RunSort {
        if (field == null) {
            throw new IllegalArgumentException("Sort field cannot be null");
        }
    }

    public static RunSort newestFirst() {
        return new RunSort(RunSortField.CREATED_AT, true);
    }

    public static RunSort ascending(RunSortField field) {
        return new RunSort(field, false);
    }

    public static RunSort descending(RunSortField field) {
        return new RunSort(field, true);
    }

    public Comparator<RunIndexEntry> comparator() {
        Comparator<RunIndexEntry> primary = descending ? field.ascending().reversed() : field.ascending();
        return primary.thenComparing(RunIndexEntry::runId);
    }
}
