package tw.gc.strategy.optimizer.services.storage;

import java.util.List;

/**
 * What a {@link ResultsStore#reconcile()} pass repaired.
 *
 * @param orphanDetailsRemoved Run ids whose detail record had no index entry
 * @param danglingEntriesDropped Run ids whose index entry had no detail record
 * @param corruptIndexLinesDropped Index lines that could not be parsed
 * @param tempFilesRemoved Leftover temp files from interrupted writes
 */
public record ReconciliationReport(
    List<String> orphanDetailsRemoved,
    List<String> danglingEntriesDropped,
    int corruptIndexLinesDropped,
    int tempFilesRemoved
) {
    public boolean clean() {
        return orphanDetailsRemoved.isEmpty()
            && danglingEntriesDropped.isEmpty()
            && corruptIndexLinesDropped == 0
            && tempFilesRemoved == 0;
    }
}
