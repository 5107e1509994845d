package tw.gc.strategy.optimizer.services.storage;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import tw.gc.strategy.optimizer.enums.SearchKind;
import tw.gc.strategy.optimizer.model.RunRecord;

/**
 * Runs laid side by side: one row per run, in the order the ids were requested.
 *
 * @param parameterNames Union of every row's parameter names, sorted; a row lacking one has no value for it
 */
public record RunComparison(List<Row> rows, List<String> parameterNames) {

    public static RunComparison of(List<RunRecord> runs) {
        List<Row> rows = runs.stream().map(Row::of).toList();
        TreeSet<String> names = new TreeSet<>();
        rows.forEach(row -> names.addAll(row.parameters().keySet()));
        return new RunComparison(rows, List.copyOf(names));
    }

    public List<String> runIds() {
        return rows.stream().map(Row::runId).toList();
    }

    public record Row(
        String runId,
        String strategyId,
        SearchKind searchKind,
        Instant createdAt,
        List<String> symbols,
        double sharpeRatio,
        double totalReturnPct,
        double maxDrawdownPct,
        double winRatePct,
        int totalTrades,
        Map<String, Object> parameters
    ) {
        static Row of(RunRecord run) {
            return new Row(
                run.getRunId(),
                run.getStrategyId(),
                run.getSearchKind(),
                run.getCreatedAt(),
                run.getConfig().getSymbols(),
                run.getBestMetrics().getSharpeRatio(),
                run.getBestMetrics().getTotalReturnPct(),
                run.getBestMetrics().getMaxDrawdownPct(),
                run.getBestMetrics().getWinRatePct(),
                run.getBestMetrics().getTotalTrades(),
                run.getBestCombination().values());
        }
    }
}
