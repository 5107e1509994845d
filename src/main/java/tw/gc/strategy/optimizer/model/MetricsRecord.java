package tw.gc.strategy.optimizer.model;

import java.util.Map;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Performance metrics reported by the backtest evaluator for one trial.
 * Percentages are expressed in percent units (12.5 means 12.5%).
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class MetricsRecord {

    /** Annualized Sharpe ratio */
    double sharpeRatio;

    /** Total return over the tested window, in percent */
    double totalReturnPct;

    /** Maximum drawdown in percent; sign is evaluator-defined, ranking uses the absolute value */
    double maxDrawdownPct;

    /** Winning trades over total trades, in percent */
    double winRatePct;

    /** Number of closed trades */
    int totalTrades;

    /** Any additional strategy-reported figures (sortino, exposure, ...) */
    @Builder.Default
    Map<String, Double> extras = Map.of();

    /**
     * @return true when the core metrics are all finite numbers
     */
    public boolean hasFiniteCoreMetrics() {
        return Double.isFinite(sharpeRatio)
            && Double.isFinite(totalReturnPct)
            && Double.isFinite(maxDrawdownPct)
            && Double.isFinite(winRatePct);
    }
}
