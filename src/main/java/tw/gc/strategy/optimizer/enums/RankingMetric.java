package tw.gc.strategy.optimizer.enums;

import tw.gc.strategy.optimizer.model.MetricsRecord;

/**
 * Primary metric used to rank trial outcomes. Higher is always better.
 */
public enum RankingMetric {
    SHARPE {
        @Override
        public double extract(MetricsRecord metrics) {
            return metrics.getSharpeRatio();
        }
    },
    TOTAL_RETURN {
        @Override
        public double extract(MetricsRecord metrics) {
            return metrics.getTotalReturnPct();
        }
    },
    WIN_RATE {
        @Override
        public double extract(MetricsRecord metrics) {
            return metrics.getWinRatePct();
        }
    },
    /** Return divided by absolute max drawdown; a zero drawdown scores the raw return. */
    CALMAR {
        @Override
        public double extract(MetricsRecord metrics) {
            double drawdown = Math.abs(metrics.getMaxDrawdownPct());
            if (drawdown == 0.0) {
                return metrics.getTotalReturnPct();
            }
            return metrics.getTotalReturnPct() / drawdown;
        }
    };

    public abstract double extract(MetricsRecord metrics);
}
