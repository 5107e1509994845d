package tw.gc.strategy.optimizer.services.execution;

import java.time.LocalDate;
import java.util.List;

import tw.gc.strategy.optimizer.exceptions.EvaluationException;
import tw.gc.strategy.optimizer.model.MetricsRecord;
import tw.gc.strategy.optimizer.model.ParameterCombination;

/**
 * Backtest engine the optimizer drives. Implemented outside this module.
 *
 * <p>Implementations must be safe to call concurrently from several worker threads with
 * different arguments, and should react to thread interruption so timed-out trials can be abandoned.
 */
@FunctionalInterface
public interface BacktestEvaluator {

    /**
     * Backtests one strategy configuration.
     *
     * @param strategyId Strategy to run
     * @param combination Parameter values
     * @param symbols Symbols to trade
     * @param startDate First day, inclusive
     * @param endDate Last day, inclusive
     * @param capital Starting capital
     * @return performance metrics of the run
     * @throws EvaluationException if the backtest cannot be completed
     */
    MetricsRecord evaluate(
        String strategyId,
        ParameterCombination combination,
        List<String> symbols,
        LocalDate startDate,
        LocalDate endDate,
        double capital) throws EvaluationException;
}
