package tw.gc.strategy.optimizer.model;

import java.time.LocalDate;
import java.util.List;

/**
 * One unit of work: a parameter combination plus the context it is evaluated in.
 *
 * @param index Submission order within its search, used as the final ranking tie-break
 * @param strategyId Strategy under optimization
 * @param combination Parameter values
 * @param symbols Symbols to backtest on
 * @param startDate First day of the evaluation window, inclusive
 * @param endDate Last day of the evaluation window, inclusive
 * @param capital Starting capital
 */
public record Trial(
    int index,
    String strategyId,
    ParameterCombination combination,
    List<String> symbols,
    LocalDate startDate,
    LocalDate endDate,
    double capital
) {
    public Trial {
        symbols = List.copyOf(symbols);
    }
}
