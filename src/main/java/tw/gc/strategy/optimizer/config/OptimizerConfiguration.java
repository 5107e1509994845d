package tw.gc.strategy.optimizer.config;

import java.nio.file.Path;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import lombok.extern.slf4j.Slf4j;
import tw.gc.strategy.optimizer.exceptions.EvaluationException;
import tw.gc.strategy.optimizer.services.execution.BacktestEvaluator;
import tw.gc.strategy.optimizer.services.storage.ResultsStore;

@Slf4j
@Configuration
public class OptimizerConfiguration {

    @Bean
    public ResultsStore resultsStore(OptimizerProperties properties) {
        ResultsStore store = new ResultsStore(Path.of(properties.getStorage().getBaseDir()),
            ResultsStore.createObjectMapper());
        if (properties.getStorage().isReconcileOnStartup()) {
            store.reconcile();
        }
        return store;
    }

    /**
     * Placeholder used when the application context has no backtest engine. Every trial fails with
     * {@code EVALUATION_ERROR} until a real {@link BacktestEvaluator} bean is provided.
     */
    @Bean
    @ConditionalOnMissingBean(BacktestEvaluator.class)
    public BacktestEvaluator unconfiguredBacktestEvaluator() {
        log.warn("⚠️ No BacktestEvaluator bean found, optimization trials will fail until one is configured");
        return (strategyId, combination, symbols, start, end, capital) -> {
            throw new EvaluationException("No backtest evaluator configured for strategy " + strategyId);
        };
    }
}
