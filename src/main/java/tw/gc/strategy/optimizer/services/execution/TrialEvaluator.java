package tw.gc.strategy.optimizer.services.execution;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import lombok.extern.slf4j.Slf4j;
import tw.gc.strategy.optimizer.enums.FailureReason;
import tw.gc.strategy.optimizer.exceptions.EvaluationException;
import tw.gc.strategy.optimizer.model.MetricsRecord;
import tw.gc.strategy.optimizer.model.Trial;
import tw.gc.strategy.optimizer.model.TrialFailure;
import tw.gc.strategy.optimizer.model.TrialOutcome;

/**
 * Turns one {@link Trial} into one {@link TrialOutcome}. Never throws for evaluator problems:
 * <ul>
 *   <li>evaluator exception → {@link FailureReason#EVALUATION_ERROR}</li>
 *   <li>no answer within the timeout → {@link FailureReason#TIMEOUT}</li>
 *   <li>null record or non-finite Sharpe / return / drawdown / win rate → {@link FailureReason#INVALID_METRICS}</li>
 *   <li>fewer trades than {@code minTrades} → {@link FailureReason#INSUFFICIENT_TRADES}</li>
 * </ul>
 *
 * <p>With a positive timeout the evaluator call runs on a separate daemon thread that is interrupted
 * once the timeout elapses. An evaluator that ignores interruption keeps its thread busy until it
 * returns, but the trial is already recorded as timed out.
 */
@Slf4j
public class TrialEvaluator implements AutoCloseable {

    private static final AtomicInteger EVALUATOR_THREAD_COUNTER = new AtomicInteger();

    private final BacktestEvaluator evaluator;
    private final long timeoutMs;
    private final int minTrades;
    private final ExecutorService timeoutExecutor;

    /**
     * @param evaluator Backtest engine
     * @param timeoutMs Per-trial timeout, 0 to wait indefinitely
     * @param minTrades Minimum trade count for a successful trial, 0 to accept any
     */
    public TrialEvaluator(BacktestEvaluator evaluator, long timeoutMs, int minTrades) {
        if (evaluator == null) {
            throw new IllegalArgumentException("evaluator cannot be null");
        }
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs cannot be negative, got: " + timeoutMs);
        }
        this.evaluator = evaluator;
        this.timeoutMs = timeoutMs;
        this.minTrades = Math.max(0, minTrades);
        this.timeoutExecutor = timeoutMs > 0 ? Executors.newCachedThreadPool(evaluatorThreadFactory()) : null;
    }

    public TrialOutcome evaluate(Trial trial) {
        long startTime = System.nanoTime();
        try {
            MetricsRecord metrics = timeoutExecutor == null ? invoke(trial) : invokeWithTimeout(trial);
            return validate(trial, metrics, elapsedMs(startTime));
        } catch (TimeoutException e) {
            log.debug("Trial {} timed out after {}ms: {}", trial.index(), timeoutMs, trial.combination());
            return TrialOutcome.failure(trial, TrialFailure.timeout(timeoutMs), elapsedMs(startTime));
        } catch (EvaluationException | RuntimeException e) {
            log.debug("Trial {} failed for {}: {}", trial.index(), trial.combination(), e.getMessage());
            return TrialOutcome.failure(trial, TrialFailure.of(FailureReason.EVALUATION_ERROR, describe(e)),
                elapsedMs(startTime));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TrialOutcome.failure(trial, TrialFailure.of(FailureReason.EVALUATION_ERROR, "Interrupted"),
                elapsedMs(startTime));
        }
    }

    private MetricsRecord invoke(Trial trial) throws EvaluationException {
        return evaluator.evaluate(trial.strategyId(), trial.combination(), trial.symbols(),
            trial.startDate(), trial.endDate(), trial.capital());
    }

    private MetricsRecord invokeWithTimeout(Trial trial)
            throws EvaluationException, TimeoutException, InterruptedException {
        Future<MetricsRecord> future = timeoutExecutor.submit(() -> invoke(trial));
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof EvaluationException evaluationException) {
                throw evaluationException;
            }
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new EvaluationException(describe(cause), cause);
        }
    }

    private TrialOutcome validate(Trial trial, MetricsRecord metrics, long durationMs) {
        if (metrics == null) {
            return TrialOutcome.failure(trial,
                TrialFailure.of(FailureReason.INVALID_METRICS, "Evaluator returned no metrics"), durationMs);
        }
        if (!metrics.hasFiniteCoreMetrics()) {
            return TrialOutcome.failure(trial,
                TrialFailure.of(FailureReason.INVALID_METRICS, "Non-finite metrics: " + metrics), durationMs);
        }
        if (metrics.getTotalTrades() < minTrades) {
            return TrialOutcome.failure(trial, TrialFailure.of(FailureReason.INSUFFICIENT_TRADES,
                "%d trades, at least %d required".formatted(metrics.getTotalTrades(), minTrades)), durationMs);
        }
        return TrialOutcome.success(trial, metrics, durationMs);
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    @Override
    public void close() {
        if (timeoutExecutor != null) {
            timeoutExecutor.shutdownNow();
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null ? e.getClass().getSimpleName() : message;
    }

    private static ThreadFactory evaluatorThreadFactory() {
        return runnable -> {
            Thread thread = new Thread(runnable, "trial-eval-" + EVALUATOR_THREAD_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
