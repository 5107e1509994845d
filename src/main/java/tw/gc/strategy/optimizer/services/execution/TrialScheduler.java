package tw.gc.strategy.optimizer.services.execution;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;
import tw.gc.strategy.optimizer.enums.FailureReason;
import tw.gc.strategy.optimizer.model.Trial;
import tw.gc.strategy.optimizer.model.TrialFailure;
import tw.gc.strategy.optimizer.model.TrialOutcome;

/**
 * Runs a lazy sequence of trials on a fixed pool of {@code concurrency} workers.
 *
 * <p>High-Performance Architecture:
 * <ul>
 *   <li>At most {@code concurrency} trials are in flight; the next trial is pulled from the
 *       sequence only when a worker frees up, so huge spaces are never materialized</li>
 *   <li>Outcomes are collected, reported and handed to the outcome listener on the calling thread,
 *       in completion order</li>
 *   <li>A failing trial becomes a failed outcome and never affects its siblings</li>
 *   <li>Cancellation is checked before every submission: nothing new starts once it is requested,
 *       in-flight trials run to completion or to their timeout</li>
 * </ul>
 */
@Component
@Slf4j
public class TrialScheduler {

    private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

    public ScheduleResult run(Iterator<Trial> trials, TrialEvaluator evaluator, ScheduleOptions options) {
        int concurrency = options.getConcurrency();
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1, got: " + concurrency);
        }

        ExecutorService pool = Executors.newFixedThreadPool(concurrency, workerThreadFactory(options.getLabel()));
        CompletionService<TrialOutcome> completionService = new ExecutorCompletionService<>(pool);
        Map<Future<TrialOutcome>, Trial> inFlight = new HashMap<>();
        List<TrialOutcome> outcomes = new ArrayList<>();
        CancellationToken token = options.getCancellationToken();
        Integer total = options.getTotal();
        int logEvery = total == null ? 100 : Math.max(1, total / 10);
        boolean cancelled = false;
        boolean exhausted = false;

        try {
            while (true) {
                while (!cancelled && !exhausted && inFlight.size() < concurrency) {
                    if (token.isCancellationRequested()) {
                        cancelled = true;
                        log.info("⏹️ Cancellation requested, no new trials will start ({} in flight)", inFlight.size());
                    } else if (!trials.hasNext()) {
                        exhausted = true;
                    } else {
                        Trial trial = trials.next();
                        inFlight.put(completionService.submit(() -> evaluator.evaluate(trial)), trial);
                    }
                }

                if (inFlight.isEmpty()) {
                    break;
                }

                Future<TrialOutcome> done = completionService.take();
                TrialOutcome outcome = resolve(done, inFlight.remove(done));
                outcomes.add(outcome);
                options.getOutcomeListener().accept(outcome);
                options.getProgress().onProgress(outcomes.size(), total);

                if (outcomes.size() % logEvery == 0) {
                    log.debug("Trial progress: {}/{} completed", outcomes.size(), total == null ? "?" : total);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Scheduler interrupted with {} trials in flight, returning {} outcomes",
                inFlight.size(), outcomes.size());
            cancelled = true;
            pool.shutdownNow();
        } finally {
            pool.shutdown();
        }

        return new ScheduleResult(outcomes, cancelled);
    }

    private TrialOutcome resolve(Future<TrialOutcome> future, Trial trial) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            // TrialEvaluator absorbs exceptions, so only Errors end up here
            Throwable cause = e.getCause();
            log.error("Trial {} crashed its worker: {}", trial.index(), cause.toString());
            return TrialOutcome.failure(trial, TrialFailure.of(FailureReason.EVALUATION_ERROR, cause.toString()), 0);
        }
    }

    private static ThreadFactory workerThreadFactory(String label) {
        int poolId = POOL_COUNTER.incrementAndGet();
        AtomicInteger threadCounter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "%s-%d-worker-%d".formatted(label, poolId, threadCounter.incrementAndGet()));
            thread.setDaemon(true);
            return thread;
        };
    }
}
