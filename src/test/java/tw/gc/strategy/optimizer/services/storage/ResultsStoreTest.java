package tw.gc.strategy.optimizer.services.storage;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import tw.gc.strategy.optimizer.enums.FailureReason;
import tw.gc.strategy.optimizer.enums.PeriodStatus;
import tw.gc.strategy.optimizer.enums.SearchKind;
import tw.gc.strategy.optimizer.exceptions.RunNotFoundException;
import tw.gc.strategy.optimizer.model.MetricsRecord;
import tw.gc.strategy.optimizer.model.OptimizationRequest;
import tw.gc.strategy.optimizer.model.Period;
import tw.gc.strategy.optimizer.model.RangeParameter;
import tw.gc.strategy.optimizer.model.RunIndexEntry;
import tw.gc.strategy.optimizer.model.RunRecord;
import tw.gc.strategy.optimizer.model.RunStatistics;
import tw.gc.strategy.optimizer.model.Trial;
import tw.gc.strategy.optimizer.model.TrialFailure;
import tw.gc.strategy.optimizer.model.TrialOutcome;
import tw.gc.strategy.optimizer.model.WalkForwardPeriodResult;
import tw.gc.strategy.optimizer.model.WalkForwardSettings;
import tw.gc.strategy.optimizer.services.walkforward.DegradationAnalyzer;

import static org.assertj.core.api.Assertions.*;
import static tw.gc.strategy.optimizer.OptimizerFixtures.END;
import static tw.gc.strategy.optimizer.OptimizerFixtures.START;
import static tw.gc.strategy.optimizer.OptimizerFixtures.combination;
import static tw.gc.strategy.optimizer.OptimizerFixtures.metrics;
import static tw.gc.strategy.optimizer.OptimizerFixtures.pqRequest;

/**
 * Tests for {@link ResultsStore} against a temporary directory.
 */
class ResultsStoreTest {

    private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");

    @TempDir
    Path baseDir;

    private ResultsStore store;

    @BeforeEach
    void setUp() {
        store = new ResultsStore(baseDir, ResultsStore.createObjectMapper());
    }

    private RunRecord gridRun(String strategy, double sharpe, Instant createdAt, String... symbols) {
        OptimizationRequest config = pqRequest(SearchKind.GRID)
            .strategyId(strategy)
            .clearSymbols()
            .symbols(symbols.length == 0 ? List.of("2330.TW") : List.of(symbols))
            .build();
        Trial best = new Trial(1, strategy, combination("p", 2, "q", 20), config.getSymbols(), START, END, 100_000.0);
        Trial failed = new Trial(0, strategy, combination("p", 1, "q", 10), config.getSymbols(), START, END, 100_000.0);
        MetricsRecord bestMetrics = metrics(sharpe, sharpe * 10, -7.5).toBuilder()
            .extras(Map.of("sortino", sharpe * 1.3))
            .build();
        List<TrialOutcome> trials = List.of(
            TrialOutcome.failure(failed, TrialFailure.timeout(500), 500),
            TrialOutcome.success(best, bestMetrics, 42));
        return RunRecord.builder()
            .runId(store.allocateRunId(strategy, SearchKind.GRID, createdAt))
            .createdAt(createdAt)
            .strategyId(strategy)
            .searchKind(SearchKind.GRID)
            .config(config)
            .bestCombination(best.combination())
            .bestMetrics(bestMetrics)
            .trials(trials)
            .statistics(RunStatistics.of(trials))
            .durationMs(1_234)
            .build();
    }

    private RunRecord walkForwardRun(Instant createdAt) {
        OptimizationRequest config = pqRequest(SearchKind.WALK_FORWARD)
            .parameter(RangeParameter.ofDouble("threshold", 0.1, 0.3, 0.1))
            .walkForward(new WalkForwardSettings(60, 20, 20, true))
            .build();
        Period period = new Period(0, START, START.plusDays(59), START.plusDays(60), START.plusDays(79));
        Trial trial = new Trial(0, "rsi", combination("p", 2, "q", 20, "threshold", 0.2), config.getSymbols(),
            period.inSampleStart(), period.inSampleEnd(), 100_000.0);
        Trial oos = new Trial(1, "rsi", trial.combination(), config.getSymbols(),
            period.outSampleStart(), period.outSampleEnd(), 100_000.0);
        TrialOutcome inSample = TrialOutcome.success(trial, metrics(1.2), 10);
        TrialOutcome outOfSample = TrialOutcome.success(oos, metrics(0.9), 10);
        WalkForwardPeriodResult completed = WalkForwardPeriodResult.completed(period, trial.combination(),
            inSample.metrics(), outOfSample.metrics(), DegradationAnalyzer.degradation(1.2, 0.9),
            List.of(inSample), outOfSample);
        Period second = new Period(1, START.plusDays(20), START.plusDays(79), START.plusDays(80), START.plusDays(99));
        WalkForwardPeriodResult failed = WalkForwardPeriodResult.failed(second, "No viable in-sample trial",
            null, null, List.of(), null);
        List<WalkForwardPeriodResult> periods = List.of(completed, failed);
        return RunRecord.builder()
            .runId(store.allocateRunId("rsi", SearchKind.WALK_FORWARD, createdAt))
            .createdAt(createdAt)
            .strategyId("rsi")
            .searchKind(SearchKind.WALK_FORWARD)
            .config(config)
            .bestCombination(trial.combination())
            .bestMetrics(outOfSample.metrics())
            .periods(periods)
            .walkForwardSummary(new DegradationAnalyzer().summarize(periods))
            .statistics(RunStatistics.of(List.of(inSample, outOfSample)))
            .durationMs(99)
            .build();
    }

    @Nested
    @DisplayName("Save and get")
    class SaveTests {

        @Test
        @DisplayName("should read back exactly what was saved")
        void shouldRoundTripGridRun() {
            RunRecord run = gridRun("rsi", 1.25, T0);

            String runId = store.save(run);
            RunRecord loaded = store.get(runId);

            assertThat(loaded).isEqualTo(run);
            assertThat(loaded.getTrials().get(0).failure().reason()).isEqualTo(FailureReason.TIMEOUT);
        }

        @Test
        @DisplayName("should read back a walk-forward run with its failed period")
        void shouldRoundTripWalkForwardRun() {
            RunRecord run = walkForwardRun(T0);

            store.save(run);
            RunRecord loaded = store.get(run.getRunId());

            assertThat(loaded).isEqualTo(run);
            assertThat(loaded.getPeriods()).extracting(WalkForwardPeriodResult::status)
                .containsExactly(PeriodStatus.COMPLETED, PeriodStatus.FAILED);
            assertThat(store.list().get(0).robust()).isTrue();
        }

        @Test
        @DisplayName("should write the detail record before the index entry and leave no temp file")
        void shouldLayOutFiles() throws Exception {
            RunRecord run = gridRun("rsi", 1.0, T0);

            store.save(run);

            assertThat(baseDir.resolve("details").resolve(run.getRunId() + ".json")).exists();
            List<String> lines = Files.readAllLines(baseDir.resolve("history").resolve("runs.jsonl"));
            assertThat(lines).hasSize(1);
            assertThat(lines.get(0)).contains(run.getRunId()).doesNotContain("\"trials\"");
            try (var files = Files.list(baseDir.resolve("details"))) {
                assertThat(files.map(Path::toString)).noneMatch(name -> name.endsWith(".tmp"));
            }
        }

        @Test
        @DisplayName("should survive a new store instance on the same directory")
        void shouldPersistAcrossInstances() {
            RunRecord run = gridRun("rsi", 1.0, T0);
            store.save(run);

            ResultsStore reopened = new ResultsStore(baseDir, ResultsStore.createObjectMapper());

            assertThat(reopened.list()).extracting(RunIndexEntry::runId).containsExactly(run.getRunId());
            assertThat(reopened.get(run.getRunId())).isEqualTo(run);
        }

        @Test
        @DisplayName("should refuse to save the same run twice")
        void shouldRejectDuplicateSave() {
            RunRecord run = gridRun("rsi", 1.0, T0);
            store.save(run);

            assertThatThrownBy(() -> store.save(run))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("already exists");
        }

        @Test
        @DisplayName("should raise NotFound for an unknown run")
        void shouldRaiseNotFound() {
            assertThatThrownBy(() -> store.get("nope"))
                .isInstanceOf(RunNotFoundException.class)
                .hasMessageContaining("nope");
        }

        @Test
        @DisplayName("should keep the index consistent under concurrent saves")
        void shouldHandleConcurrentSaves() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(4);
            try {
                List<Future<String>> futures = new ArrayList<>();
                for (int i = 0; i < 8; i++) {
                    String strategy = "s" + i;
                    futures.add(pool.submit(() -> store.save(gridRun(strategy, 1.0, T0))));
                }
                for (Future<String> future : futures) {
                    future.get();
                }
            } finally {
                pool.shutdownNow();
            }

            assertThat(store.list()).hasSize(8);
            assertThat(Files.readAllLines(baseDir.resolve("history").resolve("runs.jsonl"))).hasSize(8);
        }
    }

    @Nested
    @DisplayName("Save failures")
    class SaveFailureTests {

        @Test
        @DisplayName("should start a new index line after a torn append")
        void shouldSurviveTornIndexLine() throws Exception {
            RunRecord before = gridRun("rsi", 1.0, T0);
            store.save(before);
            Path index = baseDir.resolve("history").resolve("runs.jsonl");
            Files.writeString(index, "{\"runId\":\"torn_grid_2024", StandardCharsets.UTF_8, StandardOpenOption.APPEND);

            RunRecord after = gridRun("macd", 1.5, T0);
            store.save(after);

            assertThat(store.list()).extracting(RunIndexEntry::runId)
                .containsExactlyInAnyOrder(before.getRunId(), after.getRunId());
            assertThat(store.exists(after.getRunId())).isTrue();

            ReconciliationReport report = store.reconcile();

            assertThat(report.orphanDetailsRemoved()).isEmpty();
            assertThat(report.corruptIndexLinesDropped()).isEqualTo(1);
            assertThat(store.get(after.getRunId())).isEqualTo(after);
            assertThat(Files.readAllLines(index)).hasSize(2);
        }

        @Test
        @DisplayName("should release the run id reservation when a save is rejected")
        void shouldReleaseReservationOnRejectedSave() throws Exception {
            RunRecord run = gridRun("rsi", 1.0, T0);
            Path index = baseDir.resolve("history").resolve("runs.jsonl");
            Path detail = store.detailPath(run.getRunId());
            Files.writeString(index, ResultsStore.createObjectMapper().writeValueAsString(run.toIndexEntry()) + "\n");
            Files.writeString(detail, "{}");

            assertThatThrownBy(() -> store.save(run))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("already exists");

            Files.writeString(index, "");
            assertThat(store.reconcile().orphanDetailsRemoved()).containsExactly(run.getRunId());
            assertThat(detail).doesNotExist();
        }

        @Test
        @DisplayName("should commit only one of several concurrent saves of the same run")
        void shouldCommitSameRunOnce() throws Exception {
            RunRecord run = gridRun("rsi", 1.0, T0);
            ExecutorService pool = Executors.newFixedThreadPool(4);
            int committed = 0;
            int rejected = 0;
            try {
                List<Future<String>> futures = new ArrayList<>();
                for (int i = 0; i < 8; i++) {
                    futures.add(pool.submit(() -> store.save(run)));
                }
                for (Future<String> future : futures) {
                    try {
                        future.get();
                        committed++;
                    } catch (ExecutionException e) {
                        assertThat(e.getCause()).isInstanceOf(IllegalArgumentException.class);
                        rejected++;
                    }
                }
            } finally {
                pool.shutdownNow();
            }

            assertThat(committed).isEqualTo(1);
            assertThat(rejected).isEqualTo(7);
            assertThat(Files.readAllLines(baseDir.resolve("history").resolve("runs.jsonl"))).hasSize(1);
            try (var files = Files.list(baseDir.resolve("details"))) {
                assertThat(files.map(Path::toString)).noneMatch(name -> name.endsWith(".tmp"));
            }
            assertThat(store.get(run.getRunId())).isEqualTo(run);
        }
    }

    @Nested
    @DisplayName("Run ids")
    class RunIdTests {

        @Test
        @DisplayName("should disambiguate runs started in the same instant")
        void shouldDisambiguateCollisions() {
            String first = store.allocateRunId("rsi", SearchKind.GRID, T0);
            String second = store.allocateRunId("rsi", SearchKind.GRID, T0);
            String third = store.allocateRunId("rsi", SearchKind.GRID, T0);

            assertThat(first).isEqualTo("rsi_grid_20240501T000000Z");
            assertThat(second).isEqualTo("rsi_grid_20240501T000000Z_1");
            assertThat(third).isEqualTo("rsi_grid_20240501T000000Z_2");
        }

        @Test
        @DisplayName("should skip ids already in the index")
        void shouldSkipIndexedIds() {
            RunRecord run = gridRun("rsi", 1.0, T0);
            store.save(run);

            assertThat(store.allocateRunId("rsi", SearchKind.GRID, T0)).isEqualTo(run.getRunId() + "_1");
        }
    }

    @Nested
    @DisplayName("Listing")
    class ListTests {

        private RunRecord oldRsi;
        private RunRecord newMacd;
        private RunRecord midRsi;

        @BeforeEach
        void saveRuns() {
            oldRsi = gridRun("rsi", 0.8, T0, "2330.TW");
            newMacd = gridRun("macd", 1.6, T0.plusSeconds(7_200), "2454.TW");
            midRsi = gridRun("rsi", 1.2, T0.plusSeconds(3_600), "2317.TW", "2330.TW");
            store.save(oldRsi);
            store.save(newMacd);
            store.save(midRsi);
        }

        @Test
        @DisplayName("should default to newest first")
        void shouldListNewestFirst() {
            assertThat(store.list()).extracting(RunIndexEntry::runId)
                .containsExactly(newMacd.getRunId(), midRsi.getRunId(), oldRsi.getRunId());
        }

        @Test
        @DisplayName("should filter by strategy and minimum Sharpe")
        void shouldFilter() {
            RunFilter filter = RunFilter.builder().strategy("rsi").minSharpe(1.0).build();

            assertThat(store.list(filter)).extracting(RunIndexEntry::runId).containsExactly(midRsi.getRunId());
        }

        @Test
        @DisplayName("should filter by symbol, kind and creation window")
        void shouldFilterBySymbolAndWindow() {
            assertThat(store.list(RunFilter.builder().symbol("2330.TW").build())).hasSize(2);
            assertThat(store.list(RunFilter.builder().searchKind(SearchKind.ADAPTIVE).build())).isEmpty();
            assertThat(store.list(RunFilter.builder()
                .createdFrom(T0.plusSeconds(1)).createdTo(T0.plusSeconds(3_600)).build()))
                .extracting(RunIndexEntry::runId).containsExactly(midRsi.getRunId());
            assertThat(store.list(RunFilter.builder().maxSharpe(1.0).build()))
                .extracting(RunIndexEntry::runId).containsExactly(oldRsi.getRunId());
        }

        @Test
        @DisplayName("should sort by any index field")
        void shouldSortByField() {
            assertThat(store.list(RunFilter.all(), RunSort.ascending(RunSortField.BEST_SHARPE)))
                .extracting(RunIndexEntry::bestSharpe).containsExactly(0.8, 1.2, 1.6);
            assertThat(store.list(RunFilter.all(), RunSort.ascending(RunSortField.STRATEGY)))
                .extracting(RunIndexEntry::strategyId).containsExactly("macd", "rsi", "rsi");
        }

        @Test
        @DisplayName("should find the best run and aggregate statistics")
        void shouldComputeBestAndStatistics() {
            assertThat(store.bestRun("rsi", RunSortField.BEST_SHARPE)).get()
                .extracting(RunIndexEntry::runId).isEqualTo(midRsi.getRunId());
            assertThat(store.bestRun(null, RunSortField.BEST_RETURN)).get()
                .extracting(RunIndexEntry::runId).isEqualTo(newMacd.getRunId());

            StoreStatistics statistics = store.statistics();
            assertThat(statistics.totalRuns()).isEqualTo(3);
            assertThat(statistics.totalStrategies()).isEqualTo(2);
            assertThat(statistics.bestSharpe()).isEqualTo(1.6);
            assertThat(statistics.avgSharpe()).isCloseTo(3.6 / 3, within(1e-9));
            assertThat(statistics.strategies()).containsExactly("macd", "rsi");
            assertThat(statistics.searchKinds()).containsExactly(SearchKind.GRID);
        }

        @Test
        @DisplayName("should skip an unreadable index line")
        void shouldSkipCorruptLine() throws Exception {
            Files.writeString(baseDir.resolve("history").resolve("runs.jsonl"), "{not json\n",
                StandardCharsets.UTF_8, StandardOpenOption.APPEND);

            assertThat(store.list()).hasSize(3);
        }
    }

    @Nested
    @DisplayName("Delete")
    class DeleteTests {

        @Test
        @DisplayName("should remove both the index entry and the detail record")
        void shouldDeleteRun() {
            RunRecord keep = gridRun("rsi", 1.0, T0);
            RunRecord drop = gridRun("macd", 1.0, T0);
            store.save(keep);
            store.save(drop);

            store.delete(drop.getRunId());

            assertThat(store.list()).extracting(RunIndexEntry::runId).containsExactly(keep.getRunId());
            assertThat(baseDir.resolve("details").resolve(drop.getRunId() + ".json")).doesNotExist();
            assertThat(store.get(keep.getRunId())).isEqualTo(keep);
        }

        @Test
        @DisplayName("should raise NotFound when deleting twice")
        void shouldRaiseOnSecondDelete() {
            RunRecord run = gridRun("rsi", 1.0, T0);
            store.save(run);
            store.delete(run.getRunId());

            assertThatThrownBy(() -> store.delete(run.getRunId())).isInstanceOf(RunNotFoundException.class);
        }

        @Test
        @DisplayName("should raise NotFound when the detail record is already gone")
        void shouldRaiseWhenDetailMissing() throws Exception {
            RunRecord run = gridRun("rsi", 1.0, T0);
            store.save(run);
            Files.delete(baseDir.resolve("details").resolve(run.getRunId() + ".json"));

            assertThatThrownBy(() -> store.delete(run.getRunId())).isInstanceOf(RunNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Compare")
    class CompareTests {

        @Test
        @DisplayName("should align exactly the requested runs")
        void shouldCompareTwoRuns() {
            RunRecord a = gridRun("rsi", 1.1, T0);
            RunRecord b = gridRun("macd", 0.7, T0.plusSeconds(60));
            store.save(a);
            store.save(b);
            store.save(gridRun("kd", 2.0, T0.plusSeconds(120)));

            RunComparison comparison = store.compare(List.of(b.getRunId(), a.getRunId()));

            assertThat(comparison.runIds()).containsExactly(b.getRunId(), a.getRunId());
            assertThat(comparison.rows()).extracting(RunComparison.Row::sharpeRatio).containsExactly(0.7, 1.1);
            assertThat(comparison.rows()).extracting(RunComparison.Row::maxDrawdownPct).containsOnly(-7.5);
            assertThat(comparison.parameterNames()).containsExactly("p", "q");
            assertThat(comparison.rows().get(0).parameters()).containsEntry("p", 2).containsEntry("q", 20);
        }

        @Test
        @DisplayName("should reject fewer than two or more than five ids")
        void shouldRejectWrongCount() {
            List<String> ids = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                RunRecord run = gridRun("s" + i, 1.0, T0);
                store.save(run);
                ids.add(run.getRunId());
            }

            assertThatThrownBy(() -> store.compare(ids.subList(0, 1))).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> store.compare(ids)).isInstanceOf(IllegalArgumentException.class);
            assertThat(store.compare(ids.subList(0, 5)).rows()).hasSize(5);
        }

        @Test
        @DisplayName("should reject unknown or repeated ids")
        void shouldRejectUnknownIds() {
            RunRecord run = gridRun("rsi", 1.0, T0);
            store.save(run);

            assertThatThrownBy(() -> store.compare(List.of(run.getRunId(), "missing")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("missing");
            assertThatThrownBy(() -> store.compare(List.of(run.getRunId(), run.getRunId())))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate");
        }
    }

    @Nested
    @DisplayName("Reconcile")
    class ReconcileTests {

        @Test
        @DisplayName("should repair what interrupted writes leave behind")
        void shouldRepairStore() throws Exception {
            RunRecord kept = gridRun("rsi", 1.0, T0);
            RunRecord dangling = gridRun("macd", 1.0, T0);
            store.save(kept);
            store.save(dangling);
            Path details = baseDir.resolve("details");
            Files.delete(details.resolve(dangling.getRunId() + ".json"));
            Files.writeString(details.resolve("orphan_grid_20240101T000000Z.json"), "{}");
            Files.writeString(details.resolve("crashed_grid_20240101T000000Z.json.tmp"), "{\"partial");
            Files.writeString(baseDir.resolve("history").resolve("runs.jsonl"), "garbage\n",
                StandardCharsets.UTF_8, StandardOpenOption.APPEND);

            ReconciliationReport report = store.reconcile();

            assertThat(report.orphanDetailsRemoved()).containsExactly("orphan_grid_20240101T000000Z");
            assertThat(report.danglingEntriesDropped()).containsExactly(dangling.getRunId());
            assertThat(report.corruptIndexLinesDropped()).isEqualTo(1);
            assertThat(report.tempFilesRemoved()).isEqualTo(1);
            assertThat(store.list()).extracting(RunIndexEntry::runId).containsExactly(kept.getRunId());
            assertThat(store.get(kept.getRunId())).isEqualTo(kept);
            assertThat(store.reconcile().clean()).isTrue();
        }

        @Test
        @DisplayName("should leave a consistent store untouched")
        void shouldLeaveCleanStoreAlone() {
            store.save(gridRun("rsi", 1.0, T0));

            assertThat(store.reconcile().clean()).isTrue();
            assertThat(store.list()).hasSize(1);
        }
    }
}
