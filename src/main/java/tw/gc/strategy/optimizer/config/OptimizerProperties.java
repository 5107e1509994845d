package tw.gc.strategy.optimizer.config;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import tw.gc.strategy.optimizer.enums.RankingMetric;

@Data
@Component
@ConfigurationProperties(prefix = "optimizer")
public class OptimizerProperties {

    private Storage storage = new Storage();
    @Data
    public static class Storage {
        /** Root directory holding history/ and details/ */
        private String baseDir = "results";
        /** Remove orphan detail records and stale temp files at startup */
        private boolean reconcileOnStartup = true;
    }

    /**
     * Default worker count when a request does not set one.
     */
    private int concurrency = Runtime.getRuntime().availableProcessors();

    /**
     * Per-trial wall-clock limit in milliseconds, 0 to disable.
     */
    private long trialTimeoutMs = 60_000;

    /**
     * Largest parameter space accepted for grid and walk-forward search.
     */
    private long maxCombinations = 100_000;

    private int minTrades = 0;

    private RankingMetric rankingMetric = RankingMetric.SHARPE;

    private String defaultSampler = "random";

    private Map<String, Preset> presets = new LinkedHashMap<>();

    /**
     * Named overrides applied by {@code OptimizerService#optimizePreset}. Unset fields leave the
     * request untouched.
     */
    @Data
    public static class Preset {
        private Integer concurrency;
        private RankingMetric rankingMetric;
        private Integer inSampleDays;
        private Integer outSampleDays;
        private Integer stepDays;
        private Boolean anchored;
        private Integer trialBudget;
        private Long timeBudgetMs;
        private String sampler;
    }
}
