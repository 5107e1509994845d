package tw.gc.strategy.optimizer.model;

/**
 * Walk-forward window sizes, in calendar days.
 *
 * @param inSampleDays Length of each in-sample (optimization) window
 * @param outSampleDays Length of each out-of-sample (validation) window
 * @param stepDays How far the window rolls forward between periods
 * @param anchored Keep the in-sample start fixed and grow the window by {@code stepDays} instead of rolling
 */
public record WalkForwardSettings(
    int inSampleDays,
    int outSampleDays,
    int stepDays,
    boolean anchored
) {
    public static final int DEFAULT_IN_SAMPLE_DAYS = 60;
    public static final int DEFAULT_OUT_SAMPLE_DAYS = 20;
    public static final int DEFAULT_STEP_DAYS = 20;

    public WalkForwardSettings {
        if (inSampleDays < 1) {
            throw new IllegalArgumentException("inSampleDays must be >= 1, got: " + inSampleDays);
        }
        if (outSampleDays < 1) {
            throw new IllegalArgumentException("outSampleDays must be >= 1, got: " + outSampleDays);
        }
        if (stepDays < 1) {
            throw new IllegalArgumentException("stepDays must be >= 1, got: " + stepDays);
        }
    }

    public static WalkForwardSettings defaults() {
        return new WalkForwardSettings(DEFAULT_IN_SAMPLE_DAYS, DEFAULT_OUT_SAMPLE_DAYS, DEFAULT_STEP_DAYS, false);
    }

    public static WalkForwardSettings rolling(int inSampleDays, int outSampleDays, int stepDays) {
        return new WalkForwardSettings(inSampleDays, outSampleDays, stepDays, false);
    }
}
