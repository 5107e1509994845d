package tw.gc.strategy.optimizer.enums;

public enum PeriodStatus {
    COMPLETED,
    FAILED
}
