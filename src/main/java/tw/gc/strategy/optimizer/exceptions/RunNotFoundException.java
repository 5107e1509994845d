package tw.gc.strategy.optimizer.exceptions;

public class RunNotFoundException extends OptimizerException {

    private final String runId;

    public RunNotFoundException(String runId) {
        super("Run not found: " + runId);
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}
