package org.rapidrelief.engine.domain.exception;

/**
 * The run was interrupted at a suspension point.
 */
public final class AllocationCancelledException extends AllocationException {

    private final String stage;

    public AllocationCancelledException(String runId, String stage) {
        super("RUN_CANCELLED", "Run " + runId + " cancelled during " + stage);
        this.stage = stage;
    }

    public AllocationCancelledException(String stage) {
        super("RUN_CANCELLED", "Cancelled during " + stage);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
