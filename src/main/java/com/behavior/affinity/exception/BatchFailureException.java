package com.behavior.affinity.exception;

/**
 * Thrown by the batch run after a mid-run failure. Every write of the run has
 * already been reverted when this surfaces, so the same window can be re-run.
 */
public class BatchFailureException extends AffinityException {

    private final String runId;
    private final int rowsRolledBack;

    public BatchFailureException(String runId, int rowsRolledBack, Throwable cause) {
        super("Batch run " + runId + " failed, " + rowsRolledBack + " row(s) rolled back: "
                + cause.getMessage(), cause);
        this.runId = runId;
        this.rowsRolledBack = rowsRolledBack;
    }

    public String getRunId() {
        return runId;
    }

    public int getRowsRolledBack() {
        return rowsRolledBack;
    }
}
