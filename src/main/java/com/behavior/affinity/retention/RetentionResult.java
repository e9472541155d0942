package com.behavior.affinity.retention;

/**
 * Outcome of a garbage collection pass.
 *
 * @param deleted number of records deleted before the pass ended
 * @param batches number of store calls made
 * @param failed  whether the pass stopped on an error
 * @param error   the error message when failed, otherwise null
 */
public record RetentionResult(long deleted, int batches, boolean failed, String error) {

    public static RetentionResult success(long deleted, int batches) {
        return new RetentionResult(deleted, batches, false, null);
    }

    public static RetentionResult failure(long deleted, int batches, String error) {
        return new RetentionResult(deleted, batches, true, error);
    }

    @Override
    public String toString() {
        return "RetentionResult{deleted=" + deleted +
                ", batches=" + batches +
                (failed ? ", error=" + error : "") + '}';
    }
}
