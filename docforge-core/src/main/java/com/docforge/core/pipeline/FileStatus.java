package com.docforge.core.pipeline;

/**
 * How processing of one file ended.
 */
public enum FileStatus {
    /** Pipeline completed; the file may or may not have changed. */
    PROCESSED,
    /** Parse error or I/O failure; the file was not rewritten. */
    FAILED,
    /** Cancelled after exceeding the per-file timeout; the file was not rewritten. */
    TIMED_OUT;

    public boolean isFailure() {
        return this != PROCESSED;
    }
}
