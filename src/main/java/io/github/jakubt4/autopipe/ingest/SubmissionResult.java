package io.github.jakubt4.autopipe.ingest;

/**
 * Why a path was or was not enqueued.
 */
public enum SubmissionResult {
    ACCEPTED,
    UNDER_OUTPUT_ROOT,
    NOT_FITS,
    ALREADY_QUEUED;

    public boolean accepted() {
        return this == ACCEPTED;
    }
}
