package io.github.jakubt4.autopipe.solving;

/**
 * Lifecycle of one solver run.
 */
public enum SolveState {
    NOT_STARTED,
    VALIDATING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    TIMED_OUT,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == TIMED_OUT || this == CANCELLED;
    }
}
