package io.github.jakubt4.autopipe.service;

public enum PipelineStatus {
    /** Calibrated (when enabled) with every requested step, solved and written back. */
    PROCESSED,
    /** A valid calibrated output exists, but a step was missing or solving failed. */
    PARTIAL,
    FAILED,
    /** Not a light frame. */
    SKIPPED
}
