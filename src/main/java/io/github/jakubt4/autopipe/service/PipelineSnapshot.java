package io.github.jakubt4.autopipe.service;

import io.github.jakubt4.autopipe.solving.SolveState;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of the running pipeline.
 */
public record PipelineSnapshot(boolean watching,
                               boolean calibrationEnabled,
                               int queueDepth,
                               long skippedFiles,
                               Map<PipelineStatus, Long> outcomes,
                               List<ActiveSolve> activeSolves) {

    public record ActiveSolve(Path image, SolveState state) {
    }
}
