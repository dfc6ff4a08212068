package io.github.jakubt4.autopipe.dto;

import io.github.jakubt4.autopipe.service.PipelineSnapshot;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public record PipelineStatusResponse(boolean watching,
                                     boolean calibrationEnabled,
                                     int queueDepth,
                                     long skippedFiles,
                                     Map<String, Long> outcomes,
                                     List<ActiveSolve> activeSolves) {

    public record ActiveSolve(String image, String state) {
    }

    public static PipelineStatusResponse from(final PipelineSnapshot snapshot) {
        final var outcomes = new TreeMap<String, Long>();
        snapshot.outcomes().forEach((status, count) -> outcomes.put(status.name(), count));
        return new PipelineStatusResponse(snapshot.watching(),
                snapshot.calibrationEnabled(),
                snapshot.queueDepth(),
                snapshot.skippedFiles(),
                outcomes,
                snapshot.activeSolves().stream()
                        .map(solve -> new ActiveSolve(solve.image().toString(), solve.state().name()))
                        .toList());
    }
}
