package io.github.jakubt4.autopipe.service;

import io.github.jakubt4.autopipe.calibration.CorrectionOutcome;
import io.github.jakubt4.autopipe.solving.SolvingResult;

import java.nio.file.Path;

/**
 * What happened to one frame.
 *
 * @param input      file taken from the queue
 * @param status     overall outcome
 * @param output     file that was solved, or would have been; {@code null} when calibration failed
 * @param correction calibration outcome, {@code null} when calibration was disabled or failed
 * @param solving    solver outcome, {@code null} when solving was not attempted
 * @param message    human-readable summary
 */
public record PipelineReport(Path input,
                             PipelineStatus status,
                             Path output,
                             CorrectionOutcome correction,
                             SolvingResult solving,
                             String message) {

    static PipelineReport failed(final Path input, final String message) {
        return new PipelineReport(input, PipelineStatus.FAILED, null, null, null, message);
    }

    static PipelineReport skipped(final Path input, final String message) {
        return new PipelineReport(input, PipelineStatus.SKIPPED, null, null, null, message);
    }
}
