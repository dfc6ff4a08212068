package io.github.jakubt4.autopipe.calibration;

import lombok.Getter;

import java.nio.file.Path;
import java.util.List;

/**
 * None of the requested calibration steps could be applied to a frame.
 */
@Getter
public class CorrectionException extends RuntimeException {

    private final Path path;
    private final List<CorrectionStep> missingSteps;

    public CorrectionException(final Path path, final List<CorrectionStep> missingSteps) {
        super("No calibration step could be applied to " + path + " (missing: " + missingSteps + ")");
        this.path = path;
        this.missingSteps = List.copyOf(missingSteps);
    }

    public CorrectionException(final Path path, final String message, final Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
        this.missingSteps = List.of();
    }
}
