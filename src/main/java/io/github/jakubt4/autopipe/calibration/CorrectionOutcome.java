package io.github.jakubt4.autopipe.calibration;

import io.github.jakubt4.autopipe.model.FrameKind;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Result of a calibration run that applied at least one step.
 *
 * @param output       calibrated file
 * @param appliedSteps steps applied, in application order
 * @param missingSteps requested steps skipped for lack of a matching master
 * @param references   masters used, by kind
 */
public record CorrectionOutcome(Path output,
                                List<CorrectionStep> appliedSteps,
                                List<CorrectionStep> missingSteps,
                                Map<FrameKind, Path> references) {

    public CorrectionOutcome {
        appliedSteps = List.copyOf(appliedSteps);
        missingSteps = List.copyOf(missingSteps);
        references = Map.copyOf(references);
    }

    public boolean isComplete() {
        return missingSteps.isEmpty();
    }
}
