package io.github.jakubt4.autopipe;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Autopipe: unattended calibration and plate solving of astronomical exposures.
 *
 * <p>Watches an observation directory, calibrates each new light frame against the best
 * matching bias, dark and flat masters from the reference library, then solves it with
 * astrometry.net's {@code solve-field} and writes the WCS back into the file.
 *
 * @see io.github.jakubt4.autopipe.service.PipelineOrchestrator
 * @see io.github.jakubt4.autopipe.calibration.ReferenceFrameSelector
 * @see io.github.jakubt4.autopipe.solving.SolvingProcessSupervisor
 */
@SpringBootApplication
public class AutopipeApplication {

    public static void main(String[] args) {
        SpringApplication.run(AutopipeApplication.class, args);
    }
}
