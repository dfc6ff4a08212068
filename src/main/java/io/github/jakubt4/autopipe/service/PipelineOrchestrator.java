package io.github.jakubt4.autopipe.service;

import io.github.jakubt4.autopipe.calibration.CorrectionApplier;
import io.github.jakubt4.autopipe.calibration.CorrectionException;
import io.github.jakubt4.autopipe.calibration.CorrectionOutcome;
import io.github.jakubt4.autopipe.config.AutopipeProperties;
import io.github.jakubt4.autopipe.fits.FitsHeaderReader;
import io.github.jakubt4.autopipe.fits.InvalidFrameException;
import io.github.jakubt4.autopipe.ingest.FrameProcessor;
import io.github.jakubt4.autopipe.model.FrameMetadata;
import io.github.jakubt4.autopipe.solving.SolutionWriteException;
import io.github.jakubt4.autopipe.solving.SolutionWriter;
import io.github.jakubt4.autopipe.solving.SolveState;
import io.github.jakubt4.autopipe.solving.SolverConstraintBuilder;
import io.github.jakubt4.autopipe.solving.SolverOutputSink;
import io.github.jakubt4.autopipe.solving.SolvingProcessSupervisor;
import io.github.jakubt4.autopipe.solving.SolvingResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs one frame through calibrate, solve and write-back.
 *
 * <p>Failed calibration stops the frame before solving. With calibration disabled the
 * original file is solved in place. Every failure ends at this boundary as a
 * {@link PipelineReport}; nothing propagates to the worker loop.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineOrchestrator implements FrameProcessor {

    private final AutopipeProperties properties;
    private final FitsHeaderReader headerReader;
    private final CorrectionApplier correctionApplier;
    private final OutputLayout outputLayout;
    private final SolverConstraintBuilder constraintBuilder;
    private final SolvingProcessSupervisor supervisor;
    private final SolutionWriter solutionWriter;
    private final SolverOutputSink outputSink;
    private final Map<PipelineStatus, AtomicLong> counters = initCounters();

    @Override
    public void process(final Path frame) {
        run(frame);
    }

    public PipelineReport run(final Path frame) {
        final var input = frame.toAbsolutePath().normalize();
        log.info("[QUEUE] Processing {}", input);
        PipelineReport report;
        try {
            report = runStages(input);
        } catch (final InvalidFrameException e) {
            log.error("[QUEUE] {} | unreadable frame: {}", input.getFileName(), e.getMessage());
            report = PipelineReport.failed(input, e.getMessage());
        } catch (final RuntimeException e) {
            log.error("[QUEUE] {} | pipeline failed", input.getFileName(), e);
            report = PipelineReport.failed(input, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        counters.get(report.status()).incrementAndGet();
        log.info("[QUEUE] {} | {} | {}", input.getFileName(), report.status(), report.message());
        return report;
    }

    public Map<PipelineStatus, Long> statistics() {
        final var snapshot = new EnumMap<PipelineStatus, Long>(PipelineStatus.class);
        counters.forEach((status, count) -> snapshot.put(status, count.get()));
        return snapshot;
    }

    private PipelineReport runStages(final Path input) {
        final var light = headerReader.read(input);
        if (light.kind().isReference()) {
            return PipelineReport.skipped(input, light.kind() + " frame, not a light");
        }

        final var calibration = properties.getCalibration();
        CorrectionOutcome correction = null;
        var target = light;
        if (calibration.isEnabled()) {
            try {
                correction = correctionApplier.apply(light, calibration.getSteps(), Map.of(),
                        outputLayout.destinationFor(input));
            } catch (final CorrectionException e) {
                log.error("[CALIBRATE] {} | {}; not solving", input.getFileName(), e.getMessage());
                return PipelineReport.failed(input, "Calibration failed: " + e.getMessage());
            }
            target = headerReader.read(correction.output());
        }

        final var solving = solve(target);
        return summarize(input, target.path(), correction, solving);
    }

    private SolvingResult solve(final FrameMetadata target) {
        final var constraints = constraintBuilder.build(target);
        log.info("[SOLVE] {} | {}", target.path().getFileName(), constraints.blind()
                ? "blind search"
                : String.format("RA=%.4f Dec=%.4f r=%.2f°", constraints.ra(), constraints.dec(), constraints.radius()));
        final var result = supervisor.solve(target.path(), constraints, outputSink);
        if (!result.success()) {
            return result;
        }
        try {
            solutionWriter.apply(target.path(), result);
            return result;
        } catch (final SolutionWriteException e) {
            log.error("[WRITE-BACK] {} | solution NOT saved; kept at {}", target.path().getFileName(),
                    result.solutionFile(), e);
            return SolvingResult.failure(SolveState.FAILED, "Solved, but write-back failed: " + e.getMessage());
        }
    }

    private static PipelineReport summarize(final Path input, final Path output,
                                            final CorrectionOutcome correction, final SolvingResult solving) {
        final var written = solving.success();
        final String message;
        final PipelineStatus status;
        if (written && (correction == null || correction.isComplete())) {
            status = PipelineStatus.PROCESSED;
            message = solving.message();
        } else if (correction != null) {
            status = PipelineStatus.PARTIAL;
            message = written
                    ? "Solved; calibration missing " + correction.missingSteps()
                    : "Calibrated, solving failed: " + solving.message();
        } else {
            status = PipelineStatus.FAILED;
            message = "Solving failed: " + solving.message();
        }
        return new PipelineReport(input, status, output, correction, solving, message);
    }

    private static Map<PipelineStatus, AtomicLong> initCounters() {
        final var map = new EnumMap<PipelineStatus, AtomicLong>(PipelineStatus.class);
        for (final var status : PipelineStatus.values()) {
            map.put(status, new AtomicLong());
        }
        return map;
    }
}
