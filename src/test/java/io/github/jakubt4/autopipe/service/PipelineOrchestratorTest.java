package io.github.jakubt4.autopipe.service;

import io.github.jakubt4.autopipe.calibration.CorrectionApplier;
import io.github.jakubt4.autopipe.calibration.CorrectionException;
import io.github.jakubt4.autopipe.calibration.CorrectionOutcome;
import io.github.jakubt4.autopipe.calibration.CorrectionStep;
import io.github.jakubt4.autopipe.config.AutopipeProperties;
import io.github.jakubt4.autopipe.fits.FitsHeaderReader;
import io.github.jakubt4.autopipe.fits.InvalidFrameException;
import io.github.jakubt4.autopipe.model.FrameKind;
import io.github.jakubt4.autopipe.model.FrameMetadata;
import io.github.jakubt4.autopipe.solving.SolutionWriteException;
import io.github.jakubt4.autopipe.solving.SolutionWriter;
import io.github.jakubt4.autopipe.solving.SolveState;
import io.github.jakubt4.autopipe.solving.SolverConstraintBuilder;
import io.github.jakubt4.autopipe.solving.SolvingConstraints;
import io.github.jakubt4.autopipe.solving.SolvingProcessSupervisor;
import io.github.jakubt4.autopipe.solving.SolvingResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentMatcher;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelineOrchestratorTest {

    private static final Path INPUT = Path.of("/data/obs/M31/light_001.fits");
    private static final Path CALIBRATED = Path.of("/data/obs/autopipe/M31/light_001.fits");

    @Mock
    private FitsHeaderReader headerReader;
    @Mock
    private CorrectionApplier correctionApplier;
    @Mock
    private SolvingProcessSupervisor supervisor;
    @Mock
    private SolutionWriter solutionWriter;

    private final AutopipeProperties properties = new AutopipeProperties();
    private PipelineOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        properties.getWatch().setRoot(Path.of("/data/obs"));
        orchestrator = new PipelineOrchestrator(properties, headerReader, correctionApplier,
                new OutputLayout(properties), new SolverConstraintBuilder(properties), supervisor,
                solutionWriter, line -> { });
    }

    @Test
    void solvesOriginalInPlaceWhenCalibrationDisabled() {
        when(headerReader.read(INPUT)).thenReturn(frame(INPUT, FrameKind.LIGHT));
        final var solved = solved();
        when(supervisor.solve(eq(INPUT), any(), any())).thenReturn(solved);

        final var report = orchestrator.run(INPUT);

        assertThat(report.status()).isEqualTo(PipelineStatus.PROCESSED);
        assertThat(report.output()).isEqualTo(INPUT);
        assertThat(report.correction()).isNull();
        verify(solutionWriter).apply(INPUT, solved);
        verifyNoInteractions(correctionApplier);
    }

    @Test
    void solvesCalibratedCopyWhenCalibrationEnabled() {
        properties.getCalibration().setEnabled(true);
        final var light = frame(INPUT, FrameKind.LIGHT);
        when(headerReader.read(INPUT)).thenReturn(light);
        when(headerReader.read(CALIBRATED)).thenReturn(frame(CALIBRATED, FrameKind.LIGHT));
        when(correctionApplier.apply(eq(light), any(), anyMap(), eq(CALIBRATED)))
                .thenReturn(outcome(List.of()));
        when(supervisor.solve(eq(CALIBRATED), any(), any())).thenReturn(solved());

        final var report = orchestrator.run(INPUT);

        assertThat(report.status()).isEqualTo(PipelineStatus.PROCESSED);
        assertThat(report.output()).isEqualTo(CALIBRATED);
        verify(solutionWriter).apply(eq(CALIBRATED), any());
    }

    @Test
    void missingMasterMakesOutcomePartial() {
        properties.getCalibration().setEnabled(true);
        final var light = frame(INPUT, FrameKind.LIGHT);
        when(headerReader.read(INPUT)).thenReturn(light);
        when(headerReader.read(CALIBRATED)).thenReturn(frame(CALIBRATED, FrameKind.LIGHT));
        when(correctionApplier.apply(eq(light), any(), anyMap(), eq(CALIBRATED)))
                .thenReturn(outcome(List.of(CorrectionStep.FLAT)));
        when(supervisor.solve(eq(CALIBRATED), any(), any())).thenReturn(solved());

        final var report = orchestrator.run(INPUT);

        assertThat(report.status()).isEqualTo(PipelineStatus.PARTIAL);
        assertThat(report.message()).contains("FLAT");
    }

    @Test
    void failedSolveAfterCalibrationIsPartial() {
        properties.getCalibration().setEnabled(true);
        final var light = frame(INPUT, FrameKind.LIGHT);
        when(headerReader.read(INPUT)).thenReturn(light);
        when(headerReader.read(CALIBRATED)).thenReturn(frame(CALIBRATED, FrameKind.LIGHT));
        when(correctionApplier.apply(eq(light), any(), anyMap(), eq(CALIBRATED)))
                .thenReturn(outcome(List.of()));
        when(supervisor.solve(eq(CALIBRATED), any(), any()))
                .thenReturn(SolvingResult.failure(SolveState.TIMED_OUT, "solve-field timed out after 300s"));

        final var report = orchestrator.run(INPUT);

        assertThat(report.status()).isEqualTo(PipelineStatus.PARTIAL);
        assertThat(report.solving().state()).isEqualTo(SolveState.TIMED_OUT);
        verifyNoInteractions(solutionWriter);
    }

    @Test
    void calibrationFailureStopsBeforeSolving() {
        properties.getCalibration().setEnabled(true);
        final var light = frame(INPUT, FrameKind.LIGHT);
        when(headerReader.read(INPUT)).thenReturn(light);
        when(correctionApplier.apply(eq(light), any(), anyMap(), any()))
                .thenThrow(new CorrectionException(INPUT, List.of(CorrectionStep.values())));

        final var report = orchestrator.run(INPUT);

        assertThat(report.status()).isEqualTo(PipelineStatus.FAILED);
        assertThat(report.message()).startsWith("Calibration failed");
        verifyNoInteractions(supervisor, solutionWriter);
    }

    @Test
    void failedSolveWithoutCalibrationFails() {
        when(headerReader.read(INPUT)).thenReturn(frame(INPUT, FrameKind.LIGHT));
        when(supervisor.solve(eq(INPUT), any(), any()))
                .thenReturn(SolvingResult.failure(SolveState.FAILED, "No solution generated"));

        final var report = orchestrator.run(INPUT);

        assertThat(report.status()).isEqualTo(PipelineStatus.FAILED);
        assertThat(report.message()).contains("No solution generated");
    }

    @Test
    void writeBackFailureIsReportedAsFailedSolve() {
        when(headerReader.read(INPUT)).thenReturn(frame(INPUT, FrameKind.LIGHT));
        when(supervisor.solve(eq(INPUT), any(), any())).thenReturn(solved());
        when(solutionWriter.apply(eq(INPUT), any())).thenThrow(new SolutionWriteException(INPUT, "disk full"));

        final var report = orchestrator.run(INPUT);

        assertThat(report.status()).isEqualTo(PipelineStatus.FAILED);
        assertThat(report.solving().message()).contains("write-back failed");
    }

    @Test
    void referenceFramesAreSkipped() {
        when(headerReader.read(INPUT)).thenReturn(frame(INPUT, FrameKind.DARK));

        final var report = orchestrator.run(INPUT);

        assertThat(report.status()).isEqualTo(PipelineStatus.SKIPPED);
        verifyNoInteractions(supervisor, correctionApplier);
    }

    @Test
    void unreadableFrameIsCountedAsFailed() {
        when(headerReader.read(INPUT)).thenThrow(new InvalidFrameException(INPUT, "Missing or malformed DATE-OBS"));

        orchestrator.process(INPUT);

        assertThat(orchestrator.statistics()).containsEntry(PipelineStatus.FAILED, 1L)
                .containsEntry(PipelineStatus.PROCESSED, 0L);
    }

    @Test
    void passesPointingPriorToSolver() {
        final var frame = frame(INPUT, FrameKind.LIGHT).toBuilder().raHint("10.68").decHint("41.27").build();
        when(headerReader.read(INPUT)).thenReturn(frame);
        when(supervisor.solve(eq(INPUT), argThat(hasPrior(10.68, 41.27, 15.0)), any()))
                .thenReturn(SolvingResult.failure(SolveState.FAILED, "No solution generated"));

        orchestrator.run(INPUT);

        verify(solutionWriter, never()).apply(any(), any());
    }

    private static ArgumentMatcher<SolvingConstraints> hasPrior(final double ra, final double dec, final double radius) {
        return constraints -> !constraints.blind()
                && Math.abs(constraints.ra() - ra) < 1e-9
                && Math.abs(constraints.dec() - dec) < 1e-9
                && constraints.radius() == radius;
    }

    private static FrameMetadata frame(final Path path, final FrameKind kind) {
        return FrameMetadata.builder()
                .path(path)
                .kind(kind)
                .captureTime(LocalDateTime.of(2024, 5, 10, 22, 30))
                .width(3000)
                .height(2000)
                .build();
    }

    private static SolvingResult solved() {
        return new SolvingResult(SolveState.SUCCEEDED, "Solved: RA=10.6800°, Dec=41.2700°",
                Path.of("/tmp/autopipe/solved/light_001.new"), 10.68, 41.27, 1.2, 0.0, 0.6);
    }

    private static CorrectionOutcome outcome(final List<CorrectionStep> missing) {
        final var applied = List.of(CorrectionStep.values()).stream()
                .filter(step -> !missing.contains(step))
                .toList();
        return new CorrectionOutcome(CALIBRATED, applied, missing, Map.of());
    }
}
