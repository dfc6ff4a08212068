package io.github.jakubt4.autopipe.solving;

import io.github.jakubt4.autopipe.config.AutopipeProperties;
import io.github.jakubt4.autopipe.fits.FitsHeaderReader;
import io.github.jakubt4.autopipe.support.TestFrames;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Drives the supervisor against small shell scripts standing in for {@code solve-field}.
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
class SolvingProcessSupervisorTest {

    @TempDir
    Path dir;

    private final AutopipeProperties properties = new AutopipeProperties();
    private final SolverInputValidator validator = mock(SolverInputValidator.class);
    private final List<String> output = new CopyOnWriteArrayList<>();
    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    private Path image;
    private Path workDir;

    @BeforeEach
    void setUp() throws Exception {
        workDir = dir.resolve("solved");
        properties.getSolver().setWorkDir(workDir);
        properties.getSolver().setTimeout(Duration.ofSeconds(30));
        properties.getSolver().setCancelGrace(Duration.ofSeconds(2));
        image = Files.writeString(dir.resolve("light.fits"), "pixels");
        when(validator.validate(any())).thenReturn(Optional.empty());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void successfulSolveKeepsSolutionAndRemovesByproducts() throws Exception {
        final var prepared = TestFrames.at(dir.resolve("prepared.fits"))
                .wcs(83.82, -5.39, 120, 100, 2.0)
                .write(TestFrames.constant(120, 100, 1f));
        final var supervisor = supervisor(script("""
                echo "Field center: (RA,Dec) = (83.82, -5.39) deg."
                cp "%s" "$NEW_FITS"
                touch "$WORK_DIR/light.axy" "$WORK_DIR/light.corr" "$WORK_DIR/light.wcs"
                """.formatted(prepared)));

        final var result = supervisor.solve(image, SolvingConstraints.blindSearch(), output::add);

        assertThat(result.state()).isEqualTo(SolveState.SUCCEEDED);
        assertThat(result.raCenter()).isCloseTo(83.82, within(1e-6));
        assertThat(result.solutionFile().getParent()).isEqualTo(workDir);
        assertThat(result.solutionFile().getFileName().toString()).startsWith("light-").endsWith(".new");
        assertThat(Files.isRegularFile(result.solutionFile())).isTrue();
        assertThat(workDirEntries()).containsExactly(result.solutionFile().getFileName().toString());
        assertThat(output.get(0)).startsWith("Command: ");
        assertThat(output).contains("Field center: (RA,Dec) = (83.82, -5.39) deg.");
        assertThat(supervisor.activeSessions()).isEmpty();
    }

    @Test
    void cleanExitWithoutSolutionFails() throws Exception {
        final var supervisor = supervisor(script("""
                touch "$WORK_DIR/light.axy" "$WORK_DIR/light.xyls"
                echo "Did not solve"
                """));

        final var result = supervisor.solve(image, SolvingConstraints.blindSearch(), output::add);

        assertThat(result.state()).isEqualTo(SolveState.FAILED);
        assertThat(result.message()).isEqualTo("No solution generated");
        assertByproductsRemoved();
    }

    @Test
    void nonZeroExitFailsAndDiscardsPartialSolution() throws Exception {
        final var supervisor = supervisor(script("""
                touch "$NEW_FITS" "$WORK_DIR/light.match"
                exit 3
                """));

        final var result = supervisor.solve(image, SolvingConstraints.blindSearch(), output::add);

        assertThat(result.state()).isEqualTo(SolveState.FAILED);
        assertThat(result.message()).contains("exited with code 3");
        assertByproductsRemoved();
    }

    @Test
    void framesSharingAFileNameSolveSideBySide() throws Exception {
        final var prepared = TestFrames.at(dir.resolve("prepared.fits"))
                .wcs(83.82, -5.39, 120, 100, 2.0)
                .write(TestFrames.constant(120, 100, 1f));
        final var first = Files.writeString(Files.createDirectories(dir.resolve("night1")).resolve("light.fits"), "a");
        final var second = Files.writeString(Files.createDirectories(dir.resolve("night2")).resolve("light.fits"), "b");
        final var supervisor = supervisor(script("""
                cp "%s" "$NEW_FITS"
                touch "$WORK_DIR/light.axy"
                sleep 1
                [ -f "$NEW_FITS" ] || exit 4
                """.formatted(prepared)));
        final var pool = Executors.newFixedThreadPool(2);
        try {
            final var a = pool.submit(() -> supervisor.solve(first, SolvingConstraints.blindSearch(), output::add));
            final var b = pool.submit(() -> supervisor.solve(second, SolvingConstraints.blindSearch(), output::add));

            final var resultA = a.get(20, TimeUnit.SECONDS);
            final var resultB = b.get(20, TimeUnit.SECONDS);

            assertThat(resultA.state()).isEqualTo(SolveState.SUCCEEDED);
            assertThat(resultB.state()).isEqualTo(SolveState.SUCCEEDED);
            assertThat(resultA.solutionFile()).isNotEqualTo(resultB.solutionFile());
            assertThat(workDirEntries()).containsExactlyInAnyOrder(
                    resultA.solutionFile().getFileName().toString(),
                    resultB.solutionFile().getFileName().toString());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void timeoutTerminatesProcess() throws Exception {
        properties.getSolver().setTimeout(Duration.ofMillis(500));
        final var supervisor = supervisor(script("""
                touch "$WORK_DIR/light.axy"
                exec sleep 30
                """));
        final var session = supervisor.newSession(image, SolvingConstraints.blindSearch(), output::add);

        final var result = session.run();

        assertThat(result.state()).isEqualTo(SolveState.TIMED_OUT);
        assertThat(session.state()).isEqualTo(SolveState.TIMED_OUT);
        assertThat(session.process()).hasValueSatisfying(process -> assertThat(process.isAlive()).isFalse());
        assertByproductsRemoved();
    }

    @Test
    void cancelAllStopsRunningSolve() throws Exception {
        final var supervisor = supervisor(script("""
                touch "$WORK_DIR/light.axy" "$NEW_FITS"
                echo "started"
                exec sleep 30
                """));
        final var session = supervisor.newSession(image, SolvingConstraints.blindSearch(), output::add);
        final var future = executor.submit(session::run);

        awaitCondition(() -> session.state() == SolveState.RUNNING && output.contains("started"));
        assertThat(supervisor.cancelAll()).isEqualTo(1);

        final var result = future.get(20, TimeUnit.SECONDS);
        assertThat(result.state()).isEqualTo(SolveState.CANCELLED);
        assertThat(session.process()).hasValueSatisfying(process -> assertThat(process.isAlive()).isFalse());
        assertThat(supervisor.activeSessions()).isEmpty();
        assertByproductsRemoved();
    }

    @Test
    void cancelBeforeStartNeverSpawns() {
        final ProcessFactory factory = mock(ProcessFactory.class);
        final var supervisor = new SolvingProcessSupervisor(properties, factory, validator,
                new SolutionParser(new FitsHeaderReader()));
        final var session = supervisor.newSession(image, SolvingConstraints.blindSearch(), output::add);

        session.cancel();
        final var result = session.run();

        assertThat(result.state()).isEqualTo(SolveState.CANCELLED);
        verifyNoInteractions(factory);
    }

    @Test
    void rejectedImageNeverSpawns() throws Exception {
        when(validator.validate(any())).thenReturn(Optional.of("Image too small: 10x10"));
        final ProcessFactory factory = mock(ProcessFactory.class);
        final var supervisor = new SolvingProcessSupervisor(properties, factory, validator,
                new SolutionParser(new FitsHeaderReader()));

        final var result = supervisor.solve(image, SolvingConstraints.blindSearch(), output::add);

        assertThat(result.state()).isEqualTo(SolveState.FAILED);
        assertThat(result.message()).contains("Image too small");
        verifyNoInteractions(factory);
        assertThat(workDir).doesNotExist();
    }

    @Test
    void sessionRunsOnlyOnce() {
        final ProcessFactory factory = mock(ProcessFactory.class);
        when(validator.validate(any())).thenReturn(Optional.of("no"));
        final var supervisor = new SolvingProcessSupervisor(properties, factory, validator,
                new SolutionParser(new FitsHeaderReader()));
        final var session = supervisor.newSession(image, SolvingConstraints.blindSearch(), output::add);

        session.run();

        assertThatThrownBy(session::run).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void commandCarriesSearchPrior() {
        final var supervisor = new SolvingProcessSupervisor(properties, mock(ProcessFactory.class), validator,
                new SolutionParser(new FitsHeaderReader()));

        final var sessionDir = workDir.resolve("light-1");
        final var blind = supervisor.command(sessionDir, image, SolvingConstraints.blindSearch());
        final var constrained = supervisor.command(sessionDir, image,
                new SolvingConstraints(false, 10.68, 41.27, 2.5));

        assertThat(blind).startsWith("solve-field", "--dir", sessionDir.toString());
        assertThat(blind).contains("--guess-scale", "--no-plots", "--overwrite")
                .doesNotContain("--ra");
        assertThat(blind).containsSubsequence("--new-fits", sessionDir.resolve("light.new").toString());
        assertThat(blind).endsWith(image.toString());
        assertThat(constrained).containsSubsequence("--ra", "10.680000", "--dec", "41.270000", "--radius", "2.500000")
                .doesNotContain("--guess-scale");
    }

    private SolvingProcessSupervisor supervisor(final Path script) {
        properties.getSolver().setExecutable(script.toString());
        final ProcessFactory viaShell = (command, workingDirectory) -> {
            final var withShell = new ArrayList<String>();
            withShell.add("/bin/sh");
            withShell.addAll(command);
            return new DefaultProcessFactory().start(withShell, workingDirectory);
        };
        return new SolvingProcessSupervisor(properties, viaShell, validator, new SolutionParser(new FitsHeaderReader()));
    }

    /**
     * Prepends argument parsing that exposes {@code --dir} and {@code --new-fits} as variables.
     */
    private Path script(final String body) throws Exception {
        final var preamble = """
                WORK_DIR=""
                NEW_FITS=""
                while [ $# -gt 0 ]; do
                  case "$1" in
                    --dir) WORK_DIR="$2"; shift 2 ;;
                    --new-fits) NEW_FITS="$2"; shift 2 ;;
                    *) shift ;;
                  esac
                done
                """;
        return Files.writeString(dir.resolve("fake-solve-field.sh"), preamble + body);
    }

    private void assertByproductsRemoved() throws Exception {
        assertThat(workDirEntries()).isEmpty();
    }

    private List<String> workDirEntries() throws Exception {
        if (!Files.isDirectory(workDir)) {
            return List.of();
        }
        try (var files = Files.list(workDir)) {
            return files.map(path -> path.getFileName().toString()).toList();
        }
    }

    private static void awaitCondition(final BooleanSupplier condition) throws InterruptedException {
        final var deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Condition not met within 10s");
            }
            Thread.sleep(20);
        }
    }
}
