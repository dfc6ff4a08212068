package io.github.jakubt4.autopipe.solving;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.FileSystemUtils;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One supervised solver run: {@code NOT_STARTED -> VALIDATING -> RUNNING -> terminal}.
 *
 * <p>{@link #run()} blocks the caller; {@link #cancel()} may be called from any thread.
 * The solver works in a private directory under the work dir, removed on every terminal
 * state. A successful run moves its solution next to that directory first; the solution
 * is deleted again if it cannot be parsed.
 */
@Slf4j
public final class SolveSession {

    private final SolvingProcessSupervisor supervisor;
    private final Path image;
    private final SolvingConstraints constraints;
    private final SolverOutputSink sink;
    private final AtomicReference<SolveState> state = new AtomicReference<>(SolveState.NOT_STARTED);
    private volatile Process process;
    private volatile boolean cancelRequested;
    private Path sessionDir;
    private Path solution;

    SolveSession(final SolvingProcessSupervisor supervisor, final Path image,
                 final SolvingConstraints constraints, final SolverOutputSink sink) {
        this.supervisor = supervisor;
        this.image = image;
        this.constraints = constraints;
        this.sink = sink;
    }

    public SolveState state() {
        return state.get();
    }

    public Path image() {
        return image;
    }

    /**
     * Live process handle while {@link SolveState#RUNNING}; the exited process afterwards.
     */
    public Optional<Process> process() {
        return Optional.ofNullable(process);
    }

    public SolvingResult run() {
        if (!state.compareAndSet(SolveState.NOT_STARTED, SolveState.VALIDATING)) {
            throw new IllegalStateException("Solve session already started for " + image);
        }
        supervisor.register(this);
        var result = SolvingResult.failure(SolveState.FAILED, "Solver did not complete");
        try {
            result = execute();
        } catch (final RuntimeException e) {
            log.error("[SOLVE] {} | solver run failed", image.getFileName(), e);
            result = SolvingResult.failure(SolveState.FAILED, "Solver run failed: " + e.getMessage());
        } finally {
            cleanup(result.success());
            supervisor.unregister(this);
            state.set(result.state());
        }
        log.info("[SOLVE] {} | {} | {}", image.getFileName(), result.state(), result.message());
        return result;
    }

    /**
     * Requests cooperative termination. Before the process starts this prevents the spawn.
     */
    public void cancel() {
        cancelRequested = true;
        final var running = process;
        if (running != null && running.isAlive()) {
            terminate(running);
        }
    }

    private SolvingResult execute() {
        final var rejection = supervisor.validator().validate(image);
        if (rejection.isPresent()) {
            return SolvingResult.failure(SolveState.FAILED, "Image validation failed: " + rejection.get());
        }
        if (cancelRequested) {
            return SolvingResult.failure(SolveState.CANCELLED, "Cancelled before start");
        }

        final var settings = supervisor.settings();
        final List<String> command;
        try {
            Files.createDirectories(supervisor.workDir());
            sessionDir = Files.createTempDirectory(supervisor.workDir(), SolvingProcessSupervisor.stem(image) + "-");
            command = supervisor.command(sessionDir, image, constraints);
            sink.line("Command: " + String.join(" ", command));
            state.set(SolveState.RUNNING);
            process = supervisor.processFactory().start(command, sessionDir);
        } catch (final IOException e) {
            return SolvingResult.failure(SolveState.FAILED, "Cannot start " + settings.getExecutable() + ": " + e.getMessage());
        }

        final var running = process;
        if (cancelRequested) {
            terminate(running);
        }
        final var reader = startOutputReader(running);
        final boolean finished;
        try {
            finished = running.waitFor(settings.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            terminate(running);
            return SolvingResult.failure(SolveState.CANCELLED, "Interrupted while solving");
        }
        if (!finished) {
            log.warn("[SOLVE] {} | exceeded {}s, terminating", image.getFileName(), settings.getTimeout().toSeconds());
            terminate(running);
        }
        joinQuietly(reader, settings.getCancelGrace());

        if (cancelRequested) {
            return SolvingResult.failure(SolveState.CANCELLED, "Cancelled");
        }
        if (!finished) {
            return SolvingResult.failure(SolveState.TIMED_OUT,
                    settings.getExecutable() + " timed out after " + settings.getTimeout().toSeconds() + "s");
        }
        final var exitCode = running.exitValue();
        if (exitCode != 0) {
            return SolvingResult.failure(SolveState.FAILED, settings.getExecutable() + " exited with code " + exitCode);
        }
        final var produced = supervisor.solutionFile(sessionDir, image);
        if (!Files.isRegularFile(produced)) {
            return SolvingResult.failure(SolveState.FAILED, "No solution generated");
        }
        try {
            solution = Files.move(produced,
                    supervisor.workDir().resolve(sessionDir.getFileName() + SolvingProcessSupervisor.SOLUTION_SUFFIX),
                    StandardCopyOption.REPLACE_EXISTING);
        } catch (final IOException e) {
            return SolvingResult.failure(SolveState.FAILED, "Cannot keep solution " + produced + ": " + e.getMessage());
        }
        return supervisor.parser().parse(solution);
    }

    private Thread startOutputReader(final Process running) {
        final var reader = new Thread(() -> {
            try (var lines = new BufferedReader(
                    new InputStreamReader(running.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = lines.readLine()) != null) {
                    sink.line(line);
                }
            } catch (final IOException | UncheckedIOException e) {
                log.debug("[SOLVE] Output stream of {} closed: {}", image.getFileName(), e.getMessage());
            }
        }, "solver-output-" + SolvingProcessSupervisor.stem(image));
        reader.setDaemon(true);
        reader.start();
        return reader;
    }

    private void terminate(final Process running) {
        running.descendants().forEach(ProcessHandle::destroy);
        running.destroy();
        try {
            if (!running.waitFor(supervisor.settings().getCancelGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                running.descendants().forEach(ProcessHandle::destroyForcibly);
                running.destroyForcibly().waitFor(supervisor.settings().getCancelGrace().toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            running.destroyForcibly();
        }
    }

    private void cleanup(final boolean keepSolution) {
        if (sessionDir != null) {
            try {
                FileSystemUtils.deleteRecursively(sessionDir);
                log.debug("[SOLVE] Removed {}", sessionDir);
            } catch (final IOException e) {
                log.warn("[SOLVE] Could not remove {}: {}", sessionDir, e.getMessage());
            }
        }
        if (!keepSolution && solution != null) {
            try {
                Files.deleteIfExists(solution);
            } catch (final IOException e) {
                log.warn("[SOLVE] Could not remove {}: {}", solution, e.getMessage());
            }
        }
    }

    private static void joinQuietly(final Thread thread, final Duration timeout) {
        try {
            thread.join(Math.max(1L, timeout.toMillis()));
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
