package io.github.jakubt4.autopipe.solving;

import io.github.jakubt4.autopipe.config.AutopipeProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs the external plate solver ({@code solve-field}) under a wall-clock timeout.
 *
 * <p>Each run is a {@link SolveSession} with its own directory under the work dir, so frames
 * sharing a file name can be solved at the same time. Sessions in flight are tracked so an
 * operator can cancel them; cancellation and timeouts terminate the process tree and still
 * remove the session directory.
 */
@Slf4j
@Service
public class SolvingProcessSupervisor {

    static final String SOLUTION_SUFFIX = ".new";

    private final AutopipeProperties.Solver settings;
    private final ProcessFactory processFactory;
    private final SolverInputValidator validator;
    private final SolutionParser parser;
    private final Set<SolveSession> active = ConcurrentHashMap.newKeySet();

    public SolvingProcessSupervisor(final AutopipeProperties properties,
                                    final ProcessFactory processFactory,
                                    final SolverInputValidator validator,
                                    final SolutionParser parser) {
        this.settings = properties.getSolver();
        this.processFactory = processFactory;
        this.validator = validator;
        this.parser = parser;
    }

    public SolveSession newSession(final Path image, final SolvingConstraints constraints, final SolverOutputSink sink) {
        return new SolveSession(this, image.toAbsolutePath().normalize(), constraints, sink);
    }

    /**
     * Runs a solve to completion on the calling thread.
     */
    public SolvingResult solve(final Path image, final SolvingConstraints constraints, final SolverOutputSink sink) {
        return newSession(image, constraints, sink).run();
    }

    /**
     * Requests cancellation of every solve in flight.
     *
     * @return number of sessions signalled
     */
    public int cancelAll() {
        final var sessions = List.copyOf(active);
        sessions.forEach(SolveSession::cancel);
        if (!sessions.isEmpty()) {
            log.warn("[SOLVE] Cancellation requested for {} running solve(s)", sessions.size());
        }
        return sessions.size();
    }

    public List<SolveSession> activeSessions() {
        return List.copyOf(active);
    }

    List<String> command(final Path sessionDir, final Path image, final SolvingConstraints constraints) {
        final var command = new ArrayList<String>(List.of(
                settings.getExecutable(),
                "--dir", sessionDir.toString(),
                "--no-plots",
                "--no-verify",
                "--overwrite",
                "--downsample", Integer.toString(settings.getDownsample()),
                "--new-fits", solutionFile(sessionDir, image).toString()));
        if (constraints.blind()) {
            command.add("--guess-scale");
        } else {
            addNumeric(command, "--ra", constraints.ra());
            addNumeric(command, "--dec", constraints.dec());
            addNumeric(command, "--radius", constraints.radius());
        }
        command.add(image.toString());
        return command;
    }

    Path solutionFile(final Path sessionDir, final Path image) {
        return sessionDir.resolve(stem(image) + SOLUTION_SUFFIX);
    }

    Path workDir() {
        return settings.getWorkDir().toAbsolutePath();
    }

    AutopipeProperties.Solver settings() {
        return settings;
    }

    ProcessFactory processFactory() {
        return processFactory;
    }

    SolverInputValidator validator() {
        return validator;
    }

    SolutionParser parser() {
        return parser;
    }

    void register(final SolveSession session) {
        active.add(session);
    }

    void unregister(final SolveSession session) {
        active.remove(session);
    }

    private static void addNumeric(final List<String> command, final String flag, final Double value) {
        if (value != null) {
            command.add(flag);
            command.add(String.format(Locale.ROOT, "%.6f", value));
        }
    }

    static String stem(final Path image) {
        final var name = image.getFileName().toString();
        final var dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
