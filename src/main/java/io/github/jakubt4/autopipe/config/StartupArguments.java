package io.github.jakubt4.autopipe.config;

import org.springframework.boot.ApplicationArguments;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * Applies the pipeline's command line flags on top of {@link AutopipeProperties} and validates the result.
 *
 * <pre>
 *   --obs-path=DIR        observation directory to watch (overrides autopipe.watch.root)
 *   --autopipe-path=DIR   output root for calibrated frames (default DIR/autopipe)
 *   --calibrate           calibrate before solving
 *   --process-existing    process files already present before watching
 * </pre>
 *
 * Other {@code --key=value} options are left to Spring.
 */
public final class StartupArguments {

    static final String OBS_PATH = "obs-path";
    static final String AUTOPIPE_PATH = "autopipe-path";
    static final String CALIBRATE = "calibrate";
    static final String PROCESS_EXISTING = "process-existing";

    private static final Set<String> SPRING_FLAGS = Set.of("debug", "trace");

    private StartupArguments() {
    }

    /**
     * @throws InvalidStartupArgumentsException on unknown flags, a missing observation
     *                                          directory, or an output root equal to it
     */
    public static void apply(final ApplicationArguments arguments, final AutopipeProperties properties) {
        if (!arguments.getNonOptionArgs().isEmpty()) {
            throw new InvalidStartupArgumentsException("Unexpected arguments: " + arguments.getNonOptionArgs());
        }
        for (final var option : arguments.getOptionNames()) {
            final var values = arguments.getOptionValues(option);
            final var bare = values == null || values.isEmpty();
            if (bare && !CALIBRATE.equals(option) && !PROCESS_EXISTING.equals(option) && !SPRING_FLAGS.contains(option)) {
                throw new InvalidStartupArgumentsException("Unknown option --" + option);
            }
        }

        final var watch = properties.getWatch();
        if (arguments.containsOption(OBS_PATH)) {
            watch.setRoot(Path.of(single(arguments, OBS_PATH)));
        }
        if (arguments.containsOption(AUTOPIPE_PATH)) {
            watch.setOutputRoot(Path.of(single(arguments, AUTOPIPE_PATH)));
        }
        if (arguments.containsOption(CALIBRATE)) {
            properties.getCalibration().setEnabled(true);
        }
        if (arguments.containsOption(PROCESS_EXISTING)) {
            watch.setProcessExisting(true);
        }

        validate(properties);
    }

    static void validate(final AutopipeProperties properties) {
        final var root = properties.getWatch().getRoot();
        if (root == null) {
            throw new InvalidStartupArgumentsException("No observation directory given (--obs-path)");
        }
        if (!Files.isDirectory(root)) {
            throw new InvalidStartupArgumentsException("Observation directory " + root + " does not exist");
        }
        final var normalizedRoot = root.toAbsolutePath().normalize();
        if (normalizedRoot.equals(properties.getWatch().resolvedOutputRoot())) {
            throw new InvalidStartupArgumentsException("Output root must differ from the observation directory");
        }
        if (properties.getCalibration().isEnabled() && properties.getCalibration().getSteps().isEmpty()) {
            throw new InvalidStartupArgumentsException("Calibration enabled with no steps");
        }
    }

    private static String single(final ApplicationArguments arguments, final String option) {
        final var values = arguments.getOptionValues(option);
        if (values.size() != 1 || values.get(0).isBlank()) {
            throw new InvalidStartupArgumentsException("--" + option + " takes exactly one value");
        }
        return values.get(0);
    }
}
