package io.github.jakubt4.autopipe.config;

import io.github.jakubt4.autopipe.calibration.CorrectionStep;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Typed configuration for the watch-calibrate-solve pipeline, bound from {@code autopipe.*}.
 */
@Data
@ConfigurationProperties(prefix = "autopipe")
public class AutopipeProperties {

    private Watch watch = new Watch();
    private Calibration calibration = new Calibration();
    private Solver solver = new Solver();
    private Library library = new Library();
    private Store store = new Store();
    private Runner runner = new Runner();

    @Data
    public static class Watch {
        /**
         * Observation directory watched recursively for new exposures.
         */
        private Path root;
        /**
         * Where calibrated frames are written. Defaults to {@code <root>/autopipe}.
         */
        private Path outputRoot;
        /**
         * File extensions (case-insensitive, without dot) treated as FITS.
         */
        private List<String> extensions = new ArrayList<>(List.of("fits", "fit", "fts"));
        /**
         * Bounded wait of the worker on an empty queue; also the shutdown latency.
         */
        private Duration pollTimeout = Duration.ofSeconds(1);
        /**
         * Grace period before a dequeued file is opened, so the writer can finish.
         */
        private Duration settleDelay = Duration.ofSeconds(2);
        /**
         * Worker threads. More than one enables per-path locking.
         */
        private int workers = 1;
        /**
         * Enqueue FITS files already present under the root before watching.
         */
        private boolean processExisting = false;

        public Path resolvedOutputRoot() {
            if (outputRoot != null) {
                return outputRoot.toAbsolutePath().normalize();
            }
            return root == null ? null : root.toAbsolutePath().normalize().resolve("autopipe");
        }

        public boolean isFitsFile(final Path path) {
            final var name = path.getFileName();
            if (name == null) {
                return false;
            }
            final var fileName = name.toString().toLowerCase(Locale.ROOT);
            final var dot = fileName.lastIndexOf('.');
            return dot > 0 && extensions.stream()
                    .anyMatch(ext -> ext.equalsIgnoreCase(fileName.substring(dot + 1)));
        }
    }

    @Data
    public static class Calibration {
        /**
         * Apply bias/dark/flat before solving. When off, frames are solved in place.
         */
        private boolean enabled = false;
        private Set<CorrectionStep> steps = EnumSet.allOf(CorrectionStep.class);
        /**
         * Allowed sensor temperature deviation for bias and dark matching, °C.
         */
        private double temperatureTolerance = 2.0;
        private MaxAgeDays maxAgeDays = new MaxAgeDays();
        /**
         * Compose a dark from a bias-subtracted master plus a fresh bias when no direct dark matches.
         */
        private boolean precalibratedDarkFallback = true;
    }

    /**
     * Optional age limits in days; {@code null} means unlimited.
     */
    @Data
    public static class MaxAgeDays {
        private Integer bias;
        private Integer dark;
        private Integer flat;
    }

    @Data
    public static class Solver {
        private String executable = "solve-field";
        private Path workDir = Path.of(System.getProperty("java.io.tmpdir"), "autopipe", "solved");
        /**
         * Hard wall-clock ceiling for one solve.
         */
        private Duration timeout = Duration.ofSeconds(300);
        private int downsample = 2;
        /**
         * Search radius in degrees when only a pointing hint is available.
         */
        private double defaultRadius = 15.0;
        /**
         * Multiplier applied to the field radius of an existing mapping.
         */
        private double radiusPadding = 2.0;
        private double minRadius = 1.0;
        /**
         * Time a cancelled or timed-out solver gets to exit before it is killed.
         */
        private Duration cancelGrace = Duration.ofSeconds(5);
        private int minImageSize = 100;
    }

    @Data
    public static class Library {
        /**
         * Directory of calibration masters scanned into the store at startup.
         */
        private Path root;
    }

    @Data
    public static class Store {
        private Path path = Path.of("autopipe.db");
    }

    @Data
    public static class Runner {
        /**
         * Start the watcher and workers on application startup.
         */
        private boolean enabled = true;
    }
}
