package io.github.jakubt4.autopipe.calibration;

import io.github.jakubt4.autopipe.config.AutopipeProperties;
import io.github.jakubt4.autopipe.fits.FitsImageIo;
import io.github.jakubt4.autopipe.fits.InvalidFrameException;
import io.github.jakubt4.autopipe.model.FrameKind;
import io.github.jakubt4.autopipe.model.FrameMetadata;
import io.github.jakubt4.autopipe.store.MetadataStore;
import lombok.extern.slf4j.Slf4j;
import nom.tam.fits.Header;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Applies bias, dark and flat masters to a light frame and writes the result to a new file.
 *
 * <p>Steps always run in {@link CorrectionStep} order whatever order they are requested in.
 * A step without a usable master is skipped and reported; the run fails only when no
 * requested step could be applied. The input file is never modified.
 */
@Slf4j
@Service
public class CorrectionApplier {

    private final MetadataStore store;
    private final ReferenceFrameSelector selector;
    private final CorrectionKernel kernel;
    private final FitsImageIo imageIo;
    private final boolean precalibratedDarkFallback;

    public CorrectionApplier(final MetadataStore store,
                             final ReferenceFrameSelector selector,
                             final CorrectionKernel kernel,
                             final FitsImageIo imageIo,
                             final AutopipeProperties properties) {
        this.store = store;
        this.selector = selector;
        this.kernel = kernel;
        this.imageIo = imageIo;
        this.precalibratedDarkFallback = properties.getCalibration().isPrecalibratedDarkFallback();
    }

    /**
     * @param light       frame to calibrate
     * @param steps       requested steps, any order, not empty
     * @param overrides   masters to use instead of catalog selection, by kind
     * @param destination file to write; must differ from the light's path
     * @throws CorrectionException   if no requested step could be applied, or the output cannot be written
     * @throws InvalidFrameException if the light or a master cannot be read
     */
    public CorrectionOutcome apply(final FrameMetadata light,
                                   final Collection<CorrectionStep> steps,
                                   final Map<FrameKind, FrameMetadata> overrides,
                                   final Path destination) {
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("No calibration steps requested");
        }
        if (light.path().equals(destination.toAbsolutePath().normalize())) {
            throw new IllegalArgumentException("Calibrated output would overwrite its input: " + destination);
        }

        final var plan = plan(light, steps, overrides);
        if (plan.operations.isEmpty()) {
            log.warn("[CALIBRATE] {} | no master found for any of {}", light.path().getFileName(), plan.missing);
            throw new CorrectionException(light.path(), plan.missing);
        }

        final var image = imageIo.readImage(light.path());
        final var usable = new ArrayList<LoadedOperation>();
        var composedDarkBroken = false;
        for (final var operation : plan.operations) {
            final var master = imageIo.readImage(operation.master().path());
            if (master.width() != image.width() || master.height() != image.height()) {
                log.warn("[CALIBRATE] {} | {} master {} is {}x{}, frame is {}x{}; skipping",
                        light.path().getFileName(), operation.step().label(), operation.master().path(),
                        master.width(), master.height(), image.width(), image.height());
                if (operation.composed() || operation.step() == CorrectionStep.BIAS) {
                    composedDarkBroken = true;
                }
                if (!operation.composed()) {
                    plan.missing.add(operation.step());
                }
                continue;
            }
            usable.add(new LoadedOperation(operation, master.pixels()));
        }
        // a composed dark is only valid together with its bias
        if (composedDarkBroken && usable.removeIf(loaded -> loaded.operation().composed())) {
            plan.missing.add(CorrectionStep.DARK);
        }

        var pixels = image.pixels();
        final var applied = new ArrayList<CorrectionStep>();
        final var history = new ArrayList<String>();
        final var references = new EnumMap<FrameKind, Path>(FrameKind.class);
        for (final var loaded : usable) {
            final var operation = loaded.operation();
            pixels = switch (operation.step()) {
                case BIAS -> kernel.subtractBias(pixels, loaded.pixels());
                case DARK -> kernel.subtractDark(pixels, loaded.pixels(), operation.scale());
                case FLAT -> kernel.divideFlat(pixels, loaded.pixels());
            };
            if (!applied.contains(operation.step())) {
                applied.add(operation.step());
            }
            references.put(operation.master().kind(), operation.master().path());
            history.add(historyLine(operation));
            log.info("[CALIBRATE] {} | {} <- {}", light.path().getFileName(), operation.step().label(),
                    operation.master().path().getFileName());
        }

        final List<CorrectionStep> missing = plan.missing.stream()
                .filter(step -> !applied.contains(step))
                .distinct()
                .sorted()
                .toList();
        if (applied.stream().noneMatch(plan.wanted::contains)) {
            log.warn("[CALIBRATE] {} | none of {} could be applied", light.path().getFileName(), plan.wanted);
            throw new CorrectionException(light.path(), missing);
        }

        write(light, destination, pixels, image.header(), applied, history);
        log.info("[CALIBRATE] {} -> {} | applied={} missing={}",
                light.path().getFileName(), destination, applied, missing);
        return new CorrectionOutcome(destination.toAbsolutePath().normalize(), applied, missing, references);
    }

    private Plan plan(final FrameMetadata light,
                      final Collection<CorrectionStep> steps,
                      final Map<FrameKind, FrameMetadata> overrides) {
        final var wanted = steps.stream().distinct().sorted().toList();
        final var plan = new Plan(wanted);
        final var selectedBias = resolve(light, FrameKind.BIAS, overrides);

        for (final var step : wanted) {
            switch (step) {
                case BIAS -> selectedBias.ifPresentOrElse(
                        bias -> plan.add(step, bias, 1.0, false),
                        () -> plan.missing.add(step));
                case DARK -> planDark(light, overrides, selectedBias, wanted, plan);
                case FLAT -> resolve(light, FrameKind.FLAT, overrides).ifPresentOrElse(
                        flat -> plan.add(step, flat, 1.0, false),
                        () -> plan.missing.add(step));
            }
        }
        return plan;
    }

    private void planDark(final FrameMetadata light,
                          final Map<FrameKind, FrameMetadata> overrides,
                          final Optional<FrameMetadata> selectedBias,
                          final List<CorrectionStep> wanted,
                          final Plan plan) {
        final var direct = resolve(light, FrameKind.DARK, overrides);
        if (direct.isPresent()) {
            plan.add(CorrectionStep.DARK, direct.get(), exposureRatio(light, direct.get()), false);
            return;
        }
        if (precalibratedDarkFallback && selectedBias.isPresent()) {
            final var candidates = store.query(selector.candidateQuery(light, FrameKind.DARK));
            final var precalibrated = selector.selectPrecalibratedDark(light, candidates);
            if (precalibrated.isPresent()) {
                if (!wanted.contains(CorrectionStep.BIAS)) {
                    plan.add(CorrectionStep.BIAS, selectedBias.get(), 1.0, true);
                }
                log.info("[CALIBRATE] {} | composing dark from bias-subtracted {} ({}s)",
                        light.path().getFileName(), precalibrated.get().path().getFileName(),
                        precalibrated.get().exposure());
                plan.add(CorrectionStep.DARK, precalibrated.get(), exposureRatio(light, precalibrated.get()), true);
                return;
            }
        }
        plan.missing.add(CorrectionStep.DARK);
    }

    private Optional<FrameMetadata> resolve(final FrameMetadata light, final FrameKind kind,
                                            final Map<FrameKind, FrameMetadata> overrides) {
        final var override = overrides.get(kind);
        if (override != null) {
            return Optional.of(override);
        }
        final var candidates = store.query(selector.candidateQuery(light, kind));
        return selector.select(light, kind, candidates);
    }

    private static double exposureRatio(final FrameMetadata light, final FrameMetadata dark) {
        if (light.exposure() == null || dark.exposure() == null || dark.exposure() <= 0) {
            return 1.0;
        }
        return light.exposure() / dark.exposure();
    }

    private void write(final FrameMetadata light, final Path destination, final float[][] pixels,
                       final Header template, final List<CorrectionStep> applied, final List<String> history) {
        try {
            imageIo.writeImage(destination, pixels, template, header -> {
                final var calstat = new StringBuilder();
                final var existing = header.getStringValue("CALSTAT");
                if (existing != null) {
                    calstat.append(existing.trim().toUpperCase(Locale.ROOT));
                }
                for (final var step : applied) {
                    if (calstat.indexOf(String.valueOf(step.calstatCode())) < 0) {
                        calstat.append(step.calstatCode());
                    }
                }
                header.addValue("CALSTAT", calstat.toString(), "Calibration steps applied");
                for (final var line : history) {
                    header.insertHistory(line);
                }
            });
        } catch (final IOException e) {
            throw new CorrectionException(light.path(), "Cannot write calibrated frame " + destination, e);
        }
    }

    private static String historyLine(final Operation operation) {
        final var name = operation.master().path().getFileName().toString();
        return switch (operation.step()) {
            case BIAS -> "Bias subtracted: " + name;
            case DARK -> String.format(Locale.ROOT, "Dark subtracted (scale %.4f): %s", operation.scale(), name);
            case FLAT -> "Flat corrected: " + name;
        };
    }

    /**
     * @param composed part of a dark built from a bias-subtracted master plus a bias
     */
    private record Operation(CorrectionStep step, FrameMetadata master, double scale, boolean composed) {
    }

    private record LoadedOperation(Operation operation, float[][] pixels) {
    }

    private static final class Plan {
        private final List<CorrectionStep> wanted;
        private final List<Operation> operations = new ArrayList<>();
        private final List<CorrectionStep> missing = new ArrayList<>();

        Plan(final List<CorrectionStep> wanted) {
            this.wanted = wanted;
        }

        void add(final CorrectionStep step, final FrameMetadata master, final double scale, final boolean composed) {
            operations.add(new Operation(step, master, scale, composed));
        }
    }
}
