package io.github.jakubt4.autopipe.calibration;

import io.github.jakubt4.autopipe.config.AutopipeProperties;
import io.github.jakubt4.autopipe.model.FrameKind;
import io.github.jakubt4.autopipe.model.FrameMetadata;
import io.github.jakubt4.autopipe.store.ReferenceQuery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Picks the best calibration master for a light frame.
 *
 * <ul>
 *   <li>Bias: binning, gain and offset equal, temperature within tolerance. Most recent
 *       master not later than the capture date.</li>
 *   <li>Dark: as bias, plus exposure at least the light's. Closest in absolute days.</li>
 *   <li>Flat: binning and filter equal, produced on or before the capture date. Most recent.</li>
 * </ul>
 *
 * <p>Dates are compared at day resolution. Equal distances resolve by path so the
 * same inputs always give the same master.
 */
@Slf4j
@Component
public class ReferenceFrameSelector {

    private static final double NUMERIC_EPSILON = 1e-6;

    private final double temperatureTolerance;
    private final AutopipeProperties.MaxAgeDays maxAgeDays;

    public ReferenceFrameSelector(final AutopipeProperties properties) {
        this.temperatureTolerance = properties.getCalibration().getTemperatureTolerance();
        this.maxAgeDays = properties.getCalibration().getMaxAgeDays();
    }

    /**
     * Store predicates that narrow the catalog for {@code kind}. Tolerances and date rules
     * are re-checked by {@link #select}, so the query may be looser than the final match.
     */
    public ReferenceQuery candidateQuery(final FrameMetadata light, final FrameKind kind) {
        final var query = ReferenceQuery.builder()
                .kind(kind)
                .binning(light.binning());
        switch (kind) {
            case BIAS, DARK -> {
                query.gain(light.gain()).offset(light.offset());
                if (light.temperature() != null) {
                    query.minTemperature(light.temperature() - temperatureTolerance)
                            .maxTemperature(light.temperature() + temperatureTolerance);
                }
                if (kind == FrameKind.BIAS) {
                    query.producedOnOrBefore(light.captureDate());
                }
            }
            case FLAT -> query.filter(light.filter()).producedOnOrBefore(light.captureDate());
            default -> throw new IllegalArgumentException("Not a reference kind: " + kind);
        }
        return query.build();
    }

    public Optional<FrameMetadata> select(final FrameMetadata light, final FrameKind kind,
                                          final Collection<FrameMetadata> catalog) {
        final var captureDate = requireCaptureDate(light);
        final var candidates = catalog.stream()
                .filter(candidate -> candidate.kind() == kind)
                .filter(candidate -> candidate.captureDate() != null)
                .filter(candidate -> withinAgeLimit(candidate, captureDate, maxAge(kind)));

        final Optional<FrameMetadata> selected = switch (kind) {
            case BIAS -> nearestPrevious(candidates.filter(c -> sensorMatches(light, c)), captureDate);
            case DARK -> candidates
                    .filter(c -> sensorMatches(light, c))
                    .filter(c -> coversExposure(light, c))
                    .min(byAbsoluteDistance(captureDate));
            case FLAT -> nearestPrevious(candidates
                    .filter(c -> Objects.equals(light.binning(), c.binning()))
                    .filter(c -> Objects.equals(light.filter(), c.filter())), captureDate);
            default -> throw new IllegalArgumentException("Not a reference kind: " + kind);
        };

        if (selected.isEmpty()) {
            log.debug("[CALIBRATE] No {} master matches {}", kind, light.path());
        }
        return selected;
    }

    /**
     * Bias-subtracted dark of any exposure matching the sensor settings of {@code light}.
     * The caller scales it by exposure ratio and pairs it with a bias.
     */
    public Optional<FrameMetadata> selectPrecalibratedDark(final FrameMetadata light,
                                                           final Collection<FrameMetadata> catalog) {
        final var captureDate = requireCaptureDate(light);
        return catalog.stream()
                .filter(candidate -> candidate.kind() == FrameKind.DARK)
                .filter(FrameMetadata::biasSubtracted)
                .filter(candidate -> candidate.captureDate() != null)
                .filter(candidate -> candidate.exposure() != null && candidate.exposure() > 0)
                .filter(candidate -> withinAgeLimit(candidate, captureDate, maxAgeDays.getDark()))
                .filter(candidate -> sensorMatches(light, candidate))
                .min(byAbsoluteDistance(captureDate));
    }

    private static Optional<FrameMetadata> nearestPrevious(final Stream<FrameMetadata> candidates,
                                                           final LocalDate captureDate) {
        return candidates
                .filter(c -> !c.captureDate().isAfter(captureDate))
                .max(Comparator.comparing(FrameMetadata::captureDate)
                        .thenComparing(FrameMetadata::path, Comparator.reverseOrder()));
    }

    private static Comparator<FrameMetadata> byAbsoluteDistance(final LocalDate captureDate) {
        return Comparator.<FrameMetadata>comparingLong(c -> Math.abs(ChronoUnit.DAYS.between(captureDate, c.captureDate())))
                .thenComparing(c -> c.captureDate().isAfter(captureDate))
                .thenComparing(FrameMetadata::path);
    }

    private boolean sensorMatches(final FrameMetadata light, final FrameMetadata candidate) {
        return Objects.equals(light.binning(), candidate.binning())
                && numericEquals(light.gain(), candidate.gain())
                && numericEquals(light.offset(), candidate.offset())
                && temperatureMatches(light.temperature(), candidate.temperature());
    }

    private boolean temperatureMatches(final Double light, final Double candidate) {
        if (light == null || candidate == null) {
            return light == null && candidate == null;
        }
        return Math.abs(light - candidate) <= temperatureTolerance + NUMERIC_EPSILON;
    }

    private static boolean coversExposure(final FrameMetadata light, final FrameMetadata candidate) {
        if (light.exposure() == null) {
            return true;
        }
        return candidate.exposure() != null && candidate.exposure() >= light.exposure() - NUMERIC_EPSILON;
    }

    private static boolean numericEquals(final Double a, final Double b) {
        if (a == null || b == null) {
            return a == null && b == null;
        }
        return Math.abs(a - b) <= NUMERIC_EPSILON;
    }

    private static boolean withinAgeLimit(final FrameMetadata candidate, final LocalDate captureDate,
                                          final Integer maxAge) {
        if (maxAge == null) {
            return true;
        }
        return !candidate.captureDate().isBefore(captureDate.minusDays(maxAge));
    }

    private Integer maxAge(final FrameKind kind) {
        return switch (kind) {
            case BIAS -> maxAgeDays.getBias();
            case DARK -> maxAgeDays.getDark();
            case FLAT -> maxAgeDays.getFlat();
            default -> null;
        };
    }

    private static LocalDate requireCaptureDate(final FrameMetadata light) {
        if (light.captureDate() == null) {
            throw new IllegalArgumentException("Light frame has no capture date: " + light.path());
        }
        return light.captureDate();
    }
}
