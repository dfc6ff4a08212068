package io.github.jakubt4.autopipe.solving;

import io.github.jakubt4.autopipe.config.AutopipeProperties;
import io.github.jakubt4.autopipe.model.FrameMetadata;
import io.github.jakubt4.autopipe.model.SkyPosition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Derives a search prior from what a frame already knows about its pointing.
 *
 * <p>An existing coordinate mapping gives its centre and a padded field radius; a bare
 * RA/DEC pointing gives a fixed default radius. Anything unusable falls back to a blind
 * search; this class never throws.
 */
@Slf4j
@Component
public class SolverConstraintBuilder {

    private final double defaultRadius;
    private final double radiusPadding;
    private final double minRadius;

    public SolverConstraintBuilder(final AutopipeProperties properties) {
        final var solver = properties.getSolver();
        this.defaultRadius = solver.getDefaultRadius();
        this.radiusPadding = solver.getRadiusPadding();
        this.minRadius = solver.getMinRadius();
    }

    public SolvingConstraints build(final FrameMetadata frame) {
        try {
            if (frame.hasWcs()) {
                final var wcs = frame.wcs();
                final var radius = Math.max(minRadius, wcs.fieldRadius() * radiusPadding);
                if (Double.isFinite(radius)) {
                    log.debug("[SOLVE] {} | prior from existing WCS, radius {}°", frame.path().getFileName(), radius);
                    return SolvingConstraints.around(wcs.center(), radius);
                }
            }
            final var pointing = pointingHint(frame);
            if (pointing.isPresent()) {
                log.debug("[SOLVE] {} | prior from header pointing, radius {}°", frame.path().getFileName(), defaultRadius);
                return SolvingConstraints.around(pointing.get(), defaultRadius);
            }
        } catch (final RuntimeException e) {
            log.debug("[SOLVE] {} | unusable position hint: {}", frame.path().getFileName(), e.getMessage());
        }
        return SolvingConstraints.blindSearch();
    }

    private static Optional<SkyPosition> pointingHint(final FrameMetadata frame) {
        if (frame.raHint() == null || frame.decHint() == null) {
            return Optional.empty();
        }
        return Optional.of(new SkyPosition(parseRightAscension(frame.raHint()), parseDeclination(frame.decHint())));
    }

    /**
     * Plain numbers are degrees; sexagesimal values ({@code "12 34 56.7"} or {@code "12:34:56.7"}) are hours.
     */
    static double parseRightAscension(final String raw) {
        final var value = raw.trim();
        if (isSexagesimal(value)) {
            return sexagesimal(value) * 15.0;
        }
        return Double.parseDouble(value);
    }

    static double parseDeclination(final String raw) {
        final var value = raw.trim();
        return isSexagesimal(value) ? sexagesimal(value) : Double.parseDouble(value);
    }

    private static boolean isSexagesimal(final String value) {
        return value.indexOf(':') >= 0 || value.indexOf(' ') >= 0;
    }

    private static double sexagesimal(final String value) {
        final var parts = value.split("[:\\s]+");
        if (parts.length < 2 || parts.length > 3) {
            throw new NumberFormatException("Not a sexagesimal value: " + value);
        }
        final var negative = parts[0].startsWith("-");
        var result = Math.abs(Double.parseDouble(parts[0]));
        result += Double.parseDouble(parts[1]) / 60.0;
        if (parts.length == 3) {
            result += Double.parseDouble(parts[2]) / 3600.0;
        }
        return negative ? -result : result;
    }
}
