package io.github.jakubt4.autopipe.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Role of a frame in the calibration chain.
 */
public enum FrameKind {
    LIGHT,
    BIAS,
    DARK,
    FLAT;

    /**
     * Maps a {@code FRAME} / {@code IMAGETYP} header value to a kind.
     * Accepts the spellings written by common capture software ("Light Frame",
     * "Master Bias", "Flat Field", "Dark", ...).
     */
    public static Optional<FrameKind> fromHeaderValue(final String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        final var normalized = value.trim().toUpperCase(Locale.ROOT);
        if (normalized.contains("BIAS") || normalized.contains("OFFSET")) {
            return Optional.of(BIAS);
        }
        if (normalized.contains("DARK")) {
            return Optional.of(DARK);
        }
        if (normalized.contains("FLAT")) {
            return Optional.of(FLAT);
        }
        if (normalized.contains("LIGHT") || normalized.contains("OBJECT") || normalized.contains("SCIENCE")) {
            return Optional.of(LIGHT);
        }
        return Optional.empty();
    }

    public boolean isReference() {
        return this != LIGHT;
    }
}
