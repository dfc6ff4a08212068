package io.github.jakubt4.autopipe.solving;

import io.github.jakubt4.autopipe.config.AutopipeProperties;
import io.github.jakubt4.autopipe.fits.FitsImageIo;
import io.github.jakubt4.autopipe.fits.InvalidFrameException;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Rejects images the solver cannot possibly solve, before a process is spawned.
 */
@Component
public class SolverInputValidator {

    static final double MIN_STD = 1.0;
    static final double MIN_MEAN = 10.0;
    static final double MIN_MAX = 50.0;

    private final FitsImageIo imageIo;
    private final int minImageSize;

    public SolverInputValidator(final FitsImageIo imageIo, final AutopipeProperties properties) {
        this.imageIo = imageIo;
        this.minImageSize = properties.getSolver().getMinImageSize();
    }

    /**
     * @return the rejection reason, or empty when the image looks solvable
     */
    public Optional<String> validate(final Path image) {
        final FitsImageIo.FitsImage fits;
        try {
            fits = imageIo.readImage(image);
        } catch (final InvalidFrameException e) {
            return Optional.of(e.getMessage());
        }
        if (fits.width() < minImageSize || fits.height() < minImageSize) {
            return Optional.of("Image too small: " + fits.width() + "x" + fits.height()
                    + " (minimum " + minImageSize + " px per side)");
        }

        var min = Double.POSITIVE_INFINITY;
        var max = Double.NEGATIVE_INFINITY;
        var sum = 0.0;
        var sumSquares = 0.0;
        var count = 0L;
        for (final var row : fits.pixels()) {
            for (final var value : row) {
                if (!Float.isFinite(value)) {
                    continue;
                }
                min = Math.min(min, value);
                max = Math.max(max, value);
                sum += value;
                sumSquares += (double) value * value;
                count++;
            }
        }
        if (count == 0) {
            return Optional.of("Image has no finite pixels");
        }
        final var mean = sum / count;
        final var std = Math.sqrt(Math.max(0.0, sumSquares / count - mean * mean));
        if (max <= min || std < MIN_STD) {
            return Optional.of(String.format("Image has no contrast (min=%.1f, max=%.1f, std=%.2f)", min, max, std));
        }
        if (mean < MIN_MEAN || max < MIN_MAX) {
            return Optional.of(String.format("Image has too little signal (mean=%.1f, max=%.1f)", mean, max));
        }
        return Optional.empty();
    }
}
