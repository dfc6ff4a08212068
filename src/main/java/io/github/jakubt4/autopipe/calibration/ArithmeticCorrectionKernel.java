package io.github.jakubt4.autopipe.calibration;

import org.springframework.stereotype.Component;

/**
 * Element-wise {@link CorrectionKernel}. The flat is normalised by its mean; pixels
 * where the flat is not positive are passed through unchanged.
 */
@Component
public class ArithmeticCorrectionKernel implements CorrectionKernel {

    @Override
    public float[][] subtractBias(final float[][] image, final float[][] bias) {
        checkShape(image, bias);
        final var out = new float[image.length][];
        for (var y = 0; y < image.length; y++) {
            out[y] = new float[image[y].length];
            for (var x = 0; x < image[y].length; x++) {
                out[y][x] = image[y][x] - bias[y][x];
            }
        }
        return out;
    }

    @Override
    public float[][] subtractDark(final float[][] image, final float[][] dark, final double scale) {
        checkShape(image, dark);
        final var out = new float[image.length][];
        for (var y = 0; y < image.length; y++) {
            out[y] = new float[image[y].length];
            for (var x = 0; x < image[y].length; x++) {
                out[y][x] = (float) (image[y][x] - scale * dark[y][x]);
            }
        }
        return out;
    }

    @Override
    public float[][] divideFlat(final float[][] image, final float[][] flat) {
        checkShape(image, flat);
        final var mean = mean(flat);
        final var out = new float[image.length][];
        for (var y = 0; y < image.length; y++) {
            out[y] = new float[image[y].length];
            for (var x = 0; x < image[y].length; x++) {
                final var f = flat[y][x];
                out[y][x] = f > 0 && mean > 0 ? (float) (image[y][x] / (f / mean)) : image[y][x];
            }
        }
        return out;
    }

    private static double mean(final float[][] grid) {
        var sum = 0.0;
        var count = 0L;
        for (final var row : grid) {
            for (final var value : row) {
                sum += value;
                count++;
            }
        }
        return count == 0 ? 0.0 : sum / count;
    }

    private static void checkShape(final float[][] image, final float[][] reference) {
        if (image.length != reference.length
                || (image.length > 0 && image[0].length != reference[0].length)) {
            throw new IllegalArgumentException("Reference shape does not match image: "
                    + reference.length + " rows vs " + image.length);
        }
    }
}
