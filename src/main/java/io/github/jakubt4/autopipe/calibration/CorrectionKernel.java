package io.github.jakubt4.autopipe.calibration;

/**
 * Pixel arithmetic for the calibration steps. Grids are indexed {@code [y][x]} and
 * have identical dimensions; implementations return new grids and leave inputs untouched.
 */
public interface CorrectionKernel {

    float[][] subtractBias(float[][] image, float[][] bias);

    /**
     * @param scale exposure ratio {@code light / dark} applied to the dark before subtraction
     */
    float[][] subtractDark(float[][] image, float[][] dark, double scale);

    float[][] divideFlat(float[][] image, float[][] flat);
}
