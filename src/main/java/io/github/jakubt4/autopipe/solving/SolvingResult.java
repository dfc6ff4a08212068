package io.github.jakubt4.autopipe.solving;

import java.nio.file.Path;

/**
 * Outcome of a solver run. Solution fields are set only when {@code state} is {@link SolveState#SUCCEEDED}.
 *
 * @param state        terminal state
 * @param message      human-readable summary
 * @param solutionFile solved FITS written by the solver
 * @param raCenter     right ascension of the image centre, degrees
 * @param decCenter    declination of the image centre, degrees
 * @param pixelScale   arcsec per pixel
 * @param orientation  position angle, degrees
 * @param fieldRadius  centre-to-corner distance, degrees
 */
public record SolvingResult(SolveState state,
                            String message,
                            Path solutionFile,
                            Double raCenter,
                            Double decCenter,
                            Double pixelScale,
                            Double orientation,
                            Double fieldRadius) {

    public static SolvingResult failure(final SolveState state, final String message) {
        return new SolvingResult(state, message, null, null, null, null, null, null);
    }

    public boolean success() {
        return state == SolveState.SUCCEEDED;
    }
}
