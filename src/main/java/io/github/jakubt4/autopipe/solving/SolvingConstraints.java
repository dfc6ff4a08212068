package io.github.jakubt4.autopipe.solving;

import io.github.jakubt4.autopipe.model.SkyPosition;

/**
 * Position prior handed to the solver.
 *
 * @param blind  no prior; the solver searches the whole sky
 * @param ra     search centre right ascension in degrees, {@code null} when blind
 * @param dec    search centre declination in degrees, {@code null} when blind
 * @param radius search radius in degrees, {@code null} when blind
 */
public record SolvingConstraints(boolean blind, Double ra, Double dec, Double radius) {

    public static SolvingConstraints blindSearch() {
        return new SolvingConstraints(true, null, null, null);
    }

    public static SolvingConstraints around(final SkyPosition center, final double radius) {
        return new SolvingConstraints(false, center.ra(), center.dec(), radius);
    }
}
