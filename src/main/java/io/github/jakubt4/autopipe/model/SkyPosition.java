package io.github.jakubt4.autopipe.model;

import org.hipparchus.geometry.euclidean.threed.Vector3D;

/**
 * Equatorial position in degrees.
 *
 * @param ra  right ascension, normalised to [0, 360)
 * @param dec declination in [-90, 90]
 */
public record SkyPosition(double ra, double dec) {

    public SkyPosition {
        if (!Double.isFinite(ra) || !Double.isFinite(dec)) {
            throw new IllegalArgumentException("Non-finite sky position: ra=" + ra + ", dec=" + dec);
        }
        if (dec < -90.0 || dec > 90.0) {
            throw new IllegalArgumentException("Declination out of range: " + dec);
        }
        ra = ((ra % 360.0) + 360.0) % 360.0;
    }

    /**
     * Great-circle separation to {@code other}, in degrees.
     */
    public double separation(final SkyPosition other) {
        return Math.toDegrees(Vector3D.angle(toUnitVector(), other.toUnitVector()));
    }

    private Vector3D toUnitVector() {
        return new Vector3D(Math.toRadians(ra), Math.toRadians(dec));
    }
}
