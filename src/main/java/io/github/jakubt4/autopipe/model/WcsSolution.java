package io.github.jakubt4.autopipe.model;

import java.util.List;

/**
 * Linear celestial coordinate mapping (FITS WCS, gnomonic {@code TAN} projection).
 *
 * <p>Pixel coordinates follow the FITS convention: 1-based, with pixel {@code (1, 1)}
 * centred on the first stored sample. The CD matrix is in degrees per pixel.
 * SIP distortion terms are ignored; they are carried separately when a solution
 * is written back to a file.
 *
 * @param crpix1 reference pixel, axis 1
 * @param crpix2 reference pixel, axis 2
 * @param crval1 right ascension at the reference pixel, degrees
 * @param crval2 declination at the reference pixel, degrees
 * @param cd11   CD1_1
 * @param cd12   CD1_2
 * @param cd21   CD2_1
 * @param cd22   CD2_2
 * @param width  image width in pixels ({@code NAXIS1})
 * @param height image height in pixels ({@code NAXIS2})
 */
public record WcsSolution(double crpix1, double crpix2,
                          double crval1, double crval2,
                          double cd11, double cd12, double cd21, double cd22,
                          int width, int height) {

    private static final double ARCSEC_PER_DEGREE = 3600.0;

    public WcsSolution {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive: " + width + "x" + height);
        }
        if (cd11 * cd22 - cd12 * cd21 == 0.0) {
            throw new IllegalArgumentException("Singular CD matrix");
        }
    }

    /**
     * Projects a pixel position onto the sky.
     */
    public SkyPosition pixelToSky(final double x, final double y) {
        final var dx = x - crpix1;
        final var dy = y - crpix2;
        final var xi = Math.toRadians(cd11 * dx + cd12 * dy);
        final var eta = Math.toRadians(cd21 * dx + cd22 * dy);

        final var ra0 = Math.toRadians(crval1);
        final var dec0 = Math.toRadians(crval2);
        final var denominator = Math.cos(dec0) - eta * Math.sin(dec0);

        final var ra = ra0 + Math.atan2(xi, denominator);
        final var dec = Math.atan2(eta * Math.cos(dec0) + Math.sin(dec0), Math.hypot(xi, denominator));
        return new SkyPosition(Math.toDegrees(ra), Math.toDegrees(dec));
    }

    public SkyPosition center() {
        return pixelToSky((width + 1) / 2.0, (height + 1) / 2.0);
    }

    /**
     * Outer pixel edges of the image, in order (x0,y0), (x1,y0), (x1,y1), (x0,y1).
     */
    public List<SkyPosition> corners() {
        final var x0 = 0.5;
        final var y0 = 0.5;
        final var x1 = width + 0.5;
        final var y1 = height + 0.5;
        return List.of(pixelToSky(x0, y0), pixelToSky(x1, y0), pixelToSky(x1, y1), pixelToSky(x0, y1));
    }

    /**
     * Largest angular distance from the image centre to any of the four corners, in degrees.
     */
    public double fieldRadius() {
        final var center = center();
        return corners().stream()
                .mapToDouble(center::separation)
                .max()
                .orElse(0.0);
    }

    /**
     * Mean pixel scale in arcsec/pixel derived from the CD matrix column norms.
     */
    public double pixelScaleArcsec() {
        final var scaleX = Math.hypot(cd11, cd21) * ARCSEC_PER_DEGREE;
        final var scaleY = Math.hypot(cd12, cd22) * ARCSEC_PER_DEGREE;
        return (scaleX + scaleY) / 2.0;
    }

    /**
     * Position angle of the image +Y axis, degrees east of north.
     */
    public double orientation() {
        return Math.toDegrees(Math.atan2(cd12, cd22));
    }
}
