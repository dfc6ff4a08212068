package io.github.jakubt4.autopipe.fits;

import java.util.List;
import java.util.Set;

/**
 * Header keyword groups shared by the FITS readers and writers.
 */
public final class WcsKeywords {

    /** Linear WCS keywords; replaced as a block when a new solution is written. */
    public static final List<String> LINEAR = List.of(
            "CRPIX1", "CRPIX2",
            "CRVAL1", "CRVAL2",
            "CD1_1", "CD1_2", "CD2_1", "CD2_2",
            "CTYPE1", "CTYPE2",
            "CUNIT1", "CUNIT2",
            "LONPOLE", "LATPOLE",
            "PC1_1", "PC1_2", "PC2_1", "PC2_2",
            "CDELT1", "CDELT2",
            "CROTA1", "CROTA2");

    /** Cards owned by the data layout; never copied between HDUs. */
    public static final Set<String> STRUCTURAL = Set.of(
            "SIMPLE", "XTENSION", "BITPIX", "NAXIS", "NAXIS1", "NAXIS2", "NAXIS3",
            "EXTEND", "PCOUNT", "GCOUNT", "BZERO", "BSCALE", "BLANK", "END",
            "CHECKSUM", "DATASUM");

    private WcsKeywords() {
    }

    /**
     * SIP distortion polynomial keys ({@code A_2_0}, {@code BP_ORDER}, ...).
     */
    public static boolean isSip(final String key) {
        return key.startsWith("A_") || key.startsWith("B_")
                || key.startsWith("AP_") || key.startsWith("BP_")
                || key.endsWith("_ORDER");
    }

    public static boolean isWcs(final String key) {
        return LINEAR.contains(key) || isSip(key);
    }
}
