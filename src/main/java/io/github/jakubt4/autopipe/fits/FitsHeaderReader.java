package io.github.jakubt4.autopipe.fits;

import io.github.jakubt4.autopipe.model.FrameKind;
import io.github.jakubt4.autopipe.model.FrameMetadata;
import io.github.jakubt4.autopipe.model.WcsSolution;
import lombok.extern.slf4j.Slf4j;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCard;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;

/**
 * Extracts {@link FrameMetadata} from primary FITS headers.
 *
 * <p>Keyword fallbacks follow what common capture software writes:
 * EXPTIME/EXPOSURE, GAIN/EGAIN, CCD-TEMP/SET-TEMP, FRAME/IMAGETYP, RA/OBJCTRA.
 */
@Slf4j
@Component
public class FitsHeaderReader {

    /**
     * Reads the primary header of {@code path}.
     *
     * @throws InvalidFrameException if the file is missing or not parseable as FITS
     */
    public Header readHeader(final Path path) {
        if (!Files.isReadable(path)) {
            throw new InvalidFrameException(path, "File not readable");
        }
        try (Fits fits = new Fits(path.toFile())) {
            final var hdu = fits.getHDU(0);
            if (hdu == null) {
                throw new InvalidFrameException(path, "No primary HDU");
            }
            return hdu.getHeader();
        } catch (final FitsException | IOException e) {
            throw new InvalidFrameException(path, "Cannot read FITS header", e);
        }
    }

    /**
     * Reads and maps the header of {@code path}. Frames without a recognisable
     * {@code FRAME}/{@code IMAGETYP} are treated as light frames.
     *
     * @throws InvalidFrameException if the header lacks a parseable DATE-OBS
     */
    public FrameMetadata read(final Path path) {
        return toMetadata(path, readHeader(path));
    }

    public FrameMetadata toMetadata(final Path path, final Header header) {
        final var kind = FrameKind.fromHeaderValue(stringValue(header, "FRAME"))
                .or(() -> FrameKind.fromHeaderValue(stringValue(header, "IMAGETYP")))
                .orElse(FrameKind.LIGHT);

        final var captureTime = parseDateObs(stringValue(header, "DATE-OBS"))
                .orElseThrow(() -> new InvalidFrameException(path, "Missing or malformed DATE-OBS"));

        return FrameMetadata.builder()
                .path(path)
                .kind(kind)
                .captureTime(captureTime)
                .target(stringValue(header, "OBJECT"))
                .filter(stringValue(header, "FILTER"))
                .exposure(doubleValue(header, "EXPTIME", "EXPOSURE"))
                .gain(doubleValue(header, "GAIN", "EGAIN"))
                .offset(doubleValue(header, "OFFSET"))
                .temperature(doubleValue(header, "CCD-TEMP", "SET-TEMP"))
                .binning(formatBinning(header))
                .width(intValue(header, 0, "NAXIS1"))
                .height(intValue(header, 0, "NAXIS2"))
                .integrationCount(intValue(header, 1, "NCOMBINE"))
                .biasSubtracted(isBiasSubtracted(header))
                .wcs(extractWcs(header).orElse(null))
                .raHint(firstString(header, "RA", "OBJCTRA"))
                .decHint(firstString(header, "DEC", "OBJCTDEC"))
                .build();
    }

    /**
     * Builds a coordinate mapping from CD, PC+CDELT or CDELT+CROTA2 keywords.
     * Image size comes from NAXIS1/2, or IMAGEW/IMAGEH in detached solution headers.
     */
    public Optional<WcsSolution> extractWcs(final Header header) {
        try {
            final var ctype1 = stringValue(header, "CTYPE1");
            final var ctype2 = stringValue(header, "CTYPE2");
            if ((ctype1 != null && !ctype1.startsWith("RA")) || (ctype2 != null && !ctype2.startsWith("DEC"))) {
                return Optional.empty();
            }
            final var crval1 = doubleValue(header, "CRVAL1");
            final var crval2 = doubleValue(header, "CRVAL2");
            final var crpix1 = doubleValue(header, "CRPIX1");
            final var crpix2 = doubleValue(header, "CRPIX2");
            if (crval1 == null || crval2 == null || crpix1 == null || crpix2 == null) {
                return Optional.empty();
            }
            final var width = intValue(header, 0, "NAXIS1", "IMAGEW");
            final var height = intValue(header, 0, "NAXIS2", "IMAGEH");

            final var matrix = linearMatrix(header);
            if (matrix == null) {
                return Optional.empty();
            }
            return Optional.of(new WcsSolution(crpix1, crpix2, crval1, crval2,
                    matrix[0], matrix[1], matrix[2], matrix[3], width, height));
        } catch (final IllegalArgumentException e) {
            log.debug("Unusable WCS in header: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private double[] linearMatrix(final Header header) {
        final var cd11 = doubleValue(header, "CD1_1");
        final var cd22 = doubleValue(header, "CD2_2");
        if (cd11 != null && cd22 != null) {
            return new double[]{cd11, orZero(doubleValue(header, "CD1_2")), orZero(doubleValue(header, "CD2_1")), cd22};
        }

        final var cdelt1 = doubleValue(header, "CDELT1");
        final var cdelt2 = doubleValue(header, "CDELT2");
        if (cdelt1 == null || cdelt2 == null) {
            return null;
        }
        if (header.containsKey("PC1_1") || header.containsKey("PC2_2")) {
            final var pc11 = orDefault(doubleValue(header, "PC1_1"), 1.0);
            final var pc12 = orZero(doubleValue(header, "PC1_2"));
            final var pc21 = orZero(doubleValue(header, "PC2_1"));
            final var pc22 = orDefault(doubleValue(header, "PC2_2"), 1.0);
            return new double[]{cdelt1 * pc11, cdelt1 * pc12, cdelt2 * pc21, cdelt2 * pc22};
        }
        final var rotation = Math.toRadians(orZero(doubleValue(header, "CROTA2")));
        return new double[]{
                cdelt1 * Math.cos(rotation), -cdelt2 * Math.sin(rotation),
                cdelt1 * Math.sin(rotation), cdelt2 * Math.cos(rotation)};
    }

    static Optional<LocalDateTime> parseDateObs(final String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        var value = raw.trim();
        if (value.endsWith("Z")) {
            value = value.substring(0, value.length() - 1);
        }
        try {
            return Optional.of(LocalDateTime.parse(value));
        } catch (final DateTimeParseException ignored) {
            // date-only form below
        }
        try {
            return Optional.of(LocalDate.parse(value).atStartOfDay());
        } catch (final DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static boolean isBiasSubtracted(final Header header) {
        final var calstat = stringValue(header, "CALSTAT");
        if (calstat != null && calstat.toUpperCase(Locale.ROOT).contains("B")) {
            return true;
        }
        final var card = header.findCard("BIASSUB");
        return card != null && "T".equalsIgnoreCase(String.valueOf(card.getValue()).trim());
    }

    private static String formatBinning(final Header header) {
        final var x = intValue(header, 1, "XBINNING");
        final var y = intValue(header, x, "YBINNING");
        return x + "x" + y;
    }

    static String stringValue(final Header header, final String key) {
        final HeaderCard card = header.findCard(key);
        if (card == null || card.getValue() == null) {
            return null;
        }
        final var value = card.getValue().trim();
        return value.isEmpty() ? null : value;
    }

    private static String firstString(final Header header, final String... keys) {
        for (final var key : keys) {
            final var value = stringValue(header, key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    /**
     * First parseable numeric value among {@code keys}; FITS {@code D} exponents are accepted.
     */
    static Double doubleValue(final Header header, final String... keys) {
        for (final var key : keys) {
            final var value = stringValue(header, key);
            if (value == null) {
                continue;
            }
            try {
                return Double.parseDouble(value.replace('D', 'E').replace('d', 'e'));
            } catch (final NumberFormatException e) {
                log.debug("Non-numeric value for {}: '{}'", key, value);
            }
        }
        return null;
    }

    private static int intValue(final Header header, final int fallback, final String... keys) {
        final var value = doubleValue(header, keys);
        return value == null ? fallback : (int) Math.round(value);
    }

    private static double orZero(final Double value) {
        return orDefault(value, 0.0);
    }

    private static double orDefault(final Double value, final double fallback) {
        return value == null ? fallback : value;
    }
}
