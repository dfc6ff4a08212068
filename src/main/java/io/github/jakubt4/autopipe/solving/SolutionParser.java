package io.github.jakubt4.autopipe.solving;

import io.github.jakubt4.autopipe.fits.FitsHeaderReader;
import io.github.jakubt4.autopipe.fits.InvalidFrameException;
import lombok.RequiredArgsConstructor;
import nom.tam.fits.Header;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Reads centre, pixel scale, orientation and field radius from a solved FITS file.
 */
@Component
@RequiredArgsConstructor
public class SolutionParser {

    private static final double ARCSEC_PER_DEGREE = 3600.0;

    private final FitsHeaderReader headerReader;

    public SolvingResult parse(final Path solutionFile) {
        final Header header;
        try {
            header = headerReader.readHeader(solutionFile);
        } catch (final InvalidFrameException e) {
            return SolvingResult.failure(SolveState.FAILED, "Unreadable solution file: " + e.getMessage());
        }
        final var wcs = headerReader.extractWcs(header);
        if (wcs.isEmpty()) {
            return SolvingResult.failure(SolveState.FAILED, "Solution file has no usable WCS: " + solutionFile);
        }
        final var solution = wcs.get();
        final var center = solution.center();
        final var orientation = header.containsKey("CROTA2")
                ? header.getDoubleValue("CROTA2")
                : solution.orientation();

        return new SolvingResult(SolveState.SUCCEEDED,
                String.format("Solved: RA=%.4f°, Dec=%.4f°", center.ra(), center.dec()),
                solutionFile,
                center.ra(),
                center.dec(),
                pixelScale(header, solution.pixelScaleArcsec()),
                orientation,
                solution.fieldRadius());
    }

    /**
     * Explicit {@code SCALE} first, then {@code |CDELT1|}, then the CD matrix.
     */
    static double pixelScale(final Header header, final double fromMatrix) {
        if (header.containsKey("SCALE")) {
            return header.getDoubleValue("SCALE");
        }
        if (header.containsKey("CDELT1")) {
            return Math.abs(header.getDoubleValue("CDELT1")) * ARCSEC_PER_DEGREE;
        }
        return fromMatrix;
    }
}
