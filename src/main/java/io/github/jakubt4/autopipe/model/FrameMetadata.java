package io.github.jakubt4.autopipe.model;

import lombok.Builder;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Header-derived description of a frame on disk. One type serves light frames and
 * calibration masters alike; for masters {@code captureTime} is the production date.
 *
 * @param path             absolute location of the FITS file; identity key in the store
 * @param kind             role in the calibration chain
 * @param captureTime      DATE-OBS (UTC, local date-time as written by the camera)
 * @param target           OBJECT, may be {@code null}
 * @param filter           FILTER, may be {@code null}
 * @param exposure         exposure in seconds, may be {@code null}
 * @param gain             camera gain, may be {@code null}
 * @param offset           camera offset, may be {@code null}
 * @param temperature      sensor temperature in °C, may be {@code null}
 * @param binning          binning as {@code "XxY"}, e.g. {@code "1x1"}
 * @param width            NAXIS1
 * @param height           NAXIS2
 * @param integrationCount number of frames combined into a master (1 for single frames)
 * @param biasSubtracted   dark master already has the bias removed
 * @param wcs              existing coordinate mapping, {@code null} when absent or unusable
 * @param raHint           raw pointing right ascension from the header (RA or OBJCTRA), may be {@code null}
 * @param decHint          raw pointing declination from the header (DEC or OBJCTDEC), may be {@code null}
 */
@Builder(toBuilder = true)
public record FrameMetadata(Path path,
                            FrameKind kind,
                            LocalDateTime captureTime,
                            String target,
                            String filter,
                            Double exposure,
                            Double gain,
                            Double offset,
                            Double temperature,
                            String binning,
                            int width,
                            int height,
                            int integrationCount,
                            boolean biasSubtracted,
                            WcsSolution wcs,
                            String raHint,
                            String decHint) {

    public FrameMetadata {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(kind, "kind");
        path = path.toAbsolutePath().normalize();
    }

    public LocalDate captureDate() {
        return captureTime == null ? null : captureTime.toLocalDate();
    }

    public boolean hasWcs() {
        return wcs != null;
    }
}
