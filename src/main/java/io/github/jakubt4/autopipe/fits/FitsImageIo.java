package io.github.jakubt4.autopipe.fits;

import lombok.extern.slf4j.Slf4j;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCard;
import nom.tam.util.Cursor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.function.IntFunction;

/**
 * Pixel-level FITS access: reads primary images as physical-value float grids,
 * writes 32-bit float images and rewrites headers in place.
 *
 * <p>All writes go to a {@code .part} sibling first and are moved over the target,
 * so a reader never observes a half-written file.
 */
@Slf4j
@Component
public class FitsImageIo {

    private static final String PARTIAL_SUFFIX = ".part";

    /**
     * Primary image and its header.
     *
     * @param pixels physical values ({@code BZERO + BSCALE * raw}), indexed {@code [y][x]}
     * @param header primary header as read
     */
    public record FitsImage(float[][] pixels, Header header) {

        public int width() {
            return pixels.length == 0 ? 0 : pixels[0].length;
        }

        public int height() {
            return pixels.length;
        }
    }

    @FunctionalInterface
    public interface HeaderEditor {
        void edit(Header header) throws FitsException;
    }

    /**
     * @throws InvalidFrameException if the file is unreadable or the primary HDU is not a 2D image
     */
    public FitsImage readImage(final Path path) {
        if (!Files.isReadable(path)) {
            throw new InvalidFrameException(path, "File not readable");
        }
        try (Fits fits = new Fits(path.toFile())) {
            final BasicHDU<?> hdu = fits.getHDU(0);
            if (hdu == null) {
                throw new InvalidFrameException(path, "No primary HDU");
            }
            final var header = hdu.getHeader();
            final var kernel = hdu.getKernel();
            final var bzero = header.getDoubleValue("BZERO", 0.0);
            final var bscale = header.getDoubleValue("BSCALE", 1.0);
            final var pixels = toPhysical(kernel, bzero, bscale);
            if (pixels == null) {
                throw new InvalidFrameException(path, "Primary HDU is not a 2D image");
            }
            return new FitsImage(pixels, header);
        } catch (final FitsException | IOException e) {
            throw new InvalidFrameException(path, "Cannot read FITS image", e);
        }
    }

    /**
     * Writes {@code pixels} as a float image to {@code destination}, carrying every
     * non-structural card of {@code template} and then applying {@code editor}.
     */
    public void writeImage(final Path destination, final float[][] pixels, final Header template,
                           final HeaderEditor editor) throws IOException {
        final var parent = destination.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        final var partial = partialSibling(destination);
        Files.deleteIfExists(partial);
        try (Fits out = new Fits()) {
            final BasicHDU<?> hdu = Fits.makeHDU(pixels);
            final var header = hdu.getHeader();
            if (template != null) {
                copyCards(template, header);
            }
            editor.edit(header);
            out.addHDU(hdu);
            out.write(partial.toFile());
        } catch (final FitsException e) {
            Files.deleteIfExists(partial);
            throw new IOException("Cannot write FITS image " + destination, e);
        }
        Files.move(partial, destination, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        log.debug("Wrote {}x{} float image to {}", pixels.length == 0 ? 0 : pixels[0].length, pixels.length, destination);
    }

    /**
     * Applies {@code editor} to the primary header of {@code path}, keeping all HDUs and data.
     */
    public void rewriteHeader(final Path path, final HeaderEditor editor) throws IOException {
        final var partial = partialSibling(path);
        Files.deleteIfExists(partial);
        try (Fits in = new Fits(path.toFile())) {
            final BasicHDU<?>[] hdus = in.read();
            if (hdus == null || hdus.length == 0) {
                throw new IOException("No HDU in " + path);
            }
            editor.edit(hdus[0].getHeader());
            try (Fits out = new Fits()) {
                for (final BasicHDU<?> hdu : hdus) {
                    out.addHDU(hdu);
                }
                out.write(partial.toFile());
            }
        } catch (final FitsException e) {
            Files.deleteIfExists(partial);
            throw new IOException("Cannot rewrite FITS header of " + path, e);
        }
        Files.move(partial, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private static void copyCards(final Header source, final Header target) throws FitsException {
        final Cursor<String, HeaderCard> cursor = source.iterator();
        while (cursor.hasNext()) {
            final var card = cursor.next();
            final var key = card.getKey();
            if (key == null || key.isBlank() || WcsKeywords.STRUCTURAL.contains(key)) {
                continue;
            }
            if (card.isKeyValuePair() && target.containsKey(key)) {
                target.updateLine(key, card);
            } else {
                target.addLine(card);
            }
        }
    }

    private static Path partialSibling(final Path path) {
        return path.resolveSibling(path.getFileName() + PARTIAL_SUFFIX);
    }

    static float[][] toPhysical(final Object kernel, final double bzero, final double bscale) {
        if (kernel instanceof float[][] data) {
            return convert(data.length, y -> {
                final var row = new float[data[y].length];
                for (var x = 0; x < row.length; x++) {
                    row[x] = (float) (bzero + bscale * data[y][x]);
                }
                return row;
            });
        }
        if (kernel instanceof double[][] data) {
            return convert(data.length, y -> {
                final var row = new float[data[y].length];
                for (var x = 0; x < row.length; x++) {
                    row[x] = (float) (bzero + bscale * data[y][x]);
                }
                return row;
            });
        }
        if (kernel instanceof short[][] data) {
            return convert(data.length, y -> {
                final var row = new float[data[y].length];
                for (var x = 0; x < row.length; x++) {
                    row[x] = (float) (bzero + bscale * data[y][x]);
                }
                return row;
            });
        }
        if (kernel instanceof int[][] data) {
            return convert(data.length, y -> {
                final var row = new float[data[y].length];
                for (var x = 0; x < row.length; x++) {
                    row[x] = (float) (bzero + bscale * data[y][x]);
                }
                return row;
            });
        }
        if (kernel instanceof byte[][] data) {
            return convert(data.length, y -> {
                final var row = new float[data[y].length];
                for (var x = 0; x < row.length; x++) {
                    row[x] = (float) (bzero + bscale * (data[y][x] & 0xFF));
                }
                return row;
            });
        }
        return null;
    }

    private static float[][] convert(final int rows, final IntFunction<float[]> rowMapper) {
        final var out = new float[rows][];
        for (var y = 0; y < rows; y++) {
            out[y] = rowMapper.apply(y);
        }
        return out;
    }
}
