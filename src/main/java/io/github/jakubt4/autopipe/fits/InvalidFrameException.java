package io.github.jakubt4.autopipe.fits;

import java.nio.file.Path;

/**
 * A file could not be read as a usable FITS frame. Fails only the artifact it concerns.
 */
public class InvalidFrameException extends RuntimeException {

    private final Path path;

    public InvalidFrameException(final Path path, final String reason) {
        super(reason + ": " + path);
        this.path = path;
    }

    public InvalidFrameException(final Path path, final String reason, final Throwable cause) {
        super(reason + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
