package io.github.jakubt4.autopipe.solving;

import java.nio.file.Path;

/**
 * A completed solution could not be merged into its target. The solution file is kept.
 */
public class SolutionWriteException extends RuntimeException {

    public SolutionWriteException(final Path target, final String message, final Throwable cause) {
        super(message + ": " + target, cause);
    }

    public SolutionWriteException(final Path target, final String message) {
        super(message + ": " + target);
    }
}
