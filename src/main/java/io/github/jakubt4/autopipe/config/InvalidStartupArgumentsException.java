package io.github.jakubt4.autopipe.config;

import org.springframework.boot.ExitCodeGenerator;

/**
 * Command line or configuration unusable for starting the pipeline; the process exits with status 1.
 */
public class InvalidStartupArgumentsException extends RuntimeException implements ExitCodeGenerator {

    public InvalidStartupArgumentsException(final String message) {
        super(message);
    }

    @Override
    public int getExitCode() {
        return 1;
    }
}
