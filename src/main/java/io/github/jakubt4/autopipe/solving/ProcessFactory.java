package io.github.jakubt4.autopipe.solving;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Starts external processes; replaced in tests by a script-backed or mock factory.
 */
@FunctionalInterface
public interface ProcessFactory {

    /**
     * Starts {@code command} in {@code workingDirectory} with stderr merged into stdout.
     */
    Process start(List<String> command, Path workingDirectory) throws IOException;
}
