package io.github.jakubt4.autopipe.service;

import io.github.jakubt4.autopipe.config.AutopipeProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Maps an observation file to its calibrated counterpart: same relative path under the output root.
 * Files outside the watch root keep only their file name.
 */
@Component
public class OutputLayout {

    private final AutopipeProperties.Watch settings;

    public OutputLayout(final AutopipeProperties properties) {
        this.settings = properties.getWatch();
    }

    public Path destinationFor(final Path input) {
        final var outputRoot = settings.resolvedOutputRoot();
        if (outputRoot == null) {
            throw new IllegalStateException("No output root configured");
        }
        final var normalized = input.toAbsolutePath().normalize();
        final var root = settings.getRoot() == null ? null : settings.getRoot().toAbsolutePath().normalize();
        if (root != null && normalized.startsWith(root)) {
            return outputRoot.resolve(root.relativize(normalized));
        }
        return outputRoot.resolve(normalized.getFileName());
    }
}
