package io.github.jakubt4.autopipe.config;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;

/**
 * Binds {@link AutopipeProperties}, enables retries around store writes and prepares the
 * solver's working directory.
 */
@Slf4j
@Configuration
@EnableRetry
@EnableConfigurationProperties(AutopipeProperties.class)
@RequiredArgsConstructor
public class PipelineConfig {

    private final AutopipeProperties properties;

    /**
     * @throws UncheckedIOException if the solver working directory cannot be created
     */
    @PostConstruct
    public void init() {
        final var solver = properties.getSolver();
        try {
            Files.createDirectories(solver.getWorkDir());
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot create solver work directory " + solver.getWorkDir(), e);
        }
        log.info("[SOLVE] Using {} (timeout {}s, downsample {}), work dir {}",
                solver.getExecutable(), solver.getTimeout().toSeconds(), solver.getDownsample(), solver.getWorkDir());
    }
}
