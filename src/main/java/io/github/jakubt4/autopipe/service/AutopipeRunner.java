package io.github.jakubt4.autopipe.service;

import io.github.jakubt4.autopipe.config.AutopipeProperties;
import io.github.jakubt4.autopipe.config.StartupArguments;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Applies the command line and starts the pipeline once the context is up.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "autopipe.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AutopipeRunner implements ApplicationRunner {

    private final AutopipeProperties properties;
    private final PipelineLifecycle lifecycle;

    @Override
    public void run(final ApplicationArguments args) throws Exception {
        StartupArguments.apply(args, properties);
        lifecycle.start();
    }
}
