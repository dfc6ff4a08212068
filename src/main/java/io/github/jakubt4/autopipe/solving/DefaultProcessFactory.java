package io.github.jakubt4.autopipe.solving;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

@Component
public class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(final List<String> command, final Path workingDirectory) throws IOException {
        return new ProcessBuilder(command)
                .directory(workingDirectory.toFile())
                .redirectErrorStream(true)
                .start();
    }
}
