package io.github.jakubt4.autopipe.ingest;

import java.nio.file.Path;

/**
 * Consumer of dequeued frames. Implementations handle their own failures.
 */
@FunctionalInterface
public interface FrameProcessor {

    void process(Path frame);
}
