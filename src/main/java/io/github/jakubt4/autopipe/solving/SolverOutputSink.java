package io.github.jakubt4.autopipe.solving;

/**
 * Receives solver output one line at a time, on the thread that reads the process stream.
 */
@FunctionalInterface
public interface SolverOutputSink {

    void line(String line);
}
