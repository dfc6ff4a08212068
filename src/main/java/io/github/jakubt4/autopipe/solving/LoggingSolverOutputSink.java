package io.github.jakubt4.autopipe.solving;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingSolverOutputSink implements SolverOutputSink {

    @Override
    public void line(final String line) {
        log.info("[SOLVE] > {}", line);
    }
}
