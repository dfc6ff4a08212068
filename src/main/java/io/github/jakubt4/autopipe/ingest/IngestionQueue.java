package io.github.jakubt4.autopipe.ingest;

import io.github.jakubt4.autopipe.config.AutopipeProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * FIFO of frames waiting to be processed.
 *
 * <p>Files under the output root are refused so the pipeline never consumes its own
 * output. A path already waiting in the queue is not added twice.
 */
@Slf4j
@Component
public class IngestionQueue {

    private final AutopipeProperties.Watch settings;
    private final BlockingQueue<Path> queue = new LinkedBlockingQueue<>();
    private final Set<Path> pending = ConcurrentHashMap.newKeySet();

    public IngestionQueue(final AutopipeProperties properties) {
        this.settings = properties.getWatch();
    }

    public SubmissionResult submit(final Path path) {
        final var normalized = path.toAbsolutePath().normalize();
        final var outputRoot = settings.resolvedOutputRoot();
        if (outputRoot != null && normalized.startsWith(outputRoot)) {
            log.debug("[QUEUE] Ignoring pipeline output {}", normalized);
            return SubmissionResult.UNDER_OUTPUT_ROOT;
        }
        if (!settings.isFitsFile(normalized)) {
            log.debug("[QUEUE] Ignoring non-FITS file {}", normalized);
            return SubmissionResult.NOT_FITS;
        }
        if (!pending.add(normalized)) {
            return SubmissionResult.ALREADY_QUEUED;
        }
        queue.add(normalized);
        log.info("[QUEUE] Enqueued {} (depth {})", normalized.getFileName(), queue.size());
        return SubmissionResult.ACCEPTED;
    }

    /**
     * Waits up to {@code timeout} for the next path.
     */
    public Optional<Path> poll(final Duration timeout) throws InterruptedException {
        final var next = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (next == null) {
            return Optional.empty();
        }
        pending.remove(next);
        return Optional.of(next);
    }

    public int size() {
        return queue.size();
    }
}
