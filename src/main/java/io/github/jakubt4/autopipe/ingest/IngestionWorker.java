package io.github.jakubt4.autopipe.ingest;

import io.github.jakubt4.autopipe.config.AutopipeProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drains the {@link IngestionQueue}: waits for each file to settle, checks it is readable,
 * then hands it to the {@link FrameProcessor}.
 *
 * <p>A path is never processed by two workers at once: a second event for a path in hand
 * waits for the first run to finish and then processes the file again. Unreadable files
 * are logged and dropped. {@link #stop()} lets the frame in hand finish before the loops exit.
 */
@Slf4j
@Component
public class IngestionWorker {

    private final AutopipeProperties.Watch settings;
    private final IngestionQueue queue;
    private final Map<Path, PathLock> pathLocks = new ConcurrentHashMap<>();
    private final AtomicLong skipped = new AtomicLong();
    private ExecutorService executor;
    private volatile boolean running;

    public IngestionWorker(final AutopipeProperties properties, final IngestionQueue queue) {
        this.settings = properties.getWatch();
        this.queue = queue;
    }

    public synchronized void start(final FrameProcessor processor) {
        if (running) {
            throw new IllegalStateException("Workers already running");
        }
        final var workers = Math.max(1, settings.getWorkers());
        executor = Executors.newFixedThreadPool(workers, new CustomizableThreadFactory("autopipe-worker-"));
        running = true;
        for (var i = 0; i < workers; i++) {
            executor.submit(() -> workLoop(processor));
        }
        log.info("[QUEUE] {} worker(s) started", workers);
    }

    public boolean isRunning() {
        return running;
    }

    public long skippedCount() {
        return skipped.get();
    }

    private void workLoop(final FrameProcessor processor) {
        while (running) {
            try {
                queue.poll(settings.getPollTimeout()).ifPresent(path -> handle(path, processor));
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (final RuntimeException e) {
                log.error("[QUEUE] Unexpected failure in worker loop", e);
            }
        }
    }

    void handle(final Path path, final FrameProcessor processor) {
        final var pathLock = pathLocks.compute(path, (key, existing) -> {
            final var entry = existing == null ? new PathLock() : existing;
            entry.holders++;
            return entry;
        });
        try {
            if (pathLock.lock.isLocked()) {
                log.info("[QUEUE] {} is being processed; waiting to process it again", path);
            }
            pathLock.lock.lockInterruptibly();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            release(path);
            return;
        }
        try {
            if (!settle()) {
                return;
            }
            if (!isReadyForProcessing(path)) {
                skipped.incrementAndGet();
                return;
            }
            processor.process(path);
        } finally {
            pathLock.lock.unlock();
            release(path);
        }
    }

    private void release(final Path path) {
        pathLocks.computeIfPresent(path, (key, entry) -> --entry.holders == 0 ? null : entry);
    }

    private boolean settle() {
        try {
            Thread.sleep(settings.getSettleDelay().toMillis());
            return true;
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static boolean isReadyForProcessing(final Path path) {
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            log.warn("[QUEUE] Skipping {}: not a readable file", path);
            return false;
        }
        try {
            if (Files.size(path) == 0) {
                log.warn("[QUEUE] Skipping {}: file is empty", path);
                return false;
            }
        } catch (final IOException e) {
            log.warn("[QUEUE] Skipping {}: {}", path, e.getMessage());
            return false;
        }
        return true;
    }

    @PreDestroy
    public synchronized void stop() {
        if (executor == null) {
            return;
        }
        running = false;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.MINUTES)) {
                log.warn("[QUEUE] Workers did not finish in time; interrupting");
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        executor = null;
        log.info("[QUEUE] Workers stopped ({} still queued)", queue.size());
    }

    private static final class PathLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int holders;
    }
}
