package io.github.jakubt4.autopipe.ingest;

import io.github.jakubt4.autopipe.config.AutopipeProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Watches the observation root recursively and feeds new FITS files to the {@link IngestionQueue}.
 *
 * <p>Directories created while watching are registered on the fly, and files that landed in
 * them before registration are picked up by a scan. The output root is never registered.
 */
@Slf4j
@Component
public class FrameWatcher {

    private final AutopipeProperties.Watch settings;
    private final IngestionQueue queue;
    private final ExecutorService executor =
            Executors.newSingleThreadExecutor(new CustomizableThreadFactory("autopipe-watch-"));
    private final Map<WatchKey, Path> directories = new ConcurrentHashMap<>();
    private volatile WatchService watchService;
    private volatile boolean running;

    public FrameWatcher(final AutopipeProperties properties, final IngestionQueue queue) {
        this.settings = properties.getWatch();
        this.queue = queue;
    }

    public synchronized void start(final Path root) throws IOException {
        if (running) {
            throw new IllegalStateException("Watcher already running");
        }
        watchService = FileSystems.getDefault().newWatchService();
        registerTree(root);
        running = true;
        executor.submit(this::watchLoop);
        log.info("[WATCH] ONLINE | {} ({} directories)", root, directories.size());
    }

    /**
     * Enqueues every FITS file already under {@code root}, in path order.
     *
     * @return number of files accepted
     */
    public int enqueueExisting(final Path root) throws IOException {
        final List<Path> files;
        try (Stream<Path> walk = Files.walk(root)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(settings::isFitsFile)
                    .sorted(Comparator.naturalOrder())
                    .toList();
        }
        final var accepted = (int) files.stream()
                .map(queue::submit)
                .filter(SubmissionResult::accepted)
                .count();
        log.info("[WATCH] Enqueued {} existing file(s) under {}", accepted, root);
        return accepted;
    }

    public boolean isRunning() {
        return running;
    }

    private void watchLoop() {
        final var timeout = settings.getPollTimeout().toMillis();
        try {
            while (running) {
                final var key = watchService.poll(timeout, TimeUnit.MILLISECONDS);
                if (key == null) {
                    continue;
                }
                final var directory = directories.get(key);
                for (final WatchEvent<?> event : key.pollEvents()) {
                    if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                        log.warn("[WATCH] Event overflow in {}; some files may need manual submission", directory);
                        continue;
                    }
                    if (directory != null) {
                        onCreated(directory.resolve((Path) event.context()));
                    }
                }
                if (!key.reset()) {
                    directories.remove(key);
                }
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (final ClosedWatchServiceException e) {
            log.debug("[WATCH] Watch service closed");
        }
    }

    private void onCreated(final Path path) {
        if (Files.isDirectory(path)) {
            try {
                registerTree(path);
                enqueueExisting(path);
            } catch (final IOException e) {
                log.error("[WATCH] Cannot watch new directory {}: {}", path, e.getMessage());
            }
            return;
        }
        queue.submit(path);
    }

    private void registerTree(final Path root) throws IOException {
        final var outputRoot = settings.resolvedOutputRoot();
        try (Stream<Path> walk = Files.walk(root)) {
            for (final var directory : walk.filter(Files::isDirectory).toList()) {
                final var normalized = directory.toAbsolutePath().normalize();
                if (outputRoot != null && normalized.startsWith(outputRoot)) {
                    continue;
                }
                final var key = normalized.register(watchService, StandardWatchEventKinds.ENTRY_CREATE);
                directories.put(key, normalized);
            }
        }
    }

    @PreDestroy
    public synchronized void stop() {
        if (!running && watchService == null) {
            return;
        }
        running = false;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(settings.getPollTimeout().toMillis() * 2, TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        try {
            if (watchService != null) {
                watchService.close();
            }
        } catch (final IOException e) {
            log.warn("[WATCH] Error closing watch service: {}", e.getMessage());
        }
        watchService = null;
        directories.clear();
        log.info("[WATCH] OFFLINE");
    }
}
