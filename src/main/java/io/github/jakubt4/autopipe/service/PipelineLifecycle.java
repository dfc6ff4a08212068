package io.github.jakubt4.autopipe.service;

import io.github.jakubt4.autopipe.config.AutopipeProperties;
import io.github.jakubt4.autopipe.ingest.FrameWatcher;
import io.github.jakubt4.autopipe.ingest.IngestionQueue;
import io.github.jakubt4.autopipe.ingest.IngestionWorker;
import io.github.jakubt4.autopipe.solving.SolvingProcessSupervisor;
import io.github.jakubt4.autopipe.store.ReferenceLibraryScanner;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;

/**
 * Starts and stops the watch-and-process loop.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineLifecycle {

    private final AutopipeProperties properties;
    private final ReferenceLibraryScanner libraryScanner;
    private final IngestionQueue queue;
    private final FrameWatcher watcher;
    private final IngestionWorker worker;
    private final PipelineOrchestrator orchestrator;
    private final SolvingProcessSupervisor supervisor;
    private final ApplicationContext context;

    /**
     * Scans the reference library, starts the workers, optionally enqueues existing
     * files, then starts watching. Expects validated properties.
     */
    public void start() throws IOException {
        final var watch = properties.getWatch();
        final var root = watch.getRoot().toAbsolutePath().normalize();

        final var libraryRoot = properties.getLibrary().getRoot();
        if (libraryRoot != null) {
            if (Files.isDirectory(libraryRoot)) {
                libraryScanner.scan(libraryRoot);
            } else {
                log.warn("[STORE] Library directory {} does not exist; using the store as is", libraryRoot);
            }
        }
        if (properties.getCalibration().isEnabled()) {
            Files.createDirectories(watch.resolvedOutputRoot());
        }

        log.info("[WATCH] obs={} output={} calibration={} steps={}", root, watch.resolvedOutputRoot(),
                properties.getCalibration().isEnabled() ? "on" : "off", properties.getCalibration().getSteps());
        worker.start(orchestrator);
        if (watch.isProcessExisting()) {
            watcher.enqueueExisting(root);
        }
        watcher.start(root);
    }

    @PreDestroy
    public void stop() {
        watcher.stop();
        worker.stop();
    }

    public PipelineSnapshot snapshot() {
        final var solves = supervisor.activeSessions().stream()
                .map(session -> new PipelineSnapshot.ActiveSolve(session.image(), session.state()))
                .toList();
        return new PipelineSnapshot(watcher.isRunning(),
                properties.getCalibration().isEnabled(),
                queue.size(),
                worker.skippedCount(),
                orchestrator.statistics(),
                solves);
    }

    /**
     * Closes the context on a separate thread and exits with status 0 once in-flight work is done.
     */
    public void requestShutdown() {
        log.info("[WATCH] Shutdown requested");
        final var shutdown = new Thread(() -> System.exit(SpringApplication.exit(context, () -> 0)), "autopipe-shutdown");
        shutdown.setDaemon(false);
        shutdown.start();
    }
}
