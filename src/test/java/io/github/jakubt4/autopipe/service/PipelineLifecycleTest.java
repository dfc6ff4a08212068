package io.github.jakubt4.autopipe.service;

import io.github.jakubt4.autopipe.config.AutopipeProperties;
import io.github.jakubt4.autopipe.ingest.FrameWatcher;
import io.github.jakubt4.autopipe.ingest.IngestionQueue;
import io.github.jakubt4.autopipe.ingest.IngestionWorker;
import io.github.jakubt4.autopipe.solving.SolvingProcessSupervisor;
import io.github.jakubt4.autopipe.store.ReferenceLibraryScanner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.context.ApplicationContext;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class PipelineLifecycleTest {

    @TempDir
    Path workspace;

    private final AutopipeProperties properties = new AutopipeProperties();
    private final ReferenceLibraryScanner scanner = mock(ReferenceLibraryScanner.class);
    private final PipelineOrchestrator orchestrator = mock(PipelineOrchestrator.class);
    private final SolvingProcessSupervisor supervisor = mock(SolvingProcessSupervisor.class);

    private Path obs;
    private FrameWatcher watcher;
    private PipelineLifecycle lifecycle;

    @BeforeEach
    void setUp() throws Exception {
        obs = Files.createDirectories(workspace.resolve("obs"));
        properties.getWatch().setRoot(obs);
        properties.getWatch().setSettleDelay(Duration.ZERO);
        properties.getWatch().setPollTimeout(Duration.ofMillis(50));
        final var queue = new IngestionQueue(properties);
        watcher = new FrameWatcher(properties, queue);
        lifecycle = new PipelineLifecycle(properties, scanner, queue, watcher,
                new IngestionWorker(properties, queue), orchestrator, supervisor, mock(ApplicationContext.class));
        when(orchestrator.statistics()).thenReturn(Map.of(PipelineStatus.PROCESSED, 0L));
    }

    @AfterEach
    void tearDown() {
        lifecycle.stop();
    }

    @Test
    void startScansLibraryProcessesExistingFramesAndWatches() throws Exception {
        final var library = Files.createDirectories(workspace.resolve("library"));
        properties.getLibrary().setRoot(library);
        properties.getCalibration().setEnabled(true);
        properties.getWatch().setProcessExisting(true);
        final var frame = Files.writeString(Files.createDirectories(obs.resolve("M31")).resolve("light_001.fits"), "x");

        lifecycle.start();

        verify(scanner).scan(library);
        verify(orchestrator, timeout(5000)).process(frame);
        assertThat(obs.resolve("autopipe")).isDirectory();
        final var snapshot = lifecycle.snapshot();
        assertThat(snapshot.watching()).isTrue();
        assertThat(snapshot.calibrationEnabled()).isTrue();
        assertThat(snapshot.activeSolves()).isEmpty();
    }

    @Test
    void missingLibraryDirectoryIsNotScanned() throws Exception {
        properties.getLibrary().setRoot(workspace.resolve("no-library"));

        lifecycle.start();

        verifyNoInteractions(scanner);
        assertThat(obs.resolve("autopipe")).doesNotExist();
    }

    @Test
    void stopTakesWatcherOffline() throws Exception {
        lifecycle.start();

        lifecycle.stop();

        assertThat(watcher.isRunning()).isFalse();
        assertThat(lifecycle.snapshot().watching()).isFalse();
    }
}
