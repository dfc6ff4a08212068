package io.github.jakubt4.autopipe.ingest;

import io.github.jakubt4.autopipe.config.AutopipeProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IngestionWorkerTest {

    @TempDir
    Path dir;

    private final AutopipeProperties properties = new AutopipeProperties();
    private final List<Path> processed = new CopyOnWriteArrayList<>();
    private IngestionQueue queue;
    private IngestionWorker worker;

    @BeforeEach
    void setUp() {
        properties.getWatch().setRoot(dir);
        properties.getWatch().setSettleDelay(Duration.ZERO);
        properties.getWatch().setPollTimeout(Duration.ofMillis(50));
        queue = new IngestionQueue(properties);
        worker = new IngestionWorker(properties, queue);
    }

    @AfterEach
    void tearDown() {
        worker.stop();
    }

    @Test
    void processesQueuedFramesInOrder() throws Exception {
        final var first = Files.writeString(dir.resolve("a.fits"), "data");
        final var second = Files.writeString(dir.resolve("b.fits"), "data");
        final var done = new CountDownLatch(2);
        queue.submit(first);
        queue.submit(second);

        worker.start(path -> {
            processed.add(path);
            done.countDown();
        });

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(processed).containsExactly(first, second);
    }

    @Test
    void skipsMissingAndEmptyFiles() throws Exception {
        final var empty = Files.createFile(dir.resolve("empty.fits"));
        final var missing = dir.resolve("missing.fits");

        worker.handle(empty, processed::add);
        worker.handle(missing, processed::add);

        assertThat(processed).isEmpty();
        assertThat(worker.skippedCount()).isEqualTo(2);
    }

    @Test
    void resubmittedPathWaitsForRunningOneAndIsProcessedAgain() throws Exception {
        final var frame = Files.writeString(dir.resolve("changing.fits"), "v1");
        final var firstStarted = new CountDownLatch(1);
        final var releaseFirst = new CountDownLatch(1);
        final var running = new AtomicInteger();
        final var overlapped = new AtomicBoolean();
        final FrameProcessor processor = path -> {
            if (running.incrementAndGet() > 1) {
                overlapped.set(true);
            }
            firstStarted.countDown();
            try {
                releaseFirst.await(5, TimeUnit.SECONDS);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            processed.add(path);
            running.decrementAndGet();
        };
        final var pool = Executors.newFixedThreadPool(2);
        try {
            final var first = pool.submit(() -> worker.handle(frame, processor));
            assertThat(firstStarted.await(5, TimeUnit.SECONDS)).isTrue();
            final var second = pool.submit(() -> worker.handle(frame, processor));
            Thread.sleep(100);
            assertThat(processed).isEmpty();

            releaseFirst.countDown();
            first.get(5, TimeUnit.SECONDS);
            second.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(processed).containsExactly(frame, frame);
        assertThat(overlapped).isFalse();
        assertThat(worker.skippedCount()).isZero();
    }

    @Test
    void processorFailureDoesNotStopWorker() throws Exception {
        final var bad = Files.writeString(dir.resolve("bad.fits"), "data");
        final var good = Files.writeString(dir.resolve("good.fits"), "data");
        final var done = new CountDownLatch(1);
        queue.submit(bad);
        queue.submit(good);

        worker.start(path -> {
            if (path.equals(bad)) {
                throw new IllegalStateException("boom");
            }
            processed.add(path);
            done.countDown();
        });

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(processed).containsExactly(good);
    }

    @Test
    void stopFinishesFrameInHand() throws Exception {
        final var frame = Files.writeString(dir.resolve("slow.fits"), "data");
        final var started = new CountDownLatch(1);
        queue.submit(frame);

        worker.start(path -> {
            started.countDown();
            try {
                Thread.sleep(300);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            processed.add(path);
        });
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        worker.stop();

        assertThat(processed).containsExactly(frame);
        assertThat(worker.isRunning()).isFalse();
    }

    @Test
    void cannotStartTwice() {
        worker.start(processed::add);

        assertThatThrownBy(() -> worker.start(processed::add)).isInstanceOf(IllegalStateException.class);
    }
}
