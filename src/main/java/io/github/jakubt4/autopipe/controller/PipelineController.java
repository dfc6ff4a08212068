package io.github.jakubt4.autopipe.controller;

import io.github.jakubt4.autopipe.dto.CommandResponse;
import io.github.jakubt4.autopipe.dto.FrameSubmissionRequest;
import io.github.jakubt4.autopipe.dto.FrameSubmissionResponse;
import io.github.jakubt4.autopipe.dto.PipelineStatusResponse;
import io.github.jakubt4.autopipe.ingest.IngestionQueue;
import io.github.jakubt4.autopipe.service.PipelineLifecycle;
import io.github.jakubt4.autopipe.solving.SolvingProcessSupervisor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Operator endpoints for the running pipeline.
 *
 * <p>{@code POST /api/autopipe/frames} queues a file by hand, {@code GET /api/autopipe/status}
 * reports queue depth and outcomes, {@code POST /api/autopipe/solver/cancel} stops the
 * running solve and {@code POST /api/autopipe/shutdown} ends the process cleanly.
 */
@Slf4j
@RestController
@RequestMapping("/api/autopipe")
@RequiredArgsConstructor
public class PipelineController {

    private final IngestionQueue queue;
    private final SolvingProcessSupervisor supervisor;
    private final PipelineLifecycle lifecycle;

    /**
     * @return {@code 202 Accepted} when queued, {@code 400 Bad Request} when the path is
     *         blank, missing, not FITS, under the output root or already queued
     */
    @PostMapping("/frames")
    public ResponseEntity<FrameSubmissionResponse> submitFrame(@RequestBody final FrameSubmissionRequest request) {
        if (request.path() == null || request.path().isBlank()) {
            return ResponseEntity.badRequest()
                    .body(FrameSubmissionResponse.rejected(request.path(), "Path is required"));
        }

        final Path path;
        try {
            path = Path.of(request.path());
        } catch (final InvalidPathException e) {
            return ResponseEntity.badRequest()
                    .body(FrameSubmissionResponse.rejected(request.path(), "Invalid path: " + e.getMessage()));
        }
        if (!Files.isRegularFile(path)) {
            return ResponseEntity.badRequest()
                    .body(FrameSubmissionResponse.rejected(request.path(), "No such file"));
        }

        final var result = queue.submit(path);
        if (!result.accepted()) {
            log.info("Submission of [{}] rejected: {}", request.path(), result);
            return ResponseEntity.badRequest()
                    .body(FrameSubmissionResponse.rejected(request.path(), "Not queued: " + result));
        }
        return ResponseEntity.accepted()
                .body(FrameSubmissionResponse.accepted(request.path(), "Queued, depth " + queue.size()));
    }

    @GetMapping("/status")
    public PipelineStatusResponse status() {
        return PipelineStatusResponse.from(lifecycle.snapshot());
    }

    @PostMapping("/solver/cancel")
    public CommandResponse cancelSolve() {
        final var cancelled = supervisor.cancelAll();
        return new CommandResponse("CANCEL_SOLVE", cancelled,
                cancelled == 0 ? "No solve running" : "Cancellation requested");
    }

    @PostMapping("/shutdown")
    public ResponseEntity<CommandResponse> shutdown() {
        lifecycle.requestShutdown();
        return ResponseEntity.accepted()
                .body(new CommandResponse("SHUTDOWN", 1, "Finishing in-flight work, then exiting"));
    }
}
