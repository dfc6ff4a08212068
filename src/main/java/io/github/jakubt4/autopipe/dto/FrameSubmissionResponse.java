package io.github.jakubt4.autopipe.dto;

/**
 * @param path    path as submitted
 * @param status  {@code ACCEPTED} or {@code REJECTED}
 * @param message reason or confirmation
 */
public record FrameSubmissionResponse(String path, String status, String message) {

    public static FrameSubmissionResponse accepted(final String path, final String message) {
        return new FrameSubmissionResponse(path, "ACCEPTED", message);
    }

    public static FrameSubmissionResponse rejected(final String path, final String message) {
        return new FrameSubmissionResponse(path, "REJECTED", message);
    }
}
