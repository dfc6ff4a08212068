package io.github.jakubt4.autopipe.dto;

/**
 * Manual submission of a frame to the processing queue.
 *
 * @param path absolute or working-directory-relative path to a FITS file
 */
public record FrameSubmissionRequest(String path) {
}
