package io.github.jakubt4.autopipe.dto;

/**
 * Acknowledgement of a control command.
 *
 * @param command  command name, e.g. {@code CANCEL_SOLVE}
 * @param affected number of operations the command reached
 * @param message  human-readable result
 */
public record CommandResponse(String command, int affected, String message) {
}
