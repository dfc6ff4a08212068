package io.github.jakubt4.autopipe.store;

/**
 * Store access failed after retries were exhausted.
 */
public class MetadataStoreException extends RuntimeException {

    public MetadataStoreException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
