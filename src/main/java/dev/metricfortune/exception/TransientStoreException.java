package dev.metricfortune.exception;

/**
 * Durable store unreachable or timing out after retries.
 */
public class TransientStoreException extends RuntimeException {

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
