package dev.metricfortune.exception;

/**
 * Missing resource, or one the caller does not own. The two cases are reported identically
 * so that existence never leaks to non-owners. The message is a {@code messages.properties} key.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String messageKey) {
        super(messageKey);
    }
}
