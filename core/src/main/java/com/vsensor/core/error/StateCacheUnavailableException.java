package com.vsensor.core.error;

/**
 * The backing state cache could not be read or written.
 * <p>
 * Callers abandon the single event or sweep entry that triggered the operation; the next
 * heartbeat or sweep tick retries naturally.
 * </p>
 */
public class StateCacheUnavailableException extends RuntimeException {
    public StateCacheUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
