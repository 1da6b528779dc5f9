package io.sessionrelay.core.error;

/**
 * Base class for failures of the session relay.
 */
public class SessionRelayException extends RuntimeException {

    public SessionRelayException(String message) {
        super(message);
    }

    public SessionRelayException(String message, Throwable cause) {
        super(message, cause);
    }
}
