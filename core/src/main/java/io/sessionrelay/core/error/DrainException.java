package io.sessionrelay.core.error;

/**
 * Receiving from a locked session failed mid-drain.
 */
public class DrainException extends SessionRelayException {
    private final String sessionId;

    public DrainException(String sessionId, Throwable cause) {
        super("Failed to drain session " + sessionId + ": " + cause.getMessage(), cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
