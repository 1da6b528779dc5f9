package io.sessionrelay.core.error;

import io.sessionrelay.core.model.ForwardResult;

/**
 * The downstream system did not accept a session batch.
 */
public class ForwardException extends SessionRelayException {
    private final String sessionId;
    private final ForwardResult result;

    public ForwardException(String sessionId, ForwardResult result) {
        super("Forward of session " + sessionId + " failed: " + result);
        this.sessionId = sessionId;
        this.result = result;
    }

    public String getSessionId() {
        return sessionId;
    }

    public ForwardResult getResult() {
        return result;
    }
}
