package io.sessionrelay.core.error;

import java.util.List;

/**
 * The broker rejected a complete, abandon or release call.
 */
public class AcknowledgeException extends SessionRelayException {
    private final String sessionId;
    private final List<Long> failedSequenceNumbers;

    public AcknowledgeException(String sessionId, String message) {
        super(message);
        this.sessionId = sessionId;
        this.failedSequenceNumbers = List.of();
    }

    public AcknowledgeException(String sessionId, String message, Throwable cause) {
        super(message, cause);
        this.sessionId = sessionId;
        this.failedSequenceNumbers = List.of();
    }

    public AcknowledgeException(String sessionId, List<Long> failedSequenceNumbers, Throwable firstCause) {
        super(String.format("Failed to complete %d message(s) of session %s: %s",
            failedSequenceNumbers.size(), sessionId, failedSequenceNumbers), firstCause);
        this.sessionId = sessionId;
        this.failedSequenceNumbers = List.copyOf(failedSequenceNumbers);
    }

    public String getSessionId() {
        return sessionId;
    }

    public List<Long> getFailedSequenceNumbers() {
        return failedSequenceNumbers;
    }
}
