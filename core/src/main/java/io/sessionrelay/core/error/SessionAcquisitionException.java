package io.sessionrelay.core.error;

/**
 * The broker failed while granting a session lock.
 * <p>
 * Finding no session to lock is not a failure and never produces this exception.
 * </p>
 */
public class SessionAcquisitionException extends SessionRelayException {
    private final String queueName;

    public SessionAcquisitionException(String queueName, Throwable cause) {
        super("Failed to acquire a session on queue " + queueName + ": " + cause.getMessage(), cause);
        this.queueName = queueName;
    }

    public String getQueueName() {
        return queueName;
    }
}
