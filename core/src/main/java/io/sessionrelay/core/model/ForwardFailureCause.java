package io.sessionrelay.core.model;

/**
 * Why a forward call failed.
 */
public enum ForwardFailureCause {
    /**
     * Transport fault: connection refused, reset, DNS failure.
     */
    NETWORK(true),

    /**
     * Downstream answered but did not accept the batch (non-2xx).
     */
    REJECTED(false),

    /**
     * No answer within the downstream timeout.
     */
    TIMEOUT(true);

    private final boolean retryable;

    ForwardFailureCause(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
