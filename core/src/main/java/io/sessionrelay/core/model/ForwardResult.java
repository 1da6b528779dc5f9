package io.sessionrelay.core.model;

import lombok.Value;
import lombok.With;

/**
 * Outcome of one forward of a session batch to the downstream system.
 */
@Value
@With
public class ForwardResult {
    boolean success;
    ForwardFailureCause cause;
    String reason;
    int attempts;

    public static ForwardResult success() {
        return new ForwardResult(true, null, null, 1);
    }

    public static ForwardResult failure(ForwardFailureCause cause, String reason) {
        return new ForwardResult(false, cause, reason, 1);
    }

    public boolean isRetryable() {
        return !success && cause != null && cause.isRetryable();
    }

    @Override
    public String toString() {
        return success
            ? "ForwardResult(success, attempts=" + attempts + ")"
            : "ForwardResult(" + cause + ": " + reason + ", attempts=" + attempts + ")";
    }
}
