package io.sessionrelay.core.error;

import java.time.Instant;

/**
 * A worker was cut off by the invocation deadline.
 */
public class InvocationDeadlineExceededException extends SessionRelayException {

    public InvocationDeadlineExceededException(String stage, Instant cutoff) {
        super("Invocation cutoff " + cutoff + " reached during " + stage);
    }
}
