package io.sessionrelay.subscriber.config;

/**
 * What happens to additional-session workers still running when the invocation
 * approaches its deadline.
 */
public enum CancellationPolicy {
    /**
     * Cancel every additional worker at the soft cutoff, in-flight forward calls included.
     * Their leases are released, so the broker redelivers the sessions.
     */
    CANCEL_IN_FLIGHT,

    /**
     * At the soft cutoff cancel only workers still acquiring or draining. A forward
     * already started may finish (and complete its messages) until the hard deadline.
     */
    FINISH_IN_FLIGHT
}
