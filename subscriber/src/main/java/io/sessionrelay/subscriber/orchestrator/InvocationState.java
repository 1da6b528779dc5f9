package io.sessionrelay.subscriber.orchestrator;

/**
 * Lifecycle of one invocation: {@code STARTED → IN_FLIGHT → ALL_SETTLED → COMPLETED | FAILED}.
 */
public enum InvocationState {
    STARTED,
    /**
     * Primary task and additional workers running.
     */
    IN_FLIGHT,
    /**
     * Every task reported an outcome.
     */
    ALL_SETTLED,
    COMPLETED,
    /**
     * The primary session failed; additional sessions were still settled independently.
     */
    FAILED
}
