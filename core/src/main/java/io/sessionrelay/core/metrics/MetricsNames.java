package io.sessionrelay.core.metrics;

/**
 * Micrometer metric names used across the system.
 * <p>
 * <b>Naming convention:</b> {@code relay.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Timers: {@code .latency} or {@code .duration} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: Sessions settled by the orchestrator.
     * <p>
     * Tags: role (primary/additional), status
     * </p>
     */
    public static final String SESSIONS_TOTAL = "relay.sessions.total";

    /**
     * Counter: Messages delivered to the downstream system (duplicates included).
     */
    public static final String MESSAGES_FORWARDED_TOTAL = "relay.messages.forwarded.total";

    /**
     * Counter: Messages completed against the broker.
     */
    public static final String MESSAGES_COMPLETED_TOTAL = "relay.messages.completed.total";

    /**
     * Counter: Forward calls that failed.
     * <p>
     * Tags: reason (network/rejected/timeout)
     * </p>
     */
    public static final String FORWARD_FAILURES_TOTAL = "relay.forward.failures.total";

    /**
     * Counter: Individual message completions rejected by the broker.
     */
    public static final String ACK_FAILURES_TOTAL = "relay.ack.failures.total";

    /**
     * Timer: Downstream forward call latency (p50, p95, p99).
     */
    public static final String FORWARD_LATENCY = "relay.forward.latency";

    /**
     * Timer: Time spent draining one session.
     */
    public static final String DRAIN_DURATION = "relay.drain.duration";

    /**
     * Timer: Wall time of one invocation, primary plus additional sessions.
     * <p>
     * Tags: outcome (success/failure)
     * </p>
     */
    public static final String INVOCATION_DURATION = "relay.invocation.duration";

    /**
     * Gauge: Invocations started by the trigger and not yet settled.
     */
    public static final String INVOCATIONS_IN_FLIGHT = "relay.invocations.in.flight";

    /**
     * Counter: Invocations whose primary session settled, and those that failed or timed out.
     */
    public static final String INVOCATIONS_COMPLETED_TOTAL = "relay.invocations.completed.total";
    public static final String INVOCATIONS_FAILED_TOTAL = "relay.invocations.failed.total";
}
