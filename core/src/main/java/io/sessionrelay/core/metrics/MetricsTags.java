package io.sessionrelay.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for node identifier.
     */
    public static final String NODE_ID = "node_id";

    /**
     * Tag key for the queue name.
     */
    public static final String QUEUE = "queue";

    /**
     * Tag key for session role (primary/additional).
     */
    public static final String ROLE = "role";

    /**
     * Tag key for a session outcome.
     */
    public static final String STATUS = "status";

    /**
     * Tag key for failure reason.
     */
    public static final String REASON = "reason";

    /**
     * Tag key for invocation outcome.
     */
    public static final String OUTCOME = "outcome";
}
