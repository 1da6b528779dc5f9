package io.sessionrelay.core.redis;

/**
 * Redis keyspace for session-enabled queues.
 * <p>
 * <b>Key design principles:</b>
 * <ul>
 *   <li>Every key of a queue shares the {@code {queueName}} hash tag, so the Lua
 *   scripts touching several keys stay on one cluster slot</li>
 *   <li>Locks are plain strings with a PX expiry; a crashed holder loses its lock
 *   after the lock duration</li>
 *   <li>Lists hold serialized messages in publish order</li>
 * </ul>
 * </p>
 */
public final class Keys {
    private Keys() {
    }

    private static String prefix(String queueName) {
        return "relay:{" + queueName + "}:";
    }

    /**
     * Sequence counter: {@code relay:{queue}:seq}
     * <p>
     * <b>Type:</b> String (integer), INCR on every publish.
     * </p>
     *
     * @param queueName Queue name
     * @return Redis key
     */
    public static String sequence(String queueName) {
        return prefix(queueName) + "seq";
    }

    /**
     * Ready set: {@code relay:{queue}:ready}
     * <p>
     * <b>Type:</b> Set of session ids that may hold pending messages.
     * <br>
     * <b>Usage:</b> candidates for session acquisition. Removed when a released
     * session has nothing left.
     * </p>
     *
     * @param queueName Queue name
     * @return Redis key
     */
    public static String ready(String queueName) {
        return prefix(queueName) + "ready";
    }

    /**
     * Pending messages of a session: {@code relay:{queue}:session:{sessionId}}
     * <p>
     * <b>Type:</b> List of serialized BrokerMessage, head = oldest.
     * </p>
     *
     * @param queueName Queue name
     * @param sessionId Session identifier
     * @return Redis key
     */
    public static String session(String queueName, String sessionId) {
        return prefix(queueName) + "session:" + sessionId;
    }

    /**
     * Received but not yet completed messages: {@code relay:{queue}:inflight:{sessionId}}
     * <p>
     * <b>Type:</b> List in receipt order. Moved back to the head of the session list
     * when the lock is released.
     * </p>
     *
     * @param queueName Queue name
     * @param sessionId Session identifier
     * @return Redis key
     */
    public static String inflight(String queueName, String sessionId) {
        return prefix(queueName) + "inflight:" + sessionId;
    }

    /**
     * Session lock: {@code relay:{queue}:lock:{sessionId}}
     * <p>
     * <b>Type:</b> String holding the owner's random lease token.
     * <br>
     * <b>TTL:</b> lock duration, renewed while the owner is working.
     * </p>
     *
     * @param queueName Queue name
     * @param sessionId Session identifier
     * @return Redis key
     */
    public static String lock(String queueName, String sessionId) {
        return prefix(queueName) + "lock:" + sessionId;
    }
}
