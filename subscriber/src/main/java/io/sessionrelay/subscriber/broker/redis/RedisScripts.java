package io.sessionrelay.subscriber.broker.redis;

/**
 * Lua scripts for the lock-guarded session operations.
 * <p>
 * Each script checks the caller's lease token against the lock key before it
 * touches the session lists, so a holder whose lock expired can no longer
 * settle or move messages.
 * </p>
 */
final class RedisScripts {
    private RedisScripts() {
    }

    /**
     * KEYS: inflight, session. Moves leftovers of a previous holder back to the
     * head of the session list, oldest first.
     */
    static final String RECOVER =
        "local moved = 0\n" +
        "while redis.call('RPOPLPUSH', KEYS[1], KEYS[2]) do moved = moved + 1 end\n" +
        "return moved";

    /**
     * KEYS: inflight, lock. ARGV: token, raw message.
     * Returns -1 when the lock is not held, otherwise the LREM count.
     */
    static final String COMPLETE =
        "if redis.call('GET', KEYS[2]) ~= ARGV[1] then return -1 end\n" +
        "return redis.call('LREM', KEYS[1], 1, ARGV[2])";

    /**
     * KEYS: session, inflight, lock, ready. ARGV: token, sessionId.
     * Returns 0 when the lock is not held, 1 when released.
     */
    static final String RELEASE =
        "if redis.call('GET', KEYS[3]) ~= ARGV[1] then return 0 end\n" +
        "while redis.call('RPOPLPUSH', KEYS[2], KEYS[1]) do end\n" +
        "redis.call('DEL', KEYS[3])\n" +
        "if redis.call('LLEN', KEYS[1]) == 0 then redis.call('SREM', KEYS[4], ARGV[2]) end\n" +
        "return 1";

    /**
     * KEYS: lock. ARGV: token, lock duration in millis.
     * Returns 0 when the lock is not held.
     */
    static final String RENEW =
        "if redis.call('GET', KEYS[1]) ~= ARGV[1] then return 0 end\n" +
        "return redis.call('PEXPIRE', KEYS[1], ARGV[2])";
}
