package io.sessionrelay.subscriber.orchestrator;

import io.sessionrelay.core.model.SessionBatch;
import io.sessionrelay.subscriber.broker.SessionLease;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * One triggered run: the primary session delivered by the trigger plus the deadline
 * imposed on the whole run.
 * <p>
 * The primary lease stays owned by the trigger. The orchestrator completes or
 * abandons its messages but never closes it on success.
 * </p>
 */
@Value
public class Invocation {
    String invocationId;
    SessionLease primaryLease;
    SessionBatch primaryBatch;
    Instant deadline;

    public static Invocation of(SessionLease primaryLease, SessionBatch primaryBatch, Duration timeout) {
        if (!primaryLease.getSessionId().equals(primaryBatch.getSessionId())) {
            throw new IllegalArgumentException(String.format(
                "Primary batch of session %s does not match lease on session %s",
                primaryBatch.getSessionId(), primaryLease.getSessionId()
            ));
        }
        return new Invocation(UUID.randomUUID().toString(), primaryLease, primaryBatch, Instant.now().plus(timeout));
    }
}
