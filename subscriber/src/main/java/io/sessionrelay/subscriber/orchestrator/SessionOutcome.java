package io.sessionrelay.subscriber.orchestrator;

import io.sessionrelay.core.error.AcknowledgeException;
import io.sessionrelay.core.error.ForwardException;
import io.sessionrelay.core.error.InvocationDeadlineExceededException;
import lombok.Builder;
import lombok.Value;

/**
 * What happened to one session (or one worker slot) during an invocation.
 */
@Value
@Builder(toBuilder = true)
public class SessionOutcome {

    public enum Role {
        PRIMARY,
        ADDITIONAL
    }

    public enum Status {
        /**
         * Forwarded and every message completed.
         */
        COMPLETED(false),
        /**
         * Session drained empty and released unforwarded.
         */
        EMPTY(false),
        /**
         * No session could be locked within the acquire wait.
         */
        NONE_AVAILABLE(false),
        /**
         * Downstream did not accept the batch; session abandoned for redelivery.
         */
        FORWARD_FAILED(true),
        /**
         * Forwarded, but the broker rejected some completion or the release.
         */
        ACKNOWLEDGE_FAILED(true),
        /**
         * Acquire or drain failed.
         */
        FAILED(true),
        /**
         * Cut off by the invocation deadline; lease released.
         */
        CANCELLED(true);

        private final boolean failure;

        Status(boolean failure) {
            this.failure = failure;
        }

        public boolean isFailure() {
            return failure;
        }
    }

    Role role;
    int slot;           // 0 for the primary, 1..N for additional workers
    String sessionId;   // null when no session was acquired
    Status status;
    int messageCount;
    Throwable error;

    public boolean isFailure() {
        return status.isFailure();
    }

    static SessionOutcome noneAvailable(int slot) {
        return SessionOutcome.builder()
            .role(Role.ADDITIONAL)
            .slot(slot)
            .status(Status.NONE_AVAILABLE)
            .build();
    }

    static Status statusOf(Throwable error) {
        if (error instanceof InvocationDeadlineExceededException) {
            return Status.CANCELLED;
        }
        if (error instanceof ForwardException) {
            return Status.FORWARD_FAILED;
        }
        if (error instanceof AcknowledgeException) {
            return Status.ACKNOWLEDGE_FAILED;
        }
        return Status.FAILED;
    }
}
