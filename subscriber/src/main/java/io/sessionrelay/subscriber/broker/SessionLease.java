package io.sessionrelay.subscriber.broker;

import io.sessionrelay.core.error.AcknowledgeException;
import io.sessionrelay.core.error.SessionRelayException;
import io.sessionrelay.core.model.BrokerMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scoped ownership of a {@link SessionHandle}.
 * <p>
 * Whichever of {@link #release()} or {@link #abandon()} runs first reaches the
 * broker; every later call is a no-op.
 * </p>
 */
public final class SessionLease {
    private static final Logger log = LoggerFactory.getLogger(SessionLease.class);

    private final SessionHandle handle;
    private final AtomicBoolean released = new AtomicBoolean(false);

    public SessionLease(SessionHandle handle) {
        this.handle = handle;
    }

    public String getSessionId() {
        return handle.getSessionId();
    }

    public Mono<BrokerMessage> receiveNext(Duration timeout) {
        return isReleased() ? Mono.empty() : handle.receiveNext(timeout);
    }

    public Mono<Void> complete(BrokerMessage message) {
        if (released.get()) {
            return Mono.error(new AcknowledgeException(getSessionId(),
                "Cannot complete message " + message.getSequenceNumber() + ": lease already released"));
        }
        return handle.complete(message);
    }

    /**
     * Releases the lock, redelivering anything not completed.
     *
     * @return Mono completing when released (immediately if already released)
     */
    public Mono<Void> release() {
        return Mono.defer(() -> {
            if (!released.compareAndSet(false, true)) {
                return Mono.empty();
            }
            log.debug("Releasing session {}", getSessionId());
            return handle.close().onErrorMap(this::toAcknowledgeFailure);
        });
    }

    /**
     * Abandons the session so the broker redelivers its messages.
     *
     * @return Mono completing when abandoned (immediately if already released)
     */
    public Mono<Void> abandon() {
        return Mono.defer(() -> {
            if (!released.compareAndSet(false, true)) {
                return Mono.empty();
            }
            log.debug("Abandoning session {}", getSessionId());
            return handle.abandon().onErrorMap(this::toAcknowledgeFailure);
        });
    }

    /**
     * @return true once released here or closed on the broker side
     */
    public boolean isReleased() {
        return released.get() || handle.isClosed();
    }

    private Throwable toAcknowledgeFailure(Throwable error) {
        if (error instanceof SessionRelayException) {
            return error;
        }
        return new AcknowledgeException(getSessionId(), "Failed to release session " + getSessionId(), error);
    }
}
