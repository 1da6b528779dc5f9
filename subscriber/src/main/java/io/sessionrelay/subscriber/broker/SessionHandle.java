package io.sessionrelay.subscriber.broker;

import io.sessionrelay.core.model.BrokerMessage;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * An exclusive lock on one session, granted by a {@link SessionBroker}.
 * <p>
 * Not thread-safe by contract: a handle belongs to a single worker for its
 * whole life. Callers go through {@link SessionLease} so that the lock is given
 * back exactly once.
 * </p>
 */
public interface SessionHandle {

    String getSessionId();

    /**
     * Receives the next message of the session.
     *
     * @param timeout Maximum wait for a message
     * @return Mono of the message, empty when none arrived within the timeout
     */
    Mono<BrokerMessage> receiveNext(Duration timeout);

    /**
     * Settles a received message so that it is never redelivered.
     *
     * @param message Message received through this handle
     * @return Mono completing when the broker accepted the completion
     */
    Mono<Void> complete(BrokerMessage message);

    /**
     * Gives the session back without settling its received messages, which the
     * broker redelivers to a future owner.
     *
     * @return Mono completing when the lock is released
     */
    Mono<Void> abandon();

    /**
     * Releases the lock. Received but unsettled messages are redelivered.
     *
     * @return Mono completing when the lock is released
     */
    Mono<Void> close();

    /**
     * @return true once the lock was released or lost
     */
    boolean isClosed();
}
