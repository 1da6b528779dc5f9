package io.sessionrelay.subscriber.broker;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Interface for session-enabled queue brokers (Dependency Inversion Principle).
 * <p>
 * The client may be shared by any number of workers; every handle it grants is
 * owned by exactly one of them.
 * </p>
 */
public interface SessionBroker {
    /**
     * Locks the next session that has pending messages.
     *
     * @param queueName   Queue to take a session from
     * @param waitTimeout How long to wait for a lockable session
     * @return Mono of the handle, empty when no session became available in time.
     *     Broker errors surface as {@link io.sessionrelay.core.error.SessionAcquisitionException}.
     */
    Mono<SessionHandle> acquireNextSession(String queueName, Duration waitTimeout);

    /**
     * Closes connections held by the client.
     */
    void close();
}
