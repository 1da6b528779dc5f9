package io.sessionrelay.subscriber.drain;

import io.sessionrelay.core.error.DrainException;
import io.sessionrelay.core.model.BrokerMessage;
import io.sessionrelay.core.model.SessionBatch;
import io.sessionrelay.subscriber.broker.SessionLease;
import io.sessionrelay.subscriber.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pulls the pending messages of one locked session into a {@link SessionBatch}.
 * <p>
 * Receives are strictly sequential, so the batch keeps receipt order. The drain
 * ends on the first receive that yields nothing within the idle timeout, when the
 * lease is released or lost, or once {@code maxMessages} were received. A short
 * idle timeout bounds the worst-case drain time of a session that has fewer
 * messages than expected.
 * </p>
 * <p>
 * Nothing is completed here; settling is the {@link io.sessionrelay.subscriber.complete.SessionCompleter}'s job.
 * </p>
 */
public class SessionDrainer {
    private static final Logger log = LoggerFactory.getLogger(SessionDrainer.class);

    private final MetricsService metricsService;

    public SessionDrainer(MetricsService metricsService) {
        this.metricsService = metricsService;
    }

    /**
     * Drains the session without a size limit.
     *
     * @param lease       Lease on the session to drain
     * @param idleTimeout Bounded wait for each receive
     * @return Mono of the (possibly empty) batch; {@link DrainException} if a receive fails
     */
    public Mono<SessionBatch> drain(SessionLease lease, Duration idleTimeout) {
        return drain(lease, idleTimeout, Integer.MAX_VALUE);
    }

    /**
     * Drains at most {@code maxMessages} messages of the session.
     *
     * @param lease       Lease on the session to drain
     * @param idleTimeout Bounded wait for each receive
     * @param maxMessages Upper bound on the batch size
     * @return Mono of the (possibly empty) batch; {@link DrainException} if a receive fails
     */
    public Mono<SessionBatch> drain(SessionLease lease, Duration idleTimeout, int maxMessages) {
        String sessionId = lease.getSessionId();
        AtomicInteger received = new AtomicInteger();

        return Mono.defer(() -> {
                long startNanos = System.nanoTime();
                return receive(lease, idleTimeout)
                    .expandDeep(message -> received.incrementAndGet() < maxMessages
                        ? receive(lease, idleTimeout)
                        : Mono.empty())
                    .collectList()
                    .map(messages -> SessionBatch.of(sessionId, messages))
                    .doOnNext(batch -> {
                        metricsService.recordDrainDuration(startNanos);
                        log.debug("Drained {} message(s) from session {}", batch.size(), sessionId);
                    });
            })
            .onErrorMap(err -> !(err instanceof DrainException), err -> new DrainException(sessionId, err))
            .doOnError(err -> log.warn("Drain of session {} failed: {}", sessionId, err.getMessage()));
    }

    private Mono<BrokerMessage> receive(SessionLease lease, Duration idleTimeout) {
        return Mono.defer(() -> lease.receiveNext(idleTimeout));
    }
}
