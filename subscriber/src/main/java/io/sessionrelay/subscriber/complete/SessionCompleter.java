package io.sessionrelay.subscriber.complete;

import io.sessionrelay.core.error.AcknowledgeException;
import io.sessionrelay.core.model.BrokerMessage;
import io.sessionrelay.core.model.ForwardResult;
import io.sessionrelay.core.model.SessionBatch;
import io.sessionrelay.subscriber.broker.SessionLease;
import io.sessionrelay.subscriber.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Settles a forwarded session batch against the broker.
 * <p>
 * Forward succeeded: every message is completed, one at a time in batch order.
 * A rejected completion is logged and remembered but the remaining messages are
 * still completed; the caller then gets a single {@link AcknowledgeException}
 * naming the sequence numbers that failed. Those messages stay in flight and are
 * redelivered once the lease is released.
 * </p>
 * <p>
 * Forward failed: nothing is completed and the lease is left alone. The batch
 * stays in flight under the lock until the owner of the lease abandons it.
 * </p>
 */
public class SessionCompleter {
    private static final Logger log = LoggerFactory.getLogger(SessionCompleter.class);

    private final MetricsService metricsService;

    public SessionCompleter(MetricsService metricsService) {
        this.metricsService = metricsService;
    }

    /**
     * Completes the batch when the forward succeeded; otherwise leaves it in flight.
     *
     * @param lease  Lease the batch was received under
     * @param batch  Forwarded batch
     * @param result Forward result
     * @return Mono completing when settled; {@link AcknowledgeException} if the broker
     *     rejected any completion
     */
    public Mono<Void> complete(SessionLease lease, SessionBatch batch, ForwardResult result) {
        if (!result.isSuccess()) {
            log.info("Forward of session {} failed, {} message(s) left in flight for redelivery",
                batch.getSessionId(), batch.size());
            return Mono.empty();
        }

        List<Long> failed = Collections.synchronizedList(new ArrayList<>());
        AtomicReference<Throwable> firstError = new AtomicReference<>();

        return Flux.fromIterable(batch.getMessages())
            .concatMap(message -> completeOne(lease, message, failed, firstError))
            .then(Mono.defer(() -> {
                int completed = batch.size() - failed.size();
                metricsService.recordMessagesCompleted(completed);
                if (failed.isEmpty()) {
                    log.info("Completed {} message(s) of session {}", completed, batch.getSessionId());
                    return Mono.<Void>empty();
                }
                return Mono.error(new AcknowledgeException(batch.getSessionId(), failed, firstError.get()));
            }));
    }

    private Mono<Void> completeOne(SessionLease lease, BrokerMessage message,
                                   List<Long> failed, AtomicReference<Throwable> firstError) {
        return lease.complete(message)
            .onErrorResume(err -> {
                log.warn("Failed to complete message {} (seq {}) of session {}: {}",
                    message.getMessageId(), message.getSequenceNumber(), message.getSessionId(), err.getMessage());
                metricsService.recordAckFailure();
                failed.add(message.getSequenceNumber());
                firstError.compareAndSet(null, err);
                return Mono.empty();
            });
    }
}
