package io.sessionrelay.subscriber.forward;

import io.sessionrelay.core.model.ForwardResult;
import io.sessionrelay.core.model.SessionBatch;
import reactor.core.publisher.Mono;

/**
 * Interface for the downstream system receiving session batches.
 * <p>
 * One call per batch, carrying every message in drain order. Implementations do
 * not retry and never signal an error: every failure is a {@link ForwardResult}.
 * </p>
 */
public interface ForwardGateway {
    /**
     * Delivers a session batch.
     *
     * @param batch Non-empty session batch
     * @return Mono of the result; success only if the whole batch was accepted
     */
    Mono<ForwardResult> forward(SessionBatch batch);
}
