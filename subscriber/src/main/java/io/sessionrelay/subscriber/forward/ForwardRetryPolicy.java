package io.sessionrelay.subscriber.forward;

import io.sessionrelay.core.model.ForwardResult;
import io.sessionrelay.core.model.SessionBatch;
import io.sessionrelay.core.util.JitterBackoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Bounded retry of forward calls, applied by the orchestrator.
 * <p>
 * Only {@code NETWORK} and {@code TIMEOUT} failures are retried; a rejection is
 * final. With {@code maxAttempts == 1} every batch is forwarded exactly once per
 * invocation and redelivery is left to the broker.
 * </p>
 */
public class ForwardRetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(ForwardRetryPolicy.class);

    private final int maxAttempts;
    private final Duration backoffBase;
    private final Duration backoffMax;

    public ForwardRetryPolicy(int maxAttempts, Duration backoffBase, Duration backoffMax) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.backoffBase = backoffBase;
        this.backoffMax = backoffMax;
    }

    public static ForwardRetryPolicy none() {
        return new ForwardRetryPolicy(1, Duration.ZERO, Duration.ZERO);
    }

    /**
     * Forwards the batch, retrying retryable failures up to {@code maxAttempts} in total.
     *
     * @param gateway Downstream gateway
     * @param batch   Batch to forward
     * @return Mono of the last result, with {@code attempts} set
     */
    public Mono<ForwardResult> execute(ForwardGateway gateway, SessionBatch batch) {
        return attempt(gateway, batch, 1);
    }

    private Mono<ForwardResult> attempt(ForwardGateway gateway, SessionBatch batch, int attempt) {
        return gateway.forward(batch)
            .map(result -> result.withAttempts(attempt))
            .flatMap(result -> {
                if (!result.isRetryable() || attempt >= maxAttempts) {
                    return Mono.just(result);
                }
                Duration delay = JitterBackoff.next(attempt - 1, backoffBase, backoffMax);
                log.info("Retrying forward of session {} in {} (attempt {}/{}): {}",
                    batch.getSessionId(), delay, attempt + 1, maxAttempts, result.getReason());
                return Mono.delay(delay).then(attempt(gateway, batch, attempt + 1));
            });
    }
}
