package io.sessionrelay.subscriber.trigger;

import io.sessionrelay.subscriber.broker.SessionBroker;
import io.sessionrelay.subscriber.broker.SessionLease;
import io.sessionrelay.subscriber.config.SubscriberConfig;
import io.sessionrelay.subscriber.drain.SessionDrainer;
import io.sessionrelay.subscriber.orchestrator.ConcurrentSessionOrchestrator;
import io.sessionrelay.subscriber.orchestrator.Invocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Session trigger: plays the hosting runtime's part for the orchestrator.
 * <p>
 * Each of the {@code triggerConcurrency} loops repeatedly:
 * <ol>
 *   <li>locks the next session with pending messages (the primary session)</li>
 *   <li>drains up to {@code triggerMaxBatchSize} messages into the primary batch</li>
 *   <li>runs one invocation, bounded by {@code invocationTimeout}</li>
 *   <li>releases the primary lease, or abandons it when the invocation failed so the
 *   broker redelivers the primary messages</li>
 * </ol>
 * </p>
 */
public class SessionTriggerListener {
    private static final Logger log = LoggerFactory.getLogger(SessionTriggerListener.class);

    private static final Duration ERROR_PAUSE = Duration.ofSeconds(1);

    private final SubscriberConfig config;
    private final SessionBroker broker;
    private final SessionDrainer drainer;
    private final ConcurrentSessionOrchestrator orchestrator;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger inFlightInvocations = new AtomicInteger(0);
    private final AtomicLong completedInvocations = new AtomicLong(0);
    private final AtomicLong failedInvocations = new AtomicLong(0);
    private final Sinks.Empty<Void> terminated = Sinks.empty();

    private Disposable loops;

    public SessionTriggerListener(SubscriberConfig config,
                                  SessionBroker broker,
                                  SessionDrainer drainer,
                                  ConcurrentSessionOrchestrator orchestrator) {
        this.config = config;
        this.broker = broker;
        this.drainer = drainer;
        this.orchestrator = orchestrator;
    }

    /**
     * Starts the invocation loops. Calling it twice has no effect.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Session trigger already running");
            return;
        }

        int concurrency = config.getTriggerConcurrency();
        log.info("Starting session trigger on queue {} with {} loop(s)", config.getQueueName(), concurrency);

        loops = Flux.range(1, concurrency)
            .flatMap(this::invocationLoop, concurrency)
            .doOnTerminate(() -> {
                log.info("Session trigger loops stopped");
                terminated.tryEmitEmpty();
            })
            .subscribe();
    }

    private Mono<Void> invocationLoop(int loop) {
        return Mono.defer(this::triggerOnce)
            .onErrorResume(err -> {
                log.error("Trigger loop {} failed, pausing {}: {}", loop, ERROR_PAUSE, err.getMessage(), err);
                return Mono.delay(ERROR_PAUSE).thenReturn(false);
            })
            .repeat(running::get)
            .then();
    }

    /**
     * Runs at most one invocation.
     *
     * @return Mono of true when an invocation ran
     */
    Mono<Boolean> triggerOnce() {
        return broker.acquireNextSession(config.getQueueName(), config.getTriggerPollTimeout())
            .map(SessionLease::new)
            .flatMap(this::invoke)
            .defaultIfEmpty(false);
    }

    private Mono<Boolean> invoke(SessionLease lease) {
        return drainer.drain(lease, config.getReceiveIdleTimeout(), config.getTriggerMaxBatchSize())
            .flatMap(batch -> {
                if (batch.isEmpty()) {
                    log.debug("Session {} had nothing pending, releasing", lease.getSessionId());
                    return lease.release().thenReturn(false);
                }

                Invocation invocation = Invocation.of(lease, batch, config.getInvocationTimeout());
                inFlightInvocations.incrementAndGet();

                return orchestrator.run(invocation)
                    .timeout(config.getInvocationTimeout())
                    .flatMap(report -> {
                        completedInvocations.incrementAndGet();
                        return lease.release()
                            .doOnError(releaseErr -> log.warn("Invocation {} completed but releasing primary session {} failed: {}",
                                invocation.getInvocationId(), lease.getSessionId(), releaseErr.getMessage()))
                            .onErrorResume(releaseErr -> Mono.empty())
                            .thenReturn(true);
                    })
                    .onErrorResume(err -> {
                        failedInvocations.incrementAndGet();
                        if (err instanceof TimeoutException) {
                            log.error("Invocation {} exceeded {}, abandoning primary session {}",
                                invocation.getInvocationId(), config.getInvocationTimeout(), lease.getSessionId());
                        } else {
                            log.error("Invocation {} failed, abandoning primary session {}: {}",
                                invocation.getInvocationId(), lease.getSessionId(), err.getMessage());
                        }
                        return lease.abandon()
                            .doOnError(abandonErr -> log.warn("Failed to abandon session {}: {}",
                                lease.getSessionId(), abandonErr.getMessage()))
                            .onErrorResume(abandonErr -> Mono.empty())
                            .thenReturn(true);
                    })
                    .doFinally(signal -> inFlightInvocations.decrementAndGet());
            })
            .onErrorResume(err -> {
                log.warn("Could not build trigger batch from session {}: {}", lease.getSessionId(), err.getMessage());
                return lease.abandon()
                    .doOnError(abandonErr -> log.warn("Failed to abandon session {}: {}",
                        lease.getSessionId(), abandonErr.getMessage()))
                    .onErrorResume(abandonErr -> Mono.empty())
                    .thenReturn(false);
            });
    }

    /**
     * Stops taking new sessions and waits for in-flight invocations.
     *
     * @param timeout How long to wait before cancelling what is still running
     * @return Mono completing when the loops stopped
     */
    public Mono<Void> stop(Duration timeout) {
        if (!running.compareAndSet(true, false)) {
            return Mono.empty();
        }
        log.info("Stopping session trigger ({} invocation(s) in flight)", inFlightInvocations.get());
        return terminated.asMono()
            .timeout(timeout)
            .onErrorResume(TimeoutException.class, err -> {
                log.warn("Session trigger did not stop within {}, cancelling in-flight invocations", timeout);
                loops.dispose();
                return Mono.empty();
            });
    }

    public boolean isRunning() {
        return running.get();
    }

    public int getInFlightInvocations() {
        return inFlightInvocations.get();
    }

    public long getCompletedInvocations() {
        return completedInvocations.get();
    }

    public long getFailedInvocations() {
        return failedInvocations.get();
    }
}
