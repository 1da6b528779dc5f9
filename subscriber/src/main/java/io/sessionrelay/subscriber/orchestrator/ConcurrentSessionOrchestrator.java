package io.sessionrelay.subscriber.orchestrator;

import io.sessionrelay.core.error.ForwardException;
import io.sessionrelay.core.error.InvocationDeadlineExceededException;
import io.sessionrelay.core.model.SessionBatch;
import io.sessionrelay.subscriber.broker.SessionBroker;
import io.sessionrelay.subscriber.broker.SessionLease;
import io.sessionrelay.subscriber.complete.SessionCompleter;
import io.sessionrelay.subscriber.config.CancellationPolicy;
import io.sessionrelay.subscriber.config.SubscriberConfig;
import io.sessionrelay.subscriber.drain.SessionDrainer;
import io.sessionrelay.subscriber.forward.ForwardGateway;
import io.sessionrelay.subscriber.forward.ForwardRetryPolicy;
import io.sessionrelay.subscriber.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Processes the triggered primary session and, while its slow forward call is in
 * flight, up to N additional sessions acquired straight from the broker.
 * <p>
 * Flow per invocation:
 * <pre>
 * primary:        forward(batch) → complete(batch)
 * additional 1..N: acquire → drain → forward → complete → release (or park until the join)
 * </pre>
 * All tasks start together and run independently. Each task is turned into a
 * {@link SessionOutcome}, so a failing worker never cuts the join short and never
 * touches the messages of another session. The invocation fails only when the
 * primary session fails, and only after every worker settled.
 * </p>
 * <p>
 * Additional workers hold their lease through {@link Mono#usingWhen}. A worker
 * that succeeded releases its session right away. A worker that failed parks its
 * lease until the join and the lease is abandoned only then, so its messages stay
 * locked away from the sibling workers of this invocation. A cancelled worker
 * abandons at once. The primary lease belongs to the trigger and is never
 * released here. Deadline handling follows the configured
 * {@link CancellationPolicy}; the primary task is never cut off here.
 * </p>
 */
public class ConcurrentSessionOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(ConcurrentSessionOrchestrator.class);

    private final SessionBroker broker;
    private final SessionDrainer drainer;
    private final ForwardGateway gateway;
    private final SessionCompleter completer;
    private final ForwardRetryPolicy retryPolicy;
    private final MetricsService metricsService;

    private final String queueName;
    private final int additionalSessionCount;
    private final Duration receiveIdleTimeout;
    private final Duration sessionAcquireTimeout;
    private final CancellationPolicy cancellationPolicy;
    private final Duration cancellationGrace;

    public ConcurrentSessionOrchestrator(SubscriberConfig config,
                                         SessionBroker broker,
                                         SessionDrainer drainer,
                                         ForwardGateway gateway,
                                         SessionCompleter completer,
                                         MetricsService metricsService) {
        this.broker = broker;
        this.drainer = drainer;
        this.gateway = gateway;
        this.completer = completer;
        this.metricsService = metricsService;
        this.retryPolicy = new ForwardRetryPolicy(
            config.getForwardMaxAttempts(), config.getForwardBackoffBase(), config.getForwardBackoffMax()
        );
        this.queueName = config.getQueueName();
        this.additionalSessionCount = config.getAdditionalSessionCount();
        this.receiveIdleTimeout = config.getReceiveIdleTimeout();
        this.sessionAcquireTimeout = config.getSessionAcquireTimeout();
        this.cancellationPolicy = config.getCancellationPolicy();
        this.cancellationGrace = config.getCancellationGrace();
    }

    /**
     * Runs one invocation. Leases parked by failed workers are abandoned once every
     * task settled, or when the invocation is cancelled.
     *
     * @param invocation Primary session and deadline
     * @return Mono of the report once every task settled; {@link InvocationFailedException}
     *     (carrying the report) when the primary session failed
     */
    public Mono<InvocationReport> run(Invocation invocation) {
        return Mono.usingWhen(
            Mono.fromSupplier(() -> new ConcurrentLinkedQueue<SessionLease>()),
            parked -> fanOut(invocation, parked),
            this::abandonParked,
            (parked, err) -> abandonParked(parked),
            this::abandonParked
        );
    }

    private Mono<InvocationReport> fanOut(Invocation invocation, Queue<SessionLease> parked) {
        return Mono.defer(() -> {
            long startNanos = System.nanoTime();
            Instant hardDeadline = invocation.getDeadline();
            Instant softCutoff = hardDeadline.minus(cancellationGrace);

            log.info("Invocation {} {}: primary session {} ({} messages), {} additional worker(s), deadline {}",
                invocation.getInvocationId(), InvocationState.STARTED, invocation.getPrimaryBatch().getSessionId(),
                invocation.getPrimaryBatch().size(), additionalSessionCount, hardDeadline);

            Mono<SessionOutcome> primary = primaryTask(invocation);
            Flux<SessionOutcome> additional = Flux.range(1, additionalSessionCount)
                .flatMap(slot -> additionalWorker(slot, softCutoff, hardDeadline, parked),
                    Math.max(1, additionalSessionCount));

            return Flux.merge(primary, additional)
                .doOnSubscribe(s -> log.debug("Invocation {} {}", invocation.getInvocationId(), InvocationState.IN_FLIGHT))
                .collectList()
                .flatMap(outcomes -> abandonParked(parked)
                    .then(Mono.defer(() -> settle(invocation, outcomes, startNanos))));
        });
    }

    /**
     * Abandons the leases parked by failed workers.
     */
    private Mono<Void> abandonParked(Queue<SessionLease> parked) {
        return Flux.fromStream(() -> Stream.generate(parked::poll).takeWhile(Objects::nonNull))
            .concatMap(lease -> lease.abandon()
                .doOnError(err -> log.warn("Failed to abandon session {}: {}", lease.getSessionId(), err.getMessage()))
                .onErrorResume(err -> Mono.empty()))
            .then();
    }

    private Mono<InvocationReport> settle(Invocation invocation, List<SessionOutcome> outcomes, long startNanos) {
        log.debug("Invocation {} {}", invocation.getInvocationId(), InvocationState.ALL_SETTLED);

        List<SessionOutcome> ordered = outcomes.stream()
            .sorted(Comparator.comparingInt(SessionOutcome::getSlot))
            .collect(Collectors.toList());
        SessionOutcome primary = ordered.get(0);
        InvocationState state = primary.isFailure() ? InvocationState.FAILED : InvocationState.COMPLETED;
        InvocationReport report = new InvocationReport(
            invocation.getInvocationId(), state, ordered, Duration.ofNanos(System.nanoTime() - startNanos)
        );
        metricsService.recordInvocation(startNanos, state == InvocationState.COMPLETED);

        log.info("Invocation {} {} in {} ms: processed sessions {}, empty={}, none available={}, failed={}",
            report.getInvocationId(), state, report.getDuration().toMillis(), report.processedSessions(),
            report.count(SessionOutcome.Status.EMPTY), report.count(SessionOutcome.Status.NONE_AVAILABLE),
            ordered.stream().filter(SessionOutcome::isFailure).count());

        if (state == InvocationState.FAILED) {
            return Mono.error(new InvocationFailedException(report, primary.getError()));
        }
        return Mono.just(report);
    }

    private Mono<SessionOutcome> primaryTask(Invocation invocation) {
        SessionLease lease = invocation.getPrimaryLease();
        SessionBatch batch = invocation.getPrimaryBatch();

        if (batch.isEmpty()) {
            log.warn("Invocation {} triggered with an empty batch for session {}",
                invocation.getInvocationId(), batch.getSessionId());
            return Mono.just(record(SessionOutcome.builder()
                .role(SessionOutcome.Role.PRIMARY)
                .sessionId(batch.getSessionId())
                .status(SessionOutcome.Status.EMPTY)
                .build()));
        }

        return forwardAndComplete(SessionOutcome.Role.PRIMARY, 0, lease, batch)
            .onErrorResume(err -> Mono.just(failed(SessionOutcome.Role.PRIMARY, 0, batch.getSessionId(), batch.size(), err)))
            .map(this::record);
    }

    private Mono<SessionOutcome> additionalWorker(int slot, Instant softCutoff, Instant hardDeadline,
                                                  Queue<SessionLease> parked) {
        AtomicReference<String> sessionId = new AtomicReference<>();
        AtomicInteger messageCount = new AtomicInteger();

        Mono<SessionLease> acquire = withCutoff(
            broker.acquireNextSession(queueName, sessionAcquireTimeout).map(SessionLease::new),
            softCutoff, "acquire"
        );

        Mono<SessionOutcome> worker = Mono.usingWhen(
                acquire,
                lease -> {
                    sessionId.set(lease.getSessionId());
                    log.info("Worker {} acquired session {}", slot, lease.getSessionId());
                    return withCutoff(drainer.drain(lease, receiveIdleTimeout), softCutoff, "drain")
                        .flatMap(batch -> {
                            messageCount.set(batch.size());
                            if (batch.isEmpty()) {
                                log.info("Worker {} found session {} empty, releasing without forward", slot, batch.getSessionId());
                                return Mono.just(SessionOutcome.builder()
                                    .role(SessionOutcome.Role.ADDITIONAL)
                                    .slot(slot)
                                    .sessionId(batch.getSessionId())
                                    .status(SessionOutcome.Status.EMPTY)
                                    .build());
                            }
                            return forwardAndComplete(SessionOutcome.Role.ADDITIONAL, slot, lease, batch);
                        });
                },
                SessionLease::release,
                (lease, err) -> Mono.fromRunnable(() -> parked.add(lease)),
                SessionLease::abandon
            )
            .switchIfEmpty(Mono.fromSupplier(() -> {
                log.debug("Worker {} found no session available on {}", slot, queueName);
                return SessionOutcome.noneAvailable(slot);
            }));

        Instant workerCutoff = cancellationPolicy == CancellationPolicy.CANCEL_IN_FLIGHT ? softCutoff : hardDeadline;

        return withCutoff(worker, workerCutoff, "worker")
            .onErrorResume(err -> Mono.just(
                failed(SessionOutcome.Role.ADDITIONAL, slot, sessionId.get(), messageCount.get(), err)
            ))
            .map(this::record);
    }

    private Mono<SessionOutcome> forwardAndComplete(SessionOutcome.Role role, int slot,
                                                    SessionLease lease, SessionBatch batch) {
        return Mono.defer(() -> {
            long forwardStart = System.nanoTime();
            return retryPolicy.execute(gateway, batch)
                .doOnNext(result -> metricsService.recordForward(result, batch.size(), forwardStart))
                .flatMap(result -> completer.complete(lease, batch, result)
                    .then(Mono.fromCallable(() -> {
                        if (!result.isSuccess()) {
                            throw new ForwardException(batch.getSessionId(), result);
                        }
                        return SessionOutcome.builder()
                            .role(role)
                            .slot(slot)
                            .sessionId(batch.getSessionId())
                            .status(SessionOutcome.Status.COMPLETED)
                            .messageCount(batch.size())
                            .build();
                    })));
        });
    }

    private SessionOutcome failed(SessionOutcome.Role role, int slot, String sessionId, int messageCount, Throwable err) {
        SessionOutcome.Status status = SessionOutcome.statusOf(err);
        if (role == SessionOutcome.Role.PRIMARY) {
            log.error("Primary session {} {}: {}", sessionId, status, err.getMessage());
        } else {
            log.warn("Worker {} session {} {}: {}", slot, sessionId, status, err.getMessage());
        }
        return SessionOutcome.builder()
            .role(role)
            .slot(slot)
            .sessionId(sessionId)
            .status(status)
            .messageCount(messageCount)
            .error(err)
            .build();
    }

    private SessionOutcome record(SessionOutcome outcome) {
        metricsService.recordSession(outcome.getRole(), outcome.getStatus());
        return outcome;
    }

    private static <T> Mono<T> withCutoff(Mono<T> source, Instant cutoff, String stage) {
        return Mono.defer(() -> {
            Duration remaining = Duration.between(Instant.now(), cutoff);
            if (remaining.isNegative() || remaining.isZero()) {
                return Mono.error(new InvocationDeadlineExceededException(stage, cutoff));
            }
            return source.timeout(remaining, Mono.error(() -> new InvocationDeadlineExceededException(stage, cutoff)));
        });
    }
}
