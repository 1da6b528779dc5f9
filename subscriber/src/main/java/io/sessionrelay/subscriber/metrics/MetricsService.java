package io.sessionrelay.subscriber.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.sessionrelay.core.metrics.MetricsNames;
import io.sessionrelay.core.metrics.MetricsTags;
import io.sessionrelay.core.model.ForwardResult;
import io.sessionrelay.subscriber.orchestrator.SessionOutcome;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralized metrics service for the subscriber.
 */
public class MetricsService {

    private final MeterRegistry registry;
    private final String queueName;

    // Counters
    private final Counter messagesForwarded;
    private final Counter messagesCompleted;
    private final Counter ackFailures;

    // Timers
    private final Timer forwardLatency;
    private final Timer drainDuration;
    private final Timer invocationSuccess;
    private final Timer invocationFailure;

    public MetricsService(MeterRegistry registry, String queueName) {
        this.registry = registry;
        this.queueName = queueName;

        messagesForwarded = Counter.builder(MetricsNames.MESSAGES_FORWARDED_TOTAL)
            .tag(MetricsTags.QUEUE, queueName)
            .description("Messages accepted by the downstream system, duplicates included")
            .register(registry);

        messagesCompleted = Counter.builder(MetricsNames.MESSAGES_COMPLETED_TOTAL)
            .tag(MetricsTags.QUEUE, queueName)
            .description("Messages completed against the broker")
            .register(registry);

        ackFailures = Counter.builder(MetricsNames.ACK_FAILURES_TOTAL)
            .tag(MetricsTags.QUEUE, queueName)
            .description("Message completions rejected by the broker")
            .register(registry);

        // Downstream calls take tens of seconds, so the SLOs are coarse
        forwardLatency = Timer.builder(MetricsNames.FORWARD_LATENCY)
            .tag(MetricsTags.QUEUE, queueName)
            .description("Downstream forward call latency")
            .publishPercentileHistogram()
            .serviceLevelObjectives(
                Duration.ofSeconds(1),
                Duration.ofSeconds(5),
                Duration.ofSeconds(15),
                Duration.ofSeconds(30),
                Duration.ofSeconds(60)
            )
            .register(registry);

        drainDuration = Timer.builder(MetricsNames.DRAIN_DURATION)
            .tag(MetricsTags.QUEUE, queueName)
            .description("Time spent draining one session")
            .publishPercentileHistogram()
            .register(registry);

        invocationSuccess = invocationTimer("success");
        invocationFailure = invocationTimer("failure");
    }

    private Timer invocationTimer(String outcome) {
        return Timer.builder(MetricsNames.INVOCATION_DURATION)
            .tag(MetricsTags.QUEUE, queueName)
            .tag(MetricsTags.OUTCOME, outcome)
            .description("Wall time of one invocation")
            .register(registry);
    }

    /**
     * Counts a settled session.
     *
     * @param role   primary or additional
     * @param status outcome status
     */
    public void recordSession(SessionOutcome.Role role, SessionOutcome.Status status) {
        registry.counter(MetricsNames.SESSIONS_TOTAL,
                MetricsTags.QUEUE, queueName,
                MetricsTags.ROLE, role.name().toLowerCase(Locale.ROOT),
                MetricsTags.STATUS, status.name().toLowerCase(Locale.ROOT))
            .increment();
    }

    /**
     * Records one forward (all attempts included).
     *
     * @param result       Forward result
     * @param messageCount Messages in the batch
     * @param startNanos   start nanos
     */
    public void recordForward(ForwardResult result, int messageCount, long startNanos) {
        forwardLatency.record(Duration.ofNanos(System.nanoTime() - startNanos));
        if (result.isSuccess()) {
            messagesForwarded.increment(messageCount);
        } else {
            registry.counter(MetricsNames.FORWARD_FAILURES_TOTAL,
                    MetricsTags.QUEUE, queueName,
                    MetricsTags.REASON, result.getCause().name().toLowerCase(Locale.ROOT))
                .increment();
        }
    }

    public void recordMessagesCompleted(int count) {
        messagesCompleted.increment(count);
    }

    public void recordAckFailure() {
        ackFailures.increment();
    }

    public void recordDrainDuration(long startNanos) {
        drainDuration.record(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    public void recordInvocation(long startNanos, boolean success) {
        (success ? invocationSuccess : invocationFailure).record(Duration.ofNanos(System.nanoTime() - startNanos));
    }
}
