package io.sessionrelay.subscriber.metrics;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import io.sessionrelay.core.metrics.MetricsNames;
import io.sessionrelay.core.metrics.MetricsTags;
import io.sessionrelay.subscriber.config.SubscriberConfig;
import io.sessionrelay.subscriber.trigger.SessionTriggerListener;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.Metrics;

/**
 * Exposes the subscriber's meters in Prometheus text format.
 * <p>
 * The Prometheus registry joins a composite (reactor-netty's global one in
 * production) so HTTP client meters and the relay meters end up in one scrape.
 * Every meter carries the node id and queue name as common tags. JVM binders and
 * the trigger's invocation gauges are registered here; per-session meters live in
 * {@link MetricsService}.
 * </p>
 */
public class PrometheusMetricsExporter implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    @Getter
    private final MeterRegistry registry;
    private final CompositeMeterRegistry composite;
    private final PrometheusMeterRegistry prometheusRegistry;

    public PrometheusMetricsExporter(SubscriberConfig config) {
        this(Metrics.REGISTRY instanceof CompositeMeterRegistry global ? global : new CompositeMeterRegistry(),
            config.getNodeId(), config.getQueueName());
    }

    public PrometheusMetricsExporter(CompositeMeterRegistry composite, String nodeId, String queueName) {
        this.composite = composite;
        this.registry = composite;
        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        composite.config().commonTags(MetricsTags.NODE_ID, nodeId, MetricsTags.QUEUE, queueName);
        composite.add(prometheusRegistry);

        new ProcessorMetrics().bindTo(composite);
        new JvmMemoryMetrics().bindTo(composite);
        new JvmThreadMetrics().bindTo(composite);

        log.info("Prometheus exporter ready for node {} on queue {}", nodeId, queueName);
    }

    /**
     * Publishes the trigger's invocation counters.
     *
     * @param trigger Running trigger
     */
    public void bindTrigger(SessionTriggerListener trigger) {
        Gauge.builder(MetricsNames.INVOCATIONS_IN_FLIGHT, trigger, SessionTriggerListener::getInFlightInvocations)
            .description("Invocations started and not yet settled")
            .register(registry);
        FunctionCounter.builder(MetricsNames.INVOCATIONS_COMPLETED_TOTAL, trigger, SessionTriggerListener::getCompletedInvocations)
            .description("Invocations whose primary session settled")
            .register(registry);
        FunctionCounter.builder(MetricsNames.INVOCATIONS_FAILED_TOTAL, trigger, SessionTriggerListener::getFailedInvocations)
            .description("Invocations that failed or exceeded the invocation timeout")
            .register(registry);
    }

    public String scrape() {
        return prometheusRegistry.scrape();
    }

    @Override
    public void close() {
        composite.remove(prometheusRegistry);
        prometheusRegistry.close();
        log.info("Prometheus exporter closed");
    }
}
