package io.sessionrelay.subscriber;

import io.sessionrelay.subscriber.broker.redis.RedisSessionBroker;
import io.sessionrelay.subscriber.complete.SessionCompleter;
import io.sessionrelay.subscriber.config.SubscriberConfig;
import io.sessionrelay.subscriber.drain.SessionDrainer;
import io.sessionrelay.subscriber.forward.HttpForwardGateway;
import io.sessionrelay.subscriber.http.HttpServer;
import io.sessionrelay.subscriber.metrics.MetricsService;
import io.sessionrelay.subscriber.metrics.PrometheusMetricsExporter;
import io.sessionrelay.subscriber.orchestrator.ConcurrentSessionOrchestrator;
import io.sessionrelay.subscriber.trigger.SessionTriggerListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;

/**
 * Main entry point for the subscriber node.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Lock sessions of the configured queue and run one invocation per primary session</li>
 *   <li>Process up to N additional sessions while the primary forward is in flight</li>
 *   <li>Forward session batches to the downstream HTTP endpoint</li>
 *   <li>Expose /healthz, /readyz and /metrics endpoints</li>
 * </ul>
 * </p>
 */
public class SubscriberApp {
    private static final Logger log = LoggerFactory.getLogger(SubscriberApp.class);

    public static void main(String[] args) {
        SubscriberConfig config = SubscriberConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        log.info("Starting subscriber node: {}", config.getNodeId());
        log.info("  Redis: {}", config.getRedisUrl());
        log.info("  Queue: {} (additional sessions per invocation: {}, cancellation: {})",
            config.getQueueName(), config.getAdditionalSessionCount(), config.getCancellationPolicy());
        log.info("  Downstream: {}", config.getDownstreamUrl());

        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config);
        MetricsService metricsService = new MetricsService(metricsExporter.getRegistry(), config.getQueueName());

        RedisSessionBroker broker = new RedisSessionBroker(config);
        HttpForwardGateway gateway = new HttpForwardGateway(
            config.getDownstreamUrl(), config.getDownstreamTimeout(), config.getDownstreamAuthToken()
        );
        SessionDrainer drainer = new SessionDrainer(metricsService);
        SessionCompleter completer = new SessionCompleter(metricsService);
        ConcurrentSessionOrchestrator orchestrator = new ConcurrentSessionOrchestrator(
            config, broker, drainer, gateway, completer, metricsService
        );
        SessionTriggerListener triggerListener = new SessionTriggerListener(config, broker, drainer, orchestrator);
        metricsExporter.bindTrigger(triggerListener);

        HttpServer httpServer = new HttpServer(config, triggerListener, metricsExporter);
        httpServer.start();

        triggerListener.start();

        log.info("Subscriber node {} is ready", config.getNodeId());

        handleShutdown(config, triggerListener, httpServer, broker, metricsExporter);

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    private static void handleShutdown(SubscriberConfig config,
                                       SessionTriggerListener triggerListener,
                                       HttpServer httpServer,
                                       RedisSessionBroker broker,
                                       PrometheusMetricsExporter metricsExporter) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received, initiating graceful shutdown...");
            MDC.put("nodeId", config.getNodeId());

            // Wait for in-flight invocations before closing Redis
            Duration wait = config.getInvocationTimeout().plus(config.getTriggerPollTimeout());
            triggerListener.stop(wait).block(wait.plusSeconds(5));

            httpServer.stop();

            broker.close();
            metricsExporter.close();

            log.info("Shutdown complete");
        }));
    }
}
