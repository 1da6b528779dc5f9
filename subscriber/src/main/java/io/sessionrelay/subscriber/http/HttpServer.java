package io.sessionrelay.subscriber.http;

import io.netty.channel.ChannelOption;
import io.sessionrelay.subscriber.config.SubscriberConfig;
import io.sessionrelay.subscriber.metrics.PrometheusMetricsExporter;
import io.sessionrelay.subscriber.trigger.SessionTriggerListener;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;

import java.time.Duration;
import java.util.function.Function;

/**
 * HTTP server for health checks, readiness and Prometheus metrics.
 */
@RequiredArgsConstructor
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final SubscriberConfig config;
    private final SessionTriggerListener triggerListener;
    private final PrometheusMetricsExporter metricsExporter;
    private DisposableServer server;

    /**
     * Starts the HTTP server.
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            .metrics(true, Function.identity())
            .route(routes -> routes
                // Liveness: the process is up
                .get("/healthz", (req, res) -> res.status(200).sendString(Mono.just("OK")))
                // Readiness: fails once the trigger stops taking invocations
                .get("/readyz", (req, res) -> {
                    if (!triggerListener.isRunning()) {
                        return res.status(503).sendString(Mono.just("Not Ready - Stopping"));
                    }
                    String status = String.format(
                        "{ \"running\": true, \"inFlightInvocations\": %d, \"completedInvocations\": %d, \"failedInvocations\": %d }",
                        triggerListener.getInFlightInvocations(),
                        triggerListener.getCompletedInvocations(),
                        triggerListener.getFailedInvocations()
                    );
                    return res.status(200)
                        .header("Content-Type", "application/json")
                        .sendString(Mono.just(status));
                })
                // Metrics endpoint with Prometheus scraping
                .get("/metrics", (req, res) ->
                    res.header("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                        .sendString(Mono.just(metricsExporter.scrape()))
                )
            )
            .bind()
            .doOnNext(s -> log.info("HTTP server started on port {}", s.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(30));
        }
    }
}
