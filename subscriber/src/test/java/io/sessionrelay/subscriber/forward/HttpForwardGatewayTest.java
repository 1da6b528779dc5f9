package io.sessionrelay.subscriber.forward;

import com.fasterxml.jackson.databind.JsonNode;
import io.sessionrelay.core.model.BrokerMessage;
import io.sessionrelay.core.model.ForwardFailureCause;
import io.sessionrelay.core.model.SessionBatch;
import io.sessionrelay.core.util.Hashers;
import io.sessionrelay.core.util.JsonUtils;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Runs the gateway against a local reactor-netty server standing in for the downstream API.
 */
class HttpForwardGatewayTest {

    private static DisposableServer downstream;
    private static final AtomicReference<String> lastBody = new AtomicReference<>();
    private static final AtomicReference<String> lastIdempotencyKey = new AtomicReference<>();
    private static final AtomicReference<String> lastAuthorization = new AtomicReference<>();

    private SessionBatch batch;

    @BeforeAll
    static void startDownstream() {
        downstream = HttpServer.create()
            .port(0)
            .route(routes -> routes
                .post("/orders", (req, res) -> req.receive().aggregate().asString()
                    .flatMap(body -> {
                        lastBody.set(body);
                        lastIdempotencyKey.set(req.requestHeaders().get(HttpForwardGateway.IDEMPOTENCY_KEY_HEADER));
                        lastAuthorization.set(req.requestHeaders().get("Authorization"));
                        return res.status(200).sendString(Mono.just("{\"accepted\":true}")).then();
                    }))
                .post("/invalid", (req, res) -> req.receive().then(
                    res.status(422).sendString(Mono.just("order SO-1 is closed")).then()))
                .post("/slow", (req, res) -> req.receive().then(
                    Mono.delay(Duration.ofSeconds(3)).then(res.status(200).sendString(Mono.just("late")).then()))))
            .bindNow();
    }

    @AfterAll
    static void stopDownstream() {
        downstream.disposeNow();
    }

    @BeforeEach
    void setUp() {
        lastBody.set(null);
        lastIdempotencyKey.set(null);
        lastAuthorization.set(null);
        batch = SessionBatch.of("SO-1", List.of(message("id-1", 1, "{\"line\":1}"), message("id-2", 2, "{\"line\":2}")));
    }

    @Test
    void testAccepted_SuccessWithIdempotencyKeyAndBody() throws IOException {
        HttpForwardGateway gateway = new HttpForwardGateway(url("/orders"), Duration.ofSeconds(5), "secret");

        StepVerifier.create(gateway.forward(batch))
            .assertNext(result -> assertTrue(result.isSuccess()))
            .expectComplete()
            .verify(Duration.ofSeconds(10));

        String key = Hashers.idempotencyKey(batch);
        assertEquals(key, lastIdempotencyKey.get());
        assertEquals("Bearer secret", lastAuthorization.get());

        JsonNode body = JsonUtils.mapper().readTree(lastBody.get());
        assertEquals("SO-1", body.get("sessionId").asText());
        assertEquals(key, body.get("idempotencyKey").asText());
        assertEquals(2, body.get("messages").size());
        assertEquals(1, body.get("messages").get(0).get("sequenceNumber").asLong());
        assertEquals("{\"line\":2}", body.get("messages").get(1).get("body").asText());
    }

    @Test
    void testNon2xx_RejectedWithStatusAndBody() {
        HttpForwardGateway gateway = new HttpForwardGateway(url("/invalid"), Duration.ofSeconds(5), null);

        StepVerifier.create(gateway.forward(batch))
            .assertNext(result -> {
                assertFalse(result.isSuccess());
                assertEquals(ForwardFailureCause.REJECTED, result.getCause());
                assertEquals("HTTP 422: order SO-1 is closed", result.getReason());
                assertFalse(result.isRetryable());
            })
            .expectComplete()
            .verify(Duration.ofSeconds(10));
    }

    @Test
    void testSlowDownstream_Timeout() {
        HttpForwardGateway gateway = new HttpForwardGateway(url("/slow"), Duration.ofMillis(300), null);

        StepVerifier.create(gateway.forward(batch))
            .assertNext(result -> {
                assertEquals(ForwardFailureCause.TIMEOUT, result.getCause());
                assertTrue(result.isRetryable());
            })
            .expectComplete()
            .verify(Duration.ofSeconds(10));
    }

    @Test
    void testConnectionRefused_Network() {
        HttpForwardGateway gateway = new HttpForwardGateway("http://127.0.0.1:1/orders", Duration.ofSeconds(5), null);

        StepVerifier.create(gateway.forward(batch))
            .assertNext(result -> assertEquals(ForwardFailureCause.NETWORK, result.getCause()))
            .expectComplete()
            .verify(Duration.ofSeconds(10));
    }

    private static String url(String path) {
        return "http://127.0.0.1:" + downstream.port() + path;
    }

    private static BrokerMessage message(String id, long sequence, String body) {
        return BrokerMessage.builder()
            .messageId(id)
            .sessionId("SO-1")
            .sequenceNumber(sequence)
            .body(body)
            .enqueuedTimeMs(1_700_000_000_000L)
            .build();
    }
}
