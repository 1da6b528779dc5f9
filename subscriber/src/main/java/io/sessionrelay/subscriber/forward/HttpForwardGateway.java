package io.sessionrelay.subscriber.forward;

import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.timeout.ReadTimeoutException;
import io.sessionrelay.core.model.ForwardFailureCause;
import io.sessionrelay.core.model.ForwardResult;
import io.sessionrelay.core.model.SessionBatch;
import io.sessionrelay.core.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.ByteBufMono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Forwards session batches to the downstream HTTP API using reactor-netty HttpClient.
 * <p>
 * Each batch is one POST of a {@link ForwardRequest}. A 2xx answer means the whole
 * batch was accepted. The {@code Idempotency-Key} header lets the downstream drop
 * duplicates caused by redelivery.
 * </p>
 */
public class HttpForwardGateway implements ForwardGateway {
    private static final Logger log = LoggerFactory.getLogger(HttpForwardGateway.class);

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    private static final int MAX_REASON_LENGTH = 256;

    private final HttpClient httpClient;
    private final String url;
    private final Duration timeout;

    /**
     * Creates a gateway.
     *
     * @param url       Absolute downstream URL
     * @param timeout   Upper bound for one call (response timeout and overall timeout)
     * @param authToken Optional bearer token, null for none
     */
    public HttpForwardGateway(String url, Duration timeout, String authToken) {
        this.url = url;
        this.timeout = timeout;
        this.httpClient = HttpClient.create()
            .headers(h -> {
                h.set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON);
                h.set(HttpHeaderNames.ACCEPT, HttpHeaderValues.APPLICATION_JSON);
                if (authToken != null && !authToken.isBlank()) {
                    h.set(HttpHeaderNames.AUTHORIZATION, "Bearer " + authToken);
                }
            })
            .responseTimeout(timeout);

        log.info("HttpForwardGateway initialized for {} (timeout {})", url, timeout);
    }

    @Override
    public Mono<ForwardResult> forward(SessionBatch batch) {
        return Mono.defer(() -> {
                ForwardRequest request = ForwardRequest.from(batch);
                String json = JsonUtils.writeValueAsString(request);

                log.info("Forwarding session {} ({} messages, key={})",
                    batch.getSessionId(), batch.size(), request.getIdempotencyKey());

                return httpClient
                    .headers(h -> h.set(IDEMPOTENCY_KEY_HEADER, request.getIdempotencyKey()))
                    .post()
                    .uri(url)
                    .send(ByteBufMono.fromString(Mono.just(json)))
                    .responseSingle((response, body) -> {
                        int status = response.status().code();
                        if (status >= 200 && status < 300) {
                            return Mono.just(ForwardResult.success());
                        }
                        return body.asString()
                            .defaultIfEmpty("")
                            .map(text -> ForwardResult.failure(
                                ForwardFailureCause.REJECTED,
                                "HTTP " + status + abbreviate(text)
                            ));
                    });
            })
            .timeout(timeout)
            .onErrorResume(err -> Mono.just(classify(err)))
            .doOnNext(result -> {
                if (!result.isSuccess()) {
                    log.warn("Forward of session {} failed: {}", batch.getSessionId(), result);
                }
            });
    }

    static ForwardResult classify(Throwable err) {
        if (err instanceof TimeoutException || err instanceof ReadTimeoutException) {
            return ForwardResult.failure(ForwardFailureCause.TIMEOUT, "No response: " + err.getClass().getSimpleName());
        }
        String message = err.getMessage() != null ? err.getMessage() : err.getClass().getSimpleName();
        return ForwardResult.failure(ForwardFailureCause.NETWORK, message);
    }

    private static String abbreviate(String text) {
        if (text.isBlank()) {
            return "";
        }
        String trimmed = text.strip();
        return ": " + (trimmed.length() > MAX_REASON_LENGTH ? trimmed.substring(0, MAX_REASON_LENGTH) + "..." : trimmed);
    }
}
