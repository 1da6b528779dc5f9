package io.sessionrelay.subscriber.forward;

import io.sessionrelay.core.model.BrokerMessage;
import io.sessionrelay.core.model.ForwardFailureCause;
import io.sessionrelay.core.model.ForwardResult;
import io.sessionrelay.core.model.SessionBatch;
import io.sessionrelay.subscriber.support.ScriptedForwardGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ForwardRetryPolicyTest {

    private ScriptedForwardGateway gateway;
    private SessionBatch batch;

    @BeforeEach
    void setUp() {
        gateway = new ScriptedForwardGateway();
        batch = SessionBatch.of("S1", List.of(BrokerMessage.builder()
            .messageId("id-1")
            .sessionId("S1")
            .sequenceNumber(1)
            .body("{}")
            .build()));
    }

    @Test
    void testNetworkFailureThenSuccess_Retried() {
        gateway.respond("S1", ForwardResult.failure(ForwardFailureCause.NETWORK, "connection reset"));
        ForwardRetryPolicy policy = new ForwardRetryPolicy(3, Duration.ofMillis(5), Duration.ofMillis(20));

        StepVerifier.create(policy.execute(gateway, batch))
            .assertNext(result -> {
                assertTrue(result.isSuccess());
                assertEquals(2, result.getAttempts());
            })
            .verifyComplete();

        assertEquals(2, gateway.forwarded().size());
    }

    @Test
    void testRejected_NeverRetried() {
        gateway.respond("S1", ForwardResult.failure(ForwardFailureCause.REJECTED, "HTTP 400"));
        ForwardRetryPolicy policy = new ForwardRetryPolicy(3, Duration.ofMillis(5), Duration.ofMillis(20));

        StepVerifier.create(policy.execute(gateway, batch))
            .assertNext(result -> {
                assertFalse(result.isSuccess());
                assertEquals(ForwardFailureCause.REJECTED, result.getCause());
                assertEquals(1, result.getAttempts());
            })
            .verifyComplete();

        assertEquals(1, gateway.forwarded().size());
    }

    @Test
    void testTimeouts_StopAfterMaxAttempts() {
        ForwardResult timeout = ForwardResult.failure(ForwardFailureCause.TIMEOUT, "no response");
        gateway.respond("S1", timeout, timeout, timeout, timeout);
        ForwardRetryPolicy policy = new ForwardRetryPolicy(3, Duration.ofMillis(5), Duration.ofMillis(20));

        StepVerifier.create(policy.execute(gateway, batch))
            .assertNext(result -> {
                assertEquals(ForwardFailureCause.TIMEOUT, result.getCause());
                assertEquals(3, result.getAttempts());
            })
            .verifyComplete();

        assertEquals(3, gateway.forwarded().size());
    }

    @Test
    void testNoRetryPolicy_SingleAttempt() {
        gateway.respond("S1", ForwardResult.failure(ForwardFailureCause.NETWORK, "connection refused"));

        StepVerifier.create(ForwardRetryPolicy.none().execute(gateway, batch))
            .assertNext(result -> assertEquals(ForwardFailureCause.NETWORK, result.getCause()))
            .verifyComplete();

        assertEquals(1, gateway.forwarded().size());
    }

    @Test
    void testZeroAttempts_Rejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new ForwardRetryPolicy(0, Duration.ofMillis(5), Duration.ofMillis(20)));
    }
}
