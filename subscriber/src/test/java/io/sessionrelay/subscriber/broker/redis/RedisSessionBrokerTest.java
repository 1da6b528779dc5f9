package io.sessionrelay.subscriber.broker.redis;

import io.sessionrelay.core.error.AcknowledgeException;
import io.sessionrelay.core.error.SessionAcquisitionException;
import io.sessionrelay.core.model.BrokerMessage;
import io.sessionrelay.core.redis.Keys;
import io.sessionrelay.core.util.JsonUtils;
import io.sessionrelay.subscriber.broker.SessionHandle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Broker and handle against the fake command set: lock keys, list moves and the
 * token checks of the lock scripts.
 */
class RedisSessionBrokerTest {
    private static final String QUEUE = "sales_order";
    private static final Duration RECEIVE_TIMEOUT = Duration.ofMillis(100);
    private static final Duration VERIFY_TIMEOUT = Duration.ofSeconds(5);

    private FakeRedisCommands redis;
    private RedisSessionBroker broker;
    private final List<SessionHandle> handles = new ArrayList<>();

    @BeforeEach
    void setUp() {
        redis = new FakeRedisCommands();
        broker = new RedisSessionBroker(redis.commands(),
            Duration.ofMillis(10), Duration.ofSeconds(30), Duration.ofMillis(20));
    }

    @AfterEach
    void tearDown() {
        handles.forEach(handle -> handle.close().onErrorResume(err -> Mono.empty()).block());
        broker.close();
    }

    @Test
    void testPublishAcquireComplete_SessionLeavesReadySet() {
        List<Long> published = List.of(
            broker.publish(QUEUE, "S1", "a").block().getSequenceNumber(),
            broker.publish(QUEUE, "S1", "b").block().getSequenceNumber()
        );
        assertTrue(redis.members(Keys.ready(QUEUE)).contains("S1"));

        SessionHandle handle = acquire();
        assertEquals("S1", handle.getSessionId());
        assertNotNull(redis.get(Keys.lock(QUEUE, "S1")));

        List<BrokerMessage> received = List.of(receive(handle), receive(handle));
        assertEquals(published, received.stream().map(BrokerMessage::getSequenceNumber).collect(Collectors.toList()));
        StepVerifier.create(handle.receiveNext(RECEIVE_TIMEOUT)).expectComplete().verify(VERIFY_TIMEOUT);

        for (BrokerMessage message : received) {
            StepVerifier.create(handle.complete(message)).expectComplete().verify(VERIFY_TIMEOUT);
        }
        assertTrue(redis.list(Keys.inflight(QUEUE, "S1")).isEmpty());

        StepVerifier.create(handle.close()).expectComplete().verify(VERIFY_TIMEOUT);
        assertNull(redis.get(Keys.lock(QUEUE, "S1")));
        assertTrue(redis.members(Keys.ready(QUEUE)).isEmpty());
        assertTrue(handle.isClosed());
    }

    @Test
    void testRelease_InflightReturnsToHeadInOrder() {
        BrokerMessage m1 = broker.publish(QUEUE, "S1", "m1").block();
        BrokerMessage m2 = broker.publish(QUEUE, "S1", "m2").block();
        BrokerMessage m3 = broker.publish(QUEUE, "S1", "m3").block();

        SessionHandle first = acquire();
        receive(first);
        receive(first);
        StepVerifier.create(first.abandon()).expectComplete().verify(VERIFY_TIMEOUT);

        assertEquals(List.of(m1.getSequenceNumber(), m2.getSequenceNumber(), m3.getSequenceNumber()),
            sequenceNumbers(redis.list(Keys.session(QUEUE, "S1"))));
        assertTrue(redis.members(Keys.ready(QUEUE)).contains("S1"));
        assertNull(redis.get(Keys.lock(QUEUE, "S1")));

        SessionHandle second = acquire();
        assertEquals(m1.getSequenceNumber(), receive(second).getSequenceNumber());
    }

    @Test
    void testLockExpired_NextHolderRecoversAndOldHolderCannotComplete() {
        BrokerMessage m1 = broker.publish(QUEUE, "S1", "m1").block();
        broker.publish(QUEUE, "S1", "m2").block();

        SessionHandle crashed = acquire();
        BrokerMessage stale = receive(crashed);
        redis.expire(Keys.lock(QUEUE, "S1"));

        SessionHandle next = acquire();
        assertEquals(m1.getSequenceNumber(), receive(next).getSequenceNumber());

        StepVerifier.create(crashed.complete(stale))
            .expectErrorSatisfies(err -> {
                AcknowledgeException ack = assertInstanceOf(AcknowledgeException.class, err);
                assertEquals("S1", ack.getSessionId());
            })
            .verify(VERIFY_TIMEOUT);
        assertTrue(crashed.isClosed());
        assertEquals(List.of(m1.getSequenceNumber()), sequenceNumbers(redis.list(Keys.inflight(QUEUE, "S1"))));
    }

    @Test
    void testLockedSession_SkippedUntilReleased() {
        broker.publish(QUEUE, "S1", "m1").block();
        SessionHandle holder = acquire();

        StepVerifier.create(broker.acquireNextSession(QUEUE, Duration.ofMillis(50)))
            .expectComplete()
            .verify(VERIFY_TIMEOUT);

        holder.close().block();
        assertEquals("S1", acquire().getSessionId());
    }

    @Test
    void testRecoverFails_LockReleasedAndNeverRenewed() throws InterruptedException {
        broker.publish(QUEUE, "S1", "m1").block();
        redis.failScript(RedisScripts.RECOVER, new IllegalStateException("READONLY replica"));

        StepVerifier.create(broker.acquireNextSession(QUEUE, Duration.ofSeconds(1)))
            .expectError(SessionAcquisitionException.class)
            .verify(VERIFY_TIMEOUT);

        Thread.sleep(150);
        assertEquals(0, redis.evalCount(RedisScripts.RENEW), "No handle may outlive a failed acquisition");
        assertEquals(1, redis.evalCount(RedisScripts.RELEASE));
        assertNull(redis.get(Keys.lock(QUEUE, "S1")));
        assertEquals(1, redis.list(Keys.session(QUEUE, "S1")).size());
    }

    @Test
    void testAcquireCancelledDuringRecover_LockReleased() throws InterruptedException {
        broker.publish(QUEUE, "S1", "m1").block();
        redis.stallScript(RedisScripts.RECOVER);

        StepVerifier.create(broker.acquireNextSession(QUEUE, Duration.ofMillis(100)))
            .expectComplete()
            .verify(VERIFY_TIMEOUT);

        Thread.sleep(150);
        assertEquals(0, redis.evalCount(RedisScripts.RENEW));
        assertEquals(1, redis.evalCount(RedisScripts.RELEASE));
        assertNull(redis.get(Keys.lock(QUEUE, "S1")));
    }

    @Test
    void testRenewal_RunsWhileHandleOpenAndStopsOnClose() throws InterruptedException {
        broker.publish(QUEUE, "S1", "m1").block();
        SessionHandle handle = acquire();

        Thread.sleep(150);
        int renewals = redis.evalCount(RedisScripts.RENEW);
        assertTrue(renewals > 0);

        handle.close().block();
        Thread.sleep(100);
        assertTrue(redis.evalCount(RedisScripts.RENEW) <= renewals + 1);
    }

    private SessionHandle acquire() {
        SessionHandle handle = broker.acquireNextSession(QUEUE, Duration.ofMillis(200)).block(VERIFY_TIMEOUT);
        assertNotNull(handle, "Expected a session to be available");
        handles.add(handle);
        return handle;
    }

    private static BrokerMessage receive(SessionHandle handle) {
        BrokerMessage message = handle.receiveNext(RECEIVE_TIMEOUT).block(VERIFY_TIMEOUT);
        assertNotNull(message, "Expected a message from session " + handle.getSessionId());
        return message;
    }

    private static List<Long> sequenceNumbers(List<String> rawMessages) {
        return rawMessages.stream()
            .map(raw -> JsonUtils.readValue(raw, BrokerMessage.class).getSequenceNumber())
            .collect(Collectors.toList());
    }
}
