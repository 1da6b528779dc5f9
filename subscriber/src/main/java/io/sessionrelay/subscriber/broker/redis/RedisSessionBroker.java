package io.sessionrelay.subscriber.broker.redis;

import io.lettuce.core.RedisClient;
import io.lettuce.core.ScriptOutputType;
import io.lettuce.core.SetArgs;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import io.sessionrelay.core.error.SessionAcquisitionException;
import io.sessionrelay.core.error.SessionRelayException;
import io.sessionrelay.core.model.BrokerMessage;
import io.sessionrelay.core.redis.Keys;
import io.sessionrelay.core.util.JsonUtils;
import io.sessionrelay.subscriber.broker.SessionBroker;
import io.sessionrelay.subscriber.broker.SessionHandle;
import io.sessionrelay.subscriber.config.SubscriberConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Session-enabled queue on top of Redis.
 * <p>
 * Acquisition picks a random session from the ready set and locks it with
 * {@code SET NX PX}. Sessions already locked by another worker are skipped. When
 * nothing can be locked the broker polls every {@code brokerPollInterval} until
 * the wait timeout, then completes empty.
 * </p>
 * <p>
 * All operations are non-blocking using the Lettuce reactive API. One connection
 * is shared by every handle.
 * </p>
 */
public class RedisSessionBroker implements SessionBroker {
    private static final Logger log = LoggerFactory.getLogger(RedisSessionBroker.class);

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final RedisReactiveCommands<String, String> commands;
    private final Duration pollInterval;
    private final Duration lockDuration;
    private final Duration renewInterval;

    public RedisSessionBroker(SubscriberConfig config) {
        this.client = RedisClient.create(config.getRedisUrl());
        this.connection = client.connect();
        this.commands = connection.reactive();
        this.pollInterval = config.getBrokerPollInterval();
        this.lockDuration = config.getSessionLockDuration();
        this.renewInterval = config.getLockRenewInterval();
        log.info("Connected to Redis: {}", config.getRedisUrl());
    }

    /**
     * Broker over commands owned by the caller; {@link #close()} leaves them open.
     */
    RedisSessionBroker(RedisReactiveCommands<String, String> commands,
                       Duration pollInterval,
                       Duration lockDuration,
                       Duration renewInterval) {
        this.client = null;
        this.connection = null;
        this.commands = commands;
        this.pollInterval = pollInterval;
        this.lockDuration = lockDuration;
        this.renewInterval = renewInterval;
    }

    @Override
    public Mono<SessionHandle> acquireNextSession(String queueName, Duration waitTimeout) {
        return Mono.defer(() -> tryAcquire(queueName))
            .repeatWhenEmpty(attempts -> attempts.delayElements(pollInterval))
            .timeout(waitTimeout, Mono.empty())
            .onErrorMap(err -> !(err instanceof SessionRelayException),
                err -> new SessionAcquisitionException(queueName, err));
    }

    private Mono<SessionHandle> tryAcquire(String queueName) {
        String token = UUID.randomUUID().toString();

        return commands.smembers(Keys.ready(queueName))
            .collectList()
            .flatMapMany(sessionIds -> {
                List<String> candidates = new ArrayList<>(sessionIds);
                Collections.shuffle(candidates);
                return Flux.fromIterable(candidates);
            })
            .concatMap(sessionId -> commands.set(Keys.lock(queueName, sessionId), token,
                    SetArgs.Builder.nx().px(lockDuration.toMillis()))
                .map(ok -> sessionId))
            .next()
            .flatMap(sessionId -> {
                AtomicBoolean handedOver = new AtomicBoolean(false);
                return recover(queueName, sessionId)
                    .doOnNext(moved -> log.info("Locked session {} on {} ({} message(s) recovered from a previous holder)",
                        sessionId, queueName, moved))
                    .then(Mono.fromSupplier(() -> {
                        handedOver.set(true);
                        return (SessionHandle) new RedisSessionHandle(
                            commands, queueName, sessionId, token, pollInterval, lockDuration, renewInterval
                        );
                    }))
                    .onErrorResume(err -> unlock(queueName, sessionId, token).then(Mono.error(err)))
                    .doOnCancel(() -> {
                        if (!handedOver.get()) {
                            unlock(queueName, sessionId, token).subscribe();
                        }
                    });
            });
    }

    /**
     * Gives up a lock taken by {@link #tryAcquire} before a handle owns it.
     */
    private Mono<Void> unlock(String queueName, String sessionId, String token) {
        return commands.<Long>eval(RedisScripts.RELEASE, ScriptOutputType.INTEGER,
                new String[]{Keys.session(queueName, sessionId), Keys.inflight(queueName, sessionId),
                    Keys.lock(queueName, sessionId), Keys.ready(queueName)},
                token, sessionId)
            .next()
            .doOnNext(released -> log.debug("Unlocked session {} on {} after failed acquisition", sessionId, queueName))
            .doOnError(err -> log.warn("Failed to unlock session {} on {}: {}", sessionId, queueName, err.getMessage()))
            .onErrorResume(err -> Mono.empty())
            .then();
    }

    private Mono<Long> recover(String queueName, String sessionId) {
        return commands.<Long>eval(RedisScripts.RECOVER, ScriptOutputType.INTEGER,
                new String[]{Keys.inflight(queueName, sessionId), Keys.session(queueName, sessionId)})
            .next()
            .defaultIfEmpty(0L);
    }

    /**
     * Appends a message to a session and marks the session ready.
     *
     * @param queueName Queue name
     * @param sessionId Session the message belongs to
     * @param body      Opaque payload
     * @return Mono of the stored message
     */
    public Mono<BrokerMessage> publish(String queueName, String sessionId, String body) {
        return commands.incr(Keys.sequence(queueName))
            .map(sequence -> BrokerMessage.builder()
                .messageId(UUID.randomUUID().toString())
                .sessionId(sessionId)
                .sequenceNumber(sequence)
                .body(body)
                .enqueuedTimeMs(System.currentTimeMillis())
                .build())
            .flatMap(message -> commands.rpush(Keys.session(queueName, sessionId), JsonUtils.writeValueAsString(message))
                .then(commands.sadd(Keys.ready(queueName), sessionId))
                .thenReturn(message))
            .doOnNext(message -> log.debug("Published message {} to session {} on {}",
                message.getSequenceNumber(), sessionId, queueName))
            .doOnError(err -> log.error("Failed to publish to session {} on {}", sessionId, queueName, err));
    }

    @Override
    public void close() {
        if (client == null) {
            return;
        }
        connection.close();
        client.shutdown();
        log.info("Redis connection closed");
    }
}
