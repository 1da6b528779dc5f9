package io.sessionrelay.subscriber.broker.redis;

import io.lettuce.core.LMoveArgs;
import io.lettuce.core.ScriptOutputType;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import io.sessionrelay.core.error.AcknowledgeException;
import io.sessionrelay.core.model.BrokerMessage;
import io.sessionrelay.core.redis.Keys;
import io.sessionrelay.core.util.JsonUtils;
import io.sessionrelay.subscriber.broker.SessionHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Session lock held in Redis.
 * <p>
 * Receiving moves the head of the session list to the in-flight list; completing
 * removes it from there. Releasing moves whatever is still in flight back to the
 * head of the session list so the next holder sees it first.
 * </p>
 * <p>
 * The lock is renewed every {@code renewInterval} while the handle is open. A
 * failed renewal means another node may own the session now, so the handle
 * closes itself locally.
 * </p>
 */
class RedisSessionHandle implements SessionHandle {
    private static final Logger log = LoggerFactory.getLogger(RedisSessionHandle.class);

    private final RedisReactiveCommands<String, String> commands;
    private final String queueName;
    private final String sessionId;
    private final String token;
    private final Duration pollInterval;
    private final Duration lockDuration;

    private final String sessionKey;
    private final String inflightKey;
    private final String lockKey;

    /** Raw list entries of received messages, needed for LREM on complete. */
    private final Map<Long, String> received = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Disposable renewal;

    RedisSessionHandle(RedisReactiveCommands<String, String> commands,
                       String queueName,
                       String sessionId,
                       String token,
                       Duration pollInterval,
                       Duration lockDuration,
                       Duration renewInterval) {
        this.commands = commands;
        this.queueName = queueName;
        this.sessionId = sessionId;
        this.token = token;
        this.pollInterval = pollInterval;
        this.lockDuration = lockDuration;
        this.sessionKey = Keys.session(queueName, sessionId);
        this.inflightKey = Keys.inflight(queueName, sessionId);
        this.lockKey = Keys.lock(queueName, sessionId);
        this.renewal = startRenewal(renewInterval);
    }

    @Override
    public String getSessionId() {
        return sessionId;
    }

    @Override
    public Mono<BrokerMessage> receiveNext(Duration timeout) {
        Mono<String> move = Mono.defer(() -> closed.get()
            ? Mono.empty()
            : commands.lmove(sessionKey, inflightKey, LMoveArgs.Builder.leftRight()));

        return move
            .repeatWhenEmpty(attempts -> attempts
                .takeWhile(attempt -> !closed.get())
                .delayElements(pollInterval))
            .timeout(timeout, Mono.empty())
            .map(raw -> {
                BrokerMessage message = JsonUtils.readValue(raw, BrokerMessage.class).withLockToken(token);
                received.put(message.getSequenceNumber(), raw);
                return message;
            });
    }

    @Override
    public Mono<Void> complete(BrokerMessage message) {
        return Mono.defer(() -> {
            if (!token.equals(message.getLockToken())) {
                return Mono.error(new AcknowledgeException(sessionId,
                    "Message " + message.getSequenceNumber() + " was not received under this lock"));
            }
            String raw = received.get(message.getSequenceNumber());
            if (raw == null) {
                return Mono.error(new AcknowledgeException(sessionId,
                    "Message " + message.getSequenceNumber() + " is not in flight"));
            }
            return commands.<Long>eval(RedisScripts.COMPLETE, ScriptOutputType.INTEGER,
                    new String[]{inflightKey, lockKey}, token, raw)
                .next()
                .flatMap(removed -> {
                    if (removed < 0) {
                        closed.set(true);
                        return Mono.error(new AcknowledgeException(sessionId,
                            "Lock on session " + sessionId + " was lost before completing message "
                                + message.getSequenceNumber()));
                    }
                    received.remove(message.getSequenceNumber());
                    if (removed == 0) {
                        log.warn("Message {} of session {} was already settled", message.getSequenceNumber(), sessionId);
                    }
                    return Mono.<Void>empty();
                });
        });
    }

    @Override
    public Mono<Void> abandon() {
        return release("abandon");
    }

    @Override
    public Mono<Void> close() {
        return release("close");
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    private Mono<Void> release(String operation) {
        return Mono.defer(() -> {
            closed.set(true);
            renewal.dispose();
            return commands.<Long>eval(RedisScripts.RELEASE, ScriptOutputType.INTEGER,
                    new String[]{sessionKey, inflightKey, lockKey, Keys.ready(queueName)}, token, sessionId)
                .next()
                .doOnNext(released -> {
                    if (released == 0) {
                        log.warn("Lock on session {} already expired at {}; {} in-flight message(s) wait for the next holder",
                            sessionId, operation, received.size());
                    } else {
                        log.debug("Session {} released ({}), {} message(s) returned to the session",
                            sessionId, operation, received.size());
                    }
                    received.clear();
                })
                .then();
        });
    }

    private Disposable startRenewal(Duration renewInterval) {
        return Flux.interval(renewInterval, renewInterval)
            .takeWhile(tick -> !closed.get())
            .concatMap(tick -> commands.<Long>eval(RedisScripts.RENEW, ScriptOutputType.INTEGER,
                    new String[]{lockKey}, token, String.valueOf(lockDuration.toMillis()))
                .next()
                .onErrorResume(err -> {
                    log.warn("Failed to renew lock on session {}: {}", sessionId, err.getMessage());
                    return Mono.just(-1L);
                }))
            .subscribe(renewed -> {
                if (renewed == 0 && closed.compareAndSet(false, true)) {
                    log.error("Lost lock on session {}; in-flight messages will be redelivered", sessionId);
                }
            });
    }
}
