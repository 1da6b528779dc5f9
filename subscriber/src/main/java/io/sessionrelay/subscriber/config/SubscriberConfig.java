package io.sessionrelay.subscriber.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for the session subscriber, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class SubscriberConfig {

    String nodeId;
    int httpPort;
    String redisUrl;

    // Queue and fan-out
    String queueName;
    int additionalSessionCount;    // N extra sessions acquired per invocation
    Duration receiveIdleTimeout;   // drain stops after this long without a message
    Duration sessionAcquireTimeout;
    Duration brokerPollInterval;
    Duration sessionLockDuration;
    Duration lockRenewInterval;

    // Invocation lifecycle
    Duration invocationTimeout;
    CancellationPolicy cancellationPolicy;
    Duration cancellationGrace;    // soft cutoff = deadline - grace

    // Downstream
    String downstreamUrl;
    Duration downstreamTimeout;
    String downstreamAuthToken;
    int forwardMaxAttempts;        // 1 = fire once, no retry
    Duration forwardBackoffBase;
    Duration forwardBackoffMax;

    // Trigger
    int triggerConcurrency;
    int triggerMaxBatchSize;
    Duration triggerPollTimeout;

    public static SubscriberConfig fromEnv() {
        return SubscriberConfig.builder()
            .nodeId(getEnv("NODE_ID", "subscriber-1"))
            .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8080")))
            .redisUrl(getEnv("REDIS_URL", "redis://localhost:6379"))
            .queueName(getEnv("QUEUE_NAME", "sales_order"))
            .additionalSessionCount(Integer.parseInt(getEnv("ADDITIONAL_SESSION_COUNT", "3")))
            .receiveIdleTimeout(Duration.ofMillis(Long.parseLong(getEnv("RECEIVE_IDLE_TIMEOUT_MS", "500"))))
            .sessionAcquireTimeout(Duration.ofMillis(Long.parseLong(getEnv("SESSION_ACQUIRE_TIMEOUT_MS", "2000"))))
            .brokerPollInterval(Duration.ofMillis(Long.parseLong(getEnv("BROKER_POLL_INTERVAL_MS", "50"))))
            .sessionLockDuration(Duration.ofSeconds(Long.parseLong(getEnv("SESSION_LOCK_DURATION_SEC", "60"))))
            .lockRenewInterval(Duration.ofSeconds(Long.parseLong(getEnv("LOCK_RENEW_INTERVAL_SEC", "20"))))
            .invocationTimeout(Duration.ofSeconds(Long.parseLong(getEnv("INVOCATION_TIMEOUT_SEC", "300"))))
            .cancellationPolicy(CancellationPolicy.valueOf(getEnv("CANCELLATION_POLICY", "CANCEL_IN_FLIGHT")))
            .cancellationGrace(Duration.ofSeconds(Long.parseLong(getEnv("CANCELLATION_GRACE_SEC", "30"))))
            .downstreamUrl(getEnv("DOWNSTREAM_URL", "http://localhost:9000/orders"))
            .downstreamTimeout(Duration.ofSeconds(Long.parseLong(getEnv("DOWNSTREAM_TIMEOUT_SEC", "60"))))
            .downstreamAuthToken(System.getenv("DOWNSTREAM_AUTH_TOKEN"))
            .forwardMaxAttempts(Integer.parseInt(getEnv("FORWARD_MAX_ATTEMPTS", "1")))
            .forwardBackoffBase(Duration.ofMillis(Long.parseLong(getEnv("FORWARD_BACKOFF_BASE_MS", "500"))))
            .forwardBackoffMax(Duration.ofMillis(Long.parseLong(getEnv("FORWARD_BACKOFF_MAX_MS", "5000"))))
            .triggerConcurrency(Integer.parseInt(getEnv("TRIGGER_CONCURRENCY", "1")))
            .triggerMaxBatchSize(Integer.parseInt(getEnv("TRIGGER_MAX_BATCH_SIZE", "100")))
            .triggerPollTimeout(Duration.ofMillis(Long.parseLong(getEnv("TRIGGER_POLL_TIMEOUT_MS", "5000"))))
            .build()
            .validate();
    }

    /**
     * Checks value ranges and cross-field constraints.
     *
     * @return this config
     * @throws IllegalArgumentException on the first invalid value
     */
    public SubscriberConfig validate() {
        require(queueName != null && !queueName.isBlank(), "QUEUE_NAME must not be blank");
        require(additionalSessionCount >= 0, "ADDITIONAL_SESSION_COUNT must be >= 0");
        require(isPositive(receiveIdleTimeout), "RECEIVE_IDLE_TIMEOUT_MS must be > 0");
        require(isPositive(sessionAcquireTimeout), "SESSION_ACQUIRE_TIMEOUT_MS must be > 0");
        require(isPositive(brokerPollInterval), "BROKER_POLL_INTERVAL_MS must be > 0");
        require(isPositive(sessionLockDuration), "SESSION_LOCK_DURATION_SEC must be > 0");
        require(isPositive(lockRenewInterval) && lockRenewInterval.compareTo(sessionLockDuration) < 0,
            "LOCK_RENEW_INTERVAL_SEC must be > 0 and shorter than SESSION_LOCK_DURATION_SEC");
        require(isPositive(invocationTimeout), "INVOCATION_TIMEOUT_SEC must be > 0");
        require(cancellationGrace != null && !cancellationGrace.isNegative()
                && cancellationGrace.compareTo(invocationTimeout) < 0,
            "CANCELLATION_GRACE_SEC must be >= 0 and shorter than INVOCATION_TIMEOUT_SEC");
        require(cancellationPolicy != null, "CANCELLATION_POLICY must be set");
        require(isPositive(downstreamTimeout), "DOWNSTREAM_TIMEOUT_SEC must be > 0");
        require(forwardMaxAttempts >= 1, "FORWARD_MAX_ATTEMPTS must be >= 1");
        require(triggerConcurrency >= 1, "TRIGGER_CONCURRENCY must be >= 1");
        require(triggerMaxBatchSize >= 1, "TRIGGER_MAX_BATCH_SIZE must be >= 1");
        return this;
    }

    private static boolean isPositive(Duration duration) {
        return duration != null && !duration.isNegative() && !duration.isZero();
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
