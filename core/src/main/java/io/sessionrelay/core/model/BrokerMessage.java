package io.sessionrelay.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * A message received from a session-enabled queue.
 * <p>
 * <b>Ordering guarantee:</b> messages sharing a {@code sessionId} are delivered in
 * publish order. Nothing is guaranteed across sessions.
 * </p>
 * <p>
 * <b>At-least-once semantics:</b> a message is redelivered until it is completed
 * under the lease it was received with. Downstream consumers must tolerate
 * duplicates of the same {@code messageId}.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@With
public class BrokerMessage {
    /**
     * Globally unique message ID (UUID), assigned on publish.
     */
    @JsonProperty("messageId")
    String messageId;

    /**
     * Session (partition key) the message belongs to, e.g. the sales order number.
     */
    @JsonProperty("sessionId")
    String sessionId;

    /**
     * Broker-assigned sequence number, increasing in publish order.
     */
    @JsonProperty("sequenceNumber")
    long sequenceNumber;

    /**
     * Opaque payload.
     */
    @JsonProperty("body")
    String body;

    /**
     * Timestamp when the message was enqueued (epoch millis).
     */
    @JsonProperty("enqueuedTimeMs")
    long enqueuedTimeMs;

    /**
     * Token of the session lease this message was received under. Not stored by the broker.
     */
    @JsonProperty(value = "lockToken", access = JsonProperty.Access.WRITE_ONLY)
    String lockToken;

    @JsonCreator
    public BrokerMessage(
        @JsonProperty("messageId") String messageId,
        @JsonProperty("sessionId") String sessionId,
        @JsonProperty("sequenceNumber") long sequenceNumber,
        @JsonProperty("body") String body,
        @JsonProperty("enqueuedTimeMs") long enqueuedTimeMs,
        @JsonProperty(value = "lockToken", access = JsonProperty.Access.WRITE_ONLY) String lockToken
    ) {
        this.messageId = messageId;
        this.sessionId = sessionId;
        this.sequenceNumber = sequenceNumber;
        this.body = body;
        this.enqueuedTimeMs = enqueuedTimeMs;
        this.lockToken = lockToken;
    }
}
