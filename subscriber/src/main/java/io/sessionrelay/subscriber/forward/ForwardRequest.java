package io.sessionrelay.subscriber.forward;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.sessionrelay.core.model.BrokerMessage;
import io.sessionrelay.core.model.SessionBatch;
import io.sessionrelay.core.util.Hashers;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * JSON body posted to the downstream system for one session.
 */
@Value
@Builder
public class ForwardRequest {

    @JsonProperty("sessionId")
    String sessionId;

    /**
     * Same value for every redelivery of the same messages.
     */
    @JsonProperty("idempotencyKey")
    String idempotencyKey;

    /**
     * Messages in session order.
     */
    @JsonProperty("messages")
    List<Item> messages;

    @Value
    @Builder
    public static class Item {
        @JsonProperty("messageId")
        String messageId;

        @JsonProperty("sequenceNumber")
        long sequenceNumber;

        @JsonProperty("enqueuedTimeMs")
        long enqueuedTimeMs;

        @JsonProperty("body")
        String body;
    }

    public static ForwardRequest from(SessionBatch batch) {
        return ForwardRequest.builder()
            .sessionId(batch.getSessionId())
            .idempotencyKey(Hashers.idempotencyKey(batch))
            .messages(batch.getMessages().stream()
                .map(ForwardRequest::toItem)
                .collect(Collectors.toList()))
            .build();
    }

    private static Item toItem(BrokerMessage message) {
        return Item.builder()
            .messageId(message.getMessageId())
            .sequenceNumber(message.getSequenceNumber())
            .enqueuedTimeMs(message.getEnqueuedTimeMs())
            .body(message.getBody())
            .build();
    }
}
