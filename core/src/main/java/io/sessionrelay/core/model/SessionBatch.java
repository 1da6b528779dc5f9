package io.sessionrelay.core.model;

import lombok.Value;

import java.util.List;
import java.util.Objects;

/**
 * Ordered messages of one session, in receipt order.
 * <p>
 * Receipt order equals publish order within a session, so forwarding a batch as a
 * whole preserves the downstream ordering requirement.
 * </p>
 */
@Value
public class SessionBatch {
    String sessionId;
    List<BrokerMessage> messages;

    private SessionBatch(String sessionId, List<BrokerMessage> messages) {
        this.sessionId = sessionId;
        this.messages = messages;
    }

    /**
     * Creates a batch, rejecting messages that belong to another session.
     *
     * @param sessionId Session identifier
     * @param messages  Messages in receipt order
     * @return immutable batch
     */
    public static SessionBatch of(String sessionId, List<BrokerMessage> messages) {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(messages, "messages");
        for (BrokerMessage message : messages) {
            if (!sessionId.equals(message.getSessionId())) {
                throw new IllegalArgumentException(String.format(
                    "Message %s belongs to session %s, not %s",
                    message.getMessageId(), message.getSessionId(), sessionId
                ));
            }
        }
        return new SessionBatch(sessionId, List.copyOf(messages));
    }

    public static SessionBatch empty(String sessionId) {
        return of(sessionId, List.of());
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }

    public int size() {
        return messages.size();
    }
}
