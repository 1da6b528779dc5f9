package io.sessionrelay.core.util;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import io.sessionrelay.core.model.BrokerMessage;
import io.sessionrelay.core.model.SessionBatch;

import java.nio.charset.StandardCharsets;

/**
 * Stable hashes used to tag downstream requests.
 * <p>
 * Murmur3 is non-cryptographic but fast and well distributed, which is all an
 * idempotency key needs.
 * </p>
 */
public final class Hashers {
    private Hashers() {
    }

    /**
     * Idempotency key of a batch: murmur3-128 over the session id and the ordered
     * message ids, hex encoded.
     * <p>
     * A redelivered batch with the same messages yields the same key, which lets
     * the downstream system discard the duplicate submission.
     * </p>
     *
     * @param batch Session batch
     * @return 32-character hex key
     */
    public static String idempotencyKey(SessionBatch batch) {
        Hasher hasher = Hashing.murmur3_128().newHasher()
            .putString(batch.getSessionId(), StandardCharsets.UTF_8);
        for (BrokerMessage message : batch.getMessages()) {
            hasher.putChar('|').putString(message.getMessageId(), StandardCharsets.UTF_8);
        }
        return hasher.hash().toString();
    }
}
