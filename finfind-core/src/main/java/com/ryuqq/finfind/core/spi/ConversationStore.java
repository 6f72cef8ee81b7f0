package com.ryuqq.finfind.core.spi;

import com.ryuqq.finfind.core.context.Conversation;
import com.ryuqq.finfind.core.context.Turn;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Store of conversations carried across requests.
 *
 * <p>Implementations are bounded: idle conversations may be evicted at any time, after which
 * the id starts over with no turns.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ConversationStore {

    /**
     * Returns the conversation for {@code conversationId}, creating it when unknown.
     *
     * <p>A {@code null} id starts a new conversation under a generated id. Opening an existing
     * conversation refreshes its access time.</p>
     *
     * @param conversationId conversation id, or null for a new conversation
     * @param userId user starting the conversation when it is created
     * @return existing or new conversation
     * @throws IllegalArgumentException if userId is blank or the id is longer than 64 characters
     */
    Conversation open(String conversationId, String userId);

    Optional<Conversation> find(String conversationId);

    /**
     * Appends a turn, recreating the conversation if it was evicted in the meantime.
     *
     * @param conversationId conversation id
     * @param userId owner used when the conversation has to be recreated
     * @param turn turn to record
     * @return updated conversation
     */
    Conversation append(String conversationId, String userId, Turn turn);

    boolean delete(String conversationId);

    /**
     * Removes conversations not accessed since {@code cutoff}.
     *
     * @param cutoff oldest access time kept
     * @return number of removed conversations
     */
    int removeIdleSince(Instant cutoff);

    /**
     * Removes conversations idle for longer than {@code maxAge}.
     *
     * @param maxAge maximum idle time
     * @return number of removed conversations
     */
    default int cleanupExpired(Duration maxAge) {
        if (maxAge == null || maxAge.isNegative()) {
            throw new IllegalArgumentException("maxAge cannot be null or negative (current: " + maxAge + ")");
        }
        return removeIdleSince(Instant.now().minus(maxAge));
    }

    int size();
}
