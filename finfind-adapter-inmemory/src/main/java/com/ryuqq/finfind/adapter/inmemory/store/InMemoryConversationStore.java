package com.ryuqq.finfind.adapter.inmemory.store;

import com.ryuqq.finfind.core.context.Conversation;
import com.ryuqq.finfind.core.context.Turn;
import com.ryuqq.finfind.core.spi.ConversationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link ConversationStore} SPI.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>conversations:</strong> ConcurrentHashMap&lt;String, Conversation&gt; - keyed by conversation id,
 *       bounded by {@code maxConversations} (default {@value #DEFAULT_MAX_CONVERSATIONS})</li>
 *   <li>each conversation keeps at most {@code maxTurns} turns (default {@value #DEFAULT_MAX_TURNS})</li>
 * </ul>
 *
 * <p><strong>Eviction:</strong> when the bound is exceeded, the least recently accessed fifth of the
 * conversations is dropped (at least enough to get back under the bound). The conversation being
 * opened or appended to is never the one evicted.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryConversationStore implements ConversationStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryConversationStore.class);

    /** Default number of conversations kept. */
    public static final int DEFAULT_MAX_CONVERSATIONS = 100;

    /** Default number of turns kept per conversation. */
    public static final int DEFAULT_MAX_TURNS = 20;

    private final ConcurrentHashMap<String, Conversation> conversations = new ConcurrentHashMap<>();
    private final int maxConversations;
    private final int maxTurns;

    public InMemoryConversationStore() {
        this(DEFAULT_MAX_CONVERSATIONS, DEFAULT_MAX_TURNS);
    }

    /**
     * Creates a store with custom bounds.
     *
     * @param maxConversations maximum number of conversations kept
     * @param maxTurns maximum number of turns kept per conversation
     * @throws IllegalArgumentException if either bound is not positive
     */
    public InMemoryConversationStore(int maxConversations, int maxTurns) {
        if (maxConversations <= 0) {
            throw new IllegalArgumentException("maxConversations must be positive (current: " + maxConversations + ")");
        }
        if (maxTurns <= 0) {
            throw new IllegalArgumentException("maxTurns must be positive (current: " + maxTurns + ")");
        }
        this.maxConversations = maxConversations;
        this.maxTurns = maxTurns;
    }

    @Override
    public Conversation open(String conversationId, String userId) {
        String key = conversationId == null ? UUID.randomUUID().toString() : conversationId;
        Instant now = Instant.now();
        Conversation opened = conversations.compute(key, (id, existing) ->
            existing == null ? Conversation.start(id, userId, now) : existing.touch(now)
        );
        evictOverflow(key);
        return opened;
    }

    @Override
    public Optional<Conversation> find(String conversationId) {
        if (conversationId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(conversations.computeIfPresent(conversationId, (id, existing) -> existing.touch(Instant.now())));
    }

    @Override
    public Conversation append(String conversationId, String userId, Turn turn) {
        if (conversationId == null) {
            throw new IllegalArgumentException("conversationId cannot be null");
        }
        if (turn == null) {
            throw new IllegalArgumentException("turn cannot be null");
        }
        Instant now = Instant.now();
        Conversation updated = conversations.compute(conversationId, (id, existing) ->
            (existing == null ? Conversation.start(id, userId, now) : existing).append(turn, maxTurns, now)
        );
        evictOverflow(conversationId);
        return updated;
    }

    @Override
    public boolean delete(String conversationId) {
        return conversationId != null && conversations.remove(conversationId) != null;
    }

    @Override
    public int removeIdleSince(Instant cutoff) {
        if (cutoff == null) {
            throw new IllegalArgumentException("cutoff cannot be null");
        }
        int removed = 0;
        for (Map.Entry<String, Conversation> entry : conversations.entrySet()) {
            if (entry.getValue().updatedAt().isBefore(cutoff) && conversations.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Removed {} idle conversations (cutoff: {})", removed, cutoff);
        }
        return removed;
    }

    @Override
    public int size() {
        return conversations.size();
    }

    private void evictOverflow(String keep) {
        if (conversations.size() <= maxConversations) {
            return;
        }
        synchronized (this) {
            int size = conversations.size();
            if (size <= maxConversations) {
                return;
            }
            int toRemove = Math.max(size - maxConversations, size / 5);
            List<Conversation> oldest = conversations.values().stream()
                .filter(conversation -> !conversation.conversationId().equals(keep))
                .sorted(Comparator.comparing(Conversation::updatedAt))
                .limit(toRemove)
                .toList();
            oldest.forEach(conversation -> conversations.remove(conversation.conversationId(), conversation));
            log.debug("Evicted {} least recently used conversations (limit: {})", oldest.size(), maxConversations);
        }
    }
}
