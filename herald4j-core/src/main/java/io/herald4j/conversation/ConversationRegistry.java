package io.herald4j.conversation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open creation dialogues keyed by operator id.
 *
 * <p>Sessions idle for longer than the TTL are treated as abandoned: lookups drop them lazily and
 * {@link #evictExpired()} removes them in bulk.
 */
public class ConversationRegistry {
    private static final Logger log = LoggerFactory.getLogger(ConversationRegistry.class);

    private final ConcurrentHashMap<String, ConversationSession> sessions = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public ConversationRegistry(Duration ttl, Clock clock) {
        this.ttl = Objects.requireNonNull(ttl, "ttl must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("conversation ttl must be a positive duration");
        }
    }

    /**
     * Start a new dialogue, replacing any the operator already had open.
     */
    public ConversationSession open(String operatorId, String destination) {
        ConversationSession session = ConversationSession.open(operatorId, destination, clock.instant());
        sessions.put(operatorId, session);
        return session;
    }

    public Optional<ConversationSession> find(String operatorId) {
        ConversationSession session = sessions.get(operatorId);
        if (session == null) {
            return Optional.empty();
        }
        if (isExpired(session)) {
            if (sessions.remove(operatorId, session)) {
                log.debug("Conversation expired operator={} step={}", operatorId, session.step());
            }
            return Optional.empty();
        }
        return Optional.of(session);
    }

    public void update(ConversationSession session) {
        sessions.put(session.operatorId(), session);
    }

    /**
     * @return true if a dialogue was open
     */
    public boolean close(String operatorId) {
        return sessions.remove(operatorId) != null;
    }

    public int evictExpired() {
        int before = sessions.size();
        sessions.values().removeIf(this::isExpired);
        return before - sessions.size();
    }

    public int size() {
        return sessions.size();
    }

    private boolean isExpired(ConversationSession session) {
        return session.updatedAt().plus(ttl).isBefore(clock.instant());
    }
}
