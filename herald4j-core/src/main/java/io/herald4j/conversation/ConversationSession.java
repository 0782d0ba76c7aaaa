package io.herald4j.conversation;

import java.time.Instant;
import java.util.Objects;

/**
 * State of one operator's creation dialogue. Immutable; every step produces a new value.
 */
public record ConversationSession(
        String operatorId,
        String destination,
        ConversationStep step,
        ScheduleDraft draft,
        Instant updatedAt
) {

    public ConversationSession {
        Objects.requireNonNull(operatorId, "operatorId must not be null");
        Objects.requireNonNull(destination, "destination must not be null");
        Objects.requireNonNull(step, "step must not be null");
        Objects.requireNonNull(draft, "draft must not be null");
        Objects.requireNonNull(updatedAt, "updatedAt must not be null");
    }

    public static ConversationSession open(String operatorId, String destination, Instant now) {
        return new ConversationSession(operatorId, destination, ConversationStep.SCHEDULE_NAME, ScheduleDraft.empty(), now);
    }

    public ConversationSession advance(ConversationStep next, ScheduleDraft draft, Instant now) {
        return new ConversationSession(operatorId, destination, next, draft, now);
    }

    public ConversationSession touch(ScheduleDraft draft, Instant now) {
        return new ConversationSession(operatorId, destination, step, draft, now);
    }
}
