package io.herald4j.conversation;

/**
 * Steps of the schedule creation dialogue, in order.
 */
public enum ConversationStep {
    SCHEDULE_NAME,
    MESSAGE_TEXT,
    MEDIA,
    BUTTONS,
    TRIGGER
}
