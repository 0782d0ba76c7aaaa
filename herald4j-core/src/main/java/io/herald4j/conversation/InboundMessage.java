package io.herald4j.conversation;

import io.herald4j.core.Attachment;

import java.util.Objects;

/**
 * A chat message addressed to the bot.
 *
 * @param operatorId  sender; for anonymous administrators this is the destination itself
 * @param destination chat the message was posted in
 * @param text        message text or media caption, may be null
 * @param attachment  media carried by the message, may be null
 */
public record InboundMessage(
        String operatorId,
        String destination,
        String text,
        Attachment attachment
) {

    public InboundMessage {
        Objects.requireNonNull(operatorId, "operatorId must not be null");
        Objects.requireNonNull(destination, "destination must not be null");
    }

    public static InboundMessage text(String operatorId, String destination, String text) {
        return new InboundMessage(operatorId, destination, text, null);
    }

    public String trimmedText() {
        return text == null ? "" : text.trim();
    }
}
