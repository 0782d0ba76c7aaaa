package io.herald4j.core;

import java.util.List;
import java.util.Objects;

/**
 * A rendered message ready for a {@link io.herald4j.ChatTransport}.
 *
 * @param keyboard button rows, top to bottom; empty for no keyboard
 */
public record OutboundMessage(
        String text,
        Attachment attachment,
        List<List<InlineButton>> keyboard
) {

    public OutboundMessage {
        Objects.requireNonNull(text, "text must not be null");
        keyboard = keyboard == null ? List.of() : keyboard.stream().map(List::copyOf).toList();
    }

    public static OutboundMessage text(String text) {
        return new OutboundMessage(text, null, List.of());
    }

    public boolean hasKeyboard() {
        return !keyboard.isEmpty();
    }
}
