package io.herald4j.core;

import java.util.Objects;

/**
 * A URL button rendered under a delivered message.
 */
public record InlineButton(String text, String url) {

    public InlineButton {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(url, "url must not be null");
        if (text.isBlank()) {
            throw new IllegalArgumentException("button text must not be blank");
        }
        if (url.isBlank()) {
            throw new IllegalArgumentException("button url must not be blank");
        }
    }
}
