package io.herald4j.core;

import java.util.Objects;

/**
 * Reference to media already uploaded to the chat platform.
 *
 * <p>{@code type} is a tag such as {@code photo} or {@code video}; {@code ref} is the platform's
 * opaque file reference. {@code accessToken} is only needed by transports that sign references
 * and may be null.
 */
public record Attachment(String type, String ref, String accessToken) {

    public static final String PHOTO = "photo";
    public static final String VIDEO = "video";

    public Attachment {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(ref, "ref must not be null");
        if (type.isBlank() || ref.isBlank()) {
            throw new IllegalArgumentException("attachment type and ref must not be blank");
        }
    }

    public static Attachment photo(String ref) {
        return new Attachment(PHOTO, ref, null);
    }

    public static Attachment video(String ref) {
        return new Attachment(VIDEO, ref, null);
    }
}
