package io.herald4j.core;

import java.util.List;
import java.util.Objects;

/**
 * Validated input for creating (or replacing) a schedule.
 */
public record ScheduleRequest(
        String destination,
        String scheduleName,
        String body,
        Attachment attachment,
        List<InlineButton> buttons,
        TriggerSpec trigger
) {

    public ScheduleRequest {
        Objects.requireNonNull(destination, "destination must not be null");
        Objects.requireNonNull(scheduleName, "scheduleName must not be null");
        Objects.requireNonNull(body, "body must not be null");
        Objects.requireNonNull(trigger, "trigger must not be null");
        if (destination.isBlank()) {
            throw new IllegalArgumentException("destination must not be blank");
        }
        if (scheduleName.isBlank()) {
            throw new IllegalArgumentException("scheduleName must not be blank");
        }
        if (body.isBlank()) {
            throw new IllegalArgumentException("body must not be blank");
        }
        buttons = buttons == null ? List.of() : List.copyOf(buttons);
    }
}
