package io.herald4j.core;

import io.herald4j.utils.TriggerParser;

import java.util.List;
import java.util.Optional;

/**
 * Durable description of one scheduled message, as it is stored.
 *
 * <p>This is a pure data object. Fields are not validated here because records read back from
 * storage may have been written by older versions or edited by hand; the scheduler validates
 * them during recovery.
 *
 * <p>{@code intervalSeconds} carries whatever value was stored (normally an integer).
 * {@code fireAt} is a local date-time in {@code yyyy-MM-dd HH:mm:ss} form.
 */
public record JobRecord(

        // identity, assigned by the store
        String id,

        // addressing
        String destination,
        String scheduleName,

        // payload
        String body,
        String mediaType,
        String mediaRef,
        String mediaAccessToken,
        List<InlineButton> buttons,

        // trigger, exactly one is expected
        Object intervalSeconds,
        String fireAt,

        boolean completed
) {

    public JobRecord {
        buttons = buttons == null ? List.of() : List.copyOf(buttons);
    }

    /**
     * Builds the record to insert for a request. The id is left null for the store to assign.
     */
    public static JobRecord from(ScheduleRequest request) {
        Attachment attachment = request.attachment();
        TriggerSpec trigger = request.trigger();
        return new JobRecord(
                null,
                request.destination(),
                request.scheduleName(),
                request.body(),
                attachment == null ? null : attachment.type(),
                attachment == null ? null : attachment.ref(),
                attachment == null ? null : attachment.accessToken(),
                request.buttons(),
                trigger.isRecurring() ? trigger.interval().toSeconds() : null,
                trigger.isRecurring() ? null : TriggerParser.formatFireAt(trigger.fireAt()),
                false
        );
    }

    public JobRecord withId(String id) {
        return new JobRecord(id, destination, scheduleName, body, mediaType, mediaRef, mediaAccessToken,
                buttons, intervalSeconds, fireAt, completed);
    }

    public JobRecord withCompleted(boolean completed) {
        return new JobRecord(id, destination, scheduleName, body, mediaType, mediaRef, mediaAccessToken,
                buttons, intervalSeconds, fireAt, completed);
    }

    /**
     * Media is attached only when both the type tag and the reference are present.
     */
    public Optional<Attachment> attachment() {
        if (isBlank(mediaType) || isBlank(mediaRef)) {
            return Optional.empty();
        }
        return Optional.of(new Attachment(mediaType, mediaRef, mediaAccessToken));
    }

    /**
     * A record with any stored interval value is treated as recurring, even if that value is invalid.
     */
    public boolean isRecurring() {
        return intervalSeconds != null;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
