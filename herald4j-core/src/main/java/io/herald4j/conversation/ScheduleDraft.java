package io.herald4j.conversation;

import io.herald4j.core.Attachment;
import io.herald4j.core.InlineButton;

import java.util.ArrayList;
import java.util.List;

/**
 * Fields collected so far by a creation dialogue.
 */
public record ScheduleDraft(
        String scheduleName,
        String body,
        Attachment attachment,
        List<InlineButton> buttons
) {

    public ScheduleDraft {
        buttons = buttons == null ? List.of() : List.copyOf(buttons);
    }

    public static ScheduleDraft empty() {
        return new ScheduleDraft(null, null, null, List.of());
    }

    public ScheduleDraft withScheduleName(String scheduleName) {
        return new ScheduleDraft(scheduleName, body, attachment, buttons);
    }

    public ScheduleDraft withBody(String body) {
        return new ScheduleDraft(scheduleName, body, attachment, buttons);
    }

    public ScheduleDraft withAttachment(Attachment attachment) {
        return new ScheduleDraft(scheduleName, body, attachment, buttons);
    }

    public ScheduleDraft plusButton(InlineButton button) {
        List<InlineButton> next = new ArrayList<>(buttons);
        next.add(button);
        return new ScheduleDraft(scheduleName, body, attachment, next);
    }
}
