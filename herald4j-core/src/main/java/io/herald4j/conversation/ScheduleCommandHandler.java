package io.herald4j.conversation;

import io.herald4j.ChatTransport;
import io.herald4j.MessageScheduler;
import io.herald4j.TransportException;
import io.herald4j.core.Attachment;
import io.herald4j.core.CancelResult;
import io.herald4j.core.CreateResult;
import io.herald4j.core.InlineButton;
import io.herald4j.core.JobRecord;
import io.herald4j.core.ScheduleRequest;
import io.herald4j.core.TriggerSpec;
import io.herald4j.utils.TriggerParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operator-facing command surface.
 *
 * <p>Commands:
 * <ul>
 *   <li>/start, /help - usage text</li>
 *   <li>/schedule_message - start a creation dialogue (admins only)</li>
 *   <li>/list - pending schedules of this chat</li>
 *   <li>/delete &lt;id&gt; - delete a pending schedule (admins only)</li>
 *   <li>/cancel - abandon the current dialogue</li>
 * </ul>
 *
 * <p>Any other message continues the sender's open dialogue, if it was opened in the same chat.
 * A message that arrives while the same operator's previous message is still being handled is ignored.
 */
public class ScheduleCommandHandler {
    private static final Logger log = LoggerFactory.getLogger(ScheduleCommandHandler.class);

    static final String GENERIC_ERROR = "An error occurred.";
    static final String SKIP = "skip";

    static final String WELCOME = """
            Welcome to the message scheduler bot!
            Group admins (including anonymous admins) can schedule messages with a name, text, \
            optional media and buttons, repeating every N seconds or once at a given time.
            A new schedule with the same name in a chat replaces the old one, sent or not.
            Schedules survive restarts.
            Commands:
            - /schedule_message: set up a message
            - /list: view scheduled messages
            - /delete <id>: delete a scheduled message
            - /cancel: cancel the scheduling process
            - /help: detailed instructions""";

    static final String HELP = """
            How to schedule a message:
            1. Send /schedule_message.
            2. Provide, one message at a time:
               - the schedule name (e.g. 'Weekly Update'); an existing schedule with that name is replaced
               - the message text
               - a photo or video, or 'skip'
               - buttons as text|url (one per message), then 'skip'
               - seconds between repeats (e.g. '300'), an interval (e.g. '2 hours'), \
            or a time YYYY-MM-DD HH:MM:SS for a single delivery
            Only group admins can use /schedule_message and /delete.""";

    private final MessageScheduler scheduler;
    private final ChatTransport transport;
    private final ConversationRegistry conversations;
    private final Clock clock;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public ScheduleCommandHandler(MessageScheduler scheduler, ChatTransport transport, ConversationRegistry conversations, Clock clock) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.conversations = Objects.requireNonNull(conversations, "conversations must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Handle one inbound message.
     *
     * @return the reply to post in the message's chat, or empty when the message is not for us
     */
    public Optional<String> handle(InboundMessage message) {
        Objects.requireNonNull(message, "message must not be null");

        String operatorId = message.operatorId();
        if (!inFlight.add(operatorId)) {
            log.debug("Ignoring message from operator={} while the previous one is being handled", operatorId);
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(dispatch(message));
        } catch (RuntimeException e) {
            log.error("Failed to handle message operator={} destination={} msg={}",
                    operatorId, message.destination(), e.getMessage(), e);
            return Optional.of(GENERIC_ERROR);
        } finally {
            inFlight.remove(operatorId);
        }
    }

    private String dispatch(InboundMessage message) {
        String text = message.trimmedText();
        String command = commandOf(text);
        if (command == null) {
            return continueConversation(message);
        }

        return switch (command) {
            case "start" -> WELCOME;
            case "help" -> HELP;
            case "schedule_message" -> startConversation(message);
            case "list" -> listSchedules(message);
            case "delete" -> deleteSchedule(message, argumentOf(text));
            case "cancel" -> cancelConversation(message);
            default -> null;
        };
    }

    private String startConversation(InboundMessage message) {
        if (!isAdmin(message)) {
            return "Only group admins can schedule messages!";
        }
        int evicted = conversations.evictExpired();
        if (evicted > 0) {
            log.debug("Evicted {} abandoned conversations", evicted);
        }
        conversations.open(message.operatorId(), message.destination());
        log.debug("Conversation opened operator={} destination={}", message.operatorId(), message.destination());
        return "Please provide the schedule name (e.g., 'Daily Reminder').";
    }

    private String cancelConversation(InboundMessage message) {
        if (conversations.close(message.operatorId())) {
            return "Scheduling cancelled.";
        }
        return "No active scheduling process to cancel.";
    }

    private String listSchedules(InboundMessage message) {
        List<JobRecord> records = scheduler.list(message.destination());
        if (records.isEmpty()) {
            return "No scheduled messages.";
        }

        StringBuilder sb = new StringBuilder("Scheduled messages:\n");
        for (JobRecord r : records) {
            sb.append("ID: ").append(r.id())
                    .append(" | Name: ").append(r.scheduleName())
                    .append(" | ").append(r.fireAt() != null ? "Time: " + r.fireAt() : "Every " + r.intervalSeconds() + " seconds")
                    .append(" | Message: ").append(r.body());
            r.attachment().ifPresent(a -> sb.append(" | Media: ").append(a.type()));
            if (!r.buttons().isEmpty()) {
                sb.append(" | Buttons: ").append(String.join(", ", r.buttons().stream().map(InlineButton::text).toList()));
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private String deleteSchedule(InboundMessage message, String jobId) {
        if (!isAdmin(message)) {
            return "Only group admins can delete messages!";
        }
        if (jobId == null) {
            return "Usage: /delete <id>";
        }

        CancelResult result = scheduler.cancel(jobId, message.destination());
        if (!result.hasEffect()) {
            return "Message ID not found or already sent!";
        }
        return "Scheduled message " + jobId + " deleted.";
    }

    private String continueConversation(InboundMessage message) {
        Optional<ConversationSession> found = conversations.find(message.operatorId());
        if (found.isEmpty() || !found.get().destination().equals(message.destination())) {
            return null;
        }

        ConversationSession session = found.get();
        String text = message.trimmedText();

        return switch (session.step()) {
            case SCHEDULE_NAME -> {
                if (text.isEmpty()) {
                    yield "Schedule name cannot be empty!";
                }
                advance(session, ConversationStep.MESSAGE_TEXT, session.draft().withScheduleName(text));
                yield "Please provide the message text (e.g., 'Team meeting at 2 PM').";
            }
            case MESSAGE_TEXT -> {
                if (text.isEmpty()) {
                    yield "Message text cannot be empty!";
                }
                advance(session, ConversationStep.MEDIA, session.draft().withBody(text));
                yield "Send a photo or video (optional), or type 'skip' to proceed.";
            }
            case MEDIA -> handleMedia(session, message, text);
            case BUTTONS -> handleButton(session, text);
            case TRIGGER -> handleTrigger(session, text);
        };
    }

    private String handleMedia(ConversationSession session, InboundMessage message, String text) {
        Attachment attachment = message.attachment();
        if (attachment == null) {
            if (SKIP.equalsIgnoreCase(text)) {
                advance(session, ConversationStep.BUTTONS, session.draft());
                return "Provide an inline button (text|url, e.g., 'Join|https://example.com'), or type 'skip' to proceed.";
            }
            return "Please send a photo/video or type 'skip'.";
        }
        if (!Attachment.PHOTO.equals(attachment.type()) && !Attachment.VIDEO.equals(attachment.type())) {
            return "Please send a photo/video or type 'skip'.";
        }

        log.info("Stored {} for operator={} ref={}", attachment.type(), session.operatorId(), attachment.ref());
        advance(session, ConversationStep.BUTTONS, session.draft().withAttachment(attachment));
        String kind = Attachment.PHOTO.equals(attachment.type()) ? "Photo" : "Video";
        return kind + " received! Provide an inline button (text|url), or type 'skip' to proceed.";
    }

    private String handleButton(ConversationSession session, String text) {
        if (SKIP.equalsIgnoreCase(text)) {
            advance(session, ConversationStep.TRIGGER, session.draft());
            return "Enter the interval in seconds (e.g., '300'), an interval such as '2 hours', "
                    + "or a specific time (YYYY-MM-DD HH:MM:SS, e.g., '2026-06-05 14:00:00').";
        }

        int sep = text.indexOf('|');
        if (sep <= 0 || sep == text.length() - 1) {
            return "Invalid button format! Use text|url (e.g., 'Join|https://example.com') or type 'skip'.";
        }
        InlineButton button;
        try {
            button = new InlineButton(text.substring(0, sep).trim(), text.substring(sep + 1).trim());
        } catch (IllegalArgumentException e) {
            return "Invalid button format! Use text|url (e.g., 'Join|https://example.com') or type 'skip'.";
        }

        conversations.update(session.touch(session.draft().plusButton(button), clock.instant()));
        return "Button added! Add another button (text|url) or type 'skip' to proceed.";
    }

    private String handleTrigger(ConversationSession session, String text) {
        TriggerSpec trigger;
        try {
            trigger = TriggerParser.parseOperatorInput(text);
        } catch (IllegalArgumentException e) {
            return e.getMessage();
        }
        if (!trigger.isRecurring() && !trigger.fireAt().isAfter(LocalDateTime.now(clock))) {
            return "Cannot schedule messages in the past!";
        }

        ScheduleDraft draft = session.draft();
        CreateResult result = scheduler.create(new ScheduleRequest(
                session.destination(),
                draft.scheduleName(),
                draft.body(),
                draft.attachment(),
                draft.buttons(),
                trigger
        ));
        conversations.close(session.operatorId());

        String when = trigger.isRecurring()
                ? "to repeat every " + trigger.interval().toSeconds() + " seconds"
                : "for " + TriggerParser.formatFireAt(trigger.fireAt());
        String reply = "Message '" + draft.scheduleName() + "' (ID: " + result.id() + ") scheduled " + when + ".";
        if (result.replaced()) {
            reply += " It replaces the previous schedule with the same name.";
        }
        return reply;
    }

    private void advance(ConversationSession session, ConversationStep next, ScheduleDraft draft) {
        conversations.update(session.advance(next, draft, clock.instant()));
    }

    private boolean isAdmin(InboundMessage message) {
        try {
            return transport.isAdmin(message.operatorId(), message.destination());
        } catch (TransportException e) {
            log.error("Admin check failed operator={} destination={} msg={}",
                    message.operatorId(), message.destination(), e.getMessage(), e);
            return false;
        }
    }

    /**
     * "/list@my_bot extra" -> "list"; null for non-commands.
     */
    static String commandOf(String text) {
        if (!text.startsWith("/") || text.length() == 1) {
            return null;
        }
        String head = text.substring(1).split("\\s+", 2)[0];
        int at = head.indexOf('@');
        if (at >= 0) {
            head = head.substring(0, at);
        }
        return head.toLowerCase(Locale.ROOT);
    }

    private static String argumentOf(String text) {
        String[] parts = text.split("\\s+");
        return parts.length > 1 ? parts[1] : null;
    }
}
