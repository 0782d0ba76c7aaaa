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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScheduleCommandHandlerTest {

    private static final String CHAT = "-100";
    private static final String ADMIN = "42";

    @Mock
    private MessageScheduler scheduler;

    @Mock
    private ChatTransport transport;

    private ConversationRegistry conversations;
    private ScheduleCommandHandler handler;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-06-01T12:00:00Z"), ZoneOffset.UTC);
        conversations = new ConversationRegistry(Duration.ofMinutes(15), clock);
        handler = new ScheduleCommandHandler(scheduler, transport, conversations, clock);
    }

    @Test
    void startAndHelpShouldNotRequireAdmin() {
        assertThat(say("/start")).isEqualTo(ScheduleCommandHandler.WELCOME);
        assertThat(say("/help")).isEqualTo(ScheduleCommandHandler.HELP);
    }

    @Test
    void nonAdminShouldNotStartDialogue() throws Exception {
        when(transport.isAdmin(ADMIN, CHAT)).thenReturn(false);

        assertThat(say("/schedule_message")).isEqualTo("Only group admins can schedule messages!");
        assertThat(conversations.size()).isZero();
    }

    @Test
    void failedAdminCheckShouldDeny() throws Exception {
        when(transport.isAdmin(ADMIN, CHAT)).thenThrow(new TransportException("chat not found"));

        assertThat(say("/schedule_message")).isEqualTo("Only group admins can schedule messages!");
    }

    @Test
    void fullDialogueShouldCreateRecurringSchedule() throws Exception {
        when(transport.isAdmin(ADMIN, CHAT)).thenReturn(true);
        when(scheduler.create(any())).thenReturn(new CreateResult("abc", null, true));

        assertThat(say("/schedule_message")).startsWith("Please provide the schedule name");
        assertThat(say("Daily Reminder")).startsWith("Please provide the message text");
        assertThat(say("Hello team")).startsWith("Send a photo or video");
        assertThat(say("skip")).startsWith("Provide an inline button");
        assertThat(say("Join|https://example.com")).startsWith("Button added!");
        assertThat(say("skip")).startsWith("Enter the interval");
        assertThat(say("300")).isEqualTo("Message 'Daily Reminder' (ID: abc) scheduled to repeat every 300 seconds.");

        ArgumentCaptor<ScheduleRequest> captor = ArgumentCaptor.forClass(ScheduleRequest.class);
        verify(scheduler).create(captor.capture());
        ScheduleRequest req = captor.getValue();
        assertThat(req.destination()).isEqualTo(CHAT);
        assertThat(req.scheduleName()).isEqualTo("Daily Reminder");
        assertThat(req.body()).isEqualTo("Hello team");
        assertThat(req.attachment()).isNull();
        assertThat(req.buttons()).containsExactly(new InlineButton("Join", "https://example.com"));
        assertThat(req.trigger().interval()).isEqualTo(Duration.ofSeconds(300));
        assertThat(conversations.size()).isZero();
    }

    @Test
    void dialogueShouldAcceptPhotoAndReportReplacement() throws Exception {
        when(transport.isAdmin(ADMIN, CHAT)).thenReturn(true);
        when(scheduler.create(any())).thenReturn(new CreateResult("new", "old", true));

        say("/schedule_message");
        say("Weekly");
        say("Standup notes");
        String reply = handler.handle(new InboundMessage(ADMIN, CHAT, "caption", Attachment.photo("file-1"))).orElseThrow();
        assertThat(reply).startsWith("Photo received!");
        say("skip");

        assertThat(say("2026-06-05 14:00:00"))
                .isEqualTo("Message 'Weekly' (ID: new) scheduled for 2026-06-05 14:00:00. "
                        + "It replaces the previous schedule with the same name.");

        ArgumentCaptor<ScheduleRequest> captor = ArgumentCaptor.forClass(ScheduleRequest.class);
        verify(scheduler).create(captor.capture());
        assertThat(captor.getValue().attachment()).isEqualTo(Attachment.photo("file-1"));
        assertThat(captor.getValue().trigger().fireAt()).isEqualTo(LocalDateTime.of(2026, 6, 5, 14, 0));
    }

    @Test
    void pastTimeShouldBeRejectedAndDialogueKept() throws Exception {
        when(transport.isAdmin(ADMIN, CHAT)).thenReturn(true);

        say("/schedule_message");
        say("Old");
        say("Too late");
        say("skip");
        say("skip");

        assertThat(say("2026-05-01 10:00:00")).isEqualTo("Cannot schedule messages in the past!");
        assertThat(conversations.find(ADMIN)).isPresent();
        verify(scheduler, never()).create(any());
    }

    @Test
    void invalidInputsShouldKeepStep() throws Exception {
        when(transport.isAdmin(ADMIN, CHAT)).thenReturn(true);

        say("/schedule_message");
        assertThat(say("   ")).isEqualTo("Schedule name cannot be empty!");
        say("Name");
        assertThat(say("")).isEqualTo("Message text cannot be empty!");
        say("Body");
        assertThat(say("maybe later")).isEqualTo("Please send a photo/video or type 'skip'.");
        say("skip");
        assertThat(say("no separator")).startsWith("Invalid button format!");
        say("skip");
        assertThat(say("0")).isEqualTo("Interval must be a positive number of seconds!");
    }

    @Test
    void messageInOtherChatShouldNotContinueDialogue() throws Exception {
        when(transport.isAdmin(ADMIN, CHAT)).thenReturn(true);
        say("/schedule_message");

        assertThat(handler.handle(InboundMessage.text(ADMIN, "-200", "Name"))).isEmpty();
        assertThat(conversations.find(ADMIN)).hasValueSatisfying(s -> assertThat(s.step()).isEqualTo(ConversationStep.SCHEDULE_NAME));
    }

    @Test
    void plainMessageWithoutDialogueShouldBeIgnored() {
        assertThat(handler.handle(InboundMessage.text(ADMIN, CHAT, "hello"))).isEmpty();
    }

    @Test
    void cancelShouldReportWhetherDialogueWasOpen() throws Exception {
        assertThat(say("/cancel")).isEqualTo("No active scheduling process to cancel.");

        when(transport.isAdmin(ADMIN, CHAT)).thenReturn(true);
        say("/schedule_message");
        assertThat(say("/cancel")).isEqualTo("Scheduling cancelled.");
    }

    @Test
    void listShouldRenderPendingSchedules() {
        when(scheduler.list(CHAT)).thenReturn(List.of(
                new JobRecord("a1", CHAT, "Daily", "Hi", "photo", "f1", null,
                        List.of(new InlineButton("Join", "https://x"), new InlineButton("Docs", "https://y")), 300L, null, false),
                new JobRecord("b2", CHAT, "Once", "Bye", null, null, null, List.of(), null, "2026-06-05 14:00:00", false)
        ));

        assertThat(say("/list@herald_bot")).isEqualTo("Scheduled messages:\n"
                + "ID: a1 | Name: Daily | Every 300 seconds | Message: Hi | Media: photo | Buttons: Join, Docs\n"
                + "ID: b2 | Name: Once | Time: 2026-06-05 14:00:00 | Message: Bye\n");
    }

    @Test
    void emptyListShouldSaySo() {
        when(scheduler.list(CHAT)).thenReturn(List.of());

        assertThat(say("/list")).isEqualTo("No scheduled messages.");
    }

    @Test
    void deleteShouldValidateAndCancel() throws Exception {
        when(transport.isAdmin(ADMIN, CHAT)).thenReturn(true);
        when(scheduler.cancel("gone", CHAT)).thenReturn(CancelResult.notFound());
        when(scheduler.cancel("a1", CHAT)).thenReturn(new CancelResult(1, 1));

        assertThat(say("/delete")).isEqualTo("Usage: /delete <id>");
        assertThat(say("/delete gone")).isEqualTo("Message ID not found or already sent!");
        assertThat(say("/delete a1")).isEqualTo("Scheduled message a1 deleted.");
    }

    @Test
    void deleteShouldRequireAdmin() throws Exception {
        when(transport.isAdmin(ADMIN, CHAT)).thenReturn(false);

        assertThat(say("/delete a1")).isEqualTo("Only group admins can delete messages!");
        verify(scheduler, never()).cancel(any(), any());
    }

    @Test
    void schedulerFailureShouldProduceGenericError() {
        when(scheduler.list(CHAT)).thenThrow(new IllegalStateException("store down"));

        assertThat(say("/list")).isEqualTo(ScheduleCommandHandler.GENERIC_ERROR);
    }

    @Test
    void commandOfShouldStripBotSuffixAndArguments() {
        assertThat(ScheduleCommandHandler.commandOf("/list@herald_bot")).isEqualTo("list");
        assertThat(ScheduleCommandHandler.commandOf("/DELETE 12")).isEqualTo("delete");
        assertThat(ScheduleCommandHandler.commandOf("hello")).isNull();
        assertThat(ScheduleCommandHandler.commandOf("/")).isNull();
    }

    private String say(String text) {
        return handler.handle(InboundMessage.text(ADMIN, CHAT, text)).orElse(null);
    }
}
