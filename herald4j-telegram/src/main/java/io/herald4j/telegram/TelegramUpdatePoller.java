package io.herald4j.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import io.herald4j.TransportException;
import io.herald4j.conversation.InboundMessage;
import io.herald4j.conversation.ScheduleCommandHandler;
import io.herald4j.core.Attachment;
import io.herald4j.core.OutboundMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Long-polls Telegram for messages and feeds them to the {@link ScheduleCommandHandler}.
 * Replies go back to the chat the message came from.
 */
public class TelegramUpdatePoller {
    private static final Logger log = LoggerFactory.getLogger(TelegramUpdatePoller.class);

    private static final Duration MIN_BACKOFF = Duration.ofSeconds(1);
    private static final Duration MAX_BACKOFF = Duration.ofSeconds(30);

    private final TelegramBotApiTransport transport;
    private final ScheduleCommandHandler handler;
    private final Duration pollTimeout;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Thread thread;
    private long offset;

    public TelegramUpdatePoller(TelegramBotApiTransport transport, ScheduleCommandHandler handler, Duration pollTimeout) {
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.handler = Objects.requireNonNull(handler, "handler must not be null");
        this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout must not be null");
        if (pollTimeout.isNegative()) {
            throw new IllegalArgumentException("pollTimeout must not be negative");
        }
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        Thread t = new Thread(this::pollLoop, "herald.telegram-poller");
        t.setDaemon(true);
        thread = t;
        t.start();
        log.info("Telegram update poller started");
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        Thread t = thread;
        if (t != null) {
            t.interrupt();
        }
        log.info("Telegram update poller stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    private void pollLoop() {
        Duration backoff = MIN_BACKOFF;
        while (running.get()) {
            try {
                pollOnce();
                backoff = MIN_BACKOFF;
            } catch (TransportException | RuntimeException e) {
                log.error("Polling for updates failed, retrying in {}s msg={}", backoff.toSeconds(), e.getMessage(), e);
                try {
                    Thread.sleep(backoff.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return;
                }
                backoff = backoff.multipliedBy(2).compareTo(MAX_BACKOFF) > 0 ? MAX_BACKOFF : backoff.multipliedBy(2);
            }
        }
    }

    /**
     * Fetch one batch of updates and handle each of them.
     *
     * @return number of updates received
     */
    int pollOnce() throws TransportException {
        List<JsonNode> updates = transport.getUpdates(offset, pollTimeout.toSeconds());
        for (JsonNode update : updates) {
            offset = Math.max(offset, update.path("update_id").asLong() + 1);
            try {
                dispatch(update);
            } catch (RuntimeException e) {
                log.error("Dropping update id={} msg={}", update.path("update_id").asLong(), e.getMessage(), e);
            }
        }
        return updates.size();
    }

    private void dispatch(JsonNode update) {
        Optional<InboundMessage> inbound = toInbound(update);
        if (inbound.isEmpty()) {
            return;
        }
        InboundMessage message = inbound.get();
        Optional<String> reply = handler.handle(message);
        if (reply.isEmpty()) {
            return;
        }
        try {
            transport.send(message.destination(), OutboundMessage.text(reply.get()));
        } catch (TransportException e) {
            log.error("Failed to reply destination={} msg={}", message.destination(), e.getMessage(), e);
        }
    }

    long offset() {
        return offset;
    }

    static Optional<InboundMessage> toInbound(JsonNode update) {
        JsonNode message = update.path("message");
        if (message.isMissingNode()) {
            return Optional.empty();
        }

        String chatId = message.path("chat").path("id").asText(null);
        if (chatId == null) {
            return Optional.empty();
        }

        String operatorId;
        JsonNode senderChat = message.path("sender_chat");
        if (!senderChat.isMissingNode() && chatId.equals(senderChat.path("id").asText(null))) {
            operatorId = chatId;
        } else {
            operatorId = message.path("from").path("id").asText(null);
        }
        if (operatorId == null) {
            return Optional.empty();
        }

        String text = message.has("text") ? message.path("text").asText() : message.path("caption").asText(null);

        Attachment attachment = null;
        JsonNode photos = message.path("photo");
        if (photos.isArray() && photos.size() > 0) {
            // sizes come smallest first
            attachment = Attachment.photo(photos.get(photos.size() - 1).path("file_id").asText());
        } else if (message.has("video")) {
            attachment = Attachment.video(message.path("video").path("file_id").asText());
        }

        return Optional.of(new InboundMessage(operatorId, chatId, text, attachment));
    }
}
