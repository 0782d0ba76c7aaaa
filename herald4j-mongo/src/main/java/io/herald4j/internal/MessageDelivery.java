package io.herald4j.internal;

import io.herald4j.ChatTransport;
import io.herald4j.JobStore;
import io.herald4j.TransportException;
import io.herald4j.core.InlineButton;
import io.herald4j.core.JobRecord;
import io.herald4j.core.OutboundMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Sends one due job.
 *
 * <p>The record is re-read before sending so a job deleted or replaced after its timer fired is
 * skipped, and its timer dropped. A sent one-shot job is marked completed and its timer removed. A failed one-shot send is
 * retried with exponential delay up to {@code maxRetries} times, after which its timer is removed and
 * the record stays pending. Recurring jobs are not retried early; their next interval is the retry.
 */
public class MessageDelivery {
    private static final Logger log = LoggerFactory.getLogger(MessageDelivery.class);
    private static final Duration MAX_RETRY_DELAY = Duration.ofMinutes(10);

    private final JobStore jobStore;
    private final ChatTransport transport;
    private final TriggerSet triggers;
    private final Clock clock;
    private final int maxRetries;
    private final Duration retryDelay;

    public MessageDelivery(JobStore jobStore, ChatTransport transport, TriggerSet triggers, Clock clock,
                           int maxRetries, Duration retryDelay) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.triggers = Objects.requireNonNull(triggers, "triggers must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.retryDelay = Objects.requireNonNull(retryDelay, "retryDelay must not be null");
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        this.maxRetries = maxRetries;
    }

    public DeliveryOutcome deliver(String destination, String jobId) {
        Optional<JobRecord> current = jobStore.findById(jobId);
        if (current.isEmpty() || current.get().completed()) {
            triggers.cancel(jobId);
            log.debug("Skipping delivery of job={}: record absent or already completed", jobId);
            return DeliveryOutcome.SKIPPED;
        }

        JobRecord record = current.get();
        try {
            transport.send(destination, render(record));
        } catch (TransportException e) {
            log.error("Error sending message job={} destination={} msg={}", jobId, destination, e.getMessage(), e);
            if (!record.isRecurring()) {
                scheduleRetry(jobId);
            }
            return DeliveryOutcome.FAILED;
        }

        if (record.isRecurring()) {
            log.info("Sent recurring message job={} destination={} name='{}'", jobId, destination, record.scheduleName());
            return DeliveryOutcome.SENT;
        }

        jobStore.markCompleted(jobId);
        triggers.cancel(jobId);
        log.info("Sent one-time message job={} destination={} name='{}'", jobId, destination, record.scheduleName());
        return DeliveryOutcome.COMPLETED;
    }

    /**
     * One button per row, in stored order.
     */
    static OutboundMessage render(JobRecord record) {
        List<List<InlineButton>> keyboard = record.buttons().stream()
                .map(List::of)
                .toList();
        return new OutboundMessage(record.body(), record.attachment().orElse(null), keyboard);
    }

    private void scheduleRetry(String jobId) {
        int attempts = triggers.recordFailure(jobId);
        if (attempts == 0) {
            return;
        }
        if (attempts > maxRetries) {
            triggers.cancel(jobId);
            log.warn("Giving up on one-time message job={} after {} failed attempts; it stays pending until deleted",
                    jobId, attempts);
            return;
        }
        Duration delay = retryDelay(attempts);
        triggers.reschedule(jobId, clock.instant().plus(delay));
        log.info("Retrying one-time message job={} in {} (attempt {}/{})", jobId, delay, attempts, maxRetries);
    }

    /**
     * attempt starts from 1 (first failure).
     * Default: 10s, 20s, 40s... capped at 10 minutes.
     */
    private Duration retryDelay(int attempt) {
        int exp = Math.min(Math.max(0, attempt - 1), 20);
        Duration d = retryDelay.multipliedBy(1L << exp);
        return d.compareTo(MAX_RETRY_DELAY) > 0 ? MAX_RETRY_DELAY : d;
    }
}
