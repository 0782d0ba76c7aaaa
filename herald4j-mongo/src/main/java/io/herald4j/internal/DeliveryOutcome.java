package io.herald4j.internal;

public enum DeliveryOutcome {
    /** Record gone or already completed; nothing was sent. */
    SKIPPED,
    /** Recurring message sent; the record stays pending. */
    SENT,
    /** One-shot message sent, record marked completed and its timer removed. */
    COMPLETED,
    /** The transport rejected the message. */
    FAILED
}
